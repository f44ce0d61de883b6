package com.dcruver.notetree.index;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat id lookup for every live note and folder, active or trashed.
 * Also records which folder owns each note. Kept in lockstep with the trees.
 */
public class IdIndex {

    private final Map<Long, Note> notesById = new HashMap<>();
    private final Map<Long, Long> owningFolderByNoteId = new HashMap<>();
    private final Map<Long, Folder> foldersById = new HashMap<>();

    public void putFolder(Folder folder) {
        foldersById.put(folder.getId(), folder);
    }

    public Optional<Folder> folder(long id) {
        return Optional.ofNullable(foldersById.get(id));
    }

    public boolean containsFolder(long id) {
        return foldersById.containsKey(id);
    }

    public void removeFolder(long id) {
        foldersById.remove(id);
    }

    public void putNote(Note note, long folderId) {
        notesById.put(note.getId(), note);
        owningFolderByNoteId.put(note.getId(), folderId);
    }

    public Optional<Note> note(long id) {
        return Optional.ofNullable(notesById.get(id));
    }

    public boolean containsNote(long id) {
        return notesById.containsKey(id);
    }

    /**
     * Re-point a note at a new owning folder
     */
    public void moveNote(long noteId, long folderId) {
        if (!notesById.containsKey(noteId)) {
            throw new IllegalStateException("Note not indexed: " + noteId);
        }
        owningFolderByNoteId.put(noteId, folderId);
    }

    public Optional<Long> folderOf(long noteId) {
        return Optional.ofNullable(owningFolderByNoteId.get(noteId));
    }

    public void removeNote(long id) {
        notesById.remove(id);
        owningFolderByNoteId.remove(id);
    }

    public List<Note> notes() {
        return new ArrayList<>(notesById.values());
    }

    public int noteCount() {
        return notesById.size();
    }

    public int folderCount() {
        return foldersById.size();
    }

    public void clear() {
        notesById.clear();
        owningFolderByNoteId.clear();
        foldersById.clear();
    }
}
