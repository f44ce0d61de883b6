package com.dcruver.notetree.store;

import com.dcruver.notetree.domain.ColorLabel;
import com.dcruver.notetree.domain.CycleException;
import com.dcruver.notetree.domain.DuplicateNameException;
import com.dcruver.notetree.domain.EntityKind;
import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.IdAllocator;
import com.dcruver.notetree.domain.IndexOutOfRangeException;
import com.dcruver.notetree.domain.InvalidArgumentException;
import com.dcruver.notetree.domain.MirrorException;
import com.dcruver.notetree.domain.NotFoundException;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.NoteTreeException;
import com.dcruver.notetree.domain.NoteVersion;
import com.dcruver.notetree.domain.OriginalParentGoneException;
import com.dcruver.notetree.domain.Reminder;
import com.dcruver.notetree.domain.Tag;
import com.dcruver.notetree.domain.TagTable;
import com.dcruver.notetree.export.ExportFormat;
import com.dcruver.notetree.export.NoteExporter;
import com.dcruver.notetree.export.VersionDiffWriter;
import com.dcruver.notetree.index.IdIndex;
import com.dcruver.notetree.io.FolderMetadataStore;
import com.dcruver.notetree.io.FolderMetadataStore.FolderMetadata;
import com.dcruver.notetree.io.IdCounterStore;
import com.dcruver.notetree.io.NoteDocument;
import com.dcruver.notetree.io.NoteFileReader;
import com.dcruver.notetree.io.NoteFileWriter;
import com.dcruver.notetree.io.ScannedFolder;
import com.dcruver.notetree.io.TreeMirror;
import com.dcruver.notetree.io.TreeScanner;
import com.dcruver.notetree.security.ContentCipher;
import com.dcruver.notetree.security.XorContentCipher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The note hierarchy: an active tree and a trash tree of folders and notes,
 * the id index over both, the tag table and the mirror that keeps the data
 * and trash directories in step with them.
 *
 * Every operation validates first, then mutates the trees, then the index,
 * then disk. A rejected operation leaves memory and disk untouched. A disk
 * failure after the in-memory change surfaces as {@link MirrorException} and
 * the in-memory change is kept.
 *
 * Not thread-safe.
 */
@Slf4j
public class NoteTree {

    private static final Pattern TRASH_DIR_PREFIX = Pattern.compile("^\\d+-(.+)$");
    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{3,8}$");

    private final IdAllocator ids = new IdAllocator();
    private final IdIndex index = new IdIndex();
    private final TagTable tags = new TagTable(ids);
    private final Clock clock;
    private final ContentCipher cipher;

    private final NoteFileReader fileReader;
    private final NoteFileWriter fileWriter;
    private final FolderMetadataStore metadataStore;
    private final IdCounterStore idCounterStore;
    private final NoteExporter exporter;
    private final VersionDiffWriter diffWriter;

    private TreeMirror mirror;
    private Folder root;
    private Folder trashRoot;
    private long currentFolderId;

    public NoteTree(Path dataPath, Path trashPath) {
        this(dataPath, trashPath, Clock.systemUTC(), new XorContentCipher());
    }

    public NoteTree(Path dataPath, Path trashPath, Clock clock) {
        this(dataPath, trashPath, clock, new XorContentCipher());
    }

    public NoteTree(Path dataPath, Path trashPath, Clock clock, ContentCipher cipher) {
        this(dataPath, trashPath, clock, cipher, new NoteFileReader(), new NoteFileWriter(),
            new FolderMetadataStore(), new IdCounterStore(), new NoteExporter(), new VersionDiffWriter());
    }

    public NoteTree(Path dataPath, Path trashPath, Clock clock, ContentCipher cipher,
                    NoteFileReader fileReader, NoteFileWriter fileWriter, FolderMetadataStore metadataStore,
                    IdCounterStore idCounterStore, NoteExporter exporter, VersionDiffWriter diffWriter) {
        this.clock = clock;
        this.cipher = cipher;
        this.fileReader = fileReader;
        this.fileWriter = fileWriter;
        this.metadataStore = metadataStore;
        this.idCounterStore = idCounterStore;
        this.exporter = exporter;
        this.diffWriter = diffWriter;
        this.mirror = new TreeMirror(dataPath, trashPath, index, tags, fileWriter, metadataStore);
        resetTrees();
    }

    private void resetTrees() {
        index.clear();
        tags.clear();
        Instant now = now();
        root = new Folder(Folder.ROOT_ID, "", null, now);
        trashRoot = new Folder(Folder.TRASH_ROOT_ID, "trash", null, now);
        trashRoot.setTrashed(true);
        index.putFolder(root);
        index.putFolder(trashRoot);
        currentFolderId = Folder.ROOT_ID;
    }

    // Lookups

    public Optional<Note> findNote(long noteId) {
        return index.note(noteId);
    }

    public Optional<Folder> findFolder(long folderId) {
        return index.folder(folderId);
    }

    public Note getNote(long noteId) throws NotFoundException {
        return index.note(noteId)
            .orElseThrow(() -> new NotFoundException("Note not found: " + noteId));
    }

    public Folder getFolder(long folderId) throws NotFoundException {
        return index.folder(folderId)
            .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    /**
     * Id of the folder that directly holds a note
     */
    public long folderOfNote(long noteId) throws NotFoundException {
        return index.folderOf(noteId)
            .orElseThrow(() -> new NotFoundException("Note not found: " + noteId));
    }

    public Folder getRoot() {
        return root;
    }

    public Folder getTrashRoot() {
        return trashRoot;
    }

    public TagTable getTagTable() {
        return tags;
    }

    public IdIndex getIndex() {
        return index;
    }

    public TreeMirror getMirror() {
        return mirror;
    }

    public boolean isInTrash(Folder folder) {
        return folder.getId() == Folder.TRASH_ROOT_ID || folder.isTrashed();
    }

    public FolderContents contentsOf(Folder folder) {
        List<Note> notes = new ArrayList<>();
        for (Long noteId : folder.getNoteIds()) {
            index.note(noteId).ifPresent(notes::add);
        }
        List<Folder> folders = new ArrayList<>();
        for (Long childId : folder.getFolderIds()) {
            index.folder(childId).ifPresent(folders::add);
        }
        return new FolderContents(folder, notes, folders);
    }

    /**
     * Direct notes then direct subfolders of a folder, each in insertion order
     */
    public FolderContents listContents(long folderId) throws NotFoundException {
        return contentsOf(getFolder(folderId));
    }

    // Navigation

    public Folder getCurrentFolder() {
        return index.folder(currentFolderId).orElse(root);
    }

    public void setCurrentFolder(long folderId) throws NotFoundException {
        currentFolderId = requireActiveFolder(folderId).getId();
    }

    /**
     * Resolve a slash-delimited path. A leading slash starts at the active
     * root, anything else at the current folder.
     */
    public Optional<Folder> findFolderByPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Folder current = path.startsWith("/") ? root : getCurrentFolder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!current.isRoot()) {
                    current = index.folder(current.getParentId()).orElse(root);
                }
                continue;
            }
            Optional<Folder> child = childFolderNamed(current, segment);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
        }
        return Optional.of(current);
    }

    public Folder changeCurrentFolder(String path) throws NotFoundException {
        Folder target = findFolderByPath(path)
            .orElseThrow(() -> new NotFoundException("No such folder: " + path));
        currentFolderId = target.getId();
        return target;
    }

    public String getCurrentPath() {
        return pathOf(getCurrentFolder());
    }

    public String pathOf(long folderId) throws NotFoundException {
        return pathOf(getFolder(folderId));
    }

    /**
     * Slash-delimited path from the folder's root. Paths inside the trash
     * are prefixed with {@code trash:}.
     */
    public String pathOf(Folder folder) {
        Deque<String> names = new ArrayDeque<>();
        Folder current = folder;
        while (!current.isRoot()) {
            names.addFirst(current.getName());
            long parentId = current.getParentId();
            current = index.folder(parentId)
                .orElseThrow(() -> new IllegalStateException("Folder " + parentId + " is not indexed"));
        }
        String path = "/" + String.join("/", names);
        return current.getId() == Folder.TRASH_ROOT_ID ? "trash:" + path : path;
    }

    // Folders

    public long createFolder(long parentId, String name) throws NoteTreeException {
        validateFolderName(name);
        Folder parent = requireActiveFolder(parentId);
        requireUniqueName(parent, name);

        Folder folder = new Folder(ids.nextId(EntityKind.FOLDER), name, parent.getId(), now());
        parent.addSubfolder(folder.getId());
        index.putFolder(folder);
        log.info("Created folder {} '{}' in {}", folder.getId(), name, pathOf(parent));

        syncDisk("create folder " + folder.getId(), () -> mirror.folderCreated(folder));
        saveIdCounters();
        return folder.getId();
    }

    public void moveFolder(long folderId, long newParentId) throws NoteTreeException {
        if (folderId == Folder.ROOT_ID || folderId == Folder.TRASH_ROOT_ID) {
            throw new CycleException("A root folder cannot be moved");
        }
        Folder folder = requireActiveFolder(folderId);
        Folder target = requireActiveFolder(newParentId);
        if (Objects.equals(folder.getParentId(), target.getId())) {
            return;
        }
        if (isSelfOrDescendant(folderId, newParentId)) {
            throw new CycleException(String.format(
                "Cannot move folder %d into itself or its descendant %d", folderId, newParentId));
        }
        requireUniqueName(target, folder.getName());

        Path oldDir = mirror.directoryOf(folder);
        parentOf(folder).removeSubfolder(folderId);
        target.addSubfolder(folderId);
        folder.setParentId(target.getId());
        log.info("Moved folder {} to {}", folderId, pathOf(target));

        syncDisk("move folder " + folderId, () -> mirror.folderRelocated(oldDir, folder));
    }

    public void renameFolder(long folderId, String newName) throws NoteTreeException {
        if (folderId == Folder.ROOT_ID || folderId == Folder.TRASH_ROOT_ID) {
            throw new InvalidArgumentException("A root folder cannot be renamed");
        }
        validateFolderName(newName);
        Folder folder = requireActiveFolder(folderId);
        if (folder.getName().equals(newName)) {
            return;
        }
        requireUniqueName(parentOf(folder), newName);

        Path oldDir = mirror.directoryOf(folder);
        String oldName = folder.getName();
        folder.setName(newName);
        log.info("Renamed folder {} '{}' -> '{}'", folderId, oldName, newName);

        syncDisk("rename folder " + folderId, () -> mirror.folderRelocated(oldDir, folder));
    }

    public void deleteFolder(long folderId, boolean permanent) throws NoteTreeException {
        if (folderId == Folder.ROOT_ID || folderId == Folder.TRASH_ROOT_ID) {
            throw new InvalidArgumentException("A root folder cannot be deleted");
        }
        Folder folder = getFolder(folderId);
        if (permanent || isInTrash(folder)) {
            purgeFolder(folder);
        } else {
            trashFolder(folder);
        }
    }

    public int totalNoteCountRecursive(long folderId) throws NotFoundException {
        return countNotesRecursive(getFolder(folderId));
    }

    public int countNotesRecursive(Folder folder) {
        int count = folder.getNoteCount();
        for (Long childId : folder.getFolderIds()) {
            count += index.folder(childId).map(this::countNotesRecursive).orElse(0);
        }
        return count;
    }

    // Notes

    public long createNote(long parentId, String title, String content, Collection<String> tagNames)
            throws NoteTreeException {
        validateTitle(title);
        validateTagNames(tagNames);
        Folder folder = requireActiveFolder(parentId);

        Note note = new Note(ids.nextId(EntityKind.NOTE), title, content, now());
        if (tagNames != null) {
            for (String tagName : tagNames) {
                note.addTagId(tags.resolveOrCreate(tagName).getId());
            }
        }
        folder.addNote(note.getId());
        index.putNote(note, folder.getId());
        log.info("Created note {} '{}' in {}", note.getId(), title, pathOf(folder));

        writeNote(note, "create note");
        saveIdCounters();
        return note.getId();
    }

    public void moveNote(long noteId, long newFolderId) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        Folder target = requireActiveFolder(newFolderId);
        long currentId = folderOfNote(noteId);
        if (currentId == target.getId()) {
            return;
        }

        Path oldFile = mirror.fileOf(note);
        getFolder(currentId).removeNote(noteId);
        target.addNote(noteId);
        index.moveNote(noteId, target.getId());
        log.info("Moved note {} to {}", noteId, pathOf(target));

        syncDisk("move note " + noteId, () -> mirror.noteRelocated(oldFile, note));
    }

    public void renameNote(long noteId, String newTitle) throws NoteTreeException {
        validateTitle(newTitle);
        Note note = requireActiveNote(noteId);
        note.setTitle(newTitle, now());
        log.info("Renamed note {} to '{}'", noteId, newTitle);
        writeNote(note, "rename note");
    }

    /**
     * Replace title and content. A null title or content keeps the current
     * value. Changed content pushes the previous content onto the history.
     */
    public void editNote(long noteId, String newTitle, String newContent) throws NoteTreeException {
        if (newTitle != null) {
            validateTitle(newTitle);
        }
        Note note = requireActiveNote(noteId);
        requireEditableContent(note, newContent);
        applyEdit(note, newTitle, newContent);
        writeNote(note, "edit note");
    }

    /**
     * As {@link #editNote(long, String, String)}, also replacing the note's tag set
     */
    public void editNote(long noteId, String newTitle, String newContent, Collection<String> tagNames)
            throws NoteTreeException {
        if (newTitle != null) {
            validateTitle(newTitle);
        }
        validateTagNames(tagNames);
        Note note = requireActiveNote(noteId);
        requireEditableContent(note, newContent);
        applyEdit(note, newTitle, newContent);
        note.clearTagIds();
        if (tagNames != null) {
            for (String tagName : tagNames) {
                note.addTagId(tags.resolveOrCreate(tagName).getId());
            }
        }
        writeNote(note, "edit note");
    }

    // Encrypted content can only be replaced by decrypting it
    private static void requireEditableContent(Note note, String newContent) throws InvalidArgumentException {
        if (note.isEncrypted() && newContent != null && !newContent.equals(note.getContent())) {
            throw new InvalidArgumentException("Note " + note.getId() + " is encrypted, decrypt it before editing");
        }
    }

    private void applyEdit(Note note, String newTitle, String newContent) {
        Instant at = now();
        if (newTitle != null && !newTitle.equals(note.getTitle())) {
            note.setTitle(newTitle, at);
        }
        if (newContent != null && note.updateContent(newContent, at)) {
            log.info("Edited note {}, {} versions in history", note.getId(), note.getHistory().size());
        }
    }

    public void deleteNote(long noteId, boolean permanent) throws NoteTreeException {
        Note note = getNote(noteId);
        if (permanent || note.isTrashed()) {
            purgeNote(note);
        } else {
            trashNote(note);
        }
    }

    // Trash

    public TrashContents getTrashContents() {
        FolderContents contents = contentsOf(trashRoot);
        return new TrashContents(contents.getNotes(), contents.getFolders());
    }

    /**
     * Move a trashed item back under the folder it was deleted from.
     *
     * @return id of the folder the item was restored into
     */
    public long restoreItem(long id, boolean isNote) throws NoteTreeException {
        return isNote ? restoreNote(id) : restoreFolder(id);
    }

    private long restoreNote(long noteId) throws NoteTreeException {
        Note note = index.note(noteId)
            .filter(Note::isTrashed)
            .orElseThrow(() -> new NotFoundException("Note not in the trash: " + noteId));
        long holderId = folderOfNote(noteId);
        if (holderId != Folder.TRASH_ROOT_ID || note.getOriginalParentId() == null) {
            throw new OriginalParentGoneException(String.format(
                "Note %d sits inside trashed folder %d, restore that folder instead", noteId, holderId));
        }
        Folder target = activeOriginalParent(note.getOriginalParentId(), "Note " + noteId);

        Path oldFile = mirror.fileOf(note);
        trashRoot.removeNote(noteId);
        target.addNote(noteId);
        note.restoreFromTrash();
        index.moveNote(noteId, target.getId());
        log.info("Restored note {} to {}", noteId, pathOf(target));

        syncDisk("restore note " + noteId, () -> mirror.noteRelocated(oldFile, note));
        return target.getId();
    }

    private long restoreFolder(long folderId) throws NoteTreeException {
        Folder folder = index.folder(folderId)
            .filter(f -> f.getId() != Folder.TRASH_ROOT_ID && f.isTrashed())
            .orElseThrow(() -> new NotFoundException("Folder not in the trash: " + folderId));
        if (!Objects.equals(folder.getParentId(), Folder.TRASH_ROOT_ID) || folder.getOriginalParentId() == null) {
            throw new OriginalParentGoneException(String.format(
                "Folder %d sits inside trashed folder %d, restore that folder instead",
                folderId, folder.getParentId()));
        }
        Folder target = activeOriginalParent(folder.getOriginalParentId(), "Folder " + folderId);
        requireUniqueName(target, folder.getName());

        Path oldDir = mirror.directoryOf(folder);
        trashRoot.removeSubfolder(folderId);
        target.addSubfolder(folderId);
        folder.setParentId(target.getId());
        folder.setOriginalParentId(null);
        markTrashed(folder, false);
        log.info("Restored folder {} '{}' to {}", folderId, folder.getName(), pathOf(target));

        syncDisk("restore folder " + folderId, () -> mirror.folderRelocated(oldDir, folder));
        return target.getId();
    }

    private Folder activeOriginalParent(long originalParentId, String what) throws OriginalParentGoneException {
        return index.folder(originalParentId)
            .filter(f -> !isInTrash(f))
            .orElseThrow(() -> new OriginalParentGoneException(String.format(
                "%s cannot be restored, its original folder %d no longer exists", what, originalParentId)));
    }

    /**
     * Purge everything in the trash. Every item is removed from memory even if
     * some directory or file cannot be deleted; the first such failure is
     * reported once all deletions have been attempted.
     *
     * @return number of notes and folders purged
     */
    public int emptyTrash() throws MirrorException {
        MirrorException firstFailure = null;
        int purged = 0;

        for (Long folderId : new ArrayList<>(trashRoot.getFolderIds())) {
            Folder folder = index.folder(folderId).orElse(null);
            if (folder == null) {
                continue;
            }
            Path dir = mirror.directoryOf(folder);
            trashRoot.removeSubfolder(folderId);
            purged += unregisterSubtree(folder);
            try {
                mirror.folderRemoved(dir);
            } catch (IOException e) {
                log.error("Failed to delete trashed folder {}: {}", dir, e.getMessage());
                if (firstFailure == null) {
                    firstFailure = new MirrorException("Failed to delete " + dir, e);
                }
            }
        }
        for (Long noteId : new ArrayList<>(trashRoot.getNoteIds())) {
            Note note = index.note(noteId).orElse(null);
            if (note == null) {
                continue;
            }
            Path file = mirror.fileOf(note);
            trashRoot.removeNote(noteId);
            index.removeNote(noteId);
            purged++;
            try {
                mirror.noteRemoved(file);
            } catch (IOException e) {
                log.error("Failed to delete trashed note {}: {}", file, e.getMessage());
                if (firstFailure == null) {
                    firstFailure = new MirrorException("Failed to delete " + file, e);
                }
            }
        }

        log.info("Emptied trash, {} items purged", purged);
        if (firstFailure != null) {
            throw firstFailure;
        }
        return purged;
    }

    private void trashNote(Note note) throws NoteTreeException {
        long noteId = note.getId();
        long holderId = folderOfNote(noteId);
        Path oldFile = mirror.fileOf(note);

        getFolder(holderId).removeNote(noteId);
        trashRoot.addNote(noteId);
        note.moveToTrash(holderId);
        index.moveNote(noteId, Folder.TRASH_ROOT_ID);
        log.info("Moved note {} '{}' to trash", noteId, note.getTitle());

        syncDisk("move note " + noteId + " to trash", () -> mirror.noteRelocated(oldFile, note));
    }

    private void trashFolder(Folder folder) throws MirrorException {
        Path oldDir = mirror.directoryOf(folder);
        Folder parent = parentOf(folder);

        parent.removeSubfolder(folder.getId());
        trashRoot.addSubfolder(folder.getId());
        folder.setParentId(Folder.TRASH_ROOT_ID);
        folder.setOriginalParentId(parent.getId());
        markTrashed(folder, true);
        resetCurrentIfDetached();
        log.info("Moved folder {} '{}' to trash", folder.getId(), folder.getName());

        syncDisk("move folder " + folder.getId() + " to trash", () -> mirror.folderRelocated(oldDir, folder));
    }

    private void markTrashed(Folder folder, boolean trashed) {
        folder.setTrashed(trashed);
        for (Long noteId : folder.getNoteIds()) {
            index.note(noteId).ifPresent(note -> {
                if (trashed) {
                    note.moveToTrash(null);
                } else {
                    note.restoreFromTrash();
                }
            });
        }
        for (Long childId : folder.getFolderIds()) {
            index.folder(childId).ifPresent(child -> markTrashed(child, trashed));
        }
    }

    private void purgeNote(Note note) throws NoteTreeException {
        long noteId = note.getId();
        Path file = mirror.fileOf(note);
        getFolder(folderOfNote(noteId)).removeNote(noteId);
        index.removeNote(noteId);
        log.info("Purged note {} '{}'", noteId, note.getTitle());

        syncDisk("delete note " + noteId, () -> mirror.noteRemoved(file));
    }

    private void purgeFolder(Folder folder) throws MirrorException {
        Path dir = mirror.directoryOf(folder);
        parentOf(folder).removeSubfolder(folder.getId());
        int purged = unregisterSubtree(folder);
        resetCurrentIfDetached();
        log.info("Purged folder {} '{}' ({} items)", folder.getId(), folder.getName(), purged);

        syncDisk("delete folder " + folder.getId(), () -> mirror.folderRemoved(dir));
    }

    /**
     * Drop a folder and everything under it from the index, deepest first
     */
    private int unregisterSubtree(Folder folder) {
        int count = 0;
        for (Long childId : new ArrayList<>(folder.getFolderIds())) {
            Optional<Folder> child = index.folder(childId);
            if (child.isPresent()) {
                count += unregisterSubtree(child.get());
            }
        }
        for (Long noteId : folder.getNoteIds()) {
            index.removeNote(noteId);
            count++;
        }
        index.removeFolder(folder.getId());
        return count + 1;
    }

    private void resetCurrentIfDetached() {
        Optional<Folder> current = index.folder(currentFolderId);
        if (current.isEmpty() || isInTrash(current.get())) {
            log.debug("Current folder {} left the active tree, back to root", currentFolderId);
            currentFolderId = Folder.ROOT_ID;
        }
    }

    // Tags

    public Tag createTag(String name) throws NoteTreeException {
        Tag tag = tags.create(name);
        log.info("Created tag {} '{}'", tag.getId(), name);
        return tag;
    }

    /**
     * Remove a tag from the table and from every note that carries it,
     * active or trashed. Every affected file is rewritten; the first write
     * failure is reported after all notes have been updated.
     */
    public void deleteTag(String name) throws NoteTreeException {
        Tag tag = tags.find(name)
            .orElseThrow(() -> new NotFoundException("Tag not found: " + name));

        List<Note> affected = new ArrayList<>();
        for (Note note : index.notes()) {
            if (note.removeTagId(tag.getId())) {
                affected.add(note);
            }
        }
        tags.remove(tag.getId());
        log.info("Deleted tag {} '{}' from {} notes", tag.getId(), name, affected.size());

        MirrorException firstFailure = null;
        for (Note note : affected) {
            try {
                writeNote(note, "untag note");
            } catch (MirrorException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    public Tag addTagToNote(long noteId, String tagName) throws NoteTreeException {
        TagTable.validateName(tagName);
        Note note = requireActiveNote(noteId);
        Tag tag = tags.resolveOrCreate(tagName);
        if (note.addTagId(tag.getId())) {
            log.info("Tagged note {} with '{}'", noteId, tagName);
            writeNote(note, "tag note");
        }
        return tag;
    }

    public void removeTagFromNote(long noteId, String tagName) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        Tag tag = tags.find(tagName)
            .orElseThrow(() -> new NotFoundException("Tag not found: " + tagName));
        if (!note.removeTagId(tag.getId())) {
            throw new NotFoundException(String.format("Note %d is not tagged '%s'", noteId, tagName));
        }
        log.info("Removed tag '{}' from note {}", tagName, noteId);
        writeNote(note, "untag note");
    }

    public List<Tag> getTagsOf(long noteId) throws NotFoundException {
        return tagsOf(getNote(noteId));
    }

    public List<Tag> tagsOf(Note note) {
        List<Tag> result = new ArrayList<>();
        for (Long tagId : note.getTagIds()) {
            tags.get(tagId).ifPresent(result::add);
        }
        return result;
    }

    public List<String> tagNamesOf(Note note) {
        return tagsOf(note).stream().map(Tag::getName).toList();
    }

    /**
     * Tags referenced by at least one note in the active tree, by tag id
     */
    public List<Tag> getAllTags() {
        TreeSet<Long> referenced = new TreeSet<>();
        collectTagIds(root, referenced);
        List<Tag> result = new ArrayList<>();
        for (Long tagId : referenced) {
            tags.get(tagId).ifPresent(result::add);
        }
        return result;
    }

    private void collectTagIds(Folder folder, TreeSet<Long> into) {
        for (Long noteId : folder.getNoteIds()) {
            index.note(noteId).ifPresent(note -> into.addAll(note.getTagIds()));
        }
        for (Long childId : folder.getFolderIds()) {
            index.folder(childId).ifPresent(child -> collectTagIds(child, into));
        }
    }

    public List<Tag> listTagTable() {
        return tags.all();
    }

    // Versions

    public List<NoteVersion> getHistory(long noteId) throws NotFoundException {
        return getNote(noteId).getHistory();
    }

    public void revertToVersion(long noteId, int versionIndex) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        if (note.isEncrypted()) {
            throw new InvalidArgumentException("Note " + noteId + " is encrypted, decrypt it before reverting");
        }
        note.revertToVersion(versionIndex, now());
        log.info("Reverted note {} to version {}", noteId, versionIndex);
        writeNote(note, "revert note");
    }

    /**
     * Unified diff from a history entry to the current content, empty when equal
     */
    public String diffAgainstVersion(long noteId, int versionIndex) throws NoteTreeException {
        Note note = getNote(noteId);
        List<NoteVersion> history = note.getHistory();
        if (versionIndex < 0 || versionIndex >= history.size()) {
            throw new IndexOutOfRangeException("versions", noteId, versionIndex, history.size());
        }
        return diffWriter.generateDiff(history.get(versionIndex).getContent(), note.getContent(),
            "version-" + versionIndex, "current");
    }

    // Attachments, reminders, color, encryption

    public void addAttachment(long noteId, String path) throws NoteTreeException {
        if (path == null || path.isBlank() || containsLineBreak(path)) {
            throw new InvalidArgumentException("Attachment path must be a single non-blank line");
        }
        Note note = requireActiveNote(noteId);
        String value = path.strip();
        if (note.getAttachments().contains(value)) {
            return;
        }
        note.addAttachment(value);
        writeNote(note, "attach file to note");
    }

    public void removeAttachment(long noteId, String path) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        if (path == null || !note.removeAttachment(path.strip())) {
            throw new NotFoundException(String.format("Note %d has no attachment %s", noteId, path));
        }
        writeNote(note, "detach file from note");
    }

    public Reminder addReminder(long noteId, Instant due, String description) throws NoteTreeException {
        if (due == null) {
            throw new InvalidArgumentException("Reminder needs a due time");
        }
        if (description != null && containsLineBreak(description)) {
            throw new InvalidArgumentException("Reminder description must be a single line");
        }
        Note note = requireActiveNote(noteId);
        Reminder reminder = new Reminder(due, description == null ? "" : description.strip());
        note.addReminder(reminder);
        log.info("Added reminder to note {} due {}", noteId, due);
        writeNote(note, "add reminder");
        return reminder;
    }

    public void completeReminder(long noteId, int reminderIndex) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        List<Reminder> reminders = note.getReminders();
        if (reminderIndex < 0 || reminderIndex >= reminders.size()) {
            throw new IndexOutOfRangeException("reminders", noteId, reminderIndex, reminders.size());
        }
        reminders.get(reminderIndex).markCompleted();
        writeNote(note, "complete reminder");
    }

    public void setColorLabel(long noteId, ColorLabel label) throws NoteTreeException {
        if (label == null || label.getName() == null || label.getName().isBlank()
                || containsLineBreak(label.getName())) {
            throw new InvalidArgumentException("Color label needs a single-line name");
        }
        if (label.getHexCode() == null || !HEX_COLOR.matcher(label.getHexCode()).matches()) {
            throw new InvalidArgumentException("Not a hex color code: " + (label.getHexCode()));
        }
        Note note = requireActiveNote(noteId);
        note.setColorLabel(new ColorLabel(label.getName().strip(), label.getHexCode()));
        writeNote(note, "label note");
    }

    public void clearColorLabel(long noteId) throws NoteTreeException {
        Note note = requireActiveNote(noteId);
        if (note.getColorLabel() != null) {
            note.setColorLabel(null);
            writeNote(note, "unlabel note");
        }
    }

    public void encryptNote(long noteId, String key) throws NoteTreeException {
        requireKey(key);
        Note note = requireActiveNote(noteId);
        if (note.isEncrypted()) {
            throw new InvalidArgumentException("Note " + noteId + " is already encrypted");
        }
        note.replaceEncryptedContent(cipher.encrypt(note.getContent(), key), true, now());
        log.info("Encrypted note {}", noteId);
        writeNote(note, "encrypt note");
    }

    public void decryptNote(long noteId, String key) throws NoteTreeException {
        requireKey(key);
        Note note = requireActiveNote(noteId);
        if (!note.isEncrypted()) {
            throw new InvalidArgumentException("Note " + noteId + " is not encrypted");
        }
        String plainText;
        try {
            plainText = cipher.decrypt(note.getContent(), key);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Note " + noteId + " does not hold valid cipher text");
        }
        note.replaceEncryptedContent(plainText, false, now());
        log.info("Decrypted note {}", noteId);
        writeNote(note, "decrypt note");
    }

    private static void requireKey(String key) throws InvalidArgumentException {
        if (key == null || key.isEmpty()) {
            throw new InvalidArgumentException("Encryption key must not be empty");
        }
    }

    // Export and import

    public String renderNote(long noteId, ExportFormat format) throws NotFoundException {
        Note note = getNote(noteId);
        return exporter.render(note, tagNamesOf(note), format);
    }

    public String convertNoteToHtml(long noteId) throws NotFoundException {
        return renderNote(noteId, ExportFormat.HTML);
    }

    public Path exportNote(long noteId, ExportFormat format, Path target) throws NoteTreeException {
        Note note = getNote(noteId);
        try {
            return exporter.export(note, tagNamesOf(note), format, target);
        } catch (IOException e) {
            log.error("Failed to export note {} to {}: {}", noteId, target, e.getMessage());
            throw new MirrorException("Failed to export note " + noteId, e);
        }
    }

    /**
     * Create a note from a text file: the file name without extension becomes
     * the title, the file text the content.
     */
    public long importNoteFromText(Path file, long folderId) throws NoteTreeException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new MirrorException("Failed to read " + file, e);
        }
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String title = dot > 0 ? fileName.substring(0, dot) : fileName;
        return createNote(folderId, title, content, List.of());
    }

    // Startup scan

    public void initializeFromFileSystem() throws NoteTreeException {
        initializeFromFileSystem(mirror.getDataRoot(), mirror.getTrashRoot());
    }

    /**
     * Replace the in-memory trees with what is on disk. Malformed files are
     * skipped. Notes and folders whose ids are missing or already taken get
     * fresh ids, and their files are rewritten to match.
     */
    public void initializeFromFileSystem(Path dataPath, Path trashPath) throws NoteTreeException {
        TreeScanner scanner = new TreeScanner(fileReader, metadataStore);
        ScannedFolder activeScan;
        ScannedFolder trashScan;
        try {
            activeScan = scanner.scan(dataPath);
            trashScan = scanner.scan(trashPath);
        } catch (IOException e) {
            throw new MirrorException("Failed to scan " + dataPath + " and " + trashPath, e);
        }

        mirror = new TreeMirror(dataPath, trashPath, index, tags, fileWriter, metadataStore);
        resetTrees();

        try {
            ids.restore(idCounterStore.read(dataPath));
        } catch (IOException e) {
            log.warn("Unreadable id counters in {}, continuing from the ids on disk: {}", dataPath, e.getMessage());
        }
        observeIds(activeScan, true);
        observeIds(trashScan, true);

        List<Repair> repairs = new ArrayList<>();
        attachChildren(activeScan, root, false, repairs);
        attachChildren(trashScan, trashRoot, true, repairs);

        MirrorException firstFailure = null;
        for (Repair repair : repairs) {
            try {
                repair.action().run();
            } catch (IOException e) {
                log.error("Failed to {}: {}", repair.description(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = new MirrorException("Failed to " + repair.description(), e);
                }
            }
        }
        try {
            idCounterStore.write(dataPath, ids.snapshot());
        } catch (IOException e) {
            log.error("Failed to save id counters: {}", e.getMessage());
            if (firstFailure == null) {
                firstFailure = new MirrorException("Failed to save id counters", e);
            }
        }

        log.info("Loaded {} notes and {} folders ({} items in trash), {} tags, {} files repaired",
            index.noteCount(), index.folderCount() - 2,
            trashRoot.getNoteCount() + trashRoot.getSubfolderCount(), tags.size(), repairs.size());
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    private void observeIds(ScannedFolder scanned, boolean isBase) {
        if (!isBase && scanned.getMetadata() != null && scanned.getMetadata().getId() != null
                && scanned.getMetadata().getId() > 0) {
            ids.observe(EntityKind.FOLDER, scanned.getMetadata().getId());
        }
        for (NoteDocument doc : scanned.getNotes()) {
            if (doc.getNoteId() != null && doc.getNoteId() > 0) {
                ids.observe(EntityKind.NOTE, doc.getNoteId());
            }
        }
        for (ScannedFolder child : scanned.getChildren()) {
            observeIds(child, false);
        }
    }

    private void attachChildren(ScannedFolder scanned, Folder folder, boolean trashed, List<Repair> repairs) {
        for (NoteDocument doc : scanned.getNotes()) {
            attachNote(doc, folder, trashed, repairs);
        }
        for (ScannedFolder child : scanned.getChildren()) {
            attachFolder(child, folder, trashed, repairs);
        }
    }

    private void attachFolder(ScannedFolder scanned, Folder parent, boolean trashed, List<Repair> repairs) {
        FolderMetadata metadata = scanned.getMetadata();
        boolean topOfTrash = parent.getId() == Folder.TRASH_ROOT_ID;
        String dirName = scanned.getDirectoryName();

        String name = dirName;
        if (topOfTrash) {
            name = metadata != null && metadata.getName() != null ? metadata.getName() : stripTrashPrefix(dirName);
        }

        Long id = metadata == null ? null : metadata.getId();
        boolean rewriteMetadata = metadata == null
            || !name.equals(metadata.getName())
            || (!topOfTrash && metadata.getOriginalParentId() != null);
        if (id == null || id <= 0 || index.containsFolder(id)) {
            if (id != null) {
                log.warn("Folder id {} in {} is already taken, assigning a new one", id, scanned.getDirectory());
            }
            id = ids.nextId(EntityKind.FOLDER);
            rewriteMetadata = true;
        }

        Instant created = metadata != null && metadata.getCreated() != null ? metadata.getCreated() : now();
        Folder folder = new Folder(id, name, parent.getId(), created);
        folder.setTrashed(trashed);
        if (topOfTrash && metadata != null) {
            folder.setOriginalParentId(metadata.getOriginalParentId());
        }
        parent.addSubfolder(folder.getId());
        index.putFolder(folder);

        // Resolved when the repair runs, after any parent directory has been renamed
        String expectedName = mirror.directoryOf(folder).getFileName().toString();
        if (!expectedName.equals(dirName)) {
            repairs.add(new Repair("rename directory " + scanned.getDirectory(),
                () -> mirror.folderRelocated(mirror.directoryOf(parent).resolve(dirName), folder)));
        } else if (rewriteMetadata) {
            repairs.add(new Repair("write metadata for folder " + folder.getId(),
                () -> mirror.folderMetadataChanged(folder)));
        }

        attachChildren(scanned, folder, trashed, repairs);
    }

    private void attachNote(NoteDocument doc, Folder folder, boolean trashed, List<Repair> repairs) {
        boolean rewrite = !doc.hasRequiredProperties();
        NoteDocument source = doc;
        Long id = doc.getNoteId();
        if (id != null && (id <= 0 || index.containsNote(id))) {
            log.warn("Note id {} in {} is already taken, assigning a new one", id, doc.getFilePath());
            source = doc.withNoteId(null);
            rewrite = true;
        }
        NoteDocument normalized = fileWriter.normalize(source, () -> ids.nextId(EntityKind.NOTE), now());

        Note note = new Note(normalized.getNoteId(), normalized.getTitle(), normalized.getContent(),
            normalized.getCreated(), normalized.getUpdated());
        if (normalized.getTags() != null) {
            for (String tagName : normalized.getTags()) {
                try {
                    note.addTagId(tags.resolveOrCreate(tagName).getId());
                } catch (InvalidArgumentException e) {
                    log.warn("Ignoring tag '{}' in {}: {}", tagName, doc.getFilePath(), e.getMessage());
                }
            }
        }
        note.setEncrypted(normalized.isEncrypted());
        note.setColorLabel(normalized.getColorLabel());
        if (normalized.getAttachments() != null) {
            normalized.getAttachments().forEach(note::addAttachment);
        }
        if (normalized.getReminders() != null) {
            normalized.getReminders().forEach(note::addReminder);
        }
        if (trashed) {
            note.moveToTrash(folder.getId() == Folder.TRASH_ROOT_ID ? normalized.getOriginalParentId() : null);
        }
        if (!Objects.equals(normalized.getOriginalParentId(), note.getOriginalParentId())) {
            rewrite = true;
        }

        folder.addNote(note.getId());
        index.putNote(note, folder.getId());

        String actualName = doc.getFilePath().getFileName().toString();
        if (!TreeMirror.fileName(note.getId()).equals(actualName)) {
            repairs.add(new Repair("rename note file " + doc.getFilePath(),
                () -> mirror.noteRelocated(mirror.directoryOf(folder).resolve(actualName), note)));
        } else if (rewrite) {
            repairs.add(new Repair("rewrite note file " + doc.getFilePath(), () -> mirror.noteWritten(note)));
        }
    }

    private static String stripTrashPrefix(String dirName) {
        Matcher matcher = TRASH_DIR_PREFIX.matcher(dirName);
        return matcher.matches() ? matcher.group(1) : dirName;
    }

    // Helpers

    private Note requireActiveNote(long noteId) throws NotFoundException {
        Note note = getNote(noteId);
        if (note.isTrashed()) {
            throw new NotFoundException("Note " + noteId + " is in the trash");
        }
        return note;
    }

    private Folder requireActiveFolder(long folderId) throws NotFoundException {
        Folder folder = getFolder(folderId);
        if (isInTrash(folder)) {
            throw new NotFoundException("Folder " + folderId + " is in the trash");
        }
        return folder;
    }

    private Folder parentOf(Folder folder) {
        Long parentId = folder.getParentId();
        if (parentId == null) {
            throw new IllegalStateException("Folder " + folder.getId() + " is a root");
        }
        return index.folder(parentId)
            .orElseThrow(() -> new IllegalStateException("Folder " + parentId + " is not indexed"));
    }

    private Optional<Folder> childFolderNamed(Folder parent, String name) {
        for (Long childId : parent.getFolderIds()) {
            Optional<Folder> child = index.folder(childId);
            if (child.isPresent() && child.get().getName().equals(name)) {
                return child;
            }
        }
        return Optional.empty();
    }

    private void requireUniqueName(Folder parent, String name) throws DuplicateNameException {
        if (childFolderNamed(parent, name).isPresent()) {
            throw new DuplicateNameException(String.format(
                "A folder named '%s' already exists in %s", name, pathOf(parent)));
        }
    }

    /**
     * True if candidateId is ancestorId or lies below it
     */
    private boolean isSelfOrDescendant(long ancestorId, long candidateId) {
        Long current = candidateId;
        while (current != null) {
            if (current == ancestorId) {
                return true;
            }
            current = index.folder(current).map(Folder::getParentId).orElse(null);
        }
        return false;
    }

    private static void validateFolderName(String name) throws InvalidArgumentException {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Folder name must not be blank");
        }
        if (name.contains("/") || name.contains("\\") || containsLineBreak(name)) {
            throw new InvalidArgumentException("Folder name must not contain slashes or line breaks: " + name);
        }
        if (name.startsWith(".")) {
            throw new InvalidArgumentException("Folder name must not start with '.': " + name);
        }
    }

    private static void validateTitle(String title) throws InvalidArgumentException {
        if (title == null || title.isBlank()) {
            throw new InvalidArgumentException("Note title must not be blank");
        }
        if (containsLineBreak(title)) {
            throw new InvalidArgumentException("Note title must be a single line");
        }
    }

    private static void validateTagNames(Collection<String> tagNames) throws InvalidArgumentException {
        if (tagNames == null) {
            return;
        }
        for (String tagName : tagNames) {
            TagTable.validateName(tagName);
        }
    }

    private static boolean containsLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }

    private Instant now() {
        return clock.instant();
    }

    private void writeNote(Note note, String action) throws MirrorException {
        syncDisk(action + " " + note.getId(), () -> mirror.noteWritten(note));
    }

    private void saveIdCounters() throws MirrorException {
        syncDisk("save id counters", () -> idCounterStore.write(mirror.getDataRoot(), ids.snapshot()));
    }

    private void syncDisk(String description, DiskAction action) throws MirrorException {
        try {
            action.run();
        } catch (IOException e) {
            log.error("Failed to {}: {}", description, e.getMessage());
            throw new MirrorException("Failed to " + description, e);
        }
    }

    @FunctionalInterface
    private interface DiskAction {
        void run() throws IOException;
    }

    private record Repair(String description, DiskAction action) {
    }
}
