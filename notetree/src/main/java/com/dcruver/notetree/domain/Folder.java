package com.dcruver.notetree.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A folder node. Children are held by id in insertion order; the parent is an
 * id reference resolved through the index, null only for the two roots.
 */
@Getter
public class Folder {

    // Reserved ids, the folder counter starts at 1
    public static final long ROOT_ID = 0L;
    public static final long TRASH_ROOT_ID = -1L;

    private final long id;
    @Setter
    private String name;
    @Setter
    private Long parentId;
    private final Instant created;
    @Setter
    private boolean trashed;
    @Setter
    private Long originalParentId;

    @Getter(AccessLevel.NONE)
    private final List<Long> noteIds = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Long> folderIds = new ArrayList<>();

    public Folder(long id, String name, Long parentId, Instant created) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.created = created;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public List<Long> getNoteIds() {
        return Collections.unmodifiableList(noteIds);
    }

    public List<Long> getFolderIds() {
        return Collections.unmodifiableList(folderIds);
    }

    public void addNote(long noteId) {
        noteIds.add(noteId);
    }

    public boolean removeNote(long noteId) {
        return noteIds.remove(Long.valueOf(noteId));
    }

    public void addSubfolder(long folderId) {
        folderIds.add(folderId);
    }

    public boolean removeSubfolder(long folderId) {
        return folderIds.remove(Long.valueOf(folderId));
    }

    public int getNoteCount() {
        return noteIds.size();
    }

    public int getSubfolderCount() {
        return folderIds.size();
    }
}
