package com.dcruver.notetree.store;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import lombok.Value;

import java.util.List;

/**
 * Direct children of a folder, each list in insertion order.
 */
@Value
public class FolderContents {
    Folder folder;
    List<Note> notes;
    List<Folder> folders;

    public boolean isEmpty() {
        return notes.isEmpty() && folders.isEmpty();
    }
}
