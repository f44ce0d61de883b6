package com.dcruver.notetree.store;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import lombok.Value;

import java.util.List;

/**
 * Items sitting directly under the trash root, i.e. the ones that can be restored.
 */
@Value
public class TrashContents {
    List<Note> notes;
    List<Folder> folders;

    public boolean isEmpty() {
        return notes.isEmpty() && folders.isEmpty();
    }
}
