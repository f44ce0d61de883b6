package com.dcruver.notetree.domain;

/**
 * A version or reminder index outside the note's list.
 */
public class IndexOutOfRangeException extends NoteTreeException {

    public IndexOutOfRangeException(String listName, long noteId, int index, int size) {
        super(ErrorKind.INDEX_OUT_OF_RANGE,
            String.format("Note %d has %d %s, index %d is out of range", noteId, size, listName, index));
    }
}
