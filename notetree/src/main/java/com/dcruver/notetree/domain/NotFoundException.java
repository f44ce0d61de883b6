package com.dcruver.notetree.domain;

/**
 * Unknown id, unknown path segment, or an item that is not where the operation expects it.
 */
public class NotFoundException extends NoteTreeException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
