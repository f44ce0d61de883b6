package com.dcruver.notetree.domain;

/**
 * A sibling folder or a tag already uses the name.
 */
public class DuplicateNameException extends NoteTreeException {

    public DuplicateNameException(String message) {
        super(ErrorKind.DUPLICATE_NAME, message);
    }
}
