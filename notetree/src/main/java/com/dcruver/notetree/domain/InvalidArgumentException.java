package com.dcruver.notetree.domain;

/**
 * Blank or malformed names, and operations that roots do not support.
 */
public class InvalidArgumentException extends NoteTreeException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
