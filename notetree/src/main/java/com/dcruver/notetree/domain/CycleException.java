package com.dcruver.notetree.domain;

/**
 * Moving the folder would make it its own descendant, or the folder is a root.
 */
public class CycleException extends NoteTreeException {

    public CycleException(String message) {
        super(ErrorKind.CYCLE, message);
    }
}
