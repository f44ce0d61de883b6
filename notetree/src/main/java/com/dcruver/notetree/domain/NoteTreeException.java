package com.dcruver.notetree.domain;

/**
 * Base of every failure reported by tree, tag, version and search operations.
 */
public abstract class NoteTreeException extends Exception {

    private final ErrorKind kind;

    protected NoteTreeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected NoteTreeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
