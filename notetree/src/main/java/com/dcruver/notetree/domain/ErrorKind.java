package com.dcruver.notetree.domain;

/**
 * Tags carried by every {@link NoteTreeException} so callers can branch on the failure.
 */
public enum ErrorKind {
    NOT_FOUND,
    DUPLICATE_NAME,
    CYCLE,
    ORIGINAL_PARENT_GONE,
    INDEX_OUT_OF_RANGE,
    IO,
    PARSE,
    INVALID_ARGUMENT
}
