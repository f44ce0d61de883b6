package com.dcruver.notetree.domain;

/**
 * The folder a trashed item came from is no longer in the active tree.
 */
public class OriginalParentGoneException extends NoteTreeException {

    public OriginalParentGoneException(String message) {
        super(ErrorKind.ORIGINAL_PARENT_GONE, message);
    }
}
