package com.dcruver.notetree.domain;

import java.io.IOException;

/**
 * Disk synchronization failed. The in-memory change that preceded it is kept.
 */
public class MirrorException extends NoteTreeException {

    public MirrorException(String message, IOException cause) {
        super(ErrorKind.IO, message + ": " + cause.getMessage(), cause);
    }
}
