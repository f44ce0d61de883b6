package com.dcruver.notetree.domain;

import java.nio.file.Path;

/**
 * A note file on disk could not be decoded. Only raised while scanning at startup.
 */
public class NoteParseException extends NoteTreeException {

    private final Path file;

    public NoteParseException(Path file, String message) {
        super(ErrorKind.PARSE, file + ": " + message);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
