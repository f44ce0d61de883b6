package com.dcruver.notetree.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Content of a note captured right before it was overwritten.
 */
@Value
public class NoteVersion {
    Instant timestamp;
    String content;
}
