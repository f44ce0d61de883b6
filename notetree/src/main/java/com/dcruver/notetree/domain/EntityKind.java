package com.dcruver.notetree.domain;

/**
 * Kinds of entities that receive ids. Each kind has its own counter.
 */
public enum EntityKind {
    NOTE,
    FOLDER,
    TAG
}
