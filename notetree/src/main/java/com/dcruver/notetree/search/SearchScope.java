package com.dcruver.notetree.search;

/**
 * Which tree a search walks.
 */
public enum SearchScope {
    ACTIVE,
    TRASH,
    BOTH
}
