package com.dcruver.notetree.domain;

import lombok.Value;

/**
 * A tag owned by the {@link TagTable}. Notes reference it by id only.
 */
@Value
public class Tag {
    long id;
    String name;
}
