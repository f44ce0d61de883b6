package com.dcruver.notetree.domain;

import lombok.Value;

/**
 * Display label for a note, e.g. {@code Red #FF0000}.
 */
@Value
public class ColorLabel {
    String name;
    String hexCode;

    @Override
    public String toString() {
        return name + " " + hexCode;
    }
}
