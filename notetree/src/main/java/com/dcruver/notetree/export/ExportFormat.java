package com.dcruver.notetree.export;

import java.util.Locale;
import java.util.Optional;

public enum ExportFormat {
    MARKDOWN("md"),
    JSON("json"),
    HTML("html"),
    TEXT("txt");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Look up a format by extension or name, e.g. "md" or "markdown"
     */
    public static Optional<ExportFormat> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.extension.equals(normalized) || format.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
