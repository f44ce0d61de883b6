package com.dcruver.notetree.app;

import com.dcruver.notetree.domain.InvalidArgumentException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Parsing of the free-form values typed at the shell.
 */
final class ShellArguments {

    private ShellArguments() {
    }

    /**
     * Comma or space separated tag list, blank entries dropped
     */
    static List<String> splitTags(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split("[,\\s]+"))
            .filter(s -> !s.isBlank())
            .distinct()
            .toList();
    }

    /**
     * Accepts an ISO instant ({@code 2025-01-15T10:00:00Z}), a local date-time
     * ({@code 2025-01-15T10:00}) or a date ({@code 2025-01-15}), all read as UTC.
     * A bare date means the start of that day, or its last instant when
     * {@code endOfDay} is set.
     */
    static Instant parseInstant(String value, boolean endOfDay) throws InvalidArgumentException {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (text.indexOf('T') < 0) {
                LocalDate date = LocalDate.parse(text);
                LocalDate day = endOfDay ? date.plusDays(1) : date;
                Instant start = day.atStartOfDay().toInstant(ZoneOffset.UTC);
                return endOfDay ? start.minusNanos(1) : start;
            }
            if (text.endsWith("Z")) {
                return Instant.parse(text);
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new InvalidArgumentException("Not a date or time: " + value);
        }
    }
}
