package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.ColorLabel;
import com.dcruver.notetree.domain.NoteParseException;
import com.dcruver.notetree.domain.Reminder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads note files written by {@link NoteFileWriter}.
 * The body after the title heading is returned byte-exact.
 */
@Component
@Slf4j
public class NoteFileReader {

    private static final Pattern PROPERTIES_START = Pattern.compile("^\\s*:PROPERTIES:\\s*$");
    private static final Pattern PROPERTIES_END = Pattern.compile("^\\s*:END:\\s*$");
    private static final Pattern PROPERTY_LINE = Pattern.compile("^\\s*:(\\w+):\\s*(.*?)\\s*$");
    private static final Pattern HEADING = Pattern.compile("^\\*(?: (.*))?$");
    private static final Pattern REMINDER = Pattern.compile("^\\[([^\\]]+)\\]\\s+(TODO|DONE)(?:\\s(.*))?$");
    private static final Pattern COLOR = Pattern.compile("^(.+?)\\s+(#[0-9A-Fa-f]{3,8})$");

    // Accepted timestamp formats; the writer uses ISO instants
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
        DateTimeFormatter.ISO_INSTANT,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd")
    );

    /**
     * Read and parse a note file
     */
    public NoteDocument read(Path filePath) throws IOException, NoteParseException {
        String raw = Files.readString(filePath);
        int pos = 0;

        // Skip leading blank lines
        String line = null;
        while (pos < raw.length()) {
            int end = lineEnd(raw, pos);
            line = stripCarriageReturn(raw.substring(pos, end));
            if (!line.isBlank()) {
                break;
            }
            pos = next(raw, end);
            line = null;
        }
        if (line == null) {
            throw new NoteParseException(filePath, "file is empty");
        }

        Map<String, String> properties = new HashMap<>();
        List<String> attachments = new ArrayList<>();
        List<Reminder> reminders = new ArrayList<>();

        // Properties drawer, optional
        if (PROPERTIES_START.matcher(line).matches()) {
            pos = next(raw, lineEnd(raw, pos));
            boolean closed = false;
            while (pos < raw.length()) {
                int end = lineEnd(raw, pos);
                String property = stripCarriageReturn(raw.substring(pos, end));
                pos = next(raw, end);

                if (PROPERTIES_END.matcher(property).matches()) {
                    closed = true;
                    break;
                }
                if (property.isBlank()) {
                    continue;
                }

                Matcher propMatcher = PROPERTY_LINE.matcher(property);
                if (!propMatcher.matches()) {
                    throw new NoteParseException(filePath, "malformed property line: " + property);
                }
                String key = propMatcher.group(1);
                String value = propMatcher.group(2);
                switch (key) {
                    case "ATTACHMENT" -> attachments.add(value);
                    case "REMINDER" -> reminders.add(parseReminder(filePath, value));
                    default -> properties.put(key, value);
                }
            }
            if (!closed) {
                throw new NoteParseException(filePath, "properties drawer is not closed with :END:");
            }
        }

        // Title heading
        if (pos >= raw.length()) {
            throw new NoteParseException(filePath, "missing title heading");
        }
        int headingEnd = lineEnd(raw, pos);
        Matcher headingMatcher = HEADING.matcher(stripCarriageReturn(raw.substring(pos, headingEnd)));
        if (!headingMatcher.matches()) {
            throw new NoteParseException(filePath, "expected '* <title>' heading");
        }
        String title = headingMatcher.group(1) == null ? "" : headingMatcher.group(1);
        String content = headingEnd < raw.length() ? raw.substring(headingEnd + 1) : "";

        return NoteDocument.builder()
            .filePath(filePath)
            .noteId(parseId(filePath, "ID", properties.get("ID")))
            .created(parseTimestamp(properties.get("CREATED")))
            .updated(parseTimestamp(properties.get("UPDATED")))
            .tags(parseTags(properties.get("TAGS")))
            .encrypted(Boolean.parseBoolean(properties.get("ENCRYPTED")))
            .colorLabel(parseColor(filePath, properties.get("COLOR")))
            .attachments(attachments)
            .reminders(reminders)
            .originalParentId(parseId(filePath, "ORIGINAL_PARENT", properties.get("ORIGINAL_PARENT")))
            .title(title)
            .content(content)
            .build();
    }

    private static int lineEnd(String raw, int from) {
        int idx = raw.indexOf('\n', from);
        return idx < 0 ? raw.length() : idx;
    }

    private static int next(String raw, int lineEnd) {
        return Math.min(raw.length(), lineEnd + 1);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private Long parseId(Path filePath, String key, String value) throws NoteParseException {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new NoteParseException(filePath, ":" + key + ": is not a number: " + value);
        }
    }

    private List<String> parseTags(String value) {
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(value.trim().split("\\s+")));
    }

    private ColorLabel parseColor(Path filePath, String value) throws NoteParseException {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = COLOR.matcher(value);
        if (!matcher.matches()) {
            throw new NoteParseException(filePath, "malformed :COLOR: value: " + value);
        }
        return new ColorLabel(matcher.group(1), matcher.group(2));
    }

    private Reminder parseReminder(Path filePath, String value) throws NoteParseException {
        Matcher matcher = REMINDER.matcher(value);
        if (!matcher.matches()) {
            throw new NoteParseException(filePath, "malformed :REMINDER: value: " + value);
        }
        Instant due = parseTimestamp(matcher.group(1));
        if (due == null) {
            throw new NoteParseException(filePath, "unreadable reminder date: " + matcher.group(1));
        }
        String description = matcher.group(3) == null ? "" : matcher.group(3);
        return new Reminder(due, description, "DONE".equals(matcher.group(2)));
    }

    /**
     * Parse a bracketed timestamp to Instant, assuming UTC for local formats
     */
    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }

        String clean = timestamp.replaceAll("[\\[\\]<>]", "").trim();

        for (DateTimeFormatter formatter : TIMESTAMP_FORMATS) {
            try {
                TemporalAccessor parsed = formatter.parse(clean);
                if (parsed.isSupported(ChronoField.INSTANT_SECONDS)) {
                    return Instant.from(parsed);
                }
                // Local formats are read as UTC
                if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                    return LocalDateTime.from(parsed).atZone(ZoneOffset.UTC).toInstant();
                }
                return LocalDate.from(parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeException e) {
                // Try next format
            }
        }

        log.warn("Failed to parse timestamp: {}", timestamp);
        return null;
    }
}
