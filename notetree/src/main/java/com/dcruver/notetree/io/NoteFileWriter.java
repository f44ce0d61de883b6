package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.Reminder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.function.LongSupplier;

/**
 * Writes note files: an Org-style properties drawer, a level-1 title heading,
 * then the content exactly as stored. {@link NoteFileReader} reads them back.
 */
@Component
@Slf4j
public class NoteFileWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_INSTANT;

    /**
     * Write a note document to file, creating parent directories as needed
     */
    public void write(NoteDocument note, Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, buildContent(note));
        log.debug("Wrote note {} to: {}", note.getNoteId(), outputPath);
    }

    /**
     * Build file content from a note document
     */
    String buildContent(NoteDocument note) {
        StringBuilder sb = new StringBuilder();

        sb.append(":PROPERTIES:\n");
        if (note.getNoteId() != null) {
            sb.append(":ID:       ").append(note.getNoteId()).append("\n");
        }
        if (note.getCreated() != null) {
            sb.append(":CREATED:  ").append(formatTimestamp(note.getCreated())).append("\n");
        }
        if (note.getUpdated() != null) {
            sb.append(":UPDATED:  ").append(formatTimestamp(note.getUpdated())).append("\n");
        }
        if (note.getTags() != null && !note.getTags().isEmpty()) {
            sb.append(":TAGS:     ").append(String.join(" ", note.getTags())).append("\n");
        }
        if (note.isEncrypted()) {
            sb.append(":ENCRYPTED: true\n");
        }
        if (note.getColorLabel() != null) {
            sb.append(":COLOR:    ").append(note.getColorLabel().getName())
                .append(" ").append(note.getColorLabel().getHexCode()).append("\n");
        }
        if (note.getAttachments() != null) {
            for (String attachment : note.getAttachments()) {
                sb.append(":ATTACHMENT: ").append(attachment).append("\n");
            }
        }
        if (note.getReminders() != null) {
            for (Reminder reminder : note.getReminders()) {
                sb.append(":REMINDER: ").append(formatTimestamp(reminder.getDue()))
                    .append(reminder.isCompleted() ? " DONE" : " TODO");
                if (!reminder.getDescription().isEmpty()) {
                    sb.append(" ").append(reminder.getDescription());
                }
                sb.append("\n");
            }
        }
        if (note.getOriginalParentId() != null) {
            sb.append(":ORIGINAL_PARENT: ").append(note.getOriginalParentId()).append("\n");
        }
        sb.append(":END:\n");

        sb.append("* ").append(note.getTitle() == null ? "" : note.getTitle()).append("\n");

        // Body is written as-is, no newline normalization
        if (note.getContent() != null) {
            sb.append(note.getContent());
        }

        return sb.toString();
    }

    /**
     * Fill in what a hand-written or legacy file may lack: an id and both timestamps.
     */
    public NoteDocument normalize(NoteDocument note, LongSupplier freshIds, Instant now) {
        NoteDocument normalized = note;
        if (normalized.getNoteId() == null) {
            normalized = normalized.withNoteId(freshIds.getAsLong());
        }
        if (normalized.getCreated() == null) {
            normalized = normalized.withCreated(now);
        }
        if (normalized.getUpdated() == null) {
            normalized = normalized.withUpdated(normalized.getCreated());
        }
        return normalized;
    }

    private String formatTimestamp(Instant instant) {
        return "[" + TIMESTAMP_FORMAT.format(instant) + "]";
    }
}
