package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.ColorLabel;
import com.dcruver.notetree.domain.Reminder;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a note: the properties drawer, the title heading and the
 * raw content body. Tags are carried by name, not by id.
 */
@Data
@Builder
@With
public class NoteDocument {
    // File metadata
    private final Path filePath;

    // Properties drawer
    private final Long noteId;  // :ID:
    private final Instant created;  // :CREATED:
    private final Instant updated;  // :UPDATED:
    private final List<String> tags;  // :TAGS:
    private final boolean encrypted;  // :ENCRYPTED:
    private final ColorLabel colorLabel;  // :COLOR:
    private final List<String> attachments;  // :ATTACHMENT: (repeatable)
    private final List<Reminder> reminders;  // :REMINDER: (repeatable)
    private final Long originalParentId;  // :ORIGINAL_PARENT:

    // Content structure
    private final String title;  // Level-1 heading
    private final String content;  // Everything after the heading line, byte-exact

    /**
     * Check if the drawer carries everything needed to rebuild the note as-is
     */
    public boolean hasRequiredProperties() {
        return noteId != null && created != null && updated != null;
    }
}
