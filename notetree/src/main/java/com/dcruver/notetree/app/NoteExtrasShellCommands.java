package com.dcruver.notetree.app;

import com.dcruver.notetree.config.NoteTreeProperties;
import com.dcruver.notetree.domain.ColorLabel;
import com.dcruver.notetree.domain.InvalidArgumentException;
import com.dcruver.notetree.domain.NoteTreeException;
import com.dcruver.notetree.domain.Reminder;
import com.dcruver.notetree.export.ExportFormat;
import com.dcruver.notetree.store.NoteTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

/**
 * Shell commands for export and import, reminders, attachments, color
 * labels, encryption, the log tail and reloading from disk.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class NoteExtrasShellCommands {

    private final NoteTree noteTree;
    private final NoteTreeProperties properties;

    @Value("${logging.file.name:notetree.log}")
    private String logFile = "notetree.log";

    // Export and import

    @ShellMethod(key = "export", value = "Export a note as md, json, html or txt")
    public String export(long noteId, String format, @ShellOption(defaultValue = ShellOption.NULL) String file) {
        try {
            ExportFormat exportFormat = ExportFormat.parse(format)
                .orElseThrow(() -> new InvalidArgumentException(
                    "Unknown export format '" + format + "', expected md, json, html or txt"));
            Path target = file != null
                ? Paths.get(file)
                : Paths.get(properties.getExportDir()).resolve("note-" + noteId + "." + exportFormat.getExtension());
            Path written = noteTree.exportNote(noteId, exportFormat, target);
            return "Exported note " + noteId + " to " + written.toAbsolutePath();
        } catch (NoteTreeException e) {
            return failed("export", e);
        }
    }

    @ShellMethod(key = "html", value = "Convert a note's Markdown content to an HTML file")
    public String html(long noteId, String file) {
        try {
            Path written = noteTree.exportNote(noteId, ExportFormat.HTML, Paths.get(file));
            return "Wrote " + written.toAbsolutePath();
        } catch (NoteTreeException e) {
            return failed("html", e);
        }
    }

    @ShellMethod(key = "import", value = "Create a note in the current folder from a text file")
    public String importText(String file) {
        try {
            long id = noteTree.importNoteFromText(Paths.get(file), noteTree.getCurrentFolder().getId());
            return String.format("Imported %s as note %d", file, id);
        } catch (NoteTreeException e) {
            return failed("import", e);
        }
    }

    // Reminders

    @ShellMethod(key = "remind", value = "Add a reminder to a note, due at an ISO date or date-time (UTC)")
    public String remind(long noteId, String due, @ShellOption(defaultValue = "") String description) {
        try {
            Instant dueAt = ShellArguments.parseInstant(due, false);
            if (dueAt == null) {
                throw new InvalidArgumentException("Reminder needs a due time");
            }
            Reminder reminder = noteTree.addReminder(noteId, dueAt, description);
            return String.format("Reminder set on note %d for %s", noteId, reminder.getDue());
        } catch (NoteTreeException e) {
            return failed("remind", e);
        }
    }

    @ShellMethod(key = "reminder-done", value = "Mark a note's reminder as completed")
    public String reminderDone(long noteId, int index) {
        try {
            noteTree.completeReminder(noteId, index);
            return String.format("Reminder %d of note %d done", index, noteId);
        } catch (NoteTreeException e) {
            return failed("reminder-done", e);
        }
    }

    // Attachments

    @ShellMethod(key = "attach", value = "Attach a file path to a note")
    public String attach(long noteId, String path) {
        try {
            noteTree.addAttachment(noteId, path);
            return String.format("Attached %s to note %d", path, noteId);
        } catch (NoteTreeException e) {
            return failed("attach", e);
        }
    }

    @ShellMethod(key = "detach", value = "Remove an attached file path from a note")
    public String detach(long noteId, String path) {
        try {
            noteTree.removeAttachment(noteId, path);
            return String.format("Detached %s from note %d", path, noteId);
        } catch (NoteTreeException e) {
            return failed("detach", e);
        }
    }

    // Color labels

    @ShellMethod(key = "color", value = "Label a note with a color, or clear the label with --clear")
    public String color(long noteId,
                        @ShellOption(defaultValue = ShellOption.NULL) String name,
                        @ShellOption(defaultValue = ShellOption.NULL) String hex,
                        @ShellOption(defaultValue = "false") boolean clear) {
        try {
            if (clear) {
                noteTree.clearColorLabel(noteId);
                return "Cleared color label of note " + noteId;
            }
            ColorLabel label = new ColorLabel(name, hex);
            noteTree.setColorLabel(noteId, label);
            return String.format("Labelled note %d %s", noteId, label);
        } catch (NoteTreeException e) {
            return failed("color", e);
        }
    }

    // Encryption

    @ShellMethod(key = "encrypt", value = "Encrypt a note's content")
    public String encrypt(long noteId, @ShellOption(defaultValue = ShellOption.NULL) String key) {
        try {
            noteTree.encryptNote(noteId, keyOrDefault(key));
            return "Encrypted note " + noteId;
        } catch (NoteTreeException e) {
            return failed("encrypt", e);
        }
    }

    @ShellMethod(key = "decrypt", value = "Decrypt a note's content")
    public String decrypt(long noteId, @ShellOption(defaultValue = ShellOption.NULL) String key) {
        try {
            noteTree.decryptNote(noteId, keyOrDefault(key));
            return "Decrypted note " + noteId;
        } catch (NoteTreeException e) {
            return failed("decrypt", e);
        }
    }

    private String keyOrDefault(String key) {
        return key != null ? key : properties.getCipherKey();
    }

    // Maintenance

    @ShellMethod(key = "logs", value = "Show the tail of the log file")
    public String logs(@ShellOption(defaultValue = "0") int lines) {
        int count = lines > 0 ? lines : properties.getLogTailLines();
        Path path = Paths.get(logFile);
        if (!Files.exists(path)) {
            return "No log file at " + path.toAbsolutePath();
        }
        try {
            List<String> all = Files.readAllLines(path);
            return String.join("\n", all.subList(Math.max(0, all.size() - count), all.size()));
        } catch (IOException e) {
            log.error("Failed to read log file {}", path, e);
            return "Failed to read log file: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reload", value = "Discard in-memory state and reload from disk")
    public String reload() {
        try {
            noteTree.initializeFromFileSystem();
            return String.format("Reloaded %d notes and %d folders",
                noteTree.getIndex().noteCount(), noteTree.getIndex().folderCount() - 2);
        } catch (NoteTreeException e) {
            return failed("reload", e);
        }
    }

    private String failed(String command, NoteTreeException e) {
        log.warn("{} failed: {}", command, e.getMessage());
        return e.getKind() + ": " + e.getMessage();
    }
}
