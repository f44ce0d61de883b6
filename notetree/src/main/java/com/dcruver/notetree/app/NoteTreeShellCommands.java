package com.dcruver.notetree.app;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.NotFoundException;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.NoteTreeException;
import com.dcruver.notetree.domain.NoteVersion;
import com.dcruver.notetree.domain.Reminder;
import com.dcruver.notetree.domain.Tag;
import com.dcruver.notetree.search.NoteSearchEngine;
import com.dcruver.notetree.search.SearchCriteria;
import com.dcruver.notetree.search.SearchScope;
import com.dcruver.notetree.store.FolderContents;
import com.dcruver.notetree.store.NoteTree;
import com.dcruver.notetree.store.TrashContents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Spring Shell commands for browsing and editing the note tree.
 * Each command maps onto one {@link NoteTree} operation; failures are
 * rendered as {@code KIND: message} and the shell keeps running.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class NoteTreeShellCommands {

    private final NoteTree noteTree;
    private final NoteSearchEngine searchEngine;

    // Folders and navigation

    @ShellMethod(key = "ls", value = "List notes and folders in the current folder or a path")
    public String ls(@ShellOption(defaultValue = ShellOption.NULL) String path) {
        try {
            Folder folder = path == null
                ? noteTree.getCurrentFolder()
                : noteTree.findFolderByPath(path).orElseThrow(() -> new NotFoundException("No such folder: " + path));
            FolderContents contents = noteTree.contentsOf(folder);

            StringBuilder sb = new StringBuilder();
            sb.append(noteTree.pathOf(folder)).append("\n");
            if (contents.isEmpty()) {
                sb.append("  (empty)\n");
            }
            for (Note note : contents.getNotes()) {
                sb.append("  ").append(formatNote(note)).append("\n");
            }
            for (Folder child : contents.getFolders()) {
                sb.append(String.format("  [%d] %s/  (%d notes, %d folders)%n",
                    child.getId(), child.getName(), child.getNoteCount(), child.getSubfolderCount()));
            }
            return sb.toString();
        } catch (NoteTreeException e) {
            return failed("ls", e);
        }
    }

    @ShellMethod(key = "cd", value = "Change the current folder")
    public String cd(@ShellOption(defaultValue = "/") String path) {
        try {
            noteTree.changeCurrentFolder(path);
            return noteTree.getCurrentPath();
        } catch (NoteTreeException e) {
            return failed("cd", e);
        }
    }

    @ShellMethod(key = "pwd", value = "Show the current folder path")
    public String pwd() {
        return noteTree.getCurrentPath();
    }

    @ShellMethod(key = "mkdir", value = "Create a folder in the current folder")
    public String mkdir(String name) {
        try {
            long id = noteTree.createFolder(noteTree.getCurrentFolder().getId(), name);
            return String.format("Created folder %d '%s'", id, name);
        } catch (NoteTreeException e) {
            return failed("mkdir", e);
        }
    }

    @ShellMethod(key = "rmdir", value = "Move a folder to the trash, or purge it with --permanent")
    public String rmdir(String path, @ShellOption(defaultValue = "false") boolean permanent) {
        try {
            Folder folder = noteTree.findFolderByPath(path)
                .orElseThrow(() -> new NotFoundException("No such folder: " + path));
            boolean purge = permanent || noteTree.isInTrash(folder);
            noteTree.deleteFolder(folder.getId(), permanent);
            return String.format(purge ? "Deleted folder %d '%s'" : "Moved folder %d '%s' to trash",
                folder.getId(), folder.getName());
        } catch (NoteTreeException e) {
            return failed("rmdir", e);
        }
    }

    @ShellMethod(key = "mvdir", value = "Move a folder under another folder")
    public String mvdir(long folderId, long parentId) {
        try {
            noteTree.moveFolder(folderId, parentId);
            return "Moved folder to " + noteTree.pathOf(folderId);
        } catch (NoteTreeException e) {
            return failed("mvdir", e);
        }
    }

    @ShellMethod(key = "rename-folder", value = "Rename a folder")
    public String renameFolder(long folderId, String name) {
        try {
            noteTree.renameFolder(folderId, name);
            return "Renamed folder to " + noteTree.pathOf(folderId);
        } catch (NoteTreeException e) {
            return failed("rename-folder", e);
        }
    }

    // Notes

    @ShellMethod(key = "touch", value = "Create an empty note in the current folder")
    public String touch(String title) {
        return createNote("touch", title, "", List.of());
    }

    @ShellMethod(key = "new", value = "Create a note with content in the current folder")
    public String newNote(String title, String content, @ShellOption(defaultValue = "") String tags) {
        return createNote("new", title, content, ShellArguments.splitTags(tags));
    }

    private String createNote(String command, String title, String content, List<String> tagNames) {
        try {
            long id = noteTree.createNote(noteTree.getCurrentFolder().getId(), title, content, tagNames);
            return String.format("Created note %d '%s'", id, title);
        } catch (NoteTreeException e) {
            return failed(command, e);
        }
    }

    @ShellMethod(key = "edit", value = "Replace the content of a note")
    public String edit(long noteId, String content,
                       @ShellOption(defaultValue = ShellOption.NULL) String title,
                       @ShellOption(defaultValue = ShellOption.NULL) String tags) {
        try {
            if (tags == null) {
                noteTree.editNote(noteId, title, content);
            } else {
                noteTree.editNote(noteId, title, content, ShellArguments.splitTags(tags));
            }
            return String.format("Saved note %d (%d versions)", noteId, noteTree.getHistory(noteId).size());
        } catch (NoteTreeException e) {
            return failed("edit", e);
        }
    }

    @ShellMethod(key = "view", value = "Show a note with its properties")
    public String view(long noteId) {
        try {
            Note note = noteTree.getNote(noteId);
            long folderId = noteTree.folderOfNote(noteId);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("[%d] %s%n", note.getId(), note.getTitle()));
            sb.append("Folder:   ").append(noteTree.pathOf(folderId)).append("\n");
            sb.append("Created:  ").append(DateTimeFormatter.ISO_INSTANT.format(note.getCreated())).append("\n");
            sb.append("Updated:  ").append(DateTimeFormatter.ISO_INSTANT.format(note.getUpdated())).append("\n");
            List<String> tagNames = noteTree.tagNamesOf(note);
            if (!tagNames.isEmpty()) {
                sb.append("Tags:     ").append(String.join(", ", tagNames)).append("\n");
            }
            sb.append(String.format("Words:    %d, characters: %d%n", note.getWordCount(), note.getCharCount()));
            if (note.getColorLabel() != null) {
                sb.append("Color:    ").append(note.getColorLabel()).append("\n");
            }
            if (note.isEncrypted()) {
                sb.append("Encrypted\n");
            }
            for (String attachment : note.getAttachments()) {
                sb.append("Attached: ").append(attachment).append("\n");
            }
            List<Reminder> reminders = note.getReminders();
            for (int i = 0; i < reminders.size(); i++) {
                Reminder reminder = reminders.get(i);
                sb.append(String.format("Reminder %d: [%s] %s %s%n", i,
                    reminder.isCompleted() ? "DONE" : "TODO",
                    DateTimeFormatter.ISO_INSTANT.format(reminder.getDue()), reminder.getDescription()));
            }
            sb.append("Versions: ").append(note.getHistory().size()).append("\n");
            sb.append("\n").append(note.getContent());
            return sb.toString();
        } catch (NoteTreeException e) {
            return failed("view", e);
        }
    }

    @ShellMethod(key = "rename-note", value = "Change the title of a note")
    public String renameNote(long noteId, String title) {
        try {
            noteTree.renameNote(noteId, title);
            return String.format("Renamed note %d to '%s'", noteId, title);
        } catch (NoteTreeException e) {
            return failed("rename-note", e);
        }
    }

    @ShellMethod(key = "rm", value = "Move a note to the trash, or purge it with --permanent")
    public String rm(long noteId, @ShellOption(defaultValue = "false") boolean permanent) {
        try {
            Note note = noteTree.getNote(noteId);
            boolean purge = permanent || note.isTrashed();
            noteTree.deleteNote(noteId, permanent);
            return String.format(purge ? "Deleted note %d '%s'" : "Moved note %d '%s' to trash",
                noteId, note.getTitle());
        } catch (NoteTreeException e) {
            return failed("rm", e);
        }
    }

    @ShellMethod(key = "mvnote", value = "Move a note into another folder")
    public String mvnote(long noteId, long folderId) {
        try {
            noteTree.moveNote(noteId, folderId);
            return String.format("Moved note %d to %s", noteId, noteTree.pathOf(folderId));
        } catch (NoteTreeException e) {
            return failed("mvnote", e);
        }
    }

    // Tags

    @ShellMethod(key = "tag", value = "Tag a note, creating the tag if needed")
    public String tag(long noteId, String name) {
        try {
            Tag tag = noteTree.addTagToNote(noteId, name);
            return String.format("Tagged note %d with '%s'", noteId, tag.getName());
        } catch (NoteTreeException e) {
            return failed("tag", e);
        }
    }

    @ShellMethod(key = "untag", value = "Remove a tag from a note")
    public String untag(long noteId, String name) {
        try {
            noteTree.removeTagFromNote(noteId, name);
            return String.format("Removed tag '%s' from note %d", name, noteId);
        } catch (NoteTreeException e) {
            return failed("untag", e);
        }
    }

    @ShellMethod(key = "tags", value = "List tags in use, every tag with --all, or the tags of one note")
    public String tags(@ShellOption(defaultValue = "false") boolean all,
                       @ShellOption(defaultValue = ShellOption.NULL) Long note) {
        try {
            List<Tag> tags;
            if (note != null) {
                tags = noteTree.getTagsOf(note);
            } else if (all) {
                tags = noteTree.listTagTable();
            } else {
                tags = noteTree.getAllTags();
            }
            if (tags.isEmpty()) {
                return "No tags.";
            }
            StringBuilder sb = new StringBuilder();
            for (Tag tag : tags) {
                sb.append(String.format("[%d] %s%n", tag.getId(), tag.getName()));
            }
            return sb.toString();
        } catch (NoteTreeException e) {
            return failed("tags", e);
        }
    }

    @ShellMethod(key = "tag-create", value = "Create a tag")
    public String tagCreate(String name) {
        try {
            Tag tag = noteTree.createTag(name);
            return String.format("Created tag %d '%s'", tag.getId(), tag.getName());
        } catch (NoteTreeException e) {
            return failed("tag-create", e);
        }
    }

    @ShellMethod(key = "tag-delete", value = "Delete a tag and remove it from every note")
    public String tagDelete(String name) {
        try {
            noteTree.deleteTag(name);
            return "Deleted tag '" + name + "'";
        } catch (NoteTreeException e) {
            return failed("tag-delete", e);
        }
    }

    // Search

    @ShellMethod(key = "search", value = "Search notes by keyword, tags and last-modified range")
    public String search(@ShellOption(defaultValue = "") String keyword,
                         @ShellOption(defaultValue = "") String tags,
                         @ShellOption(defaultValue = ShellOption.NULL) String from,
                         @ShellOption(defaultValue = ShellOption.NULL) String to,
                         @ShellOption(defaultValue = "active") String scope) {
        try {
            SearchScope searchScope;
            try {
                searchScope = SearchScope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return "Unknown scope '" + scope + "', expected active, trash or both";
            }
            SearchCriteria criteria = SearchCriteria.builder()
                .keyword(keyword)
                .tagNames(ShellArguments.splitTags(tags))
                .from(ShellArguments.parseInstant(from, false))
                .to(ShellArguments.parseInstant(to, true))
                .scope(searchScope)
                .build();

            List<Note> results = searchEngine.search(criteria);
            if (results.isEmpty()) {
                return "No matching notes.";
            }
            StringBuilder sb = new StringBuilder();
            sb.append(results.size()).append(results.size() == 1 ? " note:\n" : " notes:\n");
            for (Note note : results) {
                sb.append("  ").append(formatNote(note))
                    .append("  in ").append(noteTree.pathOf(noteTree.folderOfNote(note.getId()))).append("\n");
            }
            return sb.toString();
        } catch (NoteTreeException e) {
            return failed("search", e);
        }
    }

    // Trash

    @ShellMethod(key = "trash ls", value = "List items in the trash")
    public String trashList() {
        TrashContents contents = noteTree.getTrashContents();
        if (contents.isEmpty()) {
            return "Trash is empty.";
        }
        StringBuilder sb = new StringBuilder();
        for (Note note : contents.getNotes()) {
            sb.append("  ").append(formatNote(note))
                .append("  from folder ").append(note.getOriginalParentId()).append("\n");
        }
        for (Folder folder : contents.getFolders()) {
            sb.append(String.format("  [%d] %s/  (%d notes)  from folder %s%n", folder.getId(), folder.getName(),
                noteTree.countNotesRecursive(folder),
                folder.getOriginalParentId()));
        }
        return sb.toString();
    }

    @ShellMethod(key = "trash restore", value = "Restore a note, or a folder with --folder, from the trash")
    public String trashRestore(long id, @ShellOption(defaultValue = "false") boolean folder) {
        try {
            long targetId = noteTree.restoreItem(id, !folder);
            return String.format("Restored %s %d to %s", folder ? "folder" : "note", id, noteTree.pathOf(targetId));
        } catch (NoteTreeException e) {
            return failed("trash restore", e);
        }
    }

    @ShellMethod(key = "trash empty", value = "Permanently delete everything in the trash")
    public String trashEmpty() {
        try {
            int purged = noteTree.emptyTrash();
            return "Purged " + purged + " items from the trash";
        } catch (NoteTreeException e) {
            return failed("trash empty", e);
        }
    }

    // Versions

    @ShellMethod(key = "history", value = "List the saved versions of a note")
    public String history(long noteId) {
        try {
            List<NoteVersion> history = noteTree.getHistory(noteId);
            if (history.isEmpty()) {
                return "No versions for note " + noteId;
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < history.size(); i++) {
                NoteVersion version = history.get(i);
                sb.append(String.format("%d. %s  %s%n", i,
                    DateTimeFormatter.ISO_INSTANT.format(version.getTimestamp()), preview(version.getContent())));
            }
            return sb.toString();
        } catch (NoteTreeException e) {
            return failed("history", e);
        }
    }

    @ShellMethod(key = "revert", value = "Restore the content of a saved version")
    public String revert(long noteId, int index) {
        try {
            noteTree.revertToVersion(noteId, index);
            return String.format("Reverted note %d to version %d", noteId, index);
        } catch (NoteTreeException e) {
            return failed("revert", e);
        }
    }

    @ShellMethod(key = "diff", value = "Show the changes from a saved version to the current content")
    public String diff(long noteId, int index) {
        try {
            String diff = noteTree.diffAgainstVersion(noteId, index);
            return diff.isEmpty() ? "No differences." : diff;
        } catch (NoteTreeException e) {
            return failed("diff", e);
        }
    }

    // Rendering

    private static String formatNote(Note note) {
        return String.format("[%d] %s  (%d words)", note.getId(), note.getTitle(), note.getWordCount());
    }

    private static String preview(String content) {
        String firstLine = content.lines().findFirst().orElse("");
        return firstLine.length() > 60 ? firstLine.substring(0, 57) + "..." : firstLine;
    }

    private String failed(String command, NoteTreeException e) {
        log.warn("{} failed: {}", command, e.getMessage());
        return e.getKind() + ": " + e.getMessage();
    }
}
