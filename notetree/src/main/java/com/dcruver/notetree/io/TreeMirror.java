package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.Folder;
import com.dcruver.notetree.domain.Note;
import com.dcruver.notetree.domain.TagTable;
import com.dcruver.notetree.index.IdIndex;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors the active tree under the data directory and the trash tree under
 * the trash directory. Folder maps to directory, note maps to one file.
 *
 * Paths are derived from the tree on demand, so callers that change the tree
 * must capture the old path before mutating and hand it in afterwards.
 */
@Slf4j
public class TreeMirror {

    @Getter
    private final Path dataRoot;
    @Getter
    private final Path trashRoot;
    private final IdIndex index;
    private final TagTable tags;
    private final NoteFileWriter fileWriter;
    private final FolderMetadataStore metadataStore;

    public TreeMirror(Path dataRoot, Path trashRoot, IdIndex index, TagTable tags,
                      NoteFileWriter fileWriter, FolderMetadataStore metadataStore) {
        this.dataRoot = dataRoot.toAbsolutePath().normalize();
        this.trashRoot = trashRoot.toAbsolutePath().normalize();
        this.index = index;
        this.tags = tags;
        this.fileWriter = fileWriter;
        this.metadataStore = metadataStore;
    }

    // Path derivation

    public Path directoryOf(Folder folder) {
        if (folder.getId() == Folder.ROOT_ID) {
            return dataRoot;
        }
        if (folder.getId() == Folder.TRASH_ROOT_ID) {
            return trashRoot;
        }
        Folder parent = index.folder(folder.getParentId())
            .orElseThrow(() -> new IllegalStateException("Folder " + folder.getId() + " has no indexed parent"));
        String dirName = parent.getId() == Folder.TRASH_ROOT_ID
            ? trashDirectoryName(folder)
            : folder.getName();
        return directoryOf(parent).resolve(dirName);
    }

    /**
     * Trashed folders from different parents may share a name, so the
     * top level of the trash prefixes the id.
     */
    static String trashDirectoryName(Folder folder) {
        return folder.getId() + "-" + folder.getName();
    }

    public Path fileOf(Note note) {
        long folderId = index.folderOf(note.getId())
            .orElseThrow(() -> new IllegalStateException("Note " + note.getId() + " has no indexed folder"));
        Folder folder = index.folder(folderId)
            .orElseThrow(() -> new IllegalStateException("Folder " + folderId + " is not indexed"));
        return directoryOf(folder).resolve(fileName(note.getId()));
    }

    public static String fileName(long noteId) {
        return "note-" + noteId + TreeScanner.NOTE_EXTENSION;
    }

    // Folder mirroring

    public void ensureRoots() throws IOException {
        Files.createDirectories(dataRoot);
        Files.createDirectories(trashRoot);
    }

    public void folderCreated(Folder folder) throws IOException {
        Path dir = directoryOf(folder);
        Files.createDirectories(dir);
        metadataStore.write(dir, folder);
        log.debug("Created directory for folder {}: {}", folder.getId(), dir);
    }

    /**
     * Move a folder's directory, and with it every descendant file, to where
     * the tree now says it belongs. Also refreshes the sidecar.
     */
    public void folderRelocated(Path oldDir, Folder folder) throws IOException {
        Path newDir = directoryOf(folder);
        if (!oldDir.equals(newDir)) {
            if (Files.exists(oldDir)) {
                Files.createDirectories(newDir.getParent());
                moveTree(oldDir, newDir);
                log.debug("Moved directory {} -> {}", oldDir, newDir);
            } else {
                log.warn("Directory {} was missing, recreating folder {} at {}", oldDir, folder.getId(), newDir);
                Files.createDirectories(newDir);
            }
        }
        metadataStore.write(newDir, folder);
    }

    public void folderMetadataChanged(Folder folder) throws IOException {
        metadataStore.write(directoryOf(folder), folder);
    }

    public void folderRemoved(Path dir) throws IOException {
        deleteTree(dir);
        log.debug("Deleted directory {}", dir);
    }

    // Note mirroring

    public void noteWritten(Note note) throws IOException {
        fileWriter.write(toDocument(note), fileOf(note));
    }

    /**
     * Write the note at its new location, then drop the old file
     */
    public void noteRelocated(Path oldFile, Note note) throws IOException {
        Path newFile = fileOf(note);
        fileWriter.write(toDocument(note), newFile);
        if (!oldFile.equals(newFile)) {
            Files.deleteIfExists(oldFile);
        }
    }

    public void noteRemoved(Path file) throws IOException {
        Files.deleteIfExists(file);
        log.debug("Deleted note file {}", file);
    }

    public NoteDocument toDocument(Note note) {
        List<String> tagNames = new ArrayList<>();
        for (Long tagId : note.getTagIds()) {
            tagNames.add(tags.nameOf(tagId));
        }
        return NoteDocument.builder()
            .noteId(note.getId())
            .created(note.getCreated())
            .updated(note.getUpdated())
            .tags(tagNames)
            .encrypted(note.isEncrypted())
            .colorLabel(note.getColorLabel())
            .attachments(new ArrayList<>(note.getAttachments()))
            .reminders(new ArrayList<>(note.getReminders()))
            .originalParentId(note.getOriginalParentId())
            .title(note.getTitle())
            .content(note.getContent())
            .build();
    }

    // Filesystem helpers

    private void moveTree(Path source, Path target) throws IOException {
        try {
            Files.move(source, target);
        } catch (DirectoryNotEmptyException e) {
            // Different file stores: a non-empty directory has to be copied
            copyTree(source, target);
            deleteTree(source);
        }
    }

    private void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()), StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
