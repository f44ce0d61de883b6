package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.NoteParseException;
import com.dcruver.notetree.io.FolderMetadataStore.FolderMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Walks a directory tree and reads every folder sidecar and note file in it.
 * Unreadable note files are logged and skipped; the walk continues.
 */
@Slf4j
@RequiredArgsConstructor
public class TreeScanner {

    public static final String NOTE_EXTENSION = ".org";

    private final NoteFileReader fileReader;
    private final FolderMetadataStore metadataStore;

    /**
     * Scan a base directory, creating it first if it does not exist
     */
    public ScannedFolder scan(Path baseDir) throws IOException {
        Path dir = baseDir.toAbsolutePath().normalize();

        if (!Files.exists(dir)) {
            log.info("Directory does not exist, creating: {}", dir);
            Files.createDirectories(dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }

        log.info("Scanning notes at: {}", dir);
        return scanDirectory(dir);
    }

    private ScannedFolder scanDirectory(Path dir) throws IOException {
        FolderMetadata metadata = null;
        try {
            metadata = metadataStore.read(dir).orElse(null);
        } catch (IOException e) {
            log.warn("Unreadable folder metadata in {}, a new id will be assigned: {}", dir, e.getMessage());
        }

        List<Path> entries;
        try (Stream<Path> paths = Files.list(dir)) {
            entries = paths.sorted().toList();
        }

        List<NoteDocument> notes = new ArrayList<>();
        List<ScannedFolder> children = new ArrayList<>();

        for (Path entry : entries) {
            String fileName = entry.getFileName().toString();
            if (fileName.startsWith(".")) {
                continue;  // sidecars and other hidden files
            }

            if (Files.isDirectory(entry)) {
                children.add(scanDirectory(entry));
            } else if (Files.isRegularFile(entry) && fileName.endsWith(NOTE_EXTENSION)) {
                try {
                    notes.add(fileReader.read(entry));
                } catch (NoteParseException e) {
                    log.warn("Skipping malformed note file: {}", e.getMessage());
                } catch (IOException e) {
                    log.warn("Skipping unreadable note file {}: {}", entry, e.getMessage());
                }
            }
        }

        // Creation order is id order; files without an id go last
        notes.sort(Comparator.comparing(NoteDocument::getNoteId, Comparator.nullsLast(Comparator.naturalOrder())));
        children.sort(Comparator.comparing(
            (ScannedFolder child) -> child.getMetadata() == null ? null : child.getMetadata().getId(),
            Comparator.nullsLast(Comparator.naturalOrder())));

        return ScannedFolder.builder()
            .directory(dir)
            .metadata(metadata)
            .notes(notes)
            .children(children)
            .build();
    }
}
