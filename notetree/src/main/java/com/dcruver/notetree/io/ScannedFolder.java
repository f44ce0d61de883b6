package com.dcruver.notetree.io;

import com.dcruver.notetree.io.FolderMetadataStore.FolderMetadata;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * One directory as found on disk during a scan, before ids are checked.
 */
@Data
@Builder
public class ScannedFolder {
    private final Path directory;
    private final FolderMetadata metadata;  // null when the sidecar is missing or unreadable
    private final List<NoteDocument> notes;
    private final List<ScannedFolder> children;

    public String getDirectoryName() {
        return directory.getFileName() == null ? "" : directory.getFileName().toString();
    }
}
