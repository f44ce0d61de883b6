package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.Folder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes the {@code .folder.json} sidecar kept in every folder directory.
 * The sidecar keeps folder ids stable across restarts and remembers where a
 * trashed folder came from.
 */
@Component
public class FolderMetadataStore {

    public static final String FILE_NAME = ".folder.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public void write(Path directory, Folder folder) throws IOException {
        FolderMetadata metadata = new FolderMetadata();
        metadata.setId(folder.getId());
        metadata.setName(folder.getName());
        metadata.setCreated(folder.getCreated());
        metadata.setOriginalParentId(folder.getOriginalParentId());

        Files.createDirectories(directory);
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metadata);
        Files.writeString(directory.resolve(FILE_NAME), json);
    }

    /**
     * Read the sidecar of a directory, empty if there is none
     */
    public Optional<FolderMetadata> read(Path directory) throws IOException {
        Path file = directory.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(Files.readString(file), FolderMetadata.class));
    }

    /**
     * Sidecar contents.
     */
    @Data
    public static class FolderMetadata {
        private Long id;
        private String name;
        private Instant created;
        private Long originalParentId;
    }
}
