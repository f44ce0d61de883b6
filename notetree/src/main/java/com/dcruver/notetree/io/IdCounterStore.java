package com.dcruver.notetree.io;

import com.dcruver.notetree.domain.EntityKind;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Keeps the id counters in {@code .notetree-ids.json} at the top of the data
 * directory, so ids of purged entities are not handed out again after a restart.
 */
@Component
public class IdCounterStore {

    public static final String FILE_NAME = ".notetree-ids.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public void write(Path dataRoot, Map<EntityKind, Long> nextIds) throws IOException {
        Files.createDirectories(dataRoot);
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(nextIds);
        Files.writeString(dataRoot.resolve(FILE_NAME), json);
    }

    /**
     * Saved counters, empty if the file does not exist
     */
    public Map<EntityKind, Long> read(Path dataRoot) throws IOException {
        Path file = dataRoot.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return new EnumMap<>(EntityKind.class);
        }
        return objectMapper.readValue(Files.readString(file), new TypeReference<Map<EntityKind, Long>>() {
        });
    }
}
