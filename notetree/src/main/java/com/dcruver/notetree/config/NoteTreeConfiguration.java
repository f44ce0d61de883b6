package com.dcruver.notetree.config;

import com.dcruver.notetree.domain.NoteTreeException;
import com.dcruver.notetree.export.NoteExporter;
import com.dcruver.notetree.export.VersionDiffWriter;
import com.dcruver.notetree.io.FolderMetadataStore;
import com.dcruver.notetree.io.IdCounterStore;
import com.dcruver.notetree.io.NoteFileReader;
import com.dcruver.notetree.io.NoteFileWriter;
import com.dcruver.notetree.search.NoteSearchEngine;
import com.dcruver.notetree.security.ContentCipher;
import com.dcruver.notetree.security.XorContentCipher;
import com.dcruver.notetree.store.NoteTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builds the note tree from configuration and loads it from disk.
 */
@Configuration
@Slf4j
public class NoteTreeConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContentCipher contentCipher() {
        return new XorContentCipher();
    }

    @Bean
    public NoteTree noteTree(NoteTreeProperties properties, Clock clock, ContentCipher contentCipher,
                             NoteFileReader fileReader, NoteFileWriter fileWriter,
                             FolderMetadataStore metadataStore, IdCounterStore idCounterStore,
                             NoteExporter exporter, VersionDiffWriter diffWriter) throws NoteTreeException {
        Path dataPath = resolve(properties.getDataPath());
        Path trashPath = resolve(properties.getTrashPath());
        log.info("Data directory: {}, trash directory: {}", dataPath, trashPath);

        NoteTree noteTree = new NoteTree(dataPath, trashPath, clock, contentCipher,
            fileReader, fileWriter, metadataStore, idCounterStore, exporter, diffWriter);
        if (properties.isLoadOnStartup()) {
            noteTree.initializeFromFileSystem();
        } else {
            log.info("Skipping startup scan (notetree.load-on-startup=false)");
        }
        return noteTree;
    }

    @Bean
    public NoteSearchEngine noteSearchEngine(NoteTree noteTree) {
        return new NoteSearchEngine(noteTree);
    }

    private static Path resolve(String path) {
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home")))
            .toAbsolutePath()
            .normalize();
    }
}
