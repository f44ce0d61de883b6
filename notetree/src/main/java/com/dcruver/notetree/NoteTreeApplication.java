package com.dcruver.notetree;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for NoteTree.
 *
 * An interactive shell over a hierarchy of folders and notes with a trash,
 * tags and per-note version history. The hierarchy is mirrored to a data
 * directory and a trash directory, one file per note.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NoteTreeApplication {

    public static void main(String[] args) {
        log.info("Starting NoteTree...");
        SpringApplication.run(NoteTreeApplication.class, args);
    }
}
