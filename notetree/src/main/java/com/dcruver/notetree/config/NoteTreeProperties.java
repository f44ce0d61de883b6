package com.dcruver.notetree.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code notetree.*} in application.yml.
 */
@ConfigurationProperties(prefix = "notetree")
@Data
public class NoteTreeProperties {

    private String dataPath = "data";
    private String trashPath = "trash";
    private boolean loadOnStartup = true;
    private String exportDir = "exports";

    // Used by encrypt/decrypt when no key is given on the command line
    private String cipherKey;

    private int logTailLines = 40;
}
