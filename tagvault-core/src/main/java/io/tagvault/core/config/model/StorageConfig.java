package io.tagvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String directory,
    String fileName,
    String keyFile,
    String backupDirectory,
    int maxBackups
) {

    public static StorageConfig defaults() {
        return new StorageConfig(
            "~/.tagvault/data",
            "memories.json",
            ".keyring.json",
            "~/.tagvault/backups",
            5
        );
    }
}
