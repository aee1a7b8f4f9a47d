package io.tagvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TagVaultConfig(
    StorageConfig storage,
    RetentionConfig retention,
    EncryptionConfig encryption
) {

    public static TagVaultConfig defaults() {
        return new TagVaultConfig(
            StorageConfig.defaults(),
            RetentionConfig.defaults(),
            EncryptionConfig.defaults()
        );
    }
}
