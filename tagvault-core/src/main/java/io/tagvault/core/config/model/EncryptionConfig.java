package io.tagvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptionConfig(
    boolean enabled,
    List<String> sensitiveTags,
    int keyRotationDays
) {

    public EncryptionConfig {
        sensitiveTags = sensitiveTags == null ? List.of() : List.copyOf(sensitiveTags);
    }

    public static EncryptionConfig defaults() {
        return new EncryptionConfig(
            true,
            List.of("personal", "health", "financial", "credentials"),
            90
        );
    }
}
