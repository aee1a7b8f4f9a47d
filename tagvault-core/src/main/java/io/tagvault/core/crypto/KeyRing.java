package io.tagvault.core.crypto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The active symmetric key plus at most one retired key, both Base64-encoded AES keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyRing(
    String currentKey,
    String previousKey,
    Instant createdAt
) {

    public KeyRing {
        Objects.requireNonNull(currentKey, "currentKey must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public boolean hasPreviousKey() {
        return previousKey != null && !previousKey.isBlank();
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /** Promotes {@code newKey} to current and keeps only the key it replaces. */
    public KeyRing rotate(String newKey, Instant now) {
        return new KeyRing(newKey, currentKey, now);
    }
}
