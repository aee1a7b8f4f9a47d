package io.tagvault.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.core.crypto.SealedPayload;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Stored form of a memory. Exactly one of {@code payload} (plaintext) and {@code sealed}
 * (ciphertext) is set, and {@code encrypted} says which. Instances are immutable; every change
 * produces a new record under the same id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryRecord(
    String id,
    JsonNode payload,
    SealedPayload sealed,
    List<String> tags,
    Instant createdAt,
    Instant lastAccessedAt,
    int accessCount,
    Instant expiresAt,
    boolean encrypted
) {

    public MemoryRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (payload != null && (payload.isNull() || payload.isMissingNode()) && encrypted) {
            payload = null;
        }
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount must be >= 0");
        }
        if (encrypted && (sealed == null || payload != null)) {
            throw new IllegalArgumentException("encrypted record " + id + " must carry only a sealed payload");
        }
        if (!encrypted && (payload == null || sealed != null)) {
            throw new IllegalArgumentException("plaintext record " + id + " must carry only a plaintext payload");
        }
    }

    public static MemoryRecord create(String id, JsonNode payload, List<String> tags, Instant createdAt, Instant expiresAt) {
        return new MemoryRecord(id, payload, null, tags, createdAt, null, 0, expiresAt, false);
    }

    /** Last read time, or creation time for a record never read. */
    public Instant lastTouched() {
        return lastAccessedAt == null ? createdAt : lastAccessedAt;
    }

    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public MemoryRecord withAccess(Instant now) {
        return new MemoryRecord(id, payload, sealed, tags, createdAt, now, accessCount + 1, expiresAt, encrypted);
    }

    public MemoryRecord withTags(List<String> newTags) {
        return new MemoryRecord(id, payload, sealed, newTags, createdAt, lastAccessedAt, accessCount, expiresAt, encrypted);
    }

    public MemoryRecord withPlaintext(JsonNode newPayload) {
        return new MemoryRecord(id, newPayload, null, tags, createdAt, lastAccessedAt, accessCount, expiresAt, false);
    }

    public MemoryRecord withSealed(SealedPayload newSealed) {
        return new MemoryRecord(id, null, newSealed, tags, createdAt, lastAccessedAt, accessCount, expiresAt, true);
    }
}
