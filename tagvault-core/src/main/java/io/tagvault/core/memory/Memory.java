package io.tagvault.core.memory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

/**
 * A memory as handed to callers: plaintext payload plus metadata. When a sealed payload could
 * not be opened, {@code payload} is null and {@code error} says why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Memory(
    String id,
    JsonNode payload,
    List<String> tags,
    Instant createdAt,
    Instant lastAccessedAt,
    int accessCount,
    Instant expiresAt,
    boolean encrypted,
    String error
) {

    static Memory of(MemoryRecord record, JsonNode plaintext) {
        return new Memory(
            record.id(),
            plaintext.deepCopy(),
            record.tags(),
            record.createdAt(),
            record.lastAccessedAt(),
            record.accessCount(),
            record.expiresAt(),
            record.encrypted(),
            null
        );
    }

    static Memory unreadable(MemoryRecord record, String error) {
        return new Memory(
            record.id(),
            null,
            record.tags(),
            record.createdAt(),
            record.lastAccessedAt(),
            record.accessCount(),
            record.expiresAt(),
            record.encrypted(),
            error
        );
    }

    public boolean readable() {
        return error == null;
    }

    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
