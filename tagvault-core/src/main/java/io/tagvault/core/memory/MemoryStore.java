package io.tagvault.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.core.retention.PruneResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MemoryStore {
    int DEFAULT_LIMIT = 10;

    String store(JsonNode payload, Collection<String> tags);

    String store(JsonNode payload, Collection<String> tags, Duration ttl);

    String storeUntil(JsonNode payload, Collection<String> tags, Instant expiresAt);

    /** Direct lookup; does not hide expired records. */
    Optional<Memory> get(String id);

    boolean update(String id, JsonNode payload);

    boolean delete(String id);

    boolean addTags(String id, Collection<String> tags);

    /**
     * Removes exactly the given tags. A record tagged {@code a:b} still matches {@code a} after
     * {@code a} itself is removed, since {@code a} is a prefix of a tag it keeps.
     */
    boolean removeTags(String id, Collection<String> tags);

    List<Memory> search(String query, Collection<String> tags, int limit);

    default List<Memory> search(String query) {
        return search(query, List.of(), DEFAULT_LIMIT);
    }

    default List<Memory> search(String query, Collection<String> tags) {
        return search(query, tags, DEFAULT_LIMIT);
    }

    List<Memory> byTags(Collection<String> tags, int limit);

    default List<Memory> byTags(Collection<String> tags) {
        return byTags(tags, DEFAULT_LIMIT);
    }

    List<Memory> recent(int limit);

    /** Search hits topped up with recent memories, without duplicates. */
    List<Memory> context(String query, int size);

    List<String> similarTags(String tag, int maxResults);

    boolean exists(String id);

    int count();

    List<String> ids();

    MemoryStats stats();

    PruneResult sweep();

    void rebuildIndexes();

    /** Re-seals every readable encrypted record under the current key. Also runs after a key rotation. */
    int rekey();

    void save() throws IOException;

    /**
     * Replaces the in-memory table with the persisted one.
     *
     * @return false when nothing has been persisted yet
     */
    boolean load() throws IOException;

    /**
     * Writes a compressed copy of the current table, keeping only the newest configured number.
     *
     * @param name backup name, or null for a timestamped one
     */
    Path backup(String name) throws IOException;

    List<Path> backups() throws IOException;

    /** Replaces the table with a backup, validated and migrated like {@link #load()}. */
    void restore(Path backup) throws IOException;
}
