package io.tagvault.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.crypto.DecryptionException;
import io.tagvault.core.crypto.EncryptionGate;
import io.tagvault.core.crypto.SealedPayload;
import io.tagvault.core.index.SearchIndex;
import io.tagvault.core.index.TagIndex;
import io.tagvault.core.index.Tags;
import io.tagvault.core.retention.PruneResult;
import io.tagvault.core.retention.RetentionManager;
import io.tagvault.core.retention.RetentionTarget;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory record table with tag and token indices, selective encryption and retention,
 * persisted on demand through a {@link SnapshotStore}.
 *
 * <p>Index mutations, prunes, saves and loads hold the write lock. Tag and text queries hold the
 * read lock. {@link #get(String)} only touches the concurrent record table.
 */
public final class TaggedMemoryStore implements MemoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(TaggedMemoryStore.class);

    public static final String FORMAT_VERSION = "1.0";
    private static final String UNKNOWN_TYPE = "unknown";

    private final SnapshotStore snapshots;
    private final SnapshotBackups backups;
    private final EncryptionGate gate;
    private final RetentionManager retention;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    private final ConcurrentHashMap<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final TagIndex tagIndex = new TagIndex();
    private final SearchIndex searchIndex = new SearchIndex();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // gate rotation count at the last re-seal pass, guarded by the write lock
    private long resealedAtRotation;
    private final RetentionTarget retentionTarget = new RetentionTarget() {
        @Override
        public Collection<MemoryRecord> records() {
            return List.copyOf(records.values());
        }

        @Override
        public boolean evict(String id) {
            return deleteLocked(id);
        }
    };

    public TaggedMemoryStore(SnapshotStore snapshots, EncryptionGate gate, RetentionManager retention, Clock clock) {
        this(snapshots, null, gate, retention, clock);
    }

    /** @param backups where {@link #backup(String)} writes, or null when backups are not configured */
    public TaggedMemoryStore(
        SnapshotStore snapshots,
        SnapshotBackups backups,
        EncryptionGate gate,
        RetentionManager retention,
        Clock clock
    ) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
        this.backups = backups;
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String store(JsonNode payload, Collection<String> tags) {
        return store(payload, tags, retention.defaultRetention());
    }

    @Override
    public String store(JsonNode payload, Collection<String> tags, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        return insert(payload, tags, now, now.plus(ttl));
    }

    @Override
    public String storeUntil(JsonNode payload, Collection<String> tags, Instant expiresAt) {
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        return insert(payload, tags, clock.instant(), expiresAt);
    }

    @Override
    public Optional<Memory> get(String id) {
        if (id == null || !records.containsKey(id)) {
            LOG.debug("Memory {} not found", id);
            return Optional.empty();
        }
        return Optional.ofNullable(readAndTouch(id, clock.instant()));
    }

    @Override
    public boolean update(String id, JsonNode payload) {
        requirePayload(payload);
        JsonNode copy = payload.deepCopy();
        lock.writeLock().lock();
        try {
            MemoryRecord updated = records.computeIfPresent(id, (key, current) -> {
                MemoryRecord replaced = current.withPlaintext(copy);
                boolean seal = current.encrypted() || gate.shouldEncrypt(current.tags());
                return seal ? replaced.withSealed(gate.encrypt(copy)) : replaced;
            });
            if (updated == null) {
                LOG.warn("Cannot update memory {}: not found", id);
                return false;
            }
            searchIndex.index(id, text(copy));
            LOG.debug("Updated memory {}", id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            boolean removed = deleteLocked(id);
            if (removed) {
                LOG.debug("Deleted memory {}", id);
            } else {
                LOG.warn("Cannot delete memory {}: not found", id);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean addTags(String id, Collection<String> tags) {
        List<String> normalized = Tags.normalize(tags);
        lock.writeLock().lock();
        try {
            MemoryRecord updated = records.computeIfPresent(id, (key, current) -> {
                Set<String> merged = new LinkedHashSet<>(current.tags());
                merged.addAll(normalized);
                return seal(current.withTags(List.copyOf(merged)));
            });
            if (updated == null) {
                LOG.warn("Cannot add tags: memory {} not found", id);
                return false;
            }
            tagIndex.tag(id, normalized);
            LOG.debug("Added tags {} to memory {}", normalized, id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean removeTags(String id, Collection<String> tags) {
        List<String> normalized = Tags.normalize(tags);
        lock.writeLock().lock();
        try {
            MemoryRecord updated = records.computeIfPresent(id, (key, current) -> {
                List<String> kept = new ArrayList<>(current.tags());
                kept.removeAll(normalized);
                return current.withTags(kept);
            });
            if (updated == null) {
                LOG.warn("Cannot remove tags: memory {} not found", id);
                return false;
            }
            tagIndex.untag(id, normalized);
            LOG.debug("Removed tags {} from memory {}", normalized, id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Memory> search(String query, Collection<String> tags, int limit) {
        requireLimit(limit);
        List<String> filter = Tags.normalize(tags);
        Set<String> queryTokens = query == null || query.isBlank() ? null : SearchIndex.tokenize(query);
        if (limit == 0) {
            return List.of();
        }
        List<Memory> results = consistentRead(() -> searchLocked(queryTokens, filter, limit));
        LOG.debug("Found {} memories matching query '{}' and tags {}", results.size(), query, filter);
        return results;
    }

    @Override
    public List<Memory> byTags(Collection<String> tags, int limit) {
        requireLimit(limit);
        List<String> normalized = Tags.normalize(tags);
        if (limit == 0 || normalized.isEmpty()) {
            return List.of();
        }
        List<Memory> results = consistentRead(() -> byTagsLocked(normalized, limit));
        LOG.debug("Found {} memories with tags {}", results.size(), normalized);
        return results;
    }

    @Override
    public List<Memory> recent(int limit) {
        requireLimit(limit);
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return records.values().stream()
                .filter(record -> !record.expiredAt(now))
                .sorted(Comparator.comparing(MemoryRecord::createdAt).reversed().thenComparing(MemoryRecord::id))
                .limit(limit)
                .map(this::view)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Memory> context(String query, int size) {
        requireLimit(size);
        List<Memory> out = new ArrayList<>(search(query, List.of(), size));
        if (out.size() < size) {
            Set<String> seen = new LinkedHashSet<>();
            out.forEach(memory -> seen.add(memory.id()));
            for (Memory memory : recent(size)) {
                if (out.size() >= size) {
                    break;
                }
                if (seen.add(memory.id())) {
                    out.add(memory);
                }
            }
        }
        LOG.debug("Built context of {} memories for query '{}'", out.size(), query);
        return out;
    }

    @Override
    public List<String> similarTags(String tag, int maxResults) {
        lock.readLock().lock();
        try {
            return tagIndex.similar(tag, maxResults);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean exists(String id) {
        return id != null && records.containsKey(id);
    }

    @Override
    public int count() {
        return records.size();
    }

    @Override
    public List<String> ids() {
        return List.copyOf(records.keySet());
    }

    @Override
    public MemoryStats stats() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            int total = records.size();
            int expired = 0;
            Map<String, Integer> types = new HashMap<>();
            for (MemoryRecord record : records.values()) {
                if (record.expiredAt(now)) {
                    expired++;
                    continue;
                }
                types.merge(typeOf(record), 1, Integer::sum);
            }
            return new MemoryStats(total, total - expired, expired, Map.copyOf(types), tagIndex.stats());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public PruneResult sweep() {
        lock.writeLock().lock();
        try {
            PruneResult result = retention.prune(retentionTarget, clock.instant());
            gate.rotateIfDue();
            resealIfRotatedLocked();
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rebuildIndexes() {
        lock.writeLock().lock();
        try {
            rebuildIndexesLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int rekey() {
        lock.writeLock().lock();
        try {
            return rekeyLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void save() throws IOException {
        lock.writeLock().lock();
        try {
            resealIfRotatedLocked();
            MemorySnapshot snapshot = snapshotLocked();
            snapshots.save(snapshot);
            LOG.info("Saved {} memories", snapshot.records().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean load() throws IOException {
        lock.writeLock().lock();
        try {
            MemorySnapshot snapshot = snapshots.load();
            if (snapshot == null) {
                LOG.info("No memory file found, starting empty");
                return false;
            }
            replaceLocked(snapshot);
            LOG.info("Loaded {} memories", records.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Path backup(String name) throws IOException {
        SnapshotBackups target = requireBackups();
        lock.writeLock().lock();
        try {
            resealIfRotatedLocked();
            return target.create(snapshotLocked(), name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Path> backups() throws IOException {
        return requireBackups().list();
    }

    @Override
    public void restore(Path backup) throws IOException {
        MemorySnapshot snapshot = requireBackups().read(backup);
        lock.writeLock().lock();
        try {
            replaceLocked(snapshot);
            LOG.info("Restored {} memories from {}", records.size(), backup);
        } finally {
            lock.writeLock().unlock();
        }
    }

    TagIndex tagIndex() {
        return tagIndex;
    }

    SearchIndex searchIndex() {
        return searchIndex;
    }

    /** Every id referenced by either index. */
    Set<String> indexedIds() {
        lock.readLock().lock();
        try {
            Set<String> ids = new LinkedHashSet<>(tagIndex.ids());
            ids.addAll(searchIndex.ids());
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    private String insert(JsonNode payload, Collection<String> tags, Instant now, Instant expiresAt) {
        requirePayload(payload);
        List<String> normalized = Tags.normalize(tags);
        JsonNode copy = payload.deepCopy();
        String id = UUID.randomUUID().toString();
        MemoryRecord record = seal(MemoryRecord.create(id, copy, normalized, now, expiresAt));

        lock.writeLock().lock();
        try {
            records.put(id, record);
            tagIndex.tag(id, normalized);
            searchIndex.index(id, text(copy));
            LOG.debug("Stored memory {} with tags {}", id, normalized);
            retention.prune(retentionTarget, now);
        } finally {
            lock.writeLock().unlock();
        }
        return id;
    }

    private List<Memory> searchLocked(Set<String> queryTokens, List<String> filter, int limit) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<SearchIndex.ScoredId> candidates = queryTokens == null
                ? searchIndex.all()
                : searchIndex.query(queryTokens);
            Set<String> allowed = filter.isEmpty() ? null : tagIndex.getByTags(filter, true);

            List<String> selected = new ArrayList<>();
            for (SearchIndex.ScoredId candidate : candidates) {
                if (allowed != null && !allowed.contains(candidate.id())) {
                    continue;
                }
                if (requireRecord(candidate.id()).expiredAt(now)) {
                    continue;
                }
                selected.add(candidate.id());
                if (selected.size() >= limit) {
                    break;
                }
            }
            return touchAll(selected, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Memory> byTagsLocked(List<String> tags, int limit) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<MemoryRecord> matches = new ArrayList<>();
            for (String id : tagIndex.getByTags(tags, true)) {
                MemoryRecord record = requireRecord(id);
                if (!record.expiredAt(now)) {
                    matches.add(record);
                }
            }
            List<String> selected = matches.stream()
                .sorted(Comparator.comparing(MemoryRecord::createdAt).reversed().thenComparing(MemoryRecord::id))
                .limit(limit)
                .map(MemoryRecord::id)
                .toList();
            return touchAll(selected, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Memory> touchAll(List<String> ids, Instant now) {
        List<Memory> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Memory memory = readAndTouch(id, now);
            if (memory != null) {
                out.add(memory);
            }
        }
        return out;
    }

    /** Opens the payload and, only if that succeeds, counts the read. */
    private Memory readAndTouch(String id, Instant now) {
        AtomicReference<Memory> result = new AtomicReference<>();
        records.computeIfPresent(id, (key, current) -> {
            try {
                JsonNode plaintext = plaintext(current);
                MemoryRecord touched = current.withAccess(now);
                result.set(Memory.of(touched, plaintext));
                return touched;
            } catch (DecryptionException e) {
                LOG.error("Failed to decrypt memory {}: {}", id, e.getMessage());
                result.set(Memory.unreadable(current, e.getMessage()));
                return current;
            }
        });
        return result.get();
    }

    private Memory view(MemoryRecord record) {
        try {
            return Memory.of(record, plaintext(record));
        } catch (DecryptionException e) {
            LOG.error("Failed to decrypt memory {}: {}", record.id(), e.getMessage());
            return Memory.unreadable(record, e.getMessage());
        }
    }

    private JsonNode plaintext(MemoryRecord record) throws DecryptionException {
        return record.encrypted() ? gate.decrypt(record.sealed()) : record.payload();
    }

    private MemoryRecord seal(MemoryRecord record) {
        if (record.encrypted() || !gate.shouldEncrypt(record.tags())) {
            return record;
        }
        return record.withSealed(gate.encrypt(record.payload()));
    }

    private boolean deleteLocked(String id) {
        if (id == null || records.remove(id) == null) {
            return false;
        }
        tagIndex.remove(id);
        searchIndex.remove(id);
        return true;
    }

    private MemoryRecord requireRecord(String id) {
        MemoryRecord record = records.get(id);
        if (record == null) {
            throw new IndexInconsistencyException(id);
        }
        return record;
    }

    private <T> T consistentRead(Supplier<T> read) {
        try {
            return read.get();
        } catch (IndexInconsistencyException e) {
            LOG.error("{}; rebuilding indexes", e.getMessage());
            rebuildIndexes();
            return read.get();
        }
    }

    private void rebuildIndexesLocked() {
        tagIndex.clear();
        searchIndex.clear();
        List<MemoryRecord> ordered = records.values().stream()
            .sorted(Comparator.comparing(MemoryRecord::createdAt).thenComparing(MemoryRecord::id))
            .toList();
        for (MemoryRecord record : ordered) {
            tagIndex.tag(record.id(), record.tags());
            try {
                searchIndex.index(record.id(), text(plaintext(record)));
            } catch (DecryptionException e) {
                LOG.warn("Memory {} is unreadable and will only be found by tag: {}", record.id(), e.getMessage());
                searchIndex.index(record.id(), "");
            }
        }
        LOG.debug("Rebuilt indexes for {} memories", ordered.size());
    }

    private MemorySnapshot snapshotLocked() {
        Map<String, MemoryRecord> ordered = new LinkedHashMap<>();
        records.values().stream()
            .sorted(Comparator.comparing(MemoryRecord::createdAt).thenComparing(MemoryRecord::id))
            .forEach(record -> ordered.put(record.id(), record));
        return new MemorySnapshot(FORMAT_VERSION, clock.instant(), gate.enabled(), ordered);
    }

    /** Validates and migrates a snapshot, then swaps it in. Leaves the table untouched on failure. */
    private void replaceLocked(MemorySnapshot snapshot) throws IOException {
        Map<String, MemoryRecord> loaded = validate(snapshot);
        if (snapshot.encrypted() != gate.enabled()) {
            LOG.warn("Encryption status changed: file={}, current={}", snapshot.encrypted(), gate.enabled());
        }
        migrate(loaded);

        records.clear();
        records.putAll(loaded);
        rebuildIndexesLocked();
        resealIfRotatedLocked();
    }

    private void resealIfRotatedLocked() {
        long rotations = gate.rotations();
        if (rotations != resealedAtRotation) {
            LOG.info("Encryption key rotated, re-sealing memories under the new key");
            rekeyLocked();
        }
    }

    private int rekeyLocked() {
        long rotations = gate.rotations();
        int resealed = 0;
        for (MemoryRecord record : List.copyOf(records.values())) {
            if (!record.encrypted()) {
                continue;
            }
            JsonNode plaintext;
            try {
                plaintext = gate.decrypt(record.sealed());
            } catch (DecryptionException e) {
                LOG.error("Cannot re-encrypt memory {}: {}", record.id(), e.getMessage());
                continue;
            }
            SealedPayload fresh = gate.encrypt(plaintext);
            records.computeIfPresent(record.id(), (key, current) -> current.withSealed(fresh));
            resealed++;
        }
        resealedAtRotation = rotations;
        LOG.info("Re-encrypted {} memories under the current key", resealed);
        return resealed;
    }

    private SnapshotBackups requireBackups() {
        if (backups == null) {
            throw new IllegalStateException("Backups are not configured for this store");
        }
        return backups;
    }

    private Map<String, MemoryRecord> validate(MemorySnapshot snapshot) throws IOException {
        if (!FORMAT_VERSION.equals(snapshot.version())) {
            throw new IOException("Unsupported memory file version: " + snapshot.version());
        }
        if (snapshot.records() == null) {
            throw new IOException("Memory file has no records table");
        }
        Map<String, MemoryRecord> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, MemoryRecord> entry : snapshot.records().entrySet()) {
            MemoryRecord record = entry.getValue();
            if (record == null || !entry.getKey().equals(record.id())) {
                throw new IOException("Memory file entry " + entry.getKey() + " does not match its record");
            }
            try {
                loaded.put(record.id(), record.withTags(Tags.normalize(record.tags())));
            } catch (IllegalArgumentException e) {
                throw new IOException("Memory file entry " + entry.getKey() + " has invalid tags", e);
            }
        }
        return loaded;
    }

    private void migrate(Map<String, MemoryRecord> loaded) {
        int changed = 0;
        for (Map.Entry<String, MemoryRecord> entry : loaded.entrySet()) {
            MemoryRecord record = entry.getValue();
            if (gate.enabled()) {
                MemoryRecord sealed = seal(record);
                if (sealed != record) {
                    entry.setValue(sealed);
                    changed++;
                }
            } else if (record.encrypted()) {
                try {
                    entry.setValue(record.withPlaintext(gate.decrypt(record.sealed())));
                    changed++;
                } catch (DecryptionException e) {
                    LOG.error("Cannot decrypt memory {} during migration: {}", record.id(), e.getMessage());
                }
            }
        }
        if (changed > 0) {
            LOG.warn("{} {} memories to match the current encryption settings",
                gate.enabled() ? "Encrypted" : "Decrypted", changed);
        }
    }

    private String typeOf(MemoryRecord record) {
        JsonNode plaintext;
        try {
            plaintext = plaintext(record);
        } catch (DecryptionException e) {
            return UNKNOWN_TYPE;
        }
        JsonNode type = plaintext.path("type");
        return type.isTextual() && !type.asText().isBlank() ? type.asText() : UNKNOWN_TYPE;
    }

    private String text(JsonNode payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }

    private static void requirePayload(JsonNode payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
    }

    private static void requireLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
    }
}
