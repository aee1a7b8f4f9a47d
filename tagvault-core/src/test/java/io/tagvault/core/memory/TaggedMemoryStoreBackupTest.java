package io.tagvault.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.MutableClock;
import io.tagvault.core.config.model.EncryptionConfig;
import io.tagvault.core.config.model.RetentionConfig;
import io.tagvault.core.crypto.EncryptionGate;
import io.tagvault.core.crypto.FileKeyRingStore;
import io.tagvault.core.retention.RetentionManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaggedMemoryStoreBackupTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteCompressedTimestampedBackupWithoutPlaintextSecrets() throws Exception {
        TaggedMemoryStore store = newStore(EncryptionConfig.defaults(), 5);
        store.store(json("{\"note\":\"buy milk\"}"), List.of("shopping"));
        store.store(json("{\"diary\":\"secret thoughts\"}"), List.of("personal"));

        Path backup = store.backup(null);

        assertThat(backup.getFileName().toString()).isEqualTo("memory_backup_20260101_000000_000.json.gz");
        String content = gunzip(backup);
        assertThat(content).contains("\"version\" : \"1.0\"").contains("buy milk").doesNotContain("secret thoughts");
    }

    @Test
    void shouldKeepOnlyNewestBackups() throws Exception {
        TaggedMemoryStore store = newStore(EncryptionConfig.defaults(), 2);
        store.store(json("{\"n\":1}"), List.of());

        Path oldest = store.backup(null);
        clock.advance(Duration.ofMinutes(1));
        Path middle = store.backup(null);
        clock.advance(Duration.ofMinutes(1));
        Path newest = store.backup(null);

        assertThat(Files.exists(oldest)).isFalse();
        assertThat(store.backups()).containsExactly(middle, newest);
    }

    @Test
    void shouldRestoreTableAndIndexesFromBackup() throws Exception {
        TaggedMemoryStore store = newStore(EncryptionConfig.defaults(), 5);
        String milk = store.store(json("{\"note\":\"buy milk\"}"), List.of("shopping"));
        String diary = store.store(json("{\"diary\":\"secret thoughts\"}"), List.of("personal"));
        Path backup = store.backup("before-cleanup");

        store.delete(milk);
        String added = store.store(json("{\"note\":\"walk dog\"}"), List.of("chores"));

        store.restore(backup);

        assertThat(store.ids()).containsExactlyInAnyOrder(milk, diary);
        assertThat(store.exists(added)).isFalse();
        assertThat(store.search("milk")).extracting(Memory::id).containsExactly(milk);
        assertThat(store.byTags(List.of("chores"))).isEmpty();
        assertThat(store.get(diary).orElseThrow().payload().path("diary").asText()).isEqualTo("secret thoughts");
    }

    @Test
    void shouldMigrateRestoredRecordsToCurrentEncryptionSettings() throws Exception {
        TaggedMemoryStore plain = newStore(new EncryptionConfig(false, List.of("personal"), 90), 5);
        String id = plain.store(json("{\"diary\":\"secret thoughts\"}"), List.of("personal"));
        Path backup = plain.backup("plain");

        TaggedMemoryStore sealed = newStore(EncryptionConfig.defaults(), 5);
        sealed.restore(backup);

        assertThat(sealed.get(id).orElseThrow().encrypted()).isTrue();
    }

    @Test
    void shouldRejectBadBackupsAndKeepCurrentState() throws Exception {
        TaggedMemoryStore store = newStore(EncryptionConfig.defaults(), 5);
        String id = store.store(json("{\"note\":\"buy milk\"}"), List.of());
        Path notGzip = tempDir.resolve("backups/broken.json.gz");
        Files.createDirectories(notGzip.getParent());
        Files.writeString(notGzip, "{}");

        assertThatThrownBy(() -> store.restore(notGzip)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.restore(tempDir.resolve("missing.json.gz"))).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.backup("../escape")).isInstanceOf(IllegalArgumentException.class);

        assertThat(store.ids()).containsExactly(id);
    }

    @Test
    void shouldRequireConfiguredBackups() throws Exception {
        TaggedMemoryStore store = new TaggedMemoryStore(
            new FileSnapshotStore(tempDir.resolve("memories.json")),
            gate(EncryptionConfig.defaults()),
            new RetentionManager(RetentionConfig.defaults()),
            clock
        );

        assertThatThrownBy(() -> store.backup(null)).isInstanceOf(IllegalStateException.class);
    }

    private TaggedMemoryStore newStore(EncryptionConfig encryption, int maxBackups) throws IOException {
        return new TaggedMemoryStore(
            new FileSnapshotStore(tempDir.resolve("memories.json")),
            new FileSnapshotBackups(tempDir.resolve("backups"), maxBackups, clock),
            gate(encryption),
            new RetentionManager(RetentionConfig.defaults()),
            clock
        );
    }

    private EncryptionGate gate(EncryptionConfig encryption) throws IOException {
        return new EncryptionGate(encryption, new FileKeyRingStore(tempDir.resolve("keyring.json")), clock);
    }

    private static String gunzip(Path file) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private JsonNode json(String text) throws IOException {
        return mapper.readTree(text);
    }
}
