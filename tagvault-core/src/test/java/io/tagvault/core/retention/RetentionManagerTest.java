package io.tagvault.core.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tagvault.core.config.model.RetentionConfig;
import io.tagvault.core.memory.MemoryRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetentionManagerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void shouldScoreImportanceFromAccessesAndAge() {
        MemoryRecord fresh = record("a", NOW, 0);
        MemoryRecord twoDaysOld = record("b", NOW.minus(Duration.ofDays(2)), 0);
        MemoryRecord popular = record("c", NOW.minus(Duration.ofDays(2)), 3)
            .withAccess(NOW.minus(Duration.ofDays(1)));

        assertThat(RetentionManager.importance(fresh, NOW)).isEqualTo(0.0);
        assertThat(RetentionManager.importance(twoDaysOld, NOW)).isEqualTo(-2.0);
        assertThat(RetentionManager.importance(popular, NOW)).isEqualTo(39.0);
    }

    @Test
    void shouldDropExpiredBeforeEvictingLeastImportant() {
        RetentionManager manager = new RetentionManager(new RetentionConfig(2, 365, 30, true));
        FakeTarget target = new FakeTarget();
        target.put(expired("gone"));
        target.put(record("old", NOW.minus(Duration.ofDays(3)), 0));
        target.put(record("used", NOW.minus(Duration.ofDays(5)), 2));
        target.put(record("new", NOW, 0));

        PruneResult result = manager.prune(target, NOW);

        assertThat(result).isEqualTo(new PruneResult(1, 1));
        assertThat(target.records.keySet()).containsExactlyInAnyOrder("used", "new");
    }

    @Test
    void shouldBreakImportanceTiesByAgeThenId() {
        RetentionManager manager = new RetentionManager(new RetentionConfig(1, 365, 30, true));
        FakeTarget target = new FakeTarget();
        target.put(record("b", NOW, 0));
        target.put(record("a", NOW, 0));

        manager.prune(target, NOW);

        assertThat(target.records.keySet()).containsExactly("b");
    }

    @Test
    void shouldNotEvictWhenUnlimited() {
        RetentionManager manager = new RetentionManager(new RetentionConfig(RetentionConfig.UNLIMITED, 365, 30, true));
        FakeTarget target = new FakeTarget();
        for (int i = 0; i < 20; i++) {
            target.put(record("r" + i, NOW, 0));
        }

        assertThat(manager.prune(target, NOW)).isEqualTo(PruneResult.NONE);
        assertThat(target.records).hasSize(20);
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> new RetentionManager(new RetentionConfig(0, 365, 30, true)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetentionManager(new RetentionConfig(10, 0, 30, true)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static MemoryRecord record(String id, Instant createdAt, int accessCount) {
        return new MemoryRecord(id, JsonNodeFactory.instance.textNode(id), null, List.of(), createdAt, null,
            accessCount, createdAt.plus(Duration.ofDays(365)), false);
    }

    private static MemoryRecord expired(String id) {
        return MemoryRecord.create(id, JsonNodeFactory.instance.textNode(id), List.of(),
            NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)));
    }

    private static final class FakeTarget implements RetentionTarget {
        private final Map<String, MemoryRecord> records = new LinkedHashMap<>();

        void put(MemoryRecord record) {
            records.put(record.id(), record);
        }

        @Override
        public Collection<MemoryRecord> records() {
            return new ArrayList<>(records.values());
        }

        @Override
        public boolean evict(String id) {
            return records.remove(id) != null;
        }
    }
}
