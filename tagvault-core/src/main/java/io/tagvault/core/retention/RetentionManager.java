package io.tagvault.core.retention;

import io.tagvault.core.config.model.RetentionConfig;
import io.tagvault.core.memory.MemoryRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expiry and capacity policy.
 *
 * <p>A prune first drops every record whose expiry has been reached, then, while the store holds
 * more than {@code maxRecords}, drops the least important record. Importance is
 * {@code accessCount * 10 - daysSinceLastTouch}; ties go to the oldest record.
 */
public final class RetentionManager {
    private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final int maxRecords;
    private final Duration defaultRetention;

    public RetentionManager(RetentionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (config.maxRecords() <= 0 && !config.unlimited()) {
            throw new IllegalArgumentException("maxRecords must be > 0 or -1 for unlimited");
        }
        if (config.defaultRetentionDays() <= 0) {
            throw new IllegalArgumentException("defaultRetentionDays must be > 0");
        }
        this.maxRecords = config.maxRecords();
        this.defaultRetention = Duration.ofDays(config.defaultRetentionDays());
    }

    public int maxRecords() {
        return maxRecords;
    }

    public boolean unlimited() {
        return maxRecords == RetentionConfig.UNLIMITED;
    }

    public Duration defaultRetention() {
        return defaultRetention;
    }

    public static double importance(MemoryRecord record, Instant now) {
        double ageDays = Duration.between(record.lastTouched(), now).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return record.accessCount() * 10.0 - ageDays;
    }

    /** Eviction order: least important first, then oldest, then by id. */
    public static Comparator<MemoryRecord> evictionOrder(Instant now) {
        return Comparator.<MemoryRecord>comparingDouble(record -> importance(record, now))
            .thenComparing(MemoryRecord::createdAt)
            .thenComparing(MemoryRecord::id);
    }

    public PruneResult prune(RetentionTarget target, Instant now) {
        int expired = 0;
        List<MemoryRecord> remaining = new ArrayList<>();
        for (MemoryRecord record : target.records()) {
            if (record.expiredAt(now)) {
                if (target.evict(record.id())) {
                    expired++;
                }
            } else {
                remaining.add(record);
            }
        }

        int evicted = 0;
        if (!unlimited() && remaining.size() > maxRecords) {
            // importance is fixed for a given instant, so one sort gives the repeated-minimum order
            remaining.sort(evictionOrder(now));
            int excess = remaining.size() - maxRecords;
            for (MemoryRecord record : remaining) {
                if (evicted >= excess) {
                    break;
                }
                if (target.evict(record.id())) {
                    evicted++;
                }
            }
        }

        PruneResult result = new PruneResult(expired, evicted);
        if (result.total() > 0) {
            LOG.info("Pruned {} expired and {} low-importance memories", expired, evicted);
        }
        return result;
    }
}
