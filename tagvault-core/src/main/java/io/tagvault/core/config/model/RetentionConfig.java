package io.tagvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Capacity and expiry settings. A {@code maxRecords} of {@code -1} disables the capacity bound.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionConfig(
    int maxRecords,
    int defaultRetentionDays,
    int sweepIntervalMinutes,
    boolean saveAfterSweep
) {
    public static final int UNLIMITED = -1;

    public static RetentionConfig defaults() {
        return new RetentionConfig(10_000, 365, 30, true);
    }

    public boolean unlimited() {
        return maxRecords == UNLIMITED;
    }
}
