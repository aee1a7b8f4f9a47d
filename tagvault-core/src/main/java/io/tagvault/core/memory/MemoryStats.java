package io.tagvault.core.memory;

import io.tagvault.core.index.TagStats;
import java.util.Map;

/**
 * Store summary. {@code typeCounts} groups active records by the {@code "type"} field of their
 * payload, {@code "unknown"} when absent or unreadable.
 */
public record MemoryStats(
    int total,
    int active,
    int expired,
    Map<String, Integer> typeCounts,
    TagStats tags
) {
}
