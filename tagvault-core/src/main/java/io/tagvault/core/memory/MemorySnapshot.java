package io.tagvault.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;

/**
 * Persisted container of the full record table. {@code encrypted} records whether the gate was
 * enabled when the snapshot was written.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemorySnapshot(
    String version,
    Instant timestamp,
    boolean encrypted,
    Map<String, MemoryRecord> records
) {
}
