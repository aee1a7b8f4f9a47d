package io.tagvault.core.retention;

import io.tagvault.core.memory.MemoryRecord;
import java.util.Collection;

/**
 * The store as seen by a prune. Callers invoke {@link RetentionManager#prune} while holding the
 * store's exclusive lock.
 */
public interface RetentionTarget {
    Collection<MemoryRecord> records();

    /** Removes the record and every index entry for it. */
    boolean evict(String id);
}
