package io.tagvault.core.memory;

import java.io.IOException;

public interface SnapshotStore {
    /** Returns the stored snapshot, or {@code null} when nothing has been saved yet. */
    MemorySnapshot load() throws IOException;

    void save(MemorySnapshot snapshot) throws IOException;
}
