package io.tagvault.core.memory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Compressed point-in-time copies of the record table. */
public interface SnapshotBackups {

    /**
     * Writes a backup and drops the oldest ones beyond the retention count.
     *
     * @param name backup name without extension, or null for a timestamped name
     * @return the written file
     */
    Path create(MemorySnapshot snapshot, String name) throws IOException;

    MemorySnapshot read(Path backup) throws IOException;

    /** Existing backups, oldest first. */
    List<Path> list() throws IOException;
}
