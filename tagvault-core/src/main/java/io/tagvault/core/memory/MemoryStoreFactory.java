package io.tagvault.core.memory;

import io.tagvault.core.config.ConfigPaths;
import io.tagvault.core.config.model.StorageConfig;
import io.tagvault.core.config.model.TagVaultConfig;
import io.tagvault.core.crypto.EncryptionGate;
import io.tagvault.core.crypto.FileKeyRingStore;
import io.tagvault.core.retention.RetentionManager;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public final class MemoryStoreFactory {

    private MemoryStoreFactory() {
    }

    /** Builds a file-backed store from config and loads whatever was saved before. */
    public static TaggedMemoryStore open(TagVaultConfig config, Clock clock) throws IOException {
        StorageConfig storage = config.storage();
        Path directory = ConfigPaths.resolveDirectory(storage.directory());
        Path backupDirectory = storage.backupDirectory() == null || storage.backupDirectory().isBlank()
            ? directory.resolve("backups")
            : ConfigPaths.resolveDirectory(storage.backupDirectory());
        EncryptionGate gate = new EncryptionGate(
            config.encryption(),
            new FileKeyRingStore(directory.resolve(storage.keyFile())),
            clock
        );
        TaggedMemoryStore store = new TaggedMemoryStore(
            new FileSnapshotStore(directory.resolve(storage.fileName())),
            new FileSnapshotBackups(backupDirectory, storage.maxBackups(), clock),
            gate,
            new RetentionManager(config.retention()),
            clock
        );
        store.load();
        return store;
    }
}
