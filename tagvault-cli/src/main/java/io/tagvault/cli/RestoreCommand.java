package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "restore", description = "Replace all memories with the contents of a backup")
public final class RestoreCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Backup file")
    Path backup;

    public RestoreCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            store.restore(backup);
            store.save();
            System.out.println("Restored " + store.count() + " memories from " + backup);
            return 0;
        } catch (Exception e) {
            System.err.println("Restore failed: " + e.getMessage());
            return 1;
        }
    }
}
