package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "backup", description = "Write a compressed backup of all memories, or list existing backups")
public final class BackupCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--name", description = "Backup name; defaults to a timestamp")
    String name;

    @Option(names = "--list", description = "List existing backups, oldest first")
    boolean list;

    public BackupCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            if (list) {
                for (Path backup : store.backups()) {
                    System.out.println(backup);
                }
                return 0;
            }
            System.out.println(store.backup(name));
            return 0;
        } catch (Exception e) {
            System.err.println("Backup failed: " + e.getMessage());
            return 1;
        }
    }
}
