package io.tagvault.cli;

import io.tagvault.core.memory.MemoryStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "recent", description = "List the newest unexpired memories")
public final class RecentCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--limit", description = "Maximum results", defaultValue = "" + MemoryStore.DEFAULT_LIMIT)
    int limit;

    public RecentCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliJson.print(context.openStore().recent(limit));
            return 0;
        } catch (Exception e) {
            System.err.println("Recent failed: " + e.getMessage());
            return 1;
        }
    }
}
