package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import io.tagvault.core.retention.PruneResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "sweep", description = "Drop expired memories and enforce the capacity bound now")
public final class SweepCommand implements Callable<Integer> {
    private final CliContext context;

    public SweepCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            PruneResult result = store.sweep();
            store.save();
            System.out.println("Expired: " + result.expired() + ", evicted: " + result.evicted());
            return 0;
        } catch (Exception e) {
            System.err.println("Sweep failed: " + e.getMessage());
            return 1;
        }
    }
}
