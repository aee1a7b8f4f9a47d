package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a memory")
public final class DeleteCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Memory id")
    String id;

    public DeleteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            if (!store.delete(id)) {
                System.out.println("Nothing to delete: " + id);
                return 0;
            }
            store.save();
            System.out.println("Deleted " + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Delete failed: " + e.getMessage());
            return 1;
        }
    }
}
