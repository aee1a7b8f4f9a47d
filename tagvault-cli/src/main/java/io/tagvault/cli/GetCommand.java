package io.tagvault.cli;

import io.tagvault.core.memory.Memory;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "get", description = "Print one memory, including expired ones")
public final class GetCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Memory id")
    String id;

    public GetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            Optional<Memory> memory = store.get(id);
            if (memory.isEmpty()) {
                System.err.println("Memory not found: " + id);
                return 1;
            }
            store.save();
            CliJson.print(memory.get());
            return 0;
        } catch (Exception e) {
            System.err.println("Get failed: " + e.getMessage());
            return 1;
        }
    }
}
