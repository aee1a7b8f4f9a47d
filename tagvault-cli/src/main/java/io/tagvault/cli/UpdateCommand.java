package io.tagvault.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Replace the payload of a memory")
public final class UpdateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Memory id")
    String id;

    @Parameters(index = "1", description = "New JSON payload")
    String payload;

    public UpdateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JsonNode node = CliJson.parse(payload);
            TaggedMemoryStore store = context.openStore();
            if (!store.update(id, node)) {
                System.err.println("Memory not found: " + id);
                return 1;
            }
            store.save();
            System.out.println("Updated " + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Update failed: " + e.getMessage());
            return 1;
        }
    }
}
