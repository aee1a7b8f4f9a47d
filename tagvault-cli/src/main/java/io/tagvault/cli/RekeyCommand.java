package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "rekey", description = "Re-encrypt sealed memories under the current key")
public final class RekeyCommand implements Callable<Integer> {
    private final CliContext context;

    public RekeyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            int resealed = store.rekey();
            store.save();
            System.out.println("Re-encrypted " + resealed + " memories");
            return 0;
        } catch (Exception e) {
            System.err.println("Rekey failed: " + e.getMessage());
            return 1;
        }
    }
}
