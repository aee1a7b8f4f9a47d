package io.tagvault.cli;

import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "tag", description = "Add tags to a memory, or remove them with --remove")
public final class TagCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Memory id")
    String id;

    @Parameters(index = "1..*", arity = "1..*", description = "Tags")
    List<String> tags;

    @Option(names = "--remove", description = "Remove the tags instead of adding them")
    boolean remove;

    public TagCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            boolean changed = remove ? store.removeTags(id, tags) : store.addTags(id, tags);
            if (!changed) {
                System.err.println("Memory not found: " + id);
                return 1;
            }
            store.save();
            System.out.println((remove ? "Removed tags from " : "Tagged ") + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Tag failed: " + e.getMessage());
            return 1;
        }
    }
}
