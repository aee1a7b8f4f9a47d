package io.tagvault.cli;

import io.tagvault.core.memory.Memory;
import io.tagvault.core.memory.MemoryStore;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search memories by words and/or tags")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Query text")
    String query;

    @Option(names = {"-t", "--tag"}, description = "Required tag (repeatable)")
    List<String> tags = new ArrayList<>();

    @Option(names = "--limit", description = "Maximum results", defaultValue = "" + MemoryStore.DEFAULT_LIMIT)
    int limit;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaggedMemoryStore store = context.openStore();
            List<Memory> results = (query == null || query.isBlank()) && !tags.isEmpty()
                ? store.byTags(tags, limit)
                : store.search(query, tags, limit);
            store.save();
            CliJson.print(results);
            return 0;
        } catch (Exception e) {
            System.err.println("Search failed: " + e.getMessage());
            return 1;
        }
    }
}
