package io.tagvault.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "put", description = "Store a JSON payload and print its id")
public final class PutCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "JSON payload")
    String payload;

    @Option(names = {"-t", "--tag"}, description = "Tag (repeatable, use ':' for hierarchy)")
    List<String> tags = new ArrayList<>();

    @Option(names = "--ttl-seconds", description = "Time to live; defaults to the configured retention")
    Long ttlSeconds;

    public PutCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JsonNode node = CliJson.parse(payload);
            TaggedMemoryStore store = context.openStore();
            String id = ttlSeconds == null
                ? store.store(node, tags)
                : store.store(node, tags, Duration.ofSeconds(ttlSeconds));
            store.save();
            System.out.println(id);
            return 0;
        } catch (Exception e) {
            System.err.println("Put failed: " + e.getMessage());
            return 1;
        }
    }
}
