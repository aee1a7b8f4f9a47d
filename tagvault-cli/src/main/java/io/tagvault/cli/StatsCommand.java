package io.tagvault.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Show record, type and tag counts")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliJson.print(context.openStore().stats());
            return 0;
        } catch (Exception e) {
            System.err.println("Stats failed: " + e.getMessage());
            return 1;
        }
    }
}
