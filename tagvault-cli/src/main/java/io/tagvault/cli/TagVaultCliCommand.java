package io.tagvault.cli;

import picocli.CommandLine.Command;

@Command(name = "tagvault", mixinStandardHelpOptions = true, description = "Tagged memory store with selective encryption")
public final class TagVaultCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
