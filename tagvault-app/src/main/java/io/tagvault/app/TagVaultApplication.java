package io.tagvault.app;

import io.tagvault.cli.BackupCommand;
import io.tagvault.cli.CliContext;
import io.tagvault.cli.DaemonCommand;
import io.tagvault.cli.DeleteCommand;
import io.tagvault.cli.GetCommand;
import io.tagvault.cli.OnboardCommand;
import io.tagvault.cli.PutCommand;
import io.tagvault.cli.RecentCommand;
import io.tagvault.cli.RekeyCommand;
import io.tagvault.cli.RestoreCommand;
import io.tagvault.cli.SearchCommand;
import io.tagvault.cli.StatsCommand;
import io.tagvault.cli.SweepCommand;
import io.tagvault.cli.TagCommand;
import io.tagvault.cli.TagVaultCliCommand;
import io.tagvault.cli.UpdateCommand;
import io.tagvault.core.config.ConfigPaths;
import io.tagvault.core.config.ConfigService;
import java.nio.file.Path;
import picocli.CommandLine;

public final class TagVaultApplication {

    private TagVaultApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(new ConfigService(), resolveConfigPath());

        CommandLine commandLine = new CommandLine(new TagVaultCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("put", new PutCommand(context));
        commandLine.addSubcommand("get", new GetCommand(context));
        commandLine.addSubcommand("update", new UpdateCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("tag", new TagCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("recent", new RecentCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("sweep", new SweepCommand(context));
        commandLine.addSubcommand("rekey", new RekeyCommand(context));
        commandLine.addSubcommand("backup", new BackupCommand(context));
        commandLine.addSubcommand("restore", new RestoreCommand(context));
        commandLine.addSubcommand("daemon", new DaemonCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("TAGVAULT_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(raw.substring(2));
        }
        return Path.of(raw);
    }
}
