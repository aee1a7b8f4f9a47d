package io.tagvault.cli;

import io.tagvault.core.config.ConfigService;
import io.tagvault.core.config.model.TagVaultConfig;
import io.tagvault.core.memory.MemoryStoreFactory;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemUTC());
    }

    public TagVaultConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public TaggedMemoryStore openStore() throws IOException {
        return MemoryStoreFactory.open(loadConfig(), clock);
    }
}
