package io.tagvault.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tagvault.core.config.model.RetentionConfig;
import io.tagvault.core.config.model.TagVaultConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public TagVaultConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return TagVaultConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(TagVaultConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        TagVaultConfig config = mapper.treeToValue(merged, TagVaultConfig.class);
        validate(config);
        return config;
    }

    public void save(Path configPath, TagVaultConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        validate(config);
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        TagVaultConfig config;
        if (created || overwrite) {
            config = TagVaultConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path dataDirectory = ConfigPaths.resolveDirectory(config.storage().directory());
        Files.createDirectories(dataDirectory);
        return new OnboardResult(configPath, dataDirectory, created, overwritten);
    }

    public String toPrettyJson(TagVaultConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void validate(TagVaultConfig config) {
        RetentionConfig retention = config.retention();
        if (retention.maxRecords() <= 0 && !retention.unlimited()) {
            throw new IllegalArgumentException("retention.maxRecords must be > 0 or -1 for unlimited");
        }
        if (retention.defaultRetentionDays() <= 0) {
            throw new IllegalArgumentException("retention.defaultRetentionDays must be > 0");
        }
        if (retention.sweepIntervalMinutes() <= 0) {
            throw new IllegalArgumentException("retention.sweepIntervalMinutes must be > 0");
        }
        if (config.storage().maxBackups() <= 0) {
            throw new IllegalArgumentException("storage.maxBackups must be > 0");
        }
        if (config.encryption().keyRotationDays() <= 0) {
            throw new IllegalArgumentException("encryption.keyRotationDays must be > 0");
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
