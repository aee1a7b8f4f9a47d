package io.tagvault.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tagvault.core.config.model.TagVaultConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        TagVaultConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.retention().maxRecords()).isEqualTo(10_000);
        assertThat(config.retention().defaultRetentionDays()).isEqualTo(365);
        assertThat(config.encryption().enabled()).isTrue();
        assertThat(config.encryption().sensitiveTags()).containsExactly("personal", "health", "financial", "credentials");
        assertThat(config.encryption().keyRotationDays()).isEqualTo(90);
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "retention": {
                "maxRecords": -1
              },
              "encryption": {
                "sensitiveTags": ["medical"]
              }
            }
            """);

        TagVaultConfig config = service.load(configPath);

        assertThat(config.retention().unlimited()).isTrue();
        assertThat(config.retention().defaultRetentionDays()).isEqualTo(365);
        assertThat(config.encryption().sensitiveTags()).containsExactly("medical");
        assertThat(config.encryption().enabled()).isTrue();
        assertThat(config.storage().fileName()).isEqualTo("memories.json");
    }

    @Test
    void shouldRejectInvalidRetentionSettings() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {"retention": {"maxRecords": 0}}
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxRecords");
    }

    @Test
    void shouldRejectNonPositiveBackupLimit() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {"storage": {"maxBackups": 0}}
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBackups");
    }

    @Test
    void shouldDefaultBackupSettings() throws Exception {
        TagVaultConfig config = new ConfigService().load(tempDir.resolve("config.json"));

        assertThat(config.storage().backupDirectory()).isEqualTo("~/.tagvault/backups");
        assertThat(config.storage().maxBackups()).isEqualTo(5);
    }

    @Test
    void onboardShouldCreateConfigAndDataDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".tagvault/config.json");
        Path dataDir = tempDir.resolve("data");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            {"storage": {"directory": "%s"}}
            """.formatted(dataDir.toString().replace("\\", "\\\\")));

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.dataDirectory()).isEqualTo(dataDir);
        assertThat(Files.isDirectory(dataDir)).isTrue();
        assertThat(Files.readString(configPath)).contains("\"keyRotationDays\" : 90");
    }

    @Test
    void shouldExpandHomeDirectory() {
        Path resolved = ConfigPaths.resolveDirectory("~/vault");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), "vault"));
        assertThat(ConfigPaths.resolveDirectory("/srv/vault")).isEqualTo(Path.of("/srv/vault"));
    }
}
