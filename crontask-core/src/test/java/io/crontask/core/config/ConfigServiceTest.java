package io.crontask.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.crontask.core.config.model.CrontaskConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService(Map.of());

        CrontaskConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.server().host()).isEqualTo("0.0.0.0");
        assertThat(config.server().port()).isEqualTo(8800);
        assertThat(config.storage().databasePath()).isEqualTo("~/.crontask/crontask.db");
        assertThat(config.scheduler().zoneId()).isEqualTo(ZoneId.of("Asia/Shanghai"));
        assertThat(config.scheduler().misfireGrace()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.http().requestTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "server": {
                "port": 9900
              },
              "scheduler": {
                "timezone": "UTC"
              },
              "unknown": true
            }
            """);

        CrontaskConfig config = service.load(configPath);

        assertThat(config.server().port()).isEqualTo(9900);
        assertThat(config.server().host()).isEqualTo("0.0.0.0");
        assertThat(config.scheduler().timezone()).isEqualTo("UTC");
        assertThat(config.scheduler().misfireGraceSeconds()).isEqualTo(60);
    }

    @Test
    void shouldApplyEnvironmentOverrides() throws Exception {
        ConfigService service = new ConfigService(Map.of(
            ConfigService.PORT_ENV, "9100",
            ConfigService.HOST_ENV, "127.0.0.1",
            ConfigService.DB_PATH_ENV, "/var/lib/crontask/jobs.db",
            ConfigService.TIMEZONE_ENV, "Europe/Paris",
            ConfigService.MISFIRE_GRACE_ENV, "120",
            ConfigService.REQUEST_TIMEOUT_ENV, "not-a-number"
        ));

        CrontaskConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.server().port()).isEqualTo(9100);
        assertThat(config.server().host()).isEqualTo("127.0.0.1");
        assertThat(config.storage().databasePath()).isEqualTo("/var/lib/crontask/jobs.db");
        assertThat(config.scheduler().timezone()).isEqualTo("Europe/Paris");
        assertThat(config.scheduler().misfireGraceSeconds()).isEqualTo(120);
        assertThat(config.http().requestTimeoutSeconds()).isEqualTo(10);
    }

    @Test
    void shouldRejectNonPositiveRequestTimeout() throws Exception {
        ConfigService service = new ConfigService(Map.of(ConfigService.REQUEST_TIMEOUT_ENV, "0"));

        CrontaskConfig config = service.load(tempDir.resolve("config.json"));

        assertThatThrownBy(() -> config.http().requestTimeout())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requestTimeoutSeconds");
    }

    @Test
    void initShouldCreateThenKeepThenOverwrite() throws Exception {
        ConfigService service = new ConfigService(Map.of(ConfigService.PORT_ENV, "9999"));
        Path configPath = tempDir.resolve(".crontask/config.json");

        InitResult created = service.init(configPath, false);
        assertThat(created.createdConfig()).isTrue();
        assertThat(Files.readString(configPath)).contains("\"port\" : 8800");

        Files.writeString(configPath, "{\"server\":{\"port\":7000}}");
        InitResult refreshed = service.init(configPath, false);
        assertThat(refreshed.createdConfig()).isFalse();
        assertThat(refreshed.overwrittenConfig()).isFalse();
        assertThat(Files.readString(configPath)).contains("\"port\" : 7000").contains("misfireGraceSeconds");

        InitResult overwritten = service.init(configPath, true);
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(Files.readString(configPath)).contains("\"port\" : 8800");
    }

    @Test
    void shouldExpandHomeInPaths() {
        String home = System.getProperty("user.home");

        assertThat(ConfigPaths.resolve("~/.crontask/x.db")).isEqualTo(Path.of(home, ".crontask", "x.db"));
        assertThat(ConfigPaths.resolve("/tmp/y.db")).isEqualTo(Path.of("/tmp/y.db"));
        assertThat(ConfigPaths.defaultConfigPath()).isEqualTo(Path.of(home, ".crontask", "config.json"));
    }
}
