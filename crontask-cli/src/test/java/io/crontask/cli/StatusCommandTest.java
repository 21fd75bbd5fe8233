package io.crontask.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.crontask.core.config.ConfigService;
import io.crontask.core.job.CronJob;
import io.crontask.core.job.HttpCallAction;
import io.crontask.core.job.HttpMethod;
import io.crontask.core.job.SqliteJobStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class StatusCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPrintConfigurationAndJobCounts() throws Exception {
        Path db = tempDir.resolve("crontask.db");
        SqliteJobStore store = new SqliteJobStore(db);
        HttpCallAction action = new HttpCallAction(HttpMethod.GET, "http://example.com", null, null);
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        store.create(new CronJob("a", "* * * * *", action, false, now, now));
        store.create(new CronJob("b", "* * * * *", action, true, null, now));

        ConfigService configService = new ConfigService(Map.of(
            ConfigService.DB_PATH_ENV, db.toString(),
            ConfigService.TIMEZONE_ENV, "UTC"
        ));
        CliContext context = new CliContext(configService, tempDir.resolve("config.json"));

        String output = run(context);

        assertThat(output)
            .contains("Config exists: false")
            .contains("Database: " + db)
            .contains("Timezone: UTC")
            .contains("Misfire grace: 60s")
            .contains("Request timeout: 10s")
            .contains("Listen: 0.0.0.0:8800")
            .contains("Jobs: 2 (1 paused)");
    }

    @Test
    void shouldNotCreateMissingDatabase() throws Exception {
        Path db = tempDir.resolve("absent/crontask.db");
        ConfigService configService = new ConfigService(Map.of(ConfigService.DB_PATH_ENV, db.toString()));

        String output = run(new CliContext(configService, tempDir.resolve("config.json")));

        assertThat(output).contains("database not created yet");
        assertThat(Files.exists(db)).isFalse();
    }

    private static String run(CliContext context) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new StatusCommand(context)).execute();
            assertThat(code).isZero();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
