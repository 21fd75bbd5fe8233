package io.crontask.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.crontask.core.config.ConfigService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ServeCommandTest {

    @Test
    void shouldPassOverridesToRunner() {
        List<Object> seen = new ArrayList<>();
        CliContext context = new CliContext(new ConfigService(Map.of()), Path.of("config.json"), (port, host, db) -> {
            seen.add(port);
            seen.add(host);
            seen.add(db);
            return 0;
        });

        int code = new CommandLine(new ServeCommand(context))
            .execute("--port", "9000", "--host", "127.0.0.1", "--db", "/tmp/jobs.db");

        assertThat(code).isZero();
        assertThat(seen).containsExactly(9000, "127.0.0.1", Path.of("/tmp/jobs.db"));
    }

    @Test
    void shouldLeaveMissingOverridesUnset() {
        List<Object> seen = new ArrayList<>();
        CliContext context = new CliContext(new ConfigService(Map.of()), Path.of("config.json"), (port, host, db) -> {
            seen.add(port);
            seen.add(host);
            seen.add(db);
            return 0;
        });

        assertThat(new CommandLine(new ServeCommand(context)).execute()).isZero();
        assertThat(seen).containsExactly(null, null, null);
    }

    @Test
    void shouldReturnFailureWhenRunnerThrows() {
        CliContext context = new CliContext(new ConfigService(Map.of()), Path.of("config.json"));

        assertThat(new CommandLine(new ServeCommand(context)).execute()).isEqualTo(1);
    }
}
