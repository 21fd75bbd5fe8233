package io.crontask.cli;

import io.crontask.core.config.ConfigService;
import io.crontask.core.config.model.CrontaskConfig;
import java.io.IOException;
import java.nio.file.Path;

/**
 * What every subcommand needs: the config file it operates on and, for {@code serve}, the process wiring.
 */
public record CliContext(
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (port, host, database) -> {
            throw new UnsupportedOperationException("serve needs the crontask-app launcher");
        });
    }

    public CrontaskConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }
}
