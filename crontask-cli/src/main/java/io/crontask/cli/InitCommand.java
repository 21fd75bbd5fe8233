package io.crontask.cli;

import io.crontask.core.config.ConfigPaths;
import io.crontask.core.config.InitResult;
import io.crontask.core.config.model.CrontaskConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "init",
    description = "Write the scheduler config (API address, jobs database, timezone, misfire grace, call timeout)"
)
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Discard the current settings and write the defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Wrote default scheduler config to " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Reset " + result.configPath() + " to the default scheduler settings");
            } else {
                System.out.println("Kept existing settings in " + result.configPath() + ", added missing keys");
            }
            CrontaskConfig config = context.loadConfig();
            System.out.println("  API address:  " + config.server().host() + ":" + config.server().port());
            System.out.println("  Jobs store:   " + ConfigPaths.resolve(config.storage().databasePath()));
            System.out.println("  Cron zone:    " + config.scheduler().timezone()
                + " (misfire grace " + config.scheduler().misfireGraceSeconds() + "s)");
            System.out.println("  Call timeout: " + config.http().requestTimeoutSeconds() + "s");
            return 0;
        } catch (Exception e) {
            System.err.println("Could not write config " + context.configPath() + ": " + e.getMessage());
            return 1;
        }
    }
}
