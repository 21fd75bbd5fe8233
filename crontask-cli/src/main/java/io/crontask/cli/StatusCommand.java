package io.crontask.cli;

import io.crontask.core.config.ConfigPaths;
import io.crontask.core.config.model.CrontaskConfig;
import io.crontask.core.job.CronJob;
import io.crontask.core.job.SqliteJobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and stored job counts")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CrontaskConfig config = context.loadConfig();
            Path database = ConfigPaths.resolve(config.storage().databasePath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + database);
            System.out.println("Timezone: " + config.scheduler().timezone());
            System.out.println("Misfire grace: " + config.scheduler().misfireGraceSeconds() + "s");
            System.out.println("Request timeout: " + config.http().requestTimeoutSeconds() + "s");
            System.out.println("Listen: " + config.server().host() + ":" + config.server().port());
            if (Files.exists(database)) {
                List<CronJob> jobs = new SqliteJobStore(database).list();
                long paused = jobs.stream().filter(CronJob::paused).count();
                System.out.println("Jobs: " + jobs.size() + " (" + paused + " paused)");
            } else {
                System.out.println("Jobs: 0 (database not created yet)");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
