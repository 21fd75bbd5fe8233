package io.crontask.app;

import io.crontask.cli.CliContext;
import io.crontask.cli.CrontaskCliCommand;
import io.crontask.cli.InitCommand;
import io.crontask.cli.NextCommand;
import io.crontask.cli.ServeCommand;
import io.crontask.cli.StatusCommand;
import io.crontask.core.api.JobApiServer;
import io.crontask.core.config.ConfigPaths;
import io.crontask.core.config.ConfigService;
import io.crontask.core.config.model.CrontaskConfig;
import io.crontask.core.control.JobControlService;
import io.crontask.core.execution.JobExecutor;
import io.crontask.core.execution.OkHttpCaller;
import io.crontask.core.history.SqliteRunHistoryStore;
import io.crontask.core.job.SqliteJobStore;
import io.crontask.core.scheduler.CronScheduler;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CrontaskApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CrontaskApplication.class);

    private CrontaskApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (port, host, database) -> runServer(configService, configPath, port, host, database)
        );
        CommandLine commandLine = new CommandLine(new CrontaskCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("next", new NextCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        Integer portOverride,
        String hostOverride,
        Path databaseOverride
    ) throws Exception {
        CrontaskConfig config = configService.load(configPath);
        Duration requestTimeout = config.http().requestTimeout();
        Path database = databaseOverride != null
            ? databaseOverride.toAbsolutePath().normalize()
            : ConfigPaths.resolve(config.storage().databasePath());
        int port = portOverride != null ? portOverride : config.server().port();
        String host = hostOverride != null ? hostOverride : config.server().host();

        Clock clock = Clock.systemUTC();
        SqliteJobStore jobStore = new SqliteJobStore(database);
        SqliteRunHistoryStore runHistory = new SqliteRunHistoryStore(database);
        JobExecutor executor = new JobExecutor(new OkHttpCaller(), runHistory, requestTimeout, clock);
        CountDownLatch shutdown = new CountDownLatch(1);

        try (CronScheduler scheduler = new CronScheduler(
                jobStore,
                executor,
                config.scheduler().zoneId(),
                config.scheduler().misfireGrace(),
                clock
            );
             JobApiServer server = new JobApiServer(new JobControlService(jobStore, scheduler, runHistory), host, port)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "crontask-shutdown"));
            scheduler.start();
            server.start();
            LOG.info("Using database {}", database);
            System.out.println("Crontask started on http://" + server.host() + ":" + server.port());
            System.out.println("Endpoints: GET /health, POST|GET /jobs, GET|DELETE /jobs/{id}, POST /jobs/{id}/pause|resume, GET /jobs/{id}/runs");
            shutdown.await();
        }
        return 0;
    }
}
