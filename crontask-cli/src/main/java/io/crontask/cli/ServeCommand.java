package io.crontask.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the scheduler and the job HTTP API")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Listen port (overrides config)")
    Integer port;

    @Option(names = {"--host"}, description = "Bind address (overrides config)")
    String host;

    @Option(names = {"--db"}, description = "SQLite database file (overrides config)")
    Path database;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(port, host, database);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
