package io.crontask.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface ServerRunner {
    /** Overrides are null when not given on the command line. */
    int run(Integer portOverride, String hostOverride, Path databaseOverride) throws Exception;
}
