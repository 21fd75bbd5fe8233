package io.crontask.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "crontask",
    mixinStandardHelpOptions = true,
    version = "crontask 0.1.0",
    description = "Runs HTTP ping jobs on cron schedules and keeps their run history"
)
public final class CrontaskCliCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
