package io.crontask.cli;

import io.crontask.core.cron.CronExpression;
import io.crontask.core.cron.CronParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "next", description = "Print the upcoming fire times of a cron expression")
public final class NextCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Cron expression (5 or 6 fields, quoted)")
    String expression;

    @Option(names = "--count", description = "Number of fire times to print", defaultValue = "5")
    int count;

    @Option(names = "--tz", description = "Timezone (defaults to the configured scheduler timezone)")
    String timezone;

    @Option(names = "--from", description = "Start instant, ISO-8601 (defaults to now)")
    Instant from;

    public NextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (count < 1) {
            System.err.println("--count must be at least 1");
            return 1;
        }
        try {
            ZoneId zone = timezone == null
                ? context.loadConfig().scheduler().zoneId()
                : ZoneId.of(timezone);
            CronExpression cron = CronExpression.parse(expression, zone);
            Instant cursor = from == null ? Instant.now() : from;
            for (int i = 0; i < count; i++) {
                Optional<Instant> next = cron.nextFireAfter(cursor);
                if (next.isEmpty()) {
                    System.out.println(i == 0 ? "Never fires: " + cron.expression() : "No further fire times");
                    break;
                }
                cursor = next.get();
                System.out.println(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(cursor.atZone(zone)));
            }
            return 0;
        } catch (CronParseException e) {
            System.err.println("Invalid cron expression: " + e.getMessage());
            return 1;
        } catch (DateTimeException e) {
            System.err.println("Invalid timezone: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Next command failed: " + e.getMessage());
            return 1;
        }
    }
}
