package io.crontask.core.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed cron schedule bound to a timezone.
 *
 * <p>Accepts the classic five fields ({@code minute hour day month day-of-week}) or six fields with a
 * leading seconds column. When both day-of-month and day-of-week are restricted, a date matches if
 * either one does.
 */
public final class CronExpression {
    private static final int SEARCH_HORIZON_YEARS = 10;
    private static final List<String> FIVE_FIELD_NAMES = List.of("minute", "hour", "day", "month", "day_of_week");
    private static final List<String> SIX_FIELD_NAMES =
        List.of("second", "minute", "hour", "day", "month", "day_of_week");
    private static final CronParser FIVE_FIELD_PARSER = new CronParser(definition(false));
    private static final CronParser SIX_FIELD_PARSER = new CronParser(definition(true));

    private final String expression;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    private CronExpression(String expression, ZoneId zone, Cron cron) {
        this.expression = expression;
        this.zone = zone;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    public static CronExpression parse(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        if (expression == null || expression.isBlank()) {
            throw new CronParseException(CronParseException.Kind.INVALID_FORMAT, "cron expression is required");
        }
        String normalized = expression.trim();
        String[] parts = normalized.split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            throw new CronParseException(
                CronParseException.Kind.INVALID_FORMAT,
                "cron must have 5 or 6 fields, got " + parts.length
            );
        }
        CronParser parser = parts.length == 5 ? FIVE_FIELD_PARSER : SIX_FIELD_PARSER;
        try {
            return new CronExpression(normalized, zone, compile(parser, String.join(" ", parts)));
        } catch (IllegalArgumentException e) {
            throw invalidField(parser, parts, e);
        }
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Returns the first instant strictly after {@code after} that satisfies every field, or empty when
     * nothing matches within the search horizon.
     */
    public Optional<Instant> nextFireAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        LocalDateTime cursor = after.atZone(zone).toLocalDateTime().truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime limit = cursor.plusYears(SEARCH_HORIZON_YEARS);

        while (true) {
            Optional<LocalDateTime> candidate = nextLocalMatch(cursor);
            if (candidate.isEmpty() || candidate.get().isAfter(limit)) {
                return Optional.empty();
            }
            Optional<Instant> resolved = resolve(candidate.get(), after);
            if (resolved.isPresent()) {
                return resolved;
            }
            cursor = candidate.get();
        }
    }

    // Wall-clock matching runs in UTC so the zone's transitions are applied only in resolve().
    private Optional<LocalDateTime> nextLocalMatch(LocalDateTime cursor) {
        Optional<LocalDateTime> next = nextExecution(cursor);
        if (next.isPresent() && !next.get().isAfter(cursor)) {
            next = nextExecution(cursor.plusSeconds(1));
        }
        return next.filter(candidate -> candidate.isAfter(cursor));
    }

    private Optional<LocalDateTime> nextExecution(LocalDateTime from) {
        return executionTime.nextExecution(from.atZone(ZoneOffset.UTC)).map(ZonedDateTime::toLocalDateTime);
    }

    // Gap times shift forward by the gap length; overlap times prefer the earlier offset.
    private Optional<Instant> resolve(LocalDateTime local, Instant after) {
        ZonedDateTime zoned = ZonedDateTime.ofLocal(local, zone, null);
        if (zoned.toInstant().isAfter(after)) {
            return Optional.of(zoned.toInstant());
        }
        ZonedDateTime later = zoned.withLaterOffsetAtOverlap();
        if (later.toInstant().isAfter(after)) {
            return Optional.of(later.toInstant());
        }
        return Optional.empty();
    }

    private static Cron compile(CronParser parser, String fields) {
        Cron cron = parser.parse(fields.toUpperCase(Locale.ROOT));
        return cron.validate();
    }

    // Re-parses each field against wildcards to name the one the library rejected.
    private static CronParseException invalidField(CronParser parser, String[] parts, IllegalArgumentException cause) {
        List<String> names = parts.length == 5 ? FIVE_FIELD_NAMES : SIX_FIELD_NAMES;
        for (int i = 0; i < parts.length; i++) {
            String[] isolated = new String[parts.length];
            Arrays.fill(isolated, "*");
            isolated[i] = parts[i];
            try {
                compile(parser, String.join(" ", isolated));
            } catch (IllegalArgumentException e) {
                return new CronParseException(
                    CronParseException.Kind.INVALID_FIELD,
                    "invalid " + names.get(i) + " field '" + parts[i] + "': " + e.getMessage()
                );
            }
        }
        return new CronParseException(
            CronParseException.Kind.INVALID_FIELD,
            "invalid cron expression '" + String.join(" ", parts) + "': " + cause.getMessage()
        );
    }

    private static CronDefinition definition(boolean withSeconds) {
        CronDefinitionBuilder builder = CronDefinitionBuilder.defineCron();
        if (withSeconds) {
            builder = builder.withSeconds().withStrictRange().and();
        }
        return builder
            .withMinutes().withStrictRange().and()
            .withHours().withStrictRange().and()
            .withDayOfMonth().withStrictRange().and()
            .withMonth().withStrictRange().and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).withIntMapping(7, 0).withStrictRange().and()
            .instance();
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
