package io.crontask.core.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CronExpressionTest {
    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void shouldFireAtNextMidnight() {
        CronExpression daily = CronExpression.parse("0 0 * * *", UTC);

        assertThat(daily.nextFireAfter(Instant.parse("2024-01-01T00:00:00Z")))
            .contains(Instant.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void shouldAdvanceToNextQuarterHour() {
        CronExpression quarterly = CronExpression.parse("*/15 * * * *", UTC);

        assertThat(quarterly.nextFireAfter(Instant.parse("2024-05-01T10:07:00Z")))
            .contains(Instant.parse("2024-05-01T10:15:00Z"));
        assertThat(quarterly.nextFireAfter(Instant.parse("2024-05-01T10:45:00Z")))
            .contains(Instant.parse("2024-05-01T11:00:00Z"));
    }

    @Test
    void shouldProduceStrictlyIncreasingSequence() {
        for (String raw : new String[] {"*/7 * * * * *", "5 4 * * sun", "0 22 * * 1-5", "15 10 1,15 * *"}) {
            CronExpression expression = CronExpression.parse(raw, ZoneId.of("Europe/Berlin"));
            Instant cursor = Instant.parse("2024-03-29T12:34:56.789Z");
            for (int i = 0; i < 50; i++) {
                Instant next = expression.nextFireAfter(cursor).orElseThrow();
                assertThat(next).isAfter(cursor);
                assertThat(next.getNano()).isZero();
                cursor = next;
            }
        }
    }

    @Test
    void shouldSupportSecondsField() {
        CronExpression everyTenSeconds = CronExpression.parse("*/10 * * * * *", UTC);

        assertThat(everyTenSeconds.nextFireAfter(Instant.parse("2024-01-01T10:00:03Z")))
            .contains(Instant.parse("2024-01-01T10:00:10Z"));
        assertThat(everyTenSeconds.nextFireAfter(Instant.parse("2024-01-01T10:00:10Z")))
            .contains(Instant.parse("2024-01-01T10:00:20Z"));
    }

    @Test
    void shouldTruncateFractionalSecondsBeforeSearching() {
        CronExpression everySecond = CronExpression.parse("* * * * * *", UTC);

        assertThat(everySecond.nextFireAfter(Instant.parse("2024-01-01T10:00:00.500Z")))
            .contains(Instant.parse("2024-01-01T10:00:01Z"));
    }

    @Test
    void shouldMatchEitherDayWhenBothDayFieldsAreRestricted() {
        CronExpression expression = CronExpression.parse("0 0 13 * FRI", UTC);

        // 2024-01-05 is a Friday, 2024-01-13 a Saturday
        Instant first = expression.nextFireAfter(Instant.parse("2024-01-01T00:00:00Z")).orElseThrow();
        Instant second = expression.nextFireAfter(first).orElseThrow();
        Instant third = expression.nextFireAfter(second).orElseThrow();

        assertThat(first).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2024-01-12T00:00:00Z"));
        assertThat(third).isEqualTo(Instant.parse("2024-01-13T00:00:00Z"));
    }

    @Test
    void shouldRequireBothDayFieldsWhenOneIsWildcard() {
        CronExpression lastDay = CronExpression.parse("0 0 31 * *", UTC);

        assertThat(lastDay.nextFireAfter(Instant.parse("2024-02-01T00:00:00Z")))
            .contains(Instant.parse("2024-03-31T00:00:00Z"));
    }

    @Test
    void shouldHonourLeapYears() {
        CronExpression leapDay = CronExpression.parse("0 0 29 2 *", UTC);

        assertThat(leapDay.nextFireAfter(Instant.parse("2024-03-01T00:00:00Z")))
            .contains(Instant.parse("2028-02-29T00:00:00Z"));
    }

    @Test
    void shouldReportNeverFiringExpression() {
        CronExpression impossible = CronExpression.parse("0 0 30 2 *", UTC);

        assertThat(impossible.nextFireAfter(Instant.parse("2024-01-01T00:00:00Z"))).isEqualTo(Optional.empty());
    }

    @Test
    void shouldAcceptNamesAndSundayAsSeven() {
        CronExpression weekdays = CronExpression.parse("0 9 * jan mon-fri", UTC);
        CronExpression sunday = CronExpression.parse("0 0 * * 7", UTC);

        // 2024-01-06 is a Saturday
        assertThat(weekdays.nextFireAfter(Instant.parse("2024-01-06T00:00:00Z")))
            .contains(Instant.parse("2024-01-08T09:00:00Z"));
        assertThat(sunday.nextFireAfter(Instant.parse("2024-01-01T00:00:00Z")))
            .contains(Instant.parse("2024-01-07T00:00:00Z"));
    }

    @Test
    void shouldSupportStepFromStartValue() {
        CronExpression expression = CronExpression.parse("10/20 * * * *", UTC);

        assertThat(expression.nextFireAfter(Instant.parse("2024-01-01T10:31:00Z")))
            .contains(Instant.parse("2024-01-01T10:50:00Z"));
        assertThat(expression.nextFireAfter(Instant.parse("2024-01-01T10:50:00Z")))
            .contains(Instant.parse("2024-01-01T11:10:00Z"));
    }

    @Test
    void shouldEvaluateInConfiguredZone() {
        CronExpression shanghai = CronExpression.parse("0 9 * * *", ZoneId.of("Asia/Shanghai"));

        assertThat(shanghai.nextFireAfter(Instant.parse("2024-01-01T00:00:00Z")))
            .contains(Instant.parse("2024-01-01T01:00:00Z"));
    }

    @Test
    void shouldShiftTimesInDstGapForward() {
        CronExpression expression = CronExpression.parse("30 2 * * *", ZoneId.of("America/New_York"));

        // 02:30 does not exist on 2024-03-10; it runs at 03:30 EDT instead
        assertThat(expression.nextFireAfter(Instant.parse("2024-03-10T05:00:00Z")))
            .contains(Instant.parse("2024-03-10T07:30:00Z"));
    }

    @Test
    void shouldPreferEarlierOffsetInDstOverlap() {
        CronExpression expression = CronExpression.parse("30 1 * * *", ZoneId.of("America/New_York"));

        assertThat(expression.nextFireAfter(Instant.parse("2024-11-03T04:00:00Z")))
            .contains(Instant.parse("2024-11-03T05:30:00Z"));
        assertThat(expression.nextFireAfter(Instant.parse("2024-11-03T06:00:00Z")))
            .contains(Instant.parse("2024-11-03T06:30:00Z"));
    }

    @Test
    void shouldRejectWrongFieldCount() {
        assertThatThrownBy(() -> CronExpression.parse("* * * *", UTC))
            .isInstanceOfSatisfying(CronParseException.class,
                e -> assertThat(e.kind()).isEqualTo(CronParseException.Kind.INVALID_FORMAT));
        assertThatThrownBy(() -> CronExpression.parse("0 * * * * * *", UTC))
            .isInstanceOf(CronParseException.class);
        assertThatThrownBy(() -> CronExpression.parse("  ", UTC))
            .isInstanceOf(CronParseException.class);
    }

    @Test
    void shouldRejectInvalidFieldsNamingTheField() {
        assertInvalidField("60 * * * *", "minute");
        assertInvalidField("* 24 * * *", "hour");
        assertInvalidField("* * 0 * *", "day");
        assertInvalidField("* * * 13 *", "month");
        assertInvalidField("* * * * 8", "day_of_week");
        assertInvalidField("5-1 * * * *", "minute");
        assertInvalidField("*/0 * * * *", "minute");
        assertInvalidField("abc * * * *", "minute");
        assertInvalidField("1,,2 * * * *", "minute");
    }

    private static void assertInvalidField(String raw, String field) {
        assertThatThrownBy(() -> CronExpression.parse(raw, UTC))
            .isInstanceOfSatisfying(CronParseException.class, e -> {
                assertThat(e.kind()).isEqualTo(CronParseException.Kind.INVALID_FIELD);
                assertThat(e.getMessage()).contains(field);
            });
    }
}
