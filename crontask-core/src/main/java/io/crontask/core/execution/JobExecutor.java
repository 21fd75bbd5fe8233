package io.crontask.core.execution;

import io.crontask.core.history.ExecutionRecord;
import io.crontask.core.history.RunHistoryStore;
import io.crontask.core.job.CronJob;
import io.crontask.core.job.HttpCallAction;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single job occurrence and records its outcome. {@link #execute(CronJob)} never throws: call
 * failures end up in the returned record, history write failures are only logged.
 */
public final class JobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);

    private final HttpCaller caller;
    private final RunHistoryStore history;
    private final Duration timeout;
    private final Clock clock;

    public JobExecutor(HttpCaller caller, RunHistoryStore history, Duration timeout, Clock clock) {
        this.caller = Objects.requireNonNull(caller, "caller must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public ExecutionRecord execute(CronJob job) {
        Instant runAt = clock.instant();
        ExecutionRecord record;
        try {
            record = invoke(job, runAt);
        } catch (Exception e) {
            String error = describe(e);
            LOG.warn("Job {} call failed: {}", job.id(), error);
            record = ExecutionRecord.failed(job.id(), job.cron(), job.action(), error, runAt);
        }

        try {
            history.append(record);
        } catch (Exception e) {
            LOG.error("Failed to record run of job {} at {}", job.id(), runAt, e);
        }
        return record;
    }

    private ExecutionRecord invoke(CronJob job, Instant runAt) throws IOException {
        if (job.action() instanceof HttpCallAction http) {
            HttpCallResult result = caller.send(http.method(), http.url(), http.headers(), http.body(), timeout);
            if (result.statusCode() >= 400) {
                LOG.warn("Job {} got HTTP {} from {}", job.id(), result.statusCode(), http.url());
            }
            return ExecutionRecord.completed(
                job.id(),
                job.cron(),
                http,
                result.statusCode(),
                result.body(),
                result.elapsedMs(),
                runAt
            );
        }
        throw new IllegalStateException("unsupported job action: " + job.action());
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
