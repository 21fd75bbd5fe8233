package io.crontask.core.history;

import io.crontask.core.job.JobAction;
import java.time.Instant;

public record ExecutionRecord(
    String jobId,
    String cron,
    JobAction action,
    Integer statusCode,
    boolean ok,
    String responseText,
    Long elapsedMs,
    String error,
    Instant runAt
) {
    public static ExecutionRecord completed(
        String jobId,
        String cron,
        JobAction action,
        int statusCode,
        String responseText,
        long elapsedMs,
        Instant runAt
    ) {
        return new ExecutionRecord(jobId, cron, action, statusCode, statusCode < 400, responseText, elapsedMs, null, runAt);
    }

    public static ExecutionRecord failed(String jobId, String cron, JobAction action, String error, Instant runAt) {
        return new ExecutionRecord(jobId, cron, action, null, false, null, null, error, runAt);
    }
}
