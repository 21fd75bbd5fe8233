package io.crontask.core.job;

import java.time.Instant;

public record CronJob(
    String id,
    String cron,
    JobAction action,
    boolean paused,
    Instant nextFireTime,
    Instant createdAt
) {
    public CronJob withNextFireTime(Instant next) {
        return new CronJob(id, cron, action, paused, next, createdAt);
    }

    public CronJob withPaused(boolean value) {
        return new CronJob(id, cron, action, value, value ? null : nextFireTime, createdAt);
    }
}
