package io.crontask.core.control;

import io.crontask.core.job.CronJob;
import io.crontask.core.job.HttpCallAction;
import java.time.Instant;
import java.util.Map;

public record JobView(
    String id,
    String cron,
    String method,
    String url,
    Map<String, String> headers,
    String body,
    Instant nextRunTime,
    String status
) {
    public static final String SCHEDULED = "scheduled";
    public static final String PAUSED = "paused";

    public static JobView of(CronJob job) {
        HttpCallAction http = (HttpCallAction) job.action();
        return new JobView(
            job.id(),
            job.cron(),
            http.method().name(),
            http.url(),
            http.headers(),
            http.body(),
            job.nextFireTime(),
            job.paused() ? PAUSED : SCHEDULED
        );
    }
}
