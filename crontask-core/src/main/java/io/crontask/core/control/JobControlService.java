package io.crontask.core.control;

import io.crontask.core.history.RunHistoryStore;
import io.crontask.core.history.RunPage;
import io.crontask.core.job.CronJob;
import io.crontask.core.job.HttpCallAction;
import io.crontask.core.job.HttpMethod;
import io.crontask.core.job.JobStore;
import io.crontask.core.scheduler.CronScheduler;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for job mutations and queries. Requests are validated before anything touches the
 * store; scheduling side effects go through {@link CronScheduler} so the timer view stays in step.
 */
public final class JobControlService {
    public static final int MAX_ID_LENGTH = 200;

    private final JobStore store;
    private final CronScheduler scheduler;
    private final RunHistoryStore history;

    public JobControlService(JobStore store, CronScheduler scheduler, RunHistoryStore history) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    public JobView create(JobRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        String id = requireId(request.id());
        HttpMethod method = HttpMethod.parse(request.method());
        String url = requireUrl(request.url());
        if (request.cron() == null || request.cron().isBlank()) {
            throw new IllegalArgumentException("cron is required");
        }
        scheduler.expression(request.cron());

        HttpCallAction action = new HttpCallAction(method, url, request.headers(), request.body());
        CronJob job = scheduler.addJob(id, request.cron(), action);
        return JobView.of(job);
    }

    public JobView get(String id) throws IOException {
        return JobView.of(store.get(id).orElseThrow(() -> new JobNotFoundException(id)));
    }

    public List<JobView> list() throws IOException {
        return store.list().stream().map(JobView::of).toList();
    }

    public JobView pause(String id) throws IOException {
        return JobView.of(scheduler.pauseJob(id).orElseThrow(() -> new JobNotFoundException(id)));
    }

    public JobView resume(String id) throws IOException {
        return JobView.of(scheduler.resumeJob(id).orElseThrow(() -> new JobNotFoundException(id)));
    }

    public void delete(String id) throws IOException {
        if (!scheduler.removeJob(id)) {
            throw new JobNotFoundException(id);
        }
    }

    /** History is kept for deleted jobs too, so an unknown id yields an empty page. */
    public RunPage runs(String id, int limit, int offset) throws IOException {
        RunHistoryStore.checkRange(limit, offset);
        return history.query(id, limit, offset);
    }

    private static String requireId(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("id must be at most " + MAX_ID_LENGTH + " characters");
        }
        return id;
    }

    private static String requireUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
                throw new IllegalArgumentException("url must be an absolute http(s) URL");
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL", e);
        }
    }
}
