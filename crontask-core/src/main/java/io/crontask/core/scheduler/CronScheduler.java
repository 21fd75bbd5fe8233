package io.crontask.core.scheduler;

import io.crontask.core.cron.CronExpression;
import io.crontask.core.cron.CronParseException;
import io.crontask.core.execution.JobExecutor;
import io.crontask.core.job.CronJob;
import io.crontask.core.job.JobAction;
import io.crontask.core.job.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded timer that fires cron jobs from a {@link JobStore}.
 *
 * <p>The loop sleeps until the earliest next-fire time or until a job is added, paused, resumed or
 * removed. Due jobs are handed to a worker pool and never awaited; a job whose previous run is still
 * in flight drops the occurrence. All next-fire writes happen under one lock, so the store sees a
 * single writer per job.
 *
 * <p>Overdue occurrences (after downtime or a late wake-up) fire once if the most recent missed
 * occurrence lies within the misfire grace window and are skipped otherwise. Either way the job moves
 * on to its next future occurrence.
 */
public final class CronScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronScheduler.class);
    private static final Duration IDLE_WAIT = Duration.ofMinutes(1);
    private static final Duration STORE_RETRY_DELAY = Duration.ofSeconds(5);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);

    private final JobStore store;
    private final JobExecutor executor;
    private final ZoneId zone;
    private final Duration misfireGrace;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final TreeSet<Trigger> triggers = new TreeSet<>(Trigger.ORDER);
    private final Map<String, Trigger> triggersById = new HashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService workers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running;
    private Thread loop;

    public CronScheduler(JobStore store, JobExecutor executor, ZoneId zone, Duration misfireGrace, Clock clock) {
        this(store, executor, zone, misfireGrace, clock, defaultWorkers());
    }

    /**
     * Runs calls on {@code workers}, which the scheduler shuts down on {@link #close()}.
     */
    public CronScheduler(
        JobStore store,
        JobExecutor executor,
        ZoneId zone,
        Duration misfireGrace,
        Clock clock,
        ExecutorService workers
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.misfireGrace = Objects.requireNonNull(misfireGrace, "misfireGrace must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        if (misfireGrace.isNegative()) {
            throw new IllegalArgumentException("misfireGrace must not be negative");
        }
    }

    private static ExecutorService defaultWorkers() {
        AtomicInteger workerIds = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "crontask-exec-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Loads every job from the store, fills in missing next-fire times and starts the timer thread.
     * Overdue jobs are due immediately and go through the misfire policy on the first wake-up.
     */
    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already started");
        }
        recover();
        running = true;
        loop = new Thread(this::runLoop, "crontask-scheduler");
        loop.setDaemon(true);
        loop.start();
        LOG.info("Scheduler started (zone={}, misfireGrace={})", zone, misfireGrace);
    }

    public CronExpression expression(String cron) {
        return CronExpression.parse(cron, zone);
    }

    public CronJob addJob(String id, String cron, JobAction action) throws IOException {
        CronExpression expression = expression(cron);
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant next = expression.nextFireAfter(now).orElse(null);
            CronJob job = store.create(new CronJob(id, expression.expression(), action, false, next, now));
            if (next != null) {
                register(id, next, next);
            } else {
                LOG.warn("Job {} ({}) has no upcoming fire time", id, cron);
            }
            return job;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CronJob> pauseJob(String id) throws IOException {
        lock.lock();
        try {
            if (!store.setPaused(id, true)) {
                return Optional.empty();
            }
            unregister(id);
            return store.get(id);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CronJob> resumeJob(String id) throws IOException {
        lock.lock();
        try {
            Optional<CronJob> current = store.get(id);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            CronJob job = current.get();
            Instant next = expression(job.cron()).nextFireAfter(clock.instant()).orElse(null);
            store.setPaused(id, false);
            store.updateNextFire(id, next);
            if (next != null) {
                register(id, next, next);
            } else {
                unregister(id);
            }
            return Optional.of(job.withPaused(false).withNextFireTime(next));
        } finally {
            lock.unlock();
        }
    }

    public boolean removeJob(String id) throws IOException {
        lock.lock();
        try {
            boolean removed = store.delete(id);
            unregister(id);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Earliest pending wake-up across all scheduled jobs. */
    public Optional<Instant> nextWakeUp() {
        lock.lock();
        try {
            return triggers.isEmpty() ? Optional.empty() : Optional.of(triggers.first().wakeAt());
        } finally {
            lock.unlock();
        }
    }

    public boolean isScheduled(String id) {
        lock.lock();
        try {
            return triggersById.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public boolean isInFlight(String id) {
        return inFlight.contains(id);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            running = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        try {
            if (loop != null) {
                loop.join(SHUTDOWN_WAIT.toMillis());
            }
            workers.shutdown();
            if (!workers.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Executions still running after {}; abandoning them", SHUTDOWN_WAIT);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        LOG.info("Scheduler stopped");
    }

    private void recover() throws IOException {
        lock.lock();
        try {
            triggers.clear();
            triggersById.clear();
            Instant now = clock.instant();
            int overdue = 0;
            for (CronJob job : store.list()) {
                if (job.paused()) {
                    continue;
                }
                Instant next = job.nextFireTime();
                if (next == null) {
                    Optional<CronExpression> expression = parseStored(job);
                    if (expression.isEmpty()) {
                        continue;
                    }
                    next = expression.get().nextFireAfter(now).orElse(null);
                    if (next == null) {
                        continue;
                    }
                    store.updateNextFire(job.id(), next);
                } else if (!next.isAfter(now)) {
                    overdue++;
                }
                register(job.id(), next, next);
            }
            LOG.info("Recovered {} scheduled jobs ({} overdue)", triggersById.size(), overdue);
        } finally {
            lock.unlock();
        }
    }

    private void runLoop() {
        while (running) {
            List<Trigger> due;
            Instant now;
            lock.lock();
            try {
                awaitDue();
                if (!running) {
                    break;
                }
                now = clock.instant();
                due = pollDue(now);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                lock.unlock();
            }
            for (Trigger trigger : due) {
                fire(trigger, now);
            }
        }
    }

    private void awaitDue() throws InterruptedException {
        while (running) {
            Instant now = clock.instant();
            Trigger head = triggers.isEmpty() ? null : triggers.first();
            if (head != null && !head.wakeAt().isAfter(now)) {
                return;
            }
            long waitMs = head == null
                ? IDLE_WAIT.toMillis()
                : Math.min(IDLE_WAIT.toMillis(), Math.max(1, Duration.between(now, head.wakeAt()).toMillis()));
            changed.await(waitMs, TimeUnit.MILLISECONDS);
        }
    }

    private List<Trigger> pollDue(Instant now) {
        List<Trigger> due = new ArrayList<>();
        while (!triggers.isEmpty() && !triggers.first().wakeAt().isAfter(now)) {
            Trigger trigger = triggers.pollFirst();
            triggersById.remove(trigger.jobId());
            due.add(trigger);
        }
        due.sort(Comparator.comparing(Trigger::jobId));
        return due;
    }

    private void fire(Trigger trigger, Instant now) {
        String id = trigger.jobId();
        lock.lock();
        try {
            CronJob job;
            try {
                Optional<CronJob> current = store.get(id);
                if (current.isEmpty()) {
                    return;
                }
                job = current.get();
            } catch (IOException e) {
                LOG.warn("Could not read job {}; retrying in {}", id, STORE_RETRY_DELAY, e);
                retryLater(trigger, now);
                return;
            }

            // paused, resumed or rescheduled since this trigger was queued
            if (job.paused() || !trigger.due().equals(job.nextFireTime())) {
                return;
            }
            Optional<CronExpression> parsed = parseStored(job);
            if (parsed.isEmpty()) {
                return;
            }
            CronExpression expression = parsed.get();

            boolean runNow = withinGrace(expression, trigger.due(), now);
            Instant base = trigger.due().isAfter(now) ? trigger.due() : now;
            Instant next = expression.nextFireAfter(base).orElse(null);
            try {
                store.updateNextFire(id, next);
            } catch (IOException e) {
                LOG.warn("Could not persist next fire time of job {}; retrying in {}", id, STORE_RETRY_DELAY, e);
                retryLater(trigger, now);
                return;
            }
            if (next != null) {
                register(id, next, next);
            } else {
                LOG.info("Job {} has no further fire times", id);
            }

            if (runNow) {
                dispatch(job.withNextFireTime(next));
            } else {
                LOG.warn("Job {} missed its run at {} by more than {}; skipped", id, trigger.due(), misfireGrace);
            }
        } finally {
            lock.unlock();
        }
    }

    // True when some occurrence in [now - grace, now] is still owed.
    private boolean withinGrace(CronExpression expression, Instant due, Instant now) {
        Instant windowStart = now.minus(misfireGrace);
        if (!due.isBefore(windowStart)) {
            return true;
        }
        Optional<Instant> latest = expression.nextFireAfter(windowStart.minusNanos(1));
        return latest.isPresent() && !latest.get().isAfter(now);
    }

    private void dispatch(CronJob job) {
        if (!inFlight.add(job.id())) {
            LOG.debug("Job {} is still running; dropping this occurrence", job.id());
            return;
        }
        try {
            workers.execute(() -> {
                try {
                    executor.execute(job);
                } finally {
                    inFlight.remove(job.id());
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.id());
            LOG.warn("Executor rejected job {}; scheduler is shutting down", job.id());
        }
    }

    private Optional<CronExpression> parseStored(CronJob job) {
        try {
            return Optional.of(expression(job.cron()));
        } catch (CronParseException e) {
            LOG.error("Job {} has an unparseable cron '{}': {}", job.id(), job.cron(), e.getMessage());
            return Optional.empty();
        }
    }

    private void retryLater(Trigger trigger, Instant now) {
        if (!triggersById.containsKey(trigger.jobId())) {
            register(trigger.jobId(), trigger.due(), now.plus(STORE_RETRY_DELAY));
        }
    }

    private void register(String id, Instant due, Instant wakeAt) {
        Trigger previous = triggersById.put(id, new Trigger(due, wakeAt, id));
        if (previous != null) {
            triggers.remove(previous);
        }
        triggers.add(triggersById.get(id));
        changed.signalAll();
    }

    private void unregister(String id) {
        Trigger previous = triggersById.remove(id);
        if (previous != null) {
            triggers.remove(previous);
            changed.signalAll();
        }
    }

    private record Trigger(Instant due, Instant wakeAt, String jobId) {
        static final Comparator<Trigger> ORDER = Comparator.comparing(Trigger::wakeAt)
            .thenComparing(Trigger::jobId);
    }
}
