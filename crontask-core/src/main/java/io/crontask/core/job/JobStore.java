package io.crontask.core.job;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job definitions. Every mutating call is committed before it returns.
 */
public interface JobStore {
    CronJob create(CronJob job) throws IOException;

    Optional<CronJob> get(String id) throws IOException;

    List<CronJob> list() throws IOException;

    boolean updateNextFire(String id, Instant nextFireTime) throws IOException;

    /** Pausing also clears the stored next-fire time. */
    boolean setPaused(String id, boolean paused) throws IOException;

    boolean delete(String id) throws IOException;
}
