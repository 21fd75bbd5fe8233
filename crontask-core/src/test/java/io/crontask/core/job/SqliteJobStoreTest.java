package io.crontask.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteJobStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistJobsAcrossInstances() throws Exception {
        Path db = tempDir.resolve("data/crontask.db");
        SqliteJobStore first = new SqliteJobStore(db);
        HttpCallAction action = new HttpCallAction(
            HttpMethod.POST,
            "https://example.com/hook",
            Map.of("X-Token", "abc"),
            "{\"ping\":true}"
        );
        first.create(new CronJob("ping", "*/5 * * * *", action, false,
            Instant.parse("2024-01-01T00:05:00Z"), Instant.parse("2024-01-01T00:00:00Z")));

        SqliteJobStore reopened = new SqliteJobStore(db);
        CronJob loaded = reopened.get("ping").orElseThrow();

        assertThat(loaded.cron()).isEqualTo("*/5 * * * *");
        assertThat(loaded.action()).isEqualTo(action);
        assertThat(loaded.paused()).isFalse();
        assertThat(loaded.nextFireTime()).isEqualTo(Instant.parse("2024-01-01T00:05:00Z"));
        assertThat(loaded.createdAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void shouldRejectDuplicateIdAndKeepFirst() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("crontask.db"));
        store.create(job("dup", "https://example.com/first"));

        assertThatThrownBy(() -> store.create(job("dup", "https://example.com/second")))
            .isInstanceOf(DuplicateJobException.class)
            .hasMessageContaining("dup");

        HttpCallAction kept = (HttpCallAction) store.get("dup").orElseThrow().action();
        assertThat(kept.url()).isEqualTo("https://example.com/first");
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void shouldClearNextFireWhenPausedAndListById() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("crontask.db"));
        store.create(job("b", "https://example.com/b"));
        store.create(job("a", "https://example.com/a"));

        assertThat(store.setPaused("b", true)).isTrue();
        CronJob paused = store.get("b").orElseThrow();
        assertThat(paused.paused()).isTrue();
        assertThat(paused.nextFireTime()).isNull();

        assertThat(store.setPaused("b", false)).isTrue();
        assertThat(store.updateNextFire("b", Instant.parse("2030-01-01T00:00:00Z"))).isTrue();
        assertThat(store.get("b").orElseThrow().nextFireTime()).isEqualTo(Instant.parse("2030-01-01T00:00:00Z"));

        assertThat(store.list()).extracting(CronJob::id).containsExactly("a", "b");
    }

    @Test
    void shouldReportMissingJobs() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("crontask.db"));
        store.create(job("gone", "https://example.com"));

        assertThat(store.delete("gone")).isTrue();
        assertThat(store.delete("gone")).isFalse();
        assertThat(store.get("gone")).isEmpty();
        assertThat(store.setPaused("gone", true)).isFalse();
        assertThat(store.updateNextFire("gone", null)).isFalse();
    }

    private static CronJob job(String id, String url) {
        return new CronJob(
            id,
            "0 * * * *",
            new HttpCallAction(HttpMethod.GET, url, null, null),
            false,
            Instant.parse("2024-01-01T01:00:00Z"),
            Instant.parse("2024-01-01T00:00:00Z")
        );
    }
}
