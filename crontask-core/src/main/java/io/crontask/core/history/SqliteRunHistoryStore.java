package io.crontask.core.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.crontask.core.job.JobAction;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteRunHistoryStore implements RunHistoryStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteRunHistoryStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        init();
    }

    @Override
    public synchronized void append(ExecutionRecord record) throws IOException {
        String sql = """
            INSERT INTO job_runs (job_id, cron, action_json, status_code, ok, response_text, elapsed_ms, error, run_at_us, run_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.jobId());
            statement.setString(2, record.cron());
            statement.setString(3, mapper.writeValueAsString(record.action()));
            if (record.statusCode() == null) {
                statement.setNull(4, Types.INTEGER);
            } else {
                statement.setInt(4, record.statusCode());
            }
            statement.setInt(5, record.ok() ? 1 : 0);
            statement.setString(6, record.responseText());
            if (record.elapsedMs() == null) {
                statement.setNull(7, Types.INTEGER);
            } else {
                statement.setLong(7, record.elapsedMs());
            }
            statement.setString(8, record.error());
            statement.setLong(9, toMicros(record.runAt()));
            statement.setString(10, record.runAt().toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to append run of job " + record.jobId(), e);
        }
    }

    @Override
    public synchronized RunPage query(String jobId, int limit, int offset) throws IOException {
        RunHistoryStore.checkRange(limit, offset);
        String countSql = "SELECT COUNT(*) FROM job_runs WHERE job_id = ?";
        String pageSql = """
            SELECT job_id, cron, action_json, status_code, ok, response_text, elapsed_ms, error, run_at
            FROM job_runs
            WHERE job_id = ?
            ORDER BY run_at_us DESC, seq DESC
            LIMIT ? OFFSET ?
            """;
        try (Connection connection = openConnection()) {
            long total;
            try (PreparedStatement count = connection.prepareStatement(countSql)) {
                count.setString(1, jobId);
                try (ResultSet resultSet = count.executeQuery()) {
                    total = resultSet.next() ? resultSet.getLong(1) : 0;
                }
            }

            List<ExecutionRecord> items = new ArrayList<>();
            try (PreparedStatement page = connection.prepareStatement(pageSql)) {
                page.setString(1, jobId);
                page.setInt(2, limit);
                page.setInt(3, offset);
                try (ResultSet resultSet = page.executeQuery()) {
                    while (resultSet.next()) {
                        items.add(readRecord(resultSet));
                    }
                }
            }
            return new RunPage(total, limit, offset, items);
        } catch (SQLException e) {
            throw new IOException("Failed to query runs of job " + jobId, e);
        }
    }

    private ExecutionRecord readRecord(ResultSet resultSet) throws SQLException, IOException {
        int statusCode = resultSet.getInt("status_code");
        Integer status = resultSet.wasNull() ? null : statusCode;
        long elapsedMs = resultSet.getLong("elapsed_ms");
        Long elapsed = resultSet.wasNull() ? null : elapsedMs;
        return new ExecutionRecord(
            resultSet.getString("job_id"),
            resultSet.getString("cron"),
            mapper.readValue(resultSet.getString("action_json"), JobAction.class),
            status,
            resultSet.getInt("ok") != 0,
            resultSet.getString("response_text"),
            elapsed,
            resultSet.getString("error"),
            Instant.parse(resultSet.getString("run_at"))
        );
    }

    private static long toMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS job_runs (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id TEXT NOT NULL,
                cron TEXT,
                action_json TEXT NOT NULL,
                status_code INTEGER,
                ok INTEGER NOT NULL,
                response_text TEXT,
                elapsed_ms INTEGER,
                error TEXT,
                run_at_us INTEGER NOT NULL,
                run_at TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_job_runs_job_run_at
            ON job_runs(job_id, run_at_us DESC, seq DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite run history store", e);
        }
    }
}
