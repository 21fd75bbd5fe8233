package io.crontask.core.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
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
import java.util.Optional;

public final class SqliteJobStore implements JobStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteJobStore(Path dbPath) throws IOException {
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
    public synchronized CronJob create(CronJob job) throws IOException {
        String sql = """
            INSERT OR IGNORE INTO jobs (id, cron, action_json, paused, next_fire_ms, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.id());
            statement.setString(2, job.cron());
            statement.setString(3, mapper.writeValueAsString(job.action()));
            statement.setInt(4, job.paused() ? 1 : 0);
            setInstant(statement, 5, job.nextFireTime());
            statement.setString(6, job.createdAt().toString());
            if (statement.executeUpdate() == 0) {
                throw new DuplicateJobException(job.id());
            }
            return job;
        } catch (SQLException e) {
            throw new IOException("Failed to create job " + job.id(), e);
        }
    }

    @Override
    public synchronized Optional<CronJob> get(String id) throws IOException {
        String sql = """
            SELECT id, cron, action_json, paused, next_fire_ms, created_at
            FROM jobs
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readJob(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read job " + id, e);
        }
    }

    @Override
    public synchronized List<CronJob> list() throws IOException {
        String sql = """
            SELECT id, cron, action_json, paused, next_fire_ms, created_at
            FROM jobs
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<CronJob> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(readJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to list jobs", e);
        }
    }

    @Override
    public synchronized boolean updateNextFire(String id, Instant nextFireTime) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "UPDATE jobs SET next_fire_ms = ? WHERE id = ?")) {
            setInstant(statement, 1, nextFireTime);
            statement.setString(2, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update next fire time of job " + id, e);
        }
    }

    @Override
    public synchronized boolean setPaused(String id, boolean paused) throws IOException {
        String sql = paused
            ? "UPDATE jobs SET paused = 1, next_fire_ms = NULL WHERE id = ?"
            : "UPDATE jobs SET paused = 0 WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to change pause state of job " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    private CronJob readJob(ResultSet resultSet) throws SQLException, IOException {
        long nextFireMs = resultSet.getLong("next_fire_ms");
        Instant nextFire = resultSet.wasNull() ? null : Instant.ofEpochMilli(nextFireMs);
        return new CronJob(
            resultSet.getString("id"),
            resultSet.getString("cron"),
            mapper.readValue(resultSet.getString("action_json"), JobAction.class),
            resultSet.getInt("paused") != 0,
            nextFire,
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
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
            CREATE TABLE IF NOT EXISTS jobs (
                id TEXT PRIMARY KEY,
                cron TEXT NOT NULL,
                action_json TEXT NOT NULL,
                paused INTEGER NOT NULL DEFAULT 0,
                next_fire_ms INTEGER,
                created_at TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
