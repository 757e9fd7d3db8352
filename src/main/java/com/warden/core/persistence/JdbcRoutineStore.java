package com.warden.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.routines.Routine;
import com.warden.core.routines.RoutineRun;
import com.warden.core.routines.RoutineStore;
import com.warden.core.routines.RunStatus;
import com.warden.core.routines.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link RoutineStore}. Routines and runs are JSON documents with the
 * columns lookups need alongside.
 */
public class JdbcRoutineStore implements RoutineStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRoutineStore.class);

    static final String ROUTINES_TABLE = "warden_routines";
    static final String RUNS_TABLE = "warden_routine_runs";

    private static final String CREATE_ROUTINES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id            VARCHAR(64) PRIMARY KEY,
                trigger_type  VARCHAR(16) NOT NULL,
                webhook_path  VARCHAR(255),
                created_at    TIMESTAMP NOT NULL,
                document      TEXT NOT NULL
            )
            """.formatted(ROUTINES_TABLE);

    private static final String CREATE_RUNS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64) PRIMARY KEY,
                routine_id  VARCHAR(64) NOT NULL,
                job_id      VARCHAR(64),
                status      VARCHAR(16) NOT NULL,
                started_at  TIMESTAMP NOT NULL,
                document    TEXT NOT NULL
            )
            """.formatted(RUNS_TABLE);

    private static final String UPSERT_ROUTINE_SQL = """
            INSERT INTO %s (id, trigger_type, webhook_path, created_at, document)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET trigger_type = EXCLUDED.trigger_type,
                          webhook_path = EXCLUDED.webhook_path,
                          document = EXCLUDED.document
            """.formatted(ROUTINES_TABLE);

    private static final String SELECT_ROUTINE_SQL = """
            SELECT document FROM %s WHERE id = ?
            """.formatted(ROUTINES_TABLE);

    private static final String SELECT_ALL_ROUTINES_SQL = """
            SELECT document FROM %s ORDER BY created_at ASC
            """.formatted(ROUTINES_TABLE);

    private static final String SELECT_BY_WEBHOOK_SQL = """
            SELECT document FROM %s WHERE trigger_type = 'webhook' AND webhook_path = ?
            """.formatted(ROUTINES_TABLE);

    private static final String DELETE_ROUTINE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(ROUTINES_TABLE);

    private static final String DELETE_RUNS_SQL = """
            DELETE FROM %s WHERE routine_id = ?
            """.formatted(RUNS_TABLE);

    private static final String UPSERT_RUN_SQL = """
            INSERT INTO %s (id, routine_id, job_id, status, started_at, document)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET job_id = EXCLUDED.job_id,
                          status = EXCLUDED.status,
                          document = EXCLUDED.document
            """.formatted(RUNS_TABLE);

    private static final String PRUNE_RUNS_SQL = """
            DELETE FROM %1$s
            WHERE routine_id = ? AND status <> ?
              AND id NOT IN (SELECT id FROM %1$s WHERE routine_id = ? ORDER BY started_at DESC LIMIT ?)
            """.formatted(RUNS_TABLE);

    private static final String SELECT_RUN_BY_JOB_SQL = """
            SELECT document FROM %s WHERE job_id = ?
            """.formatted(RUNS_TABLE);

    private static final String SELECT_RUNS_SQL = """
            SELECT document FROM %s WHERE routine_id = ? ORDER BY started_at DESC LIMIT ?
            """.formatted(RUNS_TABLE);

    private static final String COUNT_RUNNING_SQL = """
            SELECT COUNT(*) FROM %s WHERE routine_id = ? AND status = ?
            """.formatted(RUNS_TABLE);

    private static final String COUNT_SINCE_SQL = """
            SELECT COUNT(*) FROM %s WHERE started_at >= ?
            """.formatted(RUNS_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final int runHistoryLimit;

    public JdbcRoutineStore(DataSource dataSource, ObjectMapper objectMapper, int runHistoryLimit) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.runHistoryLimit = runHistoryLimit;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_ROUTINES_SQL)) {
                stmt.execute();
            }
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_RUNS_SQL)) {
                stmt.execute();
            }
            log.info("Routine tables '{}' and '{}' ensured", ROUTINES_TABLE, RUNS_TABLE);
        }
    }

    @Override
    public void save(Routine routine) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_ROUTINE_SQL)) {
            stmt.setString(1, routine.id());
            stmt.setString(2, routine.trigger().type().wireName());
            stmt.setString(3, routine.trigger().webhookPath());
            stmt.setTimestamp(4, Timestamp.from(routine.createdAt()));
            stmt.setString(5, write(routine));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to save routine " + routine.id(), e);
        }
    }

    @Override
    public Optional<Routine> find(String id) {
        return queryOne(SELECT_ROUTINE_SQL, id, Routine.class);
    }

    @Override
    public List<Routine> findAll() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_ROUTINES_SQL)) {
            return readAll(stmt, Routine.class);
        } catch (SQLException e) {
            throw new StoreException("Failed to list routines", e);
        }
    }

    @Override
    public Optional<Routine> findByWebhookPath(String path) {
        return queryOne(SELECT_BY_WEBHOOK_SQL, path, Routine.class);
    }

    @Override
    public boolean delete(String id) {
        try (Connection conn = dataSource.getConnection()) {
            int deleted;
            try (PreparedStatement stmt = conn.prepareStatement(DELETE_ROUTINE_SQL)) {
                stmt.setString(1, id);
                deleted = stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement(DELETE_RUNS_SQL)) {
                stmt.setString(1, id);
                stmt.executeUpdate();
            }
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete routine " + id, e);
        }
    }

    @Override
    public void saveRun(RoutineRun run) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT_RUN_SQL)) {
                stmt.setString(1, run.id());
                stmt.setString(2, run.routineId());
                stmt.setString(3, run.jobId());
                stmt.setString(4, run.status().wireName());
                stmt.setTimestamp(5, Timestamp.from(run.startedAt()));
                stmt.setString(6, write(run));
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement(PRUNE_RUNS_SQL)) {
                stmt.setString(1, run.routineId());
                stmt.setString(2, RunStatus.PENDING.wireName());
                stmt.setString(3, run.routineId());
                stmt.setInt(4, runHistoryLimit);
                stmt.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to save routine run " + run.id(), e);
        }
    }

    @Override
    public Optional<RoutineRun> findRunByJobId(String jobId) {
        return queryOne(SELECT_RUN_BY_JOB_SQL, jobId, RoutineRun.class);
    }

    @Override
    public List<RoutineRun> listRuns(String routineId, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RUNS_SQL)) {
            stmt.setString(1, routineId);
            stmt.setInt(2, limit);
            return readAll(stmt, RoutineRun.class);
        } catch (SQLException e) {
            throw new StoreException("Failed to list runs of routine " + routineId, e);
        }
    }

    @Override
    public int countRunning(String routineId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_RUNNING_SQL)) {
            stmt.setString(1, routineId);
            stmt.setString(2, RunStatus.PENDING.wireName());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count running runs of routine " + routineId, e);
        }
    }

    @Override
    public long countRunsSince(Instant since) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SINCE_SQL)) {
            stmt.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count routine runs", e);
        }
    }

    private <T> Optional<T> queryOne(String sql, String key, Class<T> type) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            List<T> rows = readAll(stmt, type);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to load " + type.getSimpleName() + " " + key, e);
        }
    }

    private <T> List<T> readAll(PreparedStatement stmt, Class<T> type) throws SQLException {
        var rows = new ArrayList<T>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(read(rs.getString("document"), type));
            }
        }
        return rows;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
