package com.warden.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.jobs.JobNotFoundException;
import com.warden.core.jobs.JobStore;
import com.warden.core.model.Job;
import com.warden.core.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link JobStore}.
 * <p>
 * Each job is stored as one JSON document plus the columns listings filter on.
 * The table {@code warden_jobs} is created by {@link #createTables()}.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    static final String TABLE_NAME = "warden_jobs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64) PRIMARY KEY,
                state       VARCHAR(32) NOT NULL,
                mode        VARCHAR(32) NOT NULL,
                routine_id  VARCHAR(64),
                created_at  TIMESTAMP NOT NULL,
                updated_at  TIMESTAMP NOT NULL,
                document    TEXT NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, state, mode, routine_id, created_at, updated_at, document)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET state = ?, updated_at = ?, document = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT document FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT document FROM %s ORDER BY created_at DESC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_STATES_SQL = """
            SELECT document FROM %s WHERE state IN (%s) ORDER BY created_at DESC
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Job table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(Job job) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, job.id());
            stmt.setString(2, job.state().name());
            stmt.setString(3, job.mode().wireName());
            stmt.setString(4, job.routineId());
            stmt.setTimestamp(5, Timestamp.from(job.createdAt()));
            stmt.setTimestamp(6, Timestamp.from(job.lastActivityAt()));
            stmt.setString(7, serialize(job));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job " + job.id(), e);
        }
    }

    @Override
    public void update(Job job) {
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, job.state().name());
            stmt.setTimestamp(2, Timestamp.from(job.lastActivityAt()));
            stmt.setString(3, serialize(job));
            stmt.setString(4, job.id());
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to update job " + job.id(), e);
        }
        if (updated == 0) {
            throw new JobNotFoundException(job.id());
        }
    }

    @Override
    public Optional<Job> find(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("document")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load job " + jobId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<Job> findAll() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            return readAll(stmt);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findByStates(Collection<JobState> states) {
        if (states.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(states.size(), "?"));
        String sql = SELECT_BY_STATES_SQL.formatted(TABLE_NAME, placeholders);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            for (JobState state : states) {
                stmt.setString(index++, state.name());
            }
            return readAll(stmt);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs by state " + states, e);
        }
    }

    private List<Job> readAll(PreparedStatement stmt) throws SQLException {
        var jobs = new ArrayList<Job>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                jobs.add(deserialize(rs.getString("document")));
            }
        }
        return jobs;
    }

    private String serialize(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize job " + job.id(), e);
        }
    }

    private Job deserialize(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize job document", e);
        }
    }
}
