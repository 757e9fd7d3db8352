package com.warden.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.EventStore;
import com.warden.core.events.JobEvent;
import com.warden.core.events.JobEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PostgreSQL-backed {@link EventStore}. The primary key {@code (job_id, sequence)}
 * rejects a duplicate sequence outright.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    static final String TABLE_NAME = "warden_job_events";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                job_id      VARCHAR(64) NOT NULL,
                sequence    BIGINT NOT NULL,
                event_type  VARCHAR(32) NOT NULL,
                payload     TEXT NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                PRIMARY KEY (job_id, sequence)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (job_id, sequence, event_type, payload, created_at)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_SINCE_SQL = """
            SELECT job_id, sequence, event_type, payload, created_at
            FROM %s
            WHERE job_id = ? AND sequence > ?
            ORDER BY sequence ASC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LAST_SEQUENCE_SQL = """
            SELECT COALESCE(MAX(sequence), 0) FROM %s WHERE job_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcEventStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Event table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(JobEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, event.jobId());
            stmt.setLong(2, event.sequence());
            stmt.setString(3, event.eventType().wireName());
            stmt.setString(4, objectMapper.writeValueAsString(event.payload()));
            stmt.setTimestamp(5, Timestamp.from(event.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Failed to append event #" + event.sequence() + " for job " + event.jobId(), e);
        }
    }

    @Override
    public List<JobEvent> read(String jobId, long since, int limit) {
        var events = new ArrayList<JobEvent>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SINCE_SQL)) {
            stmt.setString(1, jobId);
            stmt.setLong(2, since);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new JobEvent(
                            rs.getString("job_id"),
                            rs.getLong("sequence"),
                            JobEventType.fromWire(rs.getString("event_type")),
                            objectMapper.readValue(rs.getString("payload"), PAYLOAD_TYPE),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Failed to read events for job " + jobId, e);
        }
        return events;
    }

    @Override
    public long lastSequence(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LAST_SEQUENCE_SQL)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read last sequence for job " + jobId, e);
        }
    }
}
