package com.aether.core.persistence;

import com.aether.core.events.AgentEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link HistoryStore}.
 * <p>
 * Checkpoints live in {@code aether_checkpoints}, one row per agent. Logged events live
 * in {@code aether_history_events} keyed by {@code (agent_id, sequence)}. Payloads are
 * stored as JSON text. The SQL sticks to what both PostgreSQL and H2 accept, so the
 * same store runs against the embedded file database and a production server.
 */
public class JdbcHistoryStore implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcHistoryStore.class);

    private static final String CHECKPOINT_TABLE = "aether_checkpoints";
    private static final String EVENT_TABLE = "aether_history_events";

    private static final String CREATE_CHECKPOINT_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                agent_id   VARCHAR(255) NOT NULL,
                sequence   BIGINT NOT NULL,
                taken_at   TIMESTAMP NOT NULL,
                state      TEXT NOT NULL,
                PRIMARY KEY (agent_id)
            )
            """.formatted(CHECKPOINT_TABLE);

    private static final String CREATE_EVENT_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                agent_id    VARCHAR(255) NOT NULL,
                sequence    BIGINT NOT NULL,
                event_type  VARCHAR(64) NOT NULL,
                event       TEXT NOT NULL,
                recorded_at TIMESTAMP NOT NULL,
                PRIMARY KEY (agent_id, sequence)
            )
            """.formatted(EVENT_TABLE);

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO %s (agent_id, sequence, event_type, event, recorded_at)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(EVENT_TABLE);

    private static final String UPDATE_CHECKPOINT_SQL = """
            UPDATE %s SET sequence = ?, taken_at = ?, state = ?
            WHERE agent_id = ?
            """.formatted(CHECKPOINT_TABLE);

    private static final String INSERT_CHECKPOINT_SQL = """
            INSERT INTO %s (agent_id, sequence, taken_at, state)
            VALUES (?, ?, ?, ?)
            """.formatted(CHECKPOINT_TABLE);

    private static final String SELECT_CHECKPOINT_SQL = """
            SELECT state FROM %s WHERE agent_id = ?
            """.formatted(CHECKPOINT_TABLE);

    private static final String SELECT_EVENTS_AFTER_SQL = """
            SELECT agent_id, sequence, event, recorded_at
            FROM %s
            WHERE agent_id = ? AND sequence > ?
            ORDER BY sequence ASC
            """.formatted(EVENT_TABLE);

    private static final String SELECT_EVENTS_THROUGH_SQL = """
            SELECT agent_id, sequence, event, recorded_at
            FROM %s
            WHERE agent_id = ? AND sequence <= ?
            ORDER BY sequence ASC
            """.formatted(EVENT_TABLE);

    private static final String DELETE_EVENTS_THROUGH_SQL = """
            DELETE FROM %s WHERE agent_id = ? AND sequence <= ?
            """.formatted(EVENT_TABLE);

    private static final String SELECT_AGENT_IDS_SQL = """
            SELECT agent_id FROM %s
            UNION
            SELECT DISTINCT agent_id FROM %s
            """.formatted(CHECKPOINT_TABLE, EVENT_TABLE);

    private static final String COUNT_EVENTS_SQL = """
            SELECT COUNT(*) FROM %s WHERE agent_id = ?
            """.formatted(EVENT_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcHistoryStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Creates the history tables if they do not already exist.
     * Called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_CHECKPOINT_TABLE_SQL);
            stmt.execute(CREATE_EVENT_TABLE_SQL);
            log.info("History tables '{}' and '{}' ensured", CHECKPOINT_TABLE, EVENT_TABLE);
        }
    }

    @Override
    public void appendEvent(String agentId, long sequence, AgentEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT_SQL)) {
            stmt.setString(1, agentId);
            stmt.setLong(2, sequence);
            stmt.setString(3, event.eventName());
            stmt.setString(4, toJson(event));
            stmt.setTimestamp(5, Timestamp.from(clock.instant()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new HistoryStoreException(
                    "Failed to append event %d for agent '%s'".formatted(sequence, agentId), e);
        }
    }

    @Override
    public void saveCheckpoint(EntityCheckpoint checkpoint) {
        String state = toJson(checkpoint);
        Timestamp takenAt = Timestamp.from(checkpoint.takenAt());
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_CHECKPOINT_SQL)) {
                stmt.setLong(1, checkpoint.sequence());
                stmt.setTimestamp(2, takenAt);
                stmt.setString(3, state);
                stmt.setString(4, checkpoint.agentId());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_CHECKPOINT_SQL)) {
                    stmt.setString(1, checkpoint.agentId());
                    stmt.setLong(2, checkpoint.sequence());
                    stmt.setTimestamp(3, takenAt);
                    stmt.setString(4, state);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved checkpoint at sequence {} for agent '{}'", checkpoint.sequence(), checkpoint.agentId());
        } catch (SQLException e) {
            throw new HistoryStoreException(
                    "Failed to save checkpoint for agent '%s'".formatted(checkpoint.agentId()), e);
        }
    }

    @Override
    public Optional<EntityCheckpoint> loadLatestCheckpoint(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHECKPOINT_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromJson(rs.getString("state"), EntityCheckpoint.class));
                }
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to load checkpoint for agent '%s'".formatted(agentId), e);
        }
        return Optional.empty();
    }

    @Override
    public List<LoggedEvent> readEventsAfter(String agentId, long afterSequence) {
        return queryEvents(SELECT_EVENTS_AFTER_SQL, agentId, afterSequence);
    }

    @Override
    public HistorySegment readSegment(String agentId, long throughSequence) {
        return HistorySegment.of(agentId, queryEvents(SELECT_EVENTS_THROUGH_SQL, agentId, throughSequence));
    }

    @Override
    public int truncateThrough(String agentId, long throughSequence) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_EVENTS_THROUGH_SQL)) {
            stmt.setString(1, agentId);
            stmt.setLong(2, throughSequence);
            int deleted = stmt.executeUpdate();
            log.debug("Truncated {} events through {} for agent '{}'", deleted, throughSequence, agentId);
            return deleted;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to truncate history for agent '%s'".formatted(agentId), e);
        }
    }

    @Override
    public List<String> listAgentIds() {
        List<String> agentIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_AGENT_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                agentIds.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list agent ids", e);
        }
        agentIds.sort(null);
        return agentIds;
    }

    @Override
    public void deleteAgent(String agentId) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + EVENT_TABLE + " WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + CHECKPOINT_TABLE + " WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                stmt.executeUpdate();
            }
            log.debug("Deleted history for agent '{}'", agentId);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to delete history for agent '%s'".formatted(agentId), e);
        }
    }

    @Override
    public long segmentSize(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_EVENTS_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to count events for agent '%s'".formatted(agentId), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private List<LoggedEvent> queryEvents(String sql, String agentId, long sequence) {
        List<LoggedEvent> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            stmt.setLong(2, sequence);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new LoggedEvent(
                            rs.getString("agent_id"),
                            rs.getLong("sequence"),
                            fromJson(rs.getString("event"), AgentEvent.class),
                            rs.getTimestamp("recorded_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to read history for agent '%s'".formatted(agentId), e);
        }
        return events;
    }

    private String toJson(Object value) {
        try {
            if (value instanceof AgentEvent) {
                return objectMapper.writerFor(AgentEvent.class).writeValueAsString(value);
            }
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new HistoryStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new HistoryStoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
