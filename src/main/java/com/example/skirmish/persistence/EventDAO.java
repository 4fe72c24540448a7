package com.example.skirmish.persistence;

import com.example.skirmish.model.EventType;
import com.example.skirmish.model.RoleplayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Role-play events. {@code active_location} holds the location id while the event is
 * active and NULL once closed; its unique index allows one active event per location.
 */
public class EventDAO {
    private static final Logger logger = LoggerFactory.getLogger(EventDAO.class);

    private static final String COLUMNS = "id, title, description, event_type, location_id, session_id, status, "
            + "created_by, closed_by, created_at, closed_at, event_data";

    private final Database db;

    public EventDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("EventDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS rp_event (
                    id INT AUTO_INCREMENT PRIMARY KEY,
                    title VARCHAR(200) NOT NULL,
                    description VARCHAR(2000),
                    event_type VARCHAR(20) NOT NULL,
                    location_id INT NOT NULL,
                    active_location INT,
                    session_id INT,
                    status VARCHAR(20) NOT NULL DEFAULT 'ACTIVE',
                    created_by INT NOT NULL,
                    closed_by INT,
                    created_at TIMESTAMP NOT NULL,
                    closed_at TIMESTAMP,
                    event_data CLOB,
                    CONSTRAINT uq_event_active_location UNIQUE (active_location)
                )
            """);
            logger.debug("[EventDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create rp_event table", e);
        }
    }

    /**
     * Insert an active event. Fails with a unique violation if the location already has one.
     */
    public RoleplayEvent insert(Connection c, String title, String description, EventType type, int locationId,
                                Integer sessionId, int createdBy) throws SQLException {
        String sql = "INSERT INTO rp_event (title, description, event_type, location_id, active_location, session_id, "
                + "status, created_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Instant now = Instant.now();
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, title);
            ps.setString(2, description);
            ps.setString(3, type.key());
            ps.setInt(4, locationId);
            ps.setInt(5, locationId);
            CombatRoundDAO.setNullableInt(ps, 6, sessionId);
            ps.setString(7, RoleplayEvent.Status.ACTIVE.name());
            ps.setInt(8, createdBy);
            ps.setTimestamp(9, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No id generated for event");
                return new RoleplayEvent(keys.getInt(1), title, description, type, locationId, sessionId,
                        RoleplayEvent.Status.ACTIVE, createdBy, null, now, null, null);
            }
        }
    }

    public Optional<RoleplayEvent> findActiveByLocation(int locationId) {
        return db.withConnection("load active event", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM rp_event WHERE active_location = ?")) {
                ps.setInt(1, locationId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public Optional<RoleplayEvent> findById(Connection c, int id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM rp_event WHERE id = ?")) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Close an active event and store its summary.
     *
     * @return true if the event was active and is now closed
     */
    public boolean close(Connection c, int id, int closedBy, String summaryJson) throws SQLException {
        String sql = "UPDATE rp_event SET status = ?, active_location = NULL, closed_by = ?, closed_at = ?, "
                + "event_data = ? WHERE id = ? AND status = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, RoleplayEvent.Status.CLOSED.name());
            ps.setInt(2, closedBy);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setString(4, summaryJson);
            ps.setInt(5, id);
            ps.setString(6, RoleplayEvent.Status.ACTIVE.name());
            return ps.executeUpdate() > 0;
        }
    }

    private static RoleplayEvent map(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        Timestamp closed = rs.getTimestamp("closed_at");
        return new RoleplayEvent(
                rs.getInt("id"),
                rs.getString("title"),
                rs.getString("description"),
                EventType.fromString(rs.getString("event_type")),
                rs.getInt("location_id"),
                CombatRoundDAO.nullableInt(rs, "session_id"),
                RoleplayEvent.Status.valueOf(rs.getString("status")),
                rs.getInt("created_by"),
                CombatRoundDAO.nullableInt(rs, "closed_by"),
                created != null ? created.toInstant() : null,
                closed != null ? closed.toInstant() : null,
                rs.getString("event_data"));
    }
}
