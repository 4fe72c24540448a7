package com.example.skirmish.persistence;

import com.example.skirmish.model.GameSession;
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
 * Game sessions. {@code active_location} holds the location id while the session is
 * active, so a location has at most one active session.
 */
public class SessionDAO {
    private static final Logger logger = LoggerFactory.getLogger(SessionDAO.class);

    private final Database db;

    public SessionDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("SessionDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS game_session (
                    id INT AUTO_INCREMENT PRIMARY KEY,
                    name VARCHAR(200) NOT NULL,
                    location_id INT NOT NULL,
                    active_location INT,
                    is_active BOOLEAN DEFAULT TRUE,
                    status VARCHAR(20) DEFAULT 'open',
                    created_at TIMESTAMP NOT NULL,
                    CONSTRAINT uq_session_active_location UNIQUE (active_location)
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_session_location ON game_session(location_id, is_active)");
            logger.debug("[SessionDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create game_session table", e);
        }
    }

    /**
     * Most recent active session at a location.
     */
    public Optional<GameSession> findActiveByLocation(Connection c, int locationId) throws SQLException {
        String sql = "SELECT id, name, location_id, is_active, created_at FROM game_session "
                + "WHERE location_id = ? AND is_active = TRUE ORDER BY created_at DESC, id DESC LIMIT 1";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new GameSession(rs.getInt("id"), rs.getString("name"), rs.getInt("location_id"),
                        rs.getBoolean("is_active"), rs.getTimestamp("created_at").toInstant()));
            }
        }
    }

    public Optional<GameSession> findActiveByLocation(int locationId) {
        return db.withConnection("load active session", c -> findActiveByLocation(c, locationId));
    }

    public GameSession create(Connection c, String name, int locationId) throws SQLException {
        Instant now = Instant.now();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO game_session (name, location_id, active_location, is_active, status, created_at) "
                        + "VALUES (?, ?, ?, TRUE, 'open', ?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, name);
            ps.setInt(2, locationId);
            ps.setInt(3, locationId);
            ps.setTimestamp(4, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No id generated for session");
                return new GameSession(keys.getInt(1), name, locationId, true, now);
            }
        }
    }

    public GameSession create(String name, int locationId) {
        return db.withConnection("create session", c -> create(c, name, locationId));
    }
}
