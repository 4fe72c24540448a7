package com.example.skirmish.persistence;

import com.example.skirmish.combat.CombatRound;
import com.example.skirmish.combat.RoundResolution;
import com.example.skirmish.combat.RoundStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combat round rows. Status changes go through {@link #compareAndSetStatus}, which only
 * updates a row still in the expected state; that conditional update is what keeps two
 * resolvers from both winning.
 */
public class CombatRoundDAO {
    private static final Logger logger = LoggerFactory.getLogger(CombatRoundDAO.class);

    private static final String COLUMNS = "id, round_number, location_id, session_id, event_id, status, "
            + "created_by, resolved_by, resolution_data, created_at, resolved_at";

    private final Database db;

    public CombatRoundDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("CombatRoundDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS combat_round (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    round_number INT NOT NULL,
                    location_id INT NOT NULL,
                    session_id INT,
                    event_id INT,
                    scope_key VARCHAR(40) NOT NULL,
                    status VARCHAR(20) NOT NULL DEFAULT 'active',
                    created_by INT NOT NULL,
                    resolved_by INT,
                    resolution_data CLOB,
                    created_at TIMESTAMP NOT NULL,
                    resolved_at TIMESTAMP,
                    CONSTRAINT uq_round_scope_number UNIQUE (scope_key, round_number)
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_round_location_status ON combat_round(location_id, status)");
            s.execute("CREATE INDEX IF NOT EXISTS idx_round_event ON combat_round(event_id)");
            logger.debug("[CombatRoundDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create combat_round table", e);
        }
    }

    /**
     * Next round number in a numbering scope (see {@link CombatRound#scopeKey}).
     */
    public int nextRoundNumber(Connection c, String scopeKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COALESCE(MAX(round_number), 0) + 1 FROM combat_round WHERE scope_key = ?")) {
            ps.setString(1, scopeKey);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    /**
     * Insert an active round. A unique violation means another request took the number.
     */
    public CombatRound insert(Connection c, int roundNumber, int locationId, Integer sessionId, Integer eventId,
                              int createdBy) throws SQLException {
        String sql = "INSERT INTO combat_round (round_number, location_id, session_id, event_id, scope_key, status, "
                + "created_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        Instant now = Instant.now();
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setInt(1, roundNumber);
            ps.setInt(2, locationId);
            setNullableInt(ps, 3, sessionId);
            setNullableInt(ps, 4, eventId);
            ps.setString(5, CombatRound.scopeKey(locationId, eventId));
            ps.setString(6, RoundStatus.ACTIVE.getKey());
            ps.setInt(7, createdBy);
            ps.setTimestamp(8, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No id generated for combat round");
                return new CombatRound(keys.getLong(1), roundNumber, locationId, sessionId, eventId,
                        RoundStatus.ACTIVE, createdBy, null, null, now, null, null);
            }
        }
    }

    public Optional<CombatRound> findById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM combat_round WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public Optional<CombatRound> findById(long id) {
        return db.withConnection("load combat round " + id, c -> findById(c, id));
    }

    /**
     * Take the row lock on a round and return its current status. Empty if the round does not exist.
     */
    public Optional<RoundStatus> lockStatus(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM combat_round WHERE id = ? FOR UPDATE")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(RoundStatus.fromKey(rs.getString(1))) : Optional.empty();
            }
        }
    }

    /**
     * Move a round from one status to another if it is still in {@code from}.
     * Null resolver / timestamp / payload leave the stored values untouched.
     *
     * @return rows updated, 0 when the round was not in the expected status
     */
    public int compareAndSetStatus(Connection c, long id, RoundStatus from, RoundStatus to, Integer resolvedBy,
                                   Instant resolvedAt, String resolutionJson) throws SQLException {
        String sql = "UPDATE combat_round SET status = ?, "
                + "resolved_by = COALESCE(?, resolved_by), "
                + "resolved_at = COALESCE(?, resolved_at), "
                + "resolution_data = COALESCE(?, resolution_data) "
                + "WHERE id = ? AND status = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, to.getKey());
            setNullableInt(ps, 2, resolvedBy);
            if (resolvedAt != null) {
                ps.setTimestamp(3, Timestamp.from(resolvedAt));
            } else {
                ps.setNull(3, Types.TIMESTAMP);
            }
            if (resolutionJson != null) {
                ps.setString(4, resolutionJson);
            } else {
                ps.setNull(4, Types.CLOB);
            }
            ps.setLong(5, id);
            ps.setString(6, from.getKey());
            return ps.executeUpdate();
        }
    }

    /**
     * Latest active round at a location, optionally restricted to one event.
     */
    public Optional<CombatRound> findActive(int locationId, Integer eventId) {
        String sql = "SELECT " + COLUMNS + " FROM combat_round WHERE location_id = ? AND status = ?"
                + (eventId != null ? " AND event_id = ?" : "")
                + " ORDER BY created_at DESC, id DESC LIMIT 1";
        return db.withConnection("load active round", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, locationId);
                ps.setString(2, RoundStatus.ACTIVE.getKey());
                if (eventId != null) ps.setInt(3, eventId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    /**
     * Resolved rounds at a location, newest resolution first.
     */
    public List<CombatRound> findResolved(int locationId, Integer eventId, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM combat_round WHERE location_id = ? AND status = ?"
                + (eventId != null ? " AND event_id = ?" : "")
                + " ORDER BY resolved_at DESC, id DESC LIMIT ?";
        return db.withConnection("load resolved rounds", c -> {
            List<CombatRound> rounds = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                ps.setInt(i++, locationId);
                ps.setString(i++, RoundStatus.RESOLVED.getKey());
                if (eventId != null) ps.setInt(i++, eventId);
                ps.setInt(i, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rounds.add(map(rs));
                    }
                }
            }
            return rounds;
        });
    }

    /**
     * Round counts per status for one event.
     */
    public Map<RoundStatus, Integer> countByStatusForEvent(Connection c, int eventId) throws SQLException {
        Map<RoundStatus, Integer> counts = new EnumMap<>(RoundStatus.class);
        for (RoundStatus s : RoundStatus.values()) {
            counts.put(s, 0);
        }
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT status, COUNT(*) FROM combat_round WHERE event_id = ? GROUP BY status")) {
            ps.setInt(1, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    RoundStatus status = RoundStatus.fromKey(rs.getString(1));
                    if (status != null) counts.put(status, rs.getInt(2));
                }
            }
        }
        return counts;
    }

    private static CombatRound map(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        Timestamp resolved = rs.getTimestamp("resolved_at");
        return new CombatRound(
                rs.getLong("id"),
                rs.getInt("round_number"),
                rs.getInt("location_id"),
                nullableInt(rs, "session_id"),
                nullableInt(rs, "event_id"),
                RoundStatus.fromKey(rs.getString("status")),
                rs.getInt("created_by"),
                nullableInt(rs, "resolved_by"),
                JsonColumns.read(rs.getString("resolution_data"), RoundResolution.class),
                created != null ? created.toInstant() : null,
                resolved != null ? resolved.toInstant() : null,
                null);
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }
}
