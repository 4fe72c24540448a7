package com.example.skirmish.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Narrative log of what the engine did, read by game masters and the chat layer.
 */
public class EngineLogDAO {
    private static final Logger logger = LoggerFactory.getLogger(EngineLogDAO.class);

    /**
     * One engine log row.
     */
    public static class Entry {
        private final long id;
        private final Integer sessionId;
        private final int locationId;
        private final String type;
        private final String actor;
        private final String target;
        private final String skill;
        private final Integer damage;
        private final List<String> effects;
        private final String details;
        private final String engineData;
        private final Instant createdAt;

        public Entry(long id, Integer sessionId, int locationId, String type, String actor, String target,
                     String skill, Integer damage, List<String> effects, String details, String engineData,
                     Instant createdAt) {
            this.id = id;
            this.sessionId = sessionId;
            this.locationId = locationId;
            this.type = type;
            this.actor = actor;
            this.target = target;
            this.skill = skill;
            this.damage = damage;
            this.effects = effects != null ? effects : new ArrayList<>();
            this.details = details;
            this.engineData = engineData;
            this.createdAt = createdAt;
        }

        public long getId() { return id; }
        public Integer getSessionId() { return sessionId; }
        public int getLocationId() { return locationId; }
        public String getType() { return type; }
        public String getActor() { return actor; }
        public String getTarget() { return target; }
        public String getSkill() { return skill; }
        public Integer getDamage() { return damage; }
        public List<String> getEffects() { return effects; }
        public String getDetails() { return details; }
        public String getEngineData() { return engineData; }
        public Instant getCreatedAt() { return createdAt; }
    }

    private final Database db;

    public EngineLogDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("EngineLogDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS engine_log (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    session_id INT,
                    location_id INT NOT NULL,
                    log_type VARCHAR(20) NOT NULL,
                    actor VARCHAR(100) NOT NULL,
                    target VARCHAR(100),
                    skill VARCHAR(100),
                    damage INT,
                    effects CLOB,
                    details CLOB NOT NULL,
                    engine_data CLOB,
                    created_at TIMESTAMP NOT NULL
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_engine_log_location ON engine_log(location_id, created_at)");
            logger.debug("[EngineLogDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create engine_log table", e);
        }
    }

    public long insert(Integer sessionId, int locationId, String type, String actor, String target, String skill,
                       Integer damage, List<String> effects, String details, Object engineData) {
        String sql = "INSERT INTO engine_log (session_id, location_id, log_type, actor, target, skill, damage, "
                + "effects, details, engine_data, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        return db.withConnection("write engine log", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                CombatRoundDAO.setNullableInt(ps, 1, sessionId);
                ps.setInt(2, locationId);
                ps.setString(3, type);
                ps.setString(4, actor);
                ps.setString(5, target);
                ps.setString(6, skill);
                CombatRoundDAO.setNullableInt(ps, 7, damage);
                ps.setString(8, JsonColumns.write(effects));
                ps.setString(9, details);
                ps.setString(10, JsonColumns.write(engineData));
                ps.setTimestamp(11, Timestamp.from(Instant.now()));
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id generated for engine log");
                    return keys.getLong(1);
                }
            }
        });
    }

    /**
     * Entries for a location, oldest first.
     */
    public List<Entry> findByLocation(int locationId) {
        String sql = "SELECT id, session_id, location_id, log_type, actor, target, skill, damage, effects, details, "
                + "engine_data, created_at FROM engine_log WHERE location_id = ? ORDER BY created_at, id";
        return db.withConnection("read engine log", c -> {
            List<Entry> entries = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, locationId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new Entry(
                                rs.getLong("id"),
                                CombatRoundDAO.nullableInt(rs, "session_id"),
                                rs.getInt("location_id"),
                                rs.getString("log_type"),
                                rs.getString("actor"),
                                rs.getString("target"),
                                rs.getString("skill"),
                                CombatRoundDAO.nullableInt(rs, "damage"),
                                JsonColumns.readStringList(rs.getString("effects")),
                                rs.getString("details"),
                                rs.getString("engine_data"),
                                rs.getTimestamp("created_at").toInstant()));
                    }
                }
            }
            return entries;
        });
    }
}
