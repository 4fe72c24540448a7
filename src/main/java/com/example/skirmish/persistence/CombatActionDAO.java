package com.example.skirmish.persistence;

import com.example.skirmish.combat.ActionSnapshot;
import com.example.skirmish.combat.CombatAction;
import com.example.skirmish.combat.DuplicateActionException;
import com.example.skirmish.combat.RoundResolution;
import com.example.skirmish.model.RollQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
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
 * Combat action rows. {@code (round_id, character_id)} is unique: a second action for
 * the same character in a round is rejected by the database, not just by the pre-check.
 */
public class CombatActionDAO {
    private static final Logger logger = LoggerFactory.getLogger(CombatActionDAO.class);

    private static final String COLUMNS = "id, round_id, character_id, skill_id, target_id, final_output, "
            + "outcome_multiplier, roll_quality, skill_data, character_data, target_data, submitted_at, "
            + "processed, clash_result";

    private final Database db;

    public CombatActionDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("CombatActionDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS combat_action (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    round_id BIGINT NOT NULL,
                    character_id INT NOT NULL,
                    skill_id INT NOT NULL,
                    target_id INT,
                    final_output INT NOT NULL,
                    outcome_multiplier DECIMAL(3,2) NOT NULL,
                    roll_quality VARCHAR(20) NOT NULL,
                    skill_data CLOB,
                    character_data CLOB,
                    target_data CLOB,
                    submitted_at TIMESTAMP NOT NULL,
                    processed BOOLEAN DEFAULT FALSE,
                    clash_result CLOB,
                    CONSTRAINT uq_action_round_character UNIQUE (round_id, character_id)
                )
            """);
            logger.debug("[CombatActionDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create combat_action table", e);
        }
    }

    public boolean existsFor(Connection c, long roundId, int characterId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM combat_action WHERE round_id = ? AND character_id = ?")) {
            ps.setLong(1, roundId);
            ps.setInt(2, characterId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Insert a submitted action.
     *
     * @throws DuplicateActionException if the character already has an action in the round
     */
    public CombatAction insert(Connection c, long roundId, int characterId, int skillId, Integer targetId,
                               int finalOutput, RollQuality quality, ActionSnapshot.SkillData skillData,
                               ActionSnapshot.CharacterData characterData, ActionSnapshot.TargetData targetData)
            throws SQLException {
        String sql = "INSERT INTO combat_action (round_id, character_id, skill_id, target_id, final_output, "
                + "outcome_multiplier, roll_quality, skill_data, character_data, target_data, submitted_at, processed) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE)";
        Instant now = Instant.now();
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, roundId);
            ps.setInt(2, characterId);
            ps.setInt(3, skillId);
            CombatRoundDAO.setNullableInt(ps, 4, targetId);
            ps.setInt(5, finalOutput);
            ps.setBigDecimal(6, BigDecimal.valueOf(quality.getMultiplier()).setScale(2, RoundingMode.HALF_UP));
            ps.setString(7, quality.getLabel());
            ps.setString(8, JsonColumns.write(skillData));
            ps.setString(9, JsonColumns.write(characterData));
            ps.setString(10, JsonColumns.write(targetData));
            ps.setTimestamp(11, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No id generated for combat action");
                return new CombatAction(keys.getLong(1), roundId, characterId, skillId, targetId, finalOutput,
                        quality.getMultiplier(), quality, skillData, characterData, targetData, now, false, null);
            }
        } catch (SQLException e) {
            if (Database.isUniqueViolation(e)) {
                throw new DuplicateActionException(roundId, characterId);
            }
            throw e;
        }
    }

    /**
     * All actions of a round in submission order (ties broken by id).
     */
    public List<CombatAction> findByRound(Connection c, long roundId) throws SQLException {
        List<CombatAction> actions = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM combat_action WHERE round_id = ? ORDER BY submitted_at, id")) {
            ps.setLong(1, roundId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    actions.add(map(rs));
                }
            }
        }
        return actions;
    }

    public List<CombatAction> findByRound(long roundId) {
        return db.withConnection("load actions for round " + roundId, c -> findByRound(c, roundId));
    }

    /**
     * Mark an action processed and store its clash result (null for independent actions).
     * Only an unprocessed action can be marked.
     */
    public void markProcessed(Connection c, long actionId, RoundResolution.Clash clashResult) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE combat_action SET processed = TRUE, clash_result = ? WHERE id = ? AND processed = FALSE")) {
            ps.setString(1, JsonColumns.write(clashResult));
            ps.setLong(2, actionId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Combat action " + actionId + " was already processed");
            }
        }
    }

    private static CombatAction map(ResultSet rs) throws SQLException {
        Timestamp submitted = rs.getTimestamp("submitted_at");
        return new CombatAction(
                rs.getLong("id"),
                rs.getLong("round_id"),
                rs.getInt("character_id"),
                rs.getInt("skill_id"),
                CombatRoundDAO.nullableInt(rs, "target_id"),
                rs.getInt("final_output"),
                rs.getBigDecimal("outcome_multiplier").doubleValue(),
                RollQuality.fromLabel(rs.getString("roll_quality")),
                JsonColumns.read(rs.getString("skill_data"), ActionSnapshot.SkillData.class),
                JsonColumns.read(rs.getString("character_data"), ActionSnapshot.CharacterData.class),
                JsonColumns.read(rs.getString("target_data"), ActionSnapshot.TargetData.class),
                submitted != null ? submitted.toInstant() : null,
                rs.getBoolean("processed"),
                JsonColumns.read(rs.getString("clash_result"), RoundResolution.Clash.class));
    }
}
