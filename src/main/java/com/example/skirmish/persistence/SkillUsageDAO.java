package com.example.skirmish.persistence;

import com.example.skirmish.model.CharacterSkill;
import com.example.skirmish.model.CharacterSkillBranch;
import com.example.skirmish.util.RankTable;
import com.example.skirmish.util.UsageCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Per-character usage counters for skills and skill branches.
 *
 * Increments are single UPDATE statements so concurrent uses never lose a count;
 * the first use inserts the row, and a racing insert falls back to the update.
 */
public class SkillUsageDAO {
    private static final Logger logger = LoggerFactory.getLogger(SkillUsageDAO.class);

    private final Database db;

    public SkillUsageDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("SkillUsageDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS character_skill (
                    character_id INT NOT NULL,
                    skill_id INT NOT NULL,
                    uses INT NOT NULL DEFAULT 0,
                    rank_level INT NOT NULL DEFAULT 1,
                    unlocked_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    PRIMARY KEY (character_id, skill_id)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS character_skill_branch (
                    id INT AUTO_INCREMENT PRIMARY KEY,
                    character_id INT NOT NULL,
                    branch_id INT NOT NULL,
                    uses INT NOT NULL DEFAULT 0,
                    rank_level INT NOT NULL DEFAULT 1,
                    CONSTRAINT uq_character_branch UNIQUE (character_id, branch_id)
                )
            """);
            logger.debug("[SkillUsageDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create usage tables", e);
        }
    }

    /**
     * Skill and branch use counts in one query; 0 for records that do not exist yet.
     */
    public UsageCounts getUsageCounts(Connection c, int characterId, int skillId, int branchId) throws SQLException {
        String sql = "SELECT "
                + "(SELECT uses FROM character_skill WHERE character_id = ? AND skill_id = ?) AS skill_uses, "
                + "(SELECT uses FROM character_skill_branch WHERE character_id = ? AND branch_id = ?) AS branch_uses";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, characterId);
            ps.setInt(2, skillId);
            ps.setInt(3, characterId);
            ps.setInt(4, branchId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return UsageCounts.NONE;
                return new UsageCounts(rs.getInt("skill_uses"), rs.getInt("branch_uses"));
            }
        }
    }

    public UsageCounts getUsageCounts(int characterId, int skillId, int branchId) {
        return db.withConnection("read usage for character " + characterId,
                c -> getUsageCounts(c, characterId, skillId, branchId));
    }

    /**
     * Add one use to the skill record, creating it on first use, and store the recomputed rank.
     */
    public CharacterSkill incrementSkill(Connection c, int characterId, int skillId, RankTable ranks) throws SQLException {
        String update = "UPDATE character_skill SET uses = uses + 1 WHERE character_id = ? AND skill_id = ?";
        String insert = "INSERT INTO character_skill (character_id, skill_id, uses, rank_level) VALUES (?, ?, 1, 1)";
        incrementOrInsert(c, update, insert, characterId, skillId);

        int uses = readUses(c, "SELECT uses FROM character_skill WHERE character_id = ? AND skill_id = ?",
                characterId, skillId);
        int rank = ranks.rankFor(uses);
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE character_skill SET rank_level = ? WHERE character_id = ? AND skill_id = ?")) {
            ps.setInt(1, rank);
            ps.setInt(2, characterId);
            ps.setInt(3, skillId);
            ps.executeUpdate();
        }
        return new CharacterSkill(characterId, skillId, uses, rank);
    }

    /**
     * Add one use to the branch record, creating it on first use, and store the recomputed rank.
     */
    public CharacterSkillBranch incrementBranch(Connection c, int characterId, int branchId, RankTable ranks) throws SQLException {
        String update = "UPDATE character_skill_branch SET uses = uses + 1 WHERE character_id = ? AND branch_id = ?";
        String insert = "INSERT INTO character_skill_branch (character_id, branch_id, uses, rank_level) VALUES (?, ?, 1, 1)";
        incrementOrInsert(c, update, insert, characterId, branchId);

        int uses = readUses(c, "SELECT uses FROM character_skill_branch WHERE character_id = ? AND branch_id = ?",
                characterId, branchId);
        int rank = ranks.rankFor(uses);
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE character_skill_branch SET rank_level = ? WHERE character_id = ? AND branch_id = ?")) {
            ps.setInt(1, rank);
            ps.setInt(2, characterId);
            ps.setInt(3, branchId);
            ps.executeUpdate();
        }
        return new CharacterSkillBranch(characterId, branchId, uses, rank);
    }

    public Optional<CharacterSkill> findSkill(int characterId, int skillId) {
        return db.withConnection("read skill usage", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT uses, rank_level FROM character_skill WHERE character_id = ? AND skill_id = ?")) {
                ps.setInt(1, characterId);
                ps.setInt(2, skillId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(new CharacterSkill(characterId, skillId, rs.getInt("uses"), rs.getInt("rank_level")));
                }
            }
        });
    }

    public Optional<CharacterSkillBranch> findBranch(int characterId, int branchId) {
        return db.withConnection("read branch usage", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT uses, rank_level FROM character_skill_branch WHERE character_id = ? AND branch_id = ?")) {
                ps.setInt(1, characterId);
                ps.setInt(2, branchId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(new CharacterSkillBranch(characterId, branchId, rs.getInt("uses"), rs.getInt("rank_level")));
                }
            }
        });
    }

    private static void incrementOrInsert(Connection c, String update, String insert, int characterId, int key)
            throws SQLException {
        if (executeForKey(c, update, characterId, key) > 0) return;
        try {
            executeForKey(c, insert, characterId, key);
        } catch (SQLException e) {
            if (!Database.isUniqueViolation(e)) throw e;
            // Lost the first-use race: the row exists now
            logger.debug("[SkillUsageDAO] concurrent first use for character {} key {}", characterId, key);
            executeForKey(c, update, characterId, key);
        }
    }

    private static int executeForKey(Connection c, String sql, int characterId, int key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, characterId);
            ps.setInt(2, key);
            return ps.executeUpdate();
        }
    }

    private static int readUses(Connection c, String sql, int characterId, int key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, characterId);
            ps.setInt(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }
}
