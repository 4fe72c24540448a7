package com.example.skirmish.persistence;

import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Skill and skill branch definitions. Skills are read-only to the combat core;
 * writes here come from {@link DataLoader} and admin tooling.
 */
public class SkillDAO {
    private static final Logger logger = LoggerFactory.getLogger(SkillDAO.class);

    private static final String SELECT_SKILL = "SELECT s.id, s.name, s.description, s.type_name, s.category, "
            + "s.branch_id, b.name AS branch_name, s.base_power, s.aether_cost, s.target, s.scaling_stats, "
            + "s.required_stats, s.is_passive FROM skills s LEFT JOIN skill_branch b ON b.id = s.branch_id ";

    private final Database db;

    public SkillDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("SkillDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS skill_branch (
                    id INT PRIMARY KEY,
                    name VARCHAR(100) NOT NULL UNIQUE
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS skills (
                    id INT PRIMARY KEY,
                    name VARCHAR(100) NOT NULL,
                    description VARCHAR(1024) DEFAULT '',
                    type_name VARCHAR(100) NOT NULL,
                    category VARCHAR(20) NOT NULL,
                    branch_id INT NOT NULL,
                    base_power DOUBLE DEFAULT 0,
                    aether_cost INT DEFAULT 0,
                    target VARCHAR(10) DEFAULT 'ANY',
                    scaling_stats VARCHAR(200) DEFAULT '',
                    required_stats CLOB,
                    is_passive BOOLEAN DEFAULT FALSE
                )
            """);
            logger.debug("[SkillDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create skill tables", e);
        }
    }

    public void saveBranch(int id, String name) {
        String sql = "MERGE INTO skill_branch (id, name) KEY (id) VALUES (?, ?)";
        db.withConnection("save skill branch " + name, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, id);
                ps.setString(2, name);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Insert or update a skill by id. The category stored is the skill's resolved category.
     */
    public void saveSkill(Skill skill) {
        String sql = "MERGE INTO skills (id, name, description, type_name, category, branch_id, base_power, "
                + "aether_cost, target, scaling_stats, required_stats, is_passive) "
                + "KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        db.withConnection("save skill " + skill.getName(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, skill.getId());
                ps.setString(2, skill.getName());
                ps.setString(3, skill.getDescription());
                ps.setString(4, skill.getTypeName());
                ps.setString(5, skill.getCategory().name());
                ps.setInt(6, skill.getBranchId());
                ps.setDouble(7, skill.getBasePower());
                ps.setInt(8, skill.getAetherCost());
                ps.setString(9, skill.getTarget().name());
                ps.setString(10, String.join(",", skill.getScalingStats()));
                ps.setString(11, JsonColumns.write(skill.getRequiredStats()));
                ps.setBoolean(12, skill.isPassive());
                return ps.executeUpdate();
            }
        });
    }

    public Optional<Skill> findById(int id) {
        return db.withConnection("load skill " + id, c -> findById(c, id));
    }

    public Optional<Skill> findById(Connection c, int id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_SKILL + "WHERE s.id = ?")) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public List<Skill> findAll() {
        return db.withConnection("load skills", c -> {
            List<Skill> skills = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(SELECT_SKILL + "ORDER BY s.id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    skills.add(map(rs));
                }
            }
            return skills;
        });
    }

    private static Skill map(ResultSet rs) throws SQLException {
        String scaling = rs.getString("scaling_stats");
        List<String> scalingStats = scaling == null || scaling.isBlank()
                ? new ArrayList<>()
                : Arrays.stream(scaling.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                        .collect(Collectors.toList());
        return new Skill(
                rs.getInt("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("type_name"),
                SkillCategory.fromString(rs.getString("category")),
                rs.getInt("branch_id"),
                rs.getString("branch_name"),
                rs.getDouble("base_power"),
                rs.getInt("aether_cost"),
                SkillTarget.fromString(rs.getString("target")),
                scalingStats,
                JsonColumns.readIntMap(rs.getString("required_stats")),
                rs.getBoolean("is_passive"));
    }
}
