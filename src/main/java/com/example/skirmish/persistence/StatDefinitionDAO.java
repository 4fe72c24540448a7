package com.example.skirmish.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stat definitions. The active {@code primary_stat} names are the only stats skills may scale with.
 */
public class StatDefinitionDAO {
    private static final Logger logger = LoggerFactory.getLogger(StatDefinitionDAO.class);

    public static final String PRIMARY_STAT = "primary_stat";

    private final Database db;

    public StatDefinitionDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("StatDefinitionDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS stat_definition (
                    id INT AUTO_INCREMENT PRIMARY KEY,
                    internal_name VARCHAR(50) NOT NULL UNIQUE,
                    display_name VARCHAR(100),
                    category VARCHAR(30) NOT NULL DEFAULT 'primary_stat',
                    is_active BOOLEAN DEFAULT TRUE
                )
            """);
            logger.debug("[StatDefinitionDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create stat_definition table", e);
        }
    }

    /**
     * Insert or update a definition by internal name.
     */
    public void save(String internalName, String displayName, String category, boolean active) {
        String sql = "MERGE INTO stat_definition (internal_name, display_name, category, is_active) "
                + "KEY (internal_name) VALUES (?, ?, ?, ?)";
        db.withConnection("save stat definition " + internalName, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, internalName);
                ps.setString(2, displayName != null ? displayName : internalName);
                ps.setString(3, category != null ? category : PRIMARY_STAT);
                ps.setBoolean(4, active);
                return ps.executeUpdate();
            }
        });
    }

    public Set<String> getActiveStatNames(String category) {
        return db.withConnection("load stat definitions", c -> getActiveStatNames(c, category));
    }

    public Set<String> getActiveStatNames(Connection c, String category) throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        String sql = "SELECT internal_name FROM stat_definition WHERE category = ? AND is_active = TRUE ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, category);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        }
        return names;
    }

    public Set<String> getPrimaryStatNames() {
        return getActiveStatNames(PRIMARY_STAT);
    }

    public Set<String> getPrimaryStatNames(Connection c) throws SQLException {
        return getActiveStatNames(c, PRIMARY_STAT);
    }
}
