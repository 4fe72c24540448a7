package com.example.skirmish.persistence;

import com.example.skirmish.combat.CombatStorageException;
import com.example.skirmish.model.GameCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Character store: lookups by id or by any of the three identifier forms, and stat writes.
 */
public class CharacterDAO {
    private static final Logger logger = LoggerFactory.getLogger(CharacterDAO.class);

    private static final String COLUMNS = "id, user_id, name, surname, stats, is_active";

    private final Database db;

    public CharacterDAO(Database db) {
        this.db = db;
        MigrationManager.ensureMigration(MigrationManager.keyFor("CharacterDAO", db), this::ensureTables);
    }

    private void ensureTables() {
        try (Connection c = db.getConnection();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS characters (
                    id INT AUTO_INCREMENT PRIMARY KEY,
                    user_id INT NOT NULL,
                    name VARCHAR(100) NOT NULL,
                    surname VARCHAR(100),
                    stats CLOB,
                    is_active BOOLEAN DEFAULT TRUE
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_characters_user ON characters(user_id)");
            logger.debug("[CharacterDAO] tables ensured on {}", db.getUrl());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create characters table", e);
        }
    }

    /**
     * Insert a new character and return it with its generated id.
     */
    public GameCharacter create(int userId, String name, String surname, Map<String, Integer> stats, boolean active) {
        String sql = "INSERT INTO characters (user_id, name, surname, stats, is_active) VALUES (?, ?, ?, ?, ?)";
        return db.withConnection("create character " + name, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setInt(1, userId);
                ps.setString(2, name);
                ps.setString(3, surname);
                ps.setString(4, JsonColumns.write(stats));
                ps.setBoolean(5, active);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id generated for character " + name);
                    return new GameCharacter(keys.getInt(1), userId, name, surname, stats, active);
                }
            }
        });
    }

    public Optional<GameCharacter> findById(int id) {
        return db.withConnection("load character " + id, c -> findById(c, id));
    }

    public Optional<GameCharacter> findById(Connection c, int id) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM characters WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Find an active character by character id, user id or name.
     * A numeric identifier matching a character id wins over a user id match;
     * names match case-insensitively.
     */
    public Optional<GameCharacter> findActiveByIdentifier(Connection c, String identifier) throws SQLException {
        if (identifier == null || identifier.isBlank()) return Optional.empty();
        String trimmed = identifier.trim();
        int numeric = parseIntOr(trimmed, -1);
        String sql = "SELECT " + COLUMNS + " FROM characters WHERE is_active = TRUE "
                + "AND (id = ? OR user_id = ? OR LOWER(name) = LOWER(?)) "
                + "ORDER BY CASE WHEN id = ? THEN 0 WHEN user_id = ? THEN 1 ELSE 2 END, id LIMIT 1";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, numeric);
            ps.setInt(2, numeric);
            ps.setString(3, trimmed);
            ps.setInt(4, numeric);
            ps.setInt(5, numeric);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public List<GameCharacter> listActive(Connection c) throws SQLException {
        List<GameCharacter> out = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM characters WHERE is_active = TRUE ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Persist the character's stats map.
     */
    public void saveStats(Connection c, GameCharacter character) throws SQLException {
        String sql = "UPDATE characters SET stats = ? WHERE id = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JsonColumns.write(character.getStats()));
            ps.setInt(2, character.getId());
            if (ps.executeUpdate() == 0) {
                throw new CombatStorageException("save stats for missing character " + character.getId(), null);
            }
        }
    }

    public void save(GameCharacter character) {
        db.withConnection("save character " + character.getId(), c -> {
            saveStats(c, character);
            return null;
        });
    }

    private static GameCharacter map(ResultSet rs) throws SQLException {
        return new GameCharacter(
                rs.getInt("id"),
                rs.getInt("user_id"),
                rs.getString("name"),
                rs.getString("surname"),
                JsonColumns.readIntMap(rs.getString("stats")),
                rs.getBoolean("is_active"));
    }

    private static int parseIntOr(String s, int fallback) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
