package com.example.skirmish.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A player character as the combat core sees it: identity plus a named stats map.
 *
 * The stats map always carries {@code aether}; everything else is a primary stat
 * keyed by its internal name (for example {@code STR}, {@code MN}).
 */
public class GameCharacter {
    public static final String AETHER = "aether";

    private final int id;
    private final int userId;
    private final String name;
    private final String surname;
    private final Map<String, Integer> stats;
    private final boolean active;

    public GameCharacter(int id, int userId, String name, String surname,
                         Map<String, Integer> stats, boolean active) {
        this.id = id;
        this.userId = userId;
        this.name = name;
        this.surname = surname;
        this.stats = stats != null ? new LinkedHashMap<>(stats) : new LinkedHashMap<>();
        this.active = active;
    }

    public int getId() { return id; }
    public int getUserId() { return userId; }
    public String getName() { return name; }
    public String getSurname() { return surname; }
    public boolean isActive() { return active; }

    /** Name and surname, or just the name when there is no surname. */
    public String getFullName() {
        if (surname == null || surname.isBlank()) return name;
        return name + " " + surname;
    }

    public Map<String, Integer> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    /** Value of a stat, 0 when the character does not have it. */
    public int getStat(String statName) {
        Integer v = stats.get(statName);
        return v != null ? v : 0;
    }

    public int getAether() {
        return getStat(AETHER);
    }

    /**
     * Copy of this character with one stat replaced.
     */
    public GameCharacter withStat(String statName, int value) {
        Map<String, Integer> copy = new LinkedHashMap<>(stats);
        copy.put(statName, value);
        return new GameCharacter(id, userId, name, surname, copy, active);
    }

    /** Listing form used when telling a player which targets exist. */
    public String describeForTargeting() {
        return getFullName() + " (CharID: " + id + ", UserID: " + userId + ")";
    }

    @Override
    public String toString() {
        return "GameCharacter{id=" + id + ", name='" + getFullName() + "'}";
    }
}
