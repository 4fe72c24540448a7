package com.example.skirmish.model;

/**
 * Kinds of role-play event a game master can open at a location.
 */
public enum EventType {
    LORE,
    DUEL,
    QUEST;

    /**
     * Parse an event type, case-insensitive. Returns null if unrecognized.
     */
    public static EventType fromString(String s) {
        if (s == null) return null;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String key() {
        return name().toLowerCase();
    }
}
