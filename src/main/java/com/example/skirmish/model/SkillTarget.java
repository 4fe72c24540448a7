package com.example.skirmish.model;

/**
 * How a skill picks its target.
 */
public enum SkillTarget {
    /** Always the caster. */
    SELF,
    /** Another active character; the caster is not allowed. */
    OTHER,
    /** Any character, the caster when nothing is named. */
    ANY,
    /** No target (area or ambient effects). */
    NONE;

    /**
     * Parse a target mode name, case-insensitive. Returns null if unrecognized.
     */
    public static SkillTarget fromString(String s) {
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
