package com.example.skirmish.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * The eight interaction categories a skill type can fall into.
 *
 * Type names are free text authored by game masters ("Fire Attack", "Shield Wall").
 * They are classified once, when the skill is stored, by checking the keyword table
 * in declaration order; the first category with a matching keyword wins. Debuff is
 * checked ahead of Buff, since "buff" is part of "debuff".
 */
public enum SkillCategory {
    ATTACK("Attack", List.of("attack", "offensive", "damage")),
    DEFENCE("Defence", List.of("defence", "defensive", "block", "shield")),
    COUNTER("Counter", List.of("counter", "retaliate")),
    BUFF("Buff", List.of("buff", "enhance", "boost")),
    HEAL("Heal", List.of("heal", "restore", "recovery")),
    DEBUFF("Debuff", List.of("debuff", "curse", "weaken")),
    CRAFTING("Crafting", List.of("craft", "create", "build")),
    PASSIVE("Passive", List.of("passive"));

    private static final Logger logger = LoggerFactory.getLogger(SkillCategory.class);

    private static final SkillCategory[] MATCH_ORDER = {
            ATTACK, DEFENCE, COUNTER, DEBUFF, BUFF, HEAL, CRAFTING, PASSIVE
    };

    private final String displayName;
    private final List<String> keywords;

    SkillCategory(String displayName, List<String> keywords) {
        this.displayName = displayName;
        this.keywords = keywords;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /** Buff and Heal behave the same in every interaction. */
    public boolean isSupport() {
        return this == BUFF || this == HEAL;
    }

    /**
     * Keyword match only. Returns null when no keyword matches.
     */
    public static SkillCategory match(String typeName) {
        if (typeName == null) return null;
        String lower = typeName.toLowerCase(Locale.ROOT);
        for (SkillCategory category : MATCH_ORDER) {
            for (String keyword : category.keywords) {
                if (lower.contains(keyword)) return category;
            }
        }
        return null;
    }

    /**
     * Classify a type name, falling back to ATTACK when no keyword matches.
     * The fallback is logged so bad data shows up in the server log.
     *
     * @throws IllegalArgumentException if the type name is null or blank
     */
    public static SkillCategory classify(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Skill type name is required");
        }
        SkillCategory category = match(typeName);
        if (category == null) {
            logger.warn("[SkillCategory] No keyword matches skill type '{}', treating it as Attack", typeName);
            return ATTACK;
        }
        return category;
    }

    /**
     * Classify a type name, rejecting names that match no keyword.
     */
    public static SkillCategory classifyStrict(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Skill type name is required");
        }
        SkillCategory category = match(typeName);
        if (category == null) {
            throw new IllegalArgumentException("Skill type '" + typeName + "' does not map to an interaction category");
        }
        return category;
    }

    /**
     * Parse a stored category (enum name or display name). Returns null if unrecognized.
     */
    public static SkillCategory fromString(String s) {
        if (s == null) return null;
        String key = s.trim();
        for (SkillCategory category : values()) {
            if (category.name().equalsIgnoreCase(key) || category.displayName.equalsIgnoreCase(key)) {
                return category;
            }
        }
        return null;
    }
}
