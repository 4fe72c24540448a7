package com.example.skirmish.combat;

/**
 * Lifecycle state of a combat round.
 */
public enum RoundStatus {

    /** Accepting actions */
    ACTIVE("active", "Active"),

    /** A resolver holds the round; actions are being paired and scored */
    RESOLVING("resolving", "Resolving"),

    /** Outcome committed (terminal) */
    RESOLVED("resolved", "Resolved"),

    /** Abandoned before resolution (terminal) */
    CANCELLED("cancelled", "Cancelled");

    private final String key;
    private final String displayName;

    RoundStatus(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /** Value stored in the status column. */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static RoundStatus fromKey(String key) {
        if (key == null) return null;
        for (RoundStatus s : values()) {
            if (s.key.equalsIgnoreCase(key.trim())) return s;
        }
        return null;
    }
}
