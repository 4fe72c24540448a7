package com.example.skirmish.model;

/**
 * Quality band of the d20 outcome roll and its output multiplier.
 */
public enum RollQuality {
    POOR("Poor", 0.6),
    STANDARD("Standard", 1.0),
    CRITICAL("Critical", 1.4);

    private final String label;
    private final double multiplier;

    RollQuality(String label, double multiplier) {
        this.label = label;
        this.multiplier = multiplier;
    }

    public String getLabel() { return label; }
    public double getMultiplier() { return multiplier; }

    /**
     * Parse a label ("Poor", "Standard", "Critical"), case-insensitive.
     * Returns null if the label is not one of the three.
     */
    public static RollQuality fromLabel(String label) {
        if (label == null) return null;
        for (RollQuality q : values()) {
            if (q.label.equalsIgnoreCase(label.trim())) return q;
        }
        return null;
    }
}
