package com.example.skirmish.util;

import java.util.Arrays;

/**
 * Step table mapping a cumulative usage count to a rank tier and multiplier.
 *
 * A table with N thresholds has N+1 tiers. A use count below thresholds[0]
 * is rank 1; a count at or above the last threshold is the top rank.
 */
public final class RankTable {

    /** Skill tiers: 5 ranks at 20/35/60/100 uses. */
    public static final RankTable SKILL_DEFAULT = new RankTable(
            new int[] {20, 35, 60, 100},
            new double[] {1.0, 1.3, 1.7, 2.2, 2.8});

    /** Branch tiers: 10 ranks from 75 up to 1375 uses. */
    public static final RankTable BRANCH_DEFAULT = new RankTable(
            new int[] {75, 150, 250, 375, 525, 700, 900, 1125, 1375},
            new double[] {1.0, 1.05, 1.10, 1.15, 1.20, 1.25, 1.30, 1.35, 1.40, 1.50});

    private static final String[] ROMAN = {"I", "II", "III", "IV", "V", "VI", "VII", "VIII", "IX", "X"};

    private final int[] thresholds;
    private final double[] multipliers;

    public RankTable(int[] thresholds, double[] multipliers) {
        if (thresholds == null || multipliers == null) {
            throw new IllegalArgumentException("thresholds and multipliers are required");
        }
        if (multipliers.length != thresholds.length + 1) {
            throw new IllegalArgumentException("Expected " + (thresholds.length + 1)
                    + " multipliers for " + thresholds.length + " thresholds, got " + multipliers.length);
        }
        for (int i = 1; i < thresholds.length; i++) {
            if (thresholds[i] <= thresholds[i - 1]) {
                throw new IllegalArgumentException("Thresholds must be strictly increasing: " + Arrays.toString(thresholds));
            }
        }
        this.thresholds = thresholds.clone();
        this.multipliers = multipliers.clone();
    }

    /**
     * Rank tier for a use count, 1-based.
     */
    public int rankFor(int uses) {
        int rank = 1;
        for (int threshold : thresholds) {
            if (uses < threshold) break;
            rank++;
        }
        return rank;
    }

    public double multiplierFor(int uses) {
        return multipliers[rankFor(uses) - 1];
    }

    public int getTierCount() {
        return multipliers.length;
    }

    public int[] getThresholds() {
        return thresholds.clone();
    }

    public double[] getMultipliers() {
        return multipliers.clone();
    }

    /**
     * Display label for a rank ("Rank III"). Ranks past X fall back to digits.
     */
    public static String rankLabel(int rank) {
        if (rank >= 1 && rank <= ROMAN.length) {
            return "Rank " + ROMAN[rank - 1];
        }
        return "Rank " + rank;
    }

    @Override
    public String toString() {
        return "RankTable{thresholds=" + Arrays.toString(thresholds)
                + ", multipliers=" + Arrays.toString(multipliers) + "}";
    }
}
