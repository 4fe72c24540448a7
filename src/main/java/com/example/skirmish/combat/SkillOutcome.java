package com.example.skirmish.combat;

import com.example.skirmish.model.RollQuality;

/**
 * The numeric result of one skill use, either rolled here or handed in by an upstream system.
 *
 * Both variants go through the same validation: output must be positive and the
 * quality must be one of the three known bands. Skill data therefore needs a basePower
 * of at least 1, which {@code DataLoader} checks when skills are seeded.
 */
public abstract class SkillOutcome {
    private final int finalOutput;
    private final RollQuality quality;

    protected SkillOutcome(int finalOutput, RollQuality quality) {
        if (quality == null) {
            throw new InvalidOutcomeException("Roll quality must be one of: Poor, Standard, Critical");
        }
        if (finalOutput <= 0) {
            throw new InvalidOutcomeException("Final output must be positive, got " + finalOutput);
        }
        this.finalOutput = finalOutput;
        this.quality = quality;
    }

    public int getFinalOutput() { return finalOutput; }
    public RollQuality getQuality() { return quality; }
    public double getOutcomeMultiplier() { return quality.getMultiplier(); }

    public abstract boolean isPreComputed();

    /**
     * Outcome rolled elsewhere (narrative/chat layer) and accepted as-is.
     */
    public static final class PreComputed extends SkillOutcome {

        public PreComputed(int finalOutput, RollQuality quality) {
            super(finalOutput, quality);
        }

        @Override
        public boolean isPreComputed() { return true; }
    }

    /**
     * Outcome computed by {@link OutcomeCalculator}, with the intermediate numbers kept for reports.
     */
    public static final class Fresh extends SkillOutcome {
        private final int roll;
        private final double impact;
        private final double skillRankMultiplier;
        private final double branchRankMultiplier;

        public Fresh(int finalOutput, RollQuality quality, int roll, double impact,
                     double skillRankMultiplier, double branchRankMultiplier) {
            super(finalOutput, quality);
            this.roll = roll;
            this.impact = impact;
            this.skillRankMultiplier = skillRankMultiplier;
            this.branchRankMultiplier = branchRankMultiplier;
        }

        public int getRoll() { return roll; }
        public double getImpact() { return impact; }
        public double getSkillRankMultiplier() { return skillRankMultiplier; }
        public double getBranchRankMultiplier() { return branchRankMultiplier; }

        @Override
        public boolean isPreComputed() { return false; }
    }

    /**
     * Build a pre-computed outcome from the label an upstream caller sent.
     *
     * @throws InvalidOutcomeException if the label is unknown or the output is not positive
     */
    public static PreComputed preComputed(int finalOutput, String qualityLabel) {
        RollQuality quality = RollQuality.fromLabel(qualityLabel);
        if (quality == null) {
            throw new InvalidOutcomeException("Unknown roll quality '" + qualityLabel
                    + "'. Must be one of: Poor, Standard, Critical");
        }
        return new PreComputed(finalOutput, quality);
    }
}
