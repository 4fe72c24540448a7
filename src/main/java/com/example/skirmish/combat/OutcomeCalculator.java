package com.example.skirmish.combat;

import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.RollQuality;
import com.example.skirmish.model.Skill;
import com.example.skirmish.util.CombatSettings;
import com.example.skirmish.util.UsageCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Computes what one character's use of one skill is worth.
 *
 * Impact: basePower plus the character's scaling stats, sorted highest first and
 * weighted by position ([1.0], [0.7, 0.3] or [0.6, 0.25, 0.15]); each weighted term is floored.
 *
 * Final output: floor(impact * (skillRankMultiplier + branchRankMultiplier) * outcomeMultiplier)
 *
 * An instance belongs to a single action. Its d20 roll is drawn once and reused, so the
 * output and the narration of that action always agree.
 */
public class OutcomeCalculator {
    private static final Logger logger = LoggerFactory.getLogger(OutcomeCalculator.class);

    private static final int IMPACT_CACHE_PRUNE_SIZE = 1024;

    /** Base impact by character/skill/stats, shared across calculators. */
    private static final Map<String, CachedImpact> impactCache = new ConcurrentHashMap<>();

    /**
     * Supplies a character's skill and branch use counts in one read.
     */
    @FunctionalInterface
    public interface UsageSource {
        UsageCounts fetch(int characterId, int skillId, int branchId);
    }

    /**
     * Aether before and after paying a skill's cost. The character itself is not changed.
     */
    public static class CostReceipt {
        private final int aetherBefore;
        private final int aetherAfter;

        public CostReceipt(int aetherBefore, int aetherAfter) {
            this.aetherBefore = aetherBefore;
            this.aetherAfter = aetherAfter;
        }

        public int getAetherBefore() { return aetherBefore; }
        public int getAetherAfter() { return aetherAfter; }
        public int getSpent() { return aetherBefore - aetherAfter; }
    }

    private static class CachedImpact {
        final double impact;
        final long expiresAtNanos;

        CachedImpact(double impact, long expiresAtNanos) {
            this.impact = impact;
            this.expiresAtNanos = expiresAtNanos;
        }
    }

    private final GameCharacter character;
    private final Skill skill;
    private final Set<String> primaryStats;
    private final CombatSettings settings;
    private final IntSupplier d20;

    private int cachedRoll;

    public OutcomeCalculator(GameCharacter character, Skill skill, Set<String> primaryStats) {
        this(character, skill, primaryStats, CombatSettings.getInstance(), null);
    }

    /**
     * @param d20 source of d20 rolls (1-20); null uses {@link ThreadLocalRandom}
     */
    public OutcomeCalculator(GameCharacter character, Skill skill, Set<String> primaryStats,
                             CombatSettings settings, IntSupplier d20) {
        if (character == null || skill == null) {
            throw new IllegalArgumentException("character and skill are required");
        }
        this.character = character;
        this.skill = skill;
        this.primaryStats = primaryStats != null ? primaryStats : Set.of();
        this.settings = settings != null ? settings : CombatSettings.getInstance();
        this.d20 = d20 != null ? d20 : () -> ThreadLocalRandom.current().nextInt(1, 21);
    }

    /**
     * Base impact of the skill for this character, before rank and outcome multipliers.
     * Scaling stats that are not active primary stats are ignored; a stat the
     * character lacks counts as 0.
     */
    public double calculateImpact() {
        String key = impactKey();
        long now = System.nanoTime();
        CachedImpact cached = impactCache.get(key);
        if (cached != null && cached.expiresAtNanos > now) {
            logger.debug("[OutcomeCalculator] impact cache hit {}", key);
            return cached.impact;
        }

        double impact = computeImpact();

        if (impactCache.size() >= IMPACT_CACHE_PRUNE_SIZE) {
            impactCache.values().removeIf(c -> c.expiresAtNanos <= now);
        }
        long ttl = TimeUnit.SECONDS.toNanos(settings.getImpactCacheTtlSeconds());
        impactCache.put(key, new CachedImpact(impact, now + ttl));
        return impact;
    }

    private double computeImpact() {
        double impact = skill.getBasePower();
        List<Integer> values = new ArrayList<>();
        for (String stat : skill.getScalingStats()) {
            if (primaryStats.contains(stat)) {
                values.add(character.getStat(stat));
            } else {
                logger.debug("[OutcomeCalculator] skill {} scales with unknown stat {}, ignored", skill.getId(), stat);
            }
        }
        if (values.isEmpty()) return impact;

        values.sort(Comparator.reverseOrder());
        double[] weights = settings.getScalingWeights(values.size());
        for (int i = 0; i < values.size(); i++) {
            impact += Math.floor(values.get(i) * weights[i]);
        }
        return impact;
    }

    // Everything computeImpact reads: the stats that count and the weights applied to them
    private String impactKey() {
        List<String> counted = new ArrayList<>();
        for (String stat : skill.getScalingStats()) {
            if (primaryStats.contains(stat)) counted.add(stat);
        }
        String weights = counted.isEmpty() ? "[]" : Arrays.toString(settings.getScalingWeights(counted.size()));
        // TreeMap gives the stats a stable order
        return character.getId() + "-" + skill.getId() + "-" + skill.getBasePower() + "-"
                + counted + "-" + weights + "-" + new TreeMap<>(character.getStats());
    }

    /**
     * The d20 roll for this action, drawn on first call.
     */
    public int rollD20() {
        if (cachedRoll == 0) {
            int roll = d20.getAsInt();
            if (roll < 1 || roll > 20) {
                throw new IllegalStateException("d20 produced " + roll);
            }
            cachedRoll = roll;
        }
        return cachedRoll;
    }

    /**
     * Outcome band of this action's roll. Repeated calls return the same band.
     */
    public RollQuality rollOutcome() {
        return qualityForRoll(rollD20(), settings);
    }

    public static RollQuality qualityForRoll(int roll, CombatSettings settings) {
        if (roll <= settings.getPoorMaxRoll()) return RollQuality.POOR;
        if (roll <= settings.getStandardMaxRoll()) return RollQuality.STANDARD;
        return RollQuality.CRITICAL;
    }

    public double skillRankMultiplier(int uses) {
        return settings.getSkillRanks().multiplierFor(uses);
    }

    public double branchRankMultiplier(int branchUses) {
        return settings.getBranchRanks().multiplierFor(branchUses);
    }

    /**
     * Final output for this action. Usage counts are read once through {@code usage}.
     */
    public SkillOutcome.Fresh computeFinalOutput(UsageSource usage) {
        UsageCounts counts = usage.fetch(character.getId(), skill.getId(), skill.getBranchId());
        if (counts == null) counts = UsageCounts.NONE;

        double impact = calculateImpact();
        double skillMult = skillRankMultiplier(counts.getSkillUses());
        double branchMult = branchRankMultiplier(counts.getBranchUses());
        RollQuality quality = rollOutcome();
        int output = (int) Math.floor(impact * (skillMult + branchMult) * quality.getMultiplier());

        logger.debug("[OutcomeCalculator] {} uses {}: impact={} skillMult={} branchMult={} roll={} ({}) -> {}",
                character.getName(), skill.getName(), impact, skillMult, branchMult, rollD20(),
                quality.getLabel(), output);
        return new SkillOutcome.Fresh(output, quality, rollD20(), impact, skillMult, branchMult);
    }

    /**
     * Check the character can pay for the skill and work out the aether left afterwards.
     *
     * @throws InsufficientResourceException if aether is short or a required stat is below its minimum
     */
    public CostReceipt applyCost() {
        int aether = character.getAether();
        if (aether < skill.getAetherCost()) {
            throw new InsufficientResourceException(character.getId(), skill.getName(), GameCharacter.AETHER,
                    skill.getAetherCost(), aether);
        }
        for (Map.Entry<String, Integer> req : skill.getRequiredStats().entrySet()) {
            int have = character.getStat(req.getKey());
            if (have < req.getValue()) {
                throw new InsufficientResourceException(character.getId(), skill.getName(), req.getKey(),
                        req.getValue(), have);
            }
        }
        return new CostReceipt(aether, aether - skill.getAetherCost());
    }

    /** Drop all cached impacts (tests and data reloads). */
    public static void clearImpactCache() {
        impactCache.clear();
    }
}
