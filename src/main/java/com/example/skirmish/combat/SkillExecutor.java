package com.example.skirmish.combat;

import com.example.skirmish.combat.CombatException.ErrorKind;
import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.RollQuality;
import com.example.skirmish.model.Skill;
import com.example.skirmish.persistence.CharacterDAO;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.SkillDAO;
import com.example.skirmish.persistence.SkillUsageDAO;
import com.example.skirmish.persistence.StatDefinitionDAO;
import com.example.skirmish.util.CombatSettings;
import com.example.skirmish.util.ProficiencyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.function.IntSupplier;

/**
 * Uses a skill outside of any combat round: the target is resolved, the cost paid,
 * the outcome rolled and the use recorded in one transaction.
 */
public class SkillExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SkillExecutor.class);

    public static class ExecutionResult {
        private final Skill skill;
        private final GameCharacter target;
        private final SkillOutcome.Fresh outcome;
        private final int aetherRemaining;
        private final ProficiencyTracker.Result proficiency;

        public ExecutionResult(Skill skill, GameCharacter target, SkillOutcome.Fresh outcome, int aetherRemaining,
                               ProficiencyTracker.Result proficiency) {
            this.skill = skill;
            this.target = target;
            this.outcome = outcome;
            this.aetherRemaining = aetherRemaining;
            this.proficiency = proficiency;
        }

        public Skill getSkill() { return skill; }

        /** Null for skills that take no target. */
        public GameCharacter getTarget() { return target; }
        public int getFinalOutput() { return outcome.getFinalOutput(); }
        public RollQuality getQuality() { return outcome.getQuality(); }
        public double getOutcomeMultiplier() { return outcome.getOutcomeMultiplier(); }
        public double getImpact() { return outcome.getImpact(); }
        public int getRoll() { return outcome.getRoll(); }
        public int getAetherRemaining() { return aetherRemaining; }
        public ProficiencyTracker.Result getProficiency() { return proficiency; }
    }

    private final Database db;
    private final CombatSettings settings;
    private final CharacterDAO characterDAO;
    private final SkillDAO skillDAO;
    private final StatDefinitionDAO statDAO;
    private final SkillUsageDAO usageDAO;
    private final ProficiencyTracker tracker;
    private final TargetResolver targetResolver;
    private final IntSupplier d20;

    public SkillExecutor(Database db) {
        this(db, CombatSettings.getInstance(), null);
    }

    /**
     * @param d20 die for outcome rolls; null for a random d20
     */
    public SkillExecutor(Database db, CombatSettings settings, IntSupplier d20) {
        this.db = db;
        this.settings = settings;
        this.characterDAO = new CharacterDAO(db);
        this.skillDAO = new SkillDAO(db);
        this.statDAO = new StatDefinitionDAO(db);
        this.usageDAO = new SkillUsageDAO(db);
        this.tracker = new ProficiencyTracker(db, usageDAO, settings);
        this.targetResolver = new TargetResolver(characterDAO);
        this.d20 = d20;
    }

    /**
     * @throws TargetNotFoundException if the target cannot be resolved
     * @throws InsufficientResourceException if the caster cannot pay for the skill
     */
    public ExecutionResult execute(int casterId, int skillId, String targetIdentifier) {
        ExecutionResult result = db.inTransaction("execute skill " + skillId, c -> {
            GameCharacter caster = characterDAO.findById(c, casterId)
                    .filter(GameCharacter::isActive)
                    .orElseThrow(() -> new CombatException(ErrorKind.NOT_FOUND,
                            "Character " + casterId + " not found or inactive", null, casterId));
            Skill skill = skillDAO.findById(c, skillId)
                    .orElseThrow(() -> new CombatException(ErrorKind.NOT_FOUND,
                            "Skill " + skillId + " not found", null, casterId));
            GameCharacter target = targetResolver.resolve(c, caster, skill, targetIdentifier);

            OutcomeCalculator calculator = new OutcomeCalculator(caster, skill, statDAO.getPrimaryStatNames(c),
                    settings, d20);
            OutcomeCalculator.CostReceipt receipt = calculator.applyCost();
            SkillOutcome.Fresh outcome = calculator.computeFinalOutput((ch, sk, br) -> {
                try {
                    return usageDAO.getUsageCounts(c, ch, sk, br);
                } catch (SQLException e) {
                    throw new CombatStorageException("read skill usage for character " + ch, e);
                }
            });
            characterDAO.saveStats(c, caster.withStat(GameCharacter.AETHER, receipt.getAetherAfter()));
            ProficiencyTracker.Result proficiency = tracker.recordUse(c, casterId, skill);
            return new ExecutionResult(skill, target, outcome, receipt.getAetherAfter(), proficiency);
        });

        logger.info("[SkillExecutor] character {} used {} on {}: output {} ({}), aether left {}",
                casterId, result.getSkill().getName(),
                result.getTarget() != null ? result.getTarget().getName() : "nobody",
                result.getFinalOutput(), result.getQuality().getLabel(), result.getAetherRemaining());
        return result;
    }
}
