package com.example.skirmish.combat;

import com.example.skirmish.combat.CombatException.ErrorKind;
import com.example.skirmish.event.EventService;
import com.example.skirmish.event.SessionContextProvider;
import com.example.skirmish.event.SessionService;
import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.RoleplayEvent;
import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.persistence.CharacterDAO;
import com.example.skirmish.persistence.CombatActionDAO;
import com.example.skirmish.persistence.CombatRoundDAO;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.EngineLogDAO;
import com.example.skirmish.persistence.JsonColumns;
import com.example.skirmish.persistence.SkillDAO;
import com.example.skirmish.persistence.SkillUsageDAO;
import com.example.skirmish.persistence.StatDefinitionDAO;
import com.example.skirmish.util.CombatSettings;
import com.example.skirmish.util.ProficiencyTracker;
import com.example.skirmish.util.UsageCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * Runs combat rounds at a location: opening them, taking one action per character,
 * and resolving the submitted actions into clashes and independent actions.
 *
 * Every state change happens in a single transaction. Submission holds the round's
 * row lock; resolution claims the round by moving it from active to resolving, so a
 * second resolver (or a late submission) finds the round no longer active.
 */
public class CombatRoundManager {
    private static final Logger logger = LoggerFactory.getLogger(CombatRoundManager.class);

    /**
     * What a successful submission produced.
     */
    public static class Submission {
        private final CombatAction action;
        private final SkillOutcome outcome;
        private final ProficiencyTracker.Result proficiency;
        private final int aetherRemaining;

        public Submission(CombatAction action, SkillOutcome outcome, ProficiencyTracker.Result proficiency,
                          int aetherRemaining) {
            this.action = action;
            this.outcome = outcome;
            this.proficiency = proficiency;
            this.aetherRemaining = aetherRemaining;
        }

        public CombatAction getAction() { return action; }
        public SkillOutcome getOutcome() { return outcome; }
        public ProficiencyTracker.Result getProficiency() { return proficiency; }
        public int getAetherRemaining() { return aetherRemaining; }
    }

    private static class ResolvedRound {
        final CombatRound round;
        final List<CombatAction> actions;
        final RoundResolution resolution;

        ResolvedRound(CombatRound round, List<CombatAction> actions, RoundResolution resolution) {
            this.round = round;
            this.actions = actions;
            this.resolution = resolution;
        }
    }

    private final Database db;
    private final CombatSettings settings;
    private final CharacterDAO characterDAO;
    private final SkillDAO skillDAO;
    private final StatDefinitionDAO statDAO;
    private final SkillUsageDAO usageDAO;
    private final CombatRoundDAO roundDAO;
    private final CombatActionDAO actionDAO;
    private final RoundStateMachine stateMachine;
    private final ProficiencyTracker proficiencyTracker;
    private final TargetResolver targetResolver;
    private final ClashDetector clashDetector = new ClashDetector();
    private final SessionContextProvider sessions;
    private final EventService events;
    private final CombatReportWriter reportWriter;

    private volatile IntSupplier diceSource;

    public CombatRoundManager(Database db) {
        this(db, CombatSettings.getInstance());
    }

    public CombatRoundManager(Database db, CombatSettings settings) {
        this(db, settings, new SessionService(db));
    }

    private CombatRoundManager(Database db, CombatSettings settings, SessionContextProvider sessions) {
        this(db, settings, sessions, new EventService(db, sessions));
    }

    public CombatRoundManager(Database db, CombatSettings settings, SessionContextProvider sessions,
                              EventService events) {
        this.db = db;
        this.settings = settings;
        this.characterDAO = new CharacterDAO(db);
        this.skillDAO = new SkillDAO(db);
        this.statDAO = new StatDefinitionDAO(db);
        this.usageDAO = new SkillUsageDAO(db);
        this.roundDAO = new CombatRoundDAO(db);
        this.actionDAO = new CombatActionDAO(db);
        this.stateMachine = new RoundStateMachine(roundDAO);
        this.proficiencyTracker = new ProficiencyTracker(db, usageDAO, settings);
        this.targetResolver = new TargetResolver(characterDAO);
        this.sessions = sessions;
        this.events = events;
        this.reportWriter = new CombatReportWriter(new EngineLogDAO(db));
    }

    /**
     * Replace the d20 used for fresh outcomes; null restores the random die.
     */
    public void setDiceSource(IntSupplier diceSource) {
        this.diceSource = diceSource;
    }

    public ProficiencyTracker getProficiencyTracker() {
        return proficiencyTracker;
    }

    // ===== Rounds =====

    /**
     * Open a new round. Rounds are numbered from 1 within their event, or within the
     * location when no event is running.
     *
     * @param sessionId session to attach to, or null for the location's active session
     * @param eventId event to attach to, or null for the location's active event (if any)
     * @throws LocationRequiredException when no location is given
     */
    public CombatRound createRound(Integer locationId, int creatorId, Integer sessionId, Integer eventId) {
        if (locationId == null) {
            throw new LocationRequiredException();
        }
        Integer session = sessionId != null ? sessionId : sessions.resolveActiveSession(locationId);
        Integer event = eventId != null ? eventId : activeEventId(locationId);
        String scope = CombatRound.scopeKey(locationId, event);
        int attempts = Math.max(1, settings.getRoundNumberRetries());

        for (int attempt = 1; ; attempt++) {
            try {
                CombatRound round = db.inTransaction("create combat round", c -> {
                    int number = roundDAO.nextRoundNumber(c, scope);
                    return roundDAO.insert(c, number, locationId, session, event, creatorId);
                });
                logger.info("[CombatRoundManager] Round {} (#{}) opened at location {} by {}",
                        round.getId(), round.getRoundNumber(), locationId, creatorId);
                return round;
            } catch (CombatStorageException e) {
                if (attempt < attempts && isUniqueViolation(e)) {
                    logger.debug("[CombatRoundManager] round number taken in {}, retrying ({}/{})",
                            scope, attempt, attempts);
                    continue;
                }
                throw e;
            }
        }
    }

    private Integer activeEventId(int locationId) {
        try {
            return events.getActiveEvent(locationId).map(RoleplayEvent::getId).orElse(null);
        } catch (RuntimeException e) {
            logger.warn("[CombatRoundManager] Could not look up active event for location {}: {}",
                    locationId, e.getMessage());
            return null;
        }
    }

    public Optional<CombatRound> getActiveRound(int locationId, Integer eventId) {
        return roundDAO.findActive(locationId, eventId)
                .map(r -> r.withActions(actionDAO.findByRound(r.getId())));
    }

    public List<CombatAction> getRoundActions(long roundId) {
        return actionDAO.findByRound(roundId);
    }

    /**
     * Most recently resolved rounds, newest first.
     *
     * @param limit page size, or null for the configured default
     */
    public List<CombatRound> getResolvedRounds(int locationId, Integer limit, Integer eventId) {
        int pageSize = limit != null && limit > 0 ? limit : settings.getResolvedRoundsPageSize();
        List<CombatRound> rounds = new ArrayList<>();
        for (CombatRound r : roundDAO.findResolved(locationId, eventId, pageSize)) {
            rounds.add(r.withActions(actionDAO.findByRound(r.getId())));
        }
        return rounds;
    }

    /**
     * Cancel an active round. A round that is not active is left alone.
     *
     * @return the round as it stands afterwards, empty if it does not exist
     */
    public Optional<CombatRound> cancelRound(long roundId, int cancelledBy) {
        return db.inTransaction("cancel round " + roundId, c -> {
            if (stateMachine.transition(c, roundId, RoundStatus.ACTIVE, RoundStatus.CANCELLED, cancelledBy, null)) {
                logger.info("[CombatRoundManager] Round {} cancelled by {}", roundId, cancelledBy);
            } else {
                logger.debug("[CombatRoundManager] cancel of round {} ignored, not active", roundId);
            }
            return roundDAO.findById(c, roundId);
        });
    }

    // ===== Submission =====

    public Submission submitAction(long roundId, int characterId, int skillId, String targetIdentifier) {
        return submitAction(roundId, characterId, skillId, targetIdentifier, null);
    }

    /**
     * Submit a character's action for the round.
     *
     * With no pre-computed outcome the action is rolled here and its aether cost is paid.
     * A pre-computed outcome is taken as given and costs nothing further. Either way the
     * skill's use is recorded once.
     *
     * @throws RoundNotActiveException if the round is missing or no longer active
     * @throws DuplicateActionException if the character already acted this round
     * @throws TargetNotFoundException if the target cannot be resolved
     * @throws InsufficientResourceException if the character cannot pay for the skill
     */
    public Submission submitAction(long roundId, int characterId, int skillId, String targetIdentifier,
                                   SkillOutcome.PreComputed preComputed) {
        Submission submission = db.inTransaction("submit action to round " + roundId, c -> {
            RoundStatus status = roundDAO.lockStatus(c, roundId).orElse(null);
            if (status != RoundStatus.ACTIVE) {
                throw new RoundNotActiveException(roundId);
            }
            if (actionDAO.existsFor(c, roundId, characterId)) {
                throw new DuplicateActionException(roundId, characterId);
            }
            GameCharacter caster = characterDAO.findById(c, characterId)
                    .filter(GameCharacter::isActive)
                    .orElseThrow(() -> new CombatException(ErrorKind.NOT_FOUND,
                            "Character " + characterId + " not found or inactive", roundId, characterId));
            Skill skill = skillDAO.findById(c, skillId)
                    .orElseThrow(() -> new CombatException(ErrorKind.NOT_FOUND,
                            "Skill " + skillId + " not found", roundId, characterId));
            GameCharacter target = targetResolver.resolve(c, caster, skill, targetIdentifier);

            SkillOutcome outcome;
            int aetherRemaining;
            if (preComputed != null) {
                outcome = preComputed;
                aetherRemaining = caster.getAether();
            } else {
                OutcomeCalculator calculator = new OutcomeCalculator(caster, skill,
                        statDAO.getPrimaryStatNames(c), settings, diceSource);
                OutcomeCalculator.CostReceipt receipt = calculator.applyCost();
                outcome = calculator.computeFinalOutput((ch, sk, br) -> readUsage(c, ch, sk, br));
                characterDAO.saveStats(c, caster.withStat(GameCharacter.AETHER, receipt.getAetherAfter()));
                aetherRemaining = receipt.getAetherAfter();
            }

            CombatAction action = actionDAO.insert(c, roundId, characterId, skillId,
                    target != null ? target.getId() : null,
                    outcome.getFinalOutput(), outcome.getQuality(),
                    ActionSnapshot.SkillData.of(skill),
                    ActionSnapshot.CharacterData.of(caster),
                    target != null ? ActionSnapshot.TargetData.of(target) : null);
            ProficiencyTracker.Result proficiency = proficiencyTracker.recordUse(c, characterId, skill);
            return new Submission(action, outcome, proficiency, aetherRemaining);
        });

        CombatAction action = submission.getAction();
        logger.info("[CombatRoundManager] {} submitted {} in round {} (output {}, {})",
                action.getCharacterName(), action.getSkillName(), roundId,
                action.getFinalOutput(), action.getRollQuality().getLabel());
        return submission;
    }

    private UsageCounts readUsage(Connection c, int characterId, int skillId, int branchId) {
        try {
            return usageDAO.getUsageCounts(c, characterId, skillId, branchId);
        } catch (SQLException e) {
            throw new CombatStorageException("read skill usage for character " + characterId, e);
        }
    }

    // ===== Resolution =====

    /**
     * Resolve an active round. The round is claimed, its actions are partitioned into
     * clashes and independent actions, every action is marked processed and the result
     * is stored on the round, all in one transaction. The engine-log report is written
     * after commit.
     *
     * @throws RoundNotActiveException if the round is not active (including when another
     *         resolver got there first)
     * @throws NoActionsToResolveException if nobody submitted; the round stays active
     */
    public RoundResolution resolveRound(long roundId, int resolverId) {
        ResolvedRound resolved;
        try {
            resolved = db.inTransaction("resolve round " + roundId, c -> {
                CombatRound round = claim(c, roundId, resolverId);
                List<CombatAction> actions = actionDAO.findByRound(c, roundId);
                if (actions.isEmpty()) {
                    throw new NoActionsToResolveException(roundId);
                }

                ClashDetector.Partition partition = clashDetector.partition(actions);
                List<RoundResolution.Clash> clashes = new ArrayList<>();
                for (ClashDetector.ClashPair pair : partition.getClashes()) {
                    RoundResolution.Clash clash = toClash(pair);
                    actionDAO.markProcessed(c, pair.getFirst().getId(), clash);
                    actionDAO.markProcessed(c, pair.getSecond().getId(), clash);
                    clashes.add(clash);
                }
                List<RoundResolution.IndependentAction> independent = new ArrayList<>();
                for (CombatAction a : partition.getIndependent()) {
                    actionDAO.markProcessed(c, a.getId(), null);
                    independent.add(toIndependent(a));
                }

                RoundResolution resolution = new RoundResolution(roundId, round.getRoundNumber(),
                        clashes, independent);
                if (!stateMachine.transition(c, roundId, RoundStatus.RESOLVING, RoundStatus.RESOLVED,
                        resolverId, JsonColumns.write(resolution))) {
                    throw new IllegalStateException("Round " + roundId + " left the resolving state mid-resolution");
                }
                return new ResolvedRound(round, actions, resolution);
            });
        } catch (RoundNotActiveException | NoActionsToResolveException e) {
            logger.info("[CombatRoundManager] Round {} not resolved: {}", roundId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("[CombatRoundManager] Resolution of round {} aborted", roundId, e);
            throw e;
        }

        RoundResolution.Summary summary = resolved.resolution.getSummary();
        logger.info("[CombatRoundManager] Round {} resolved by {}: {} actions, {} clashes, {} independent",
                roundId, resolverId, summary.getTotalActions(), summary.getClashCount(),
                summary.getIndependentCount());
        try {
            reportWriter.writeRoundResolution(resolved.round, resolved.actions, resolved.resolution);
        } catch (RuntimeException e) {
            logger.warn("[CombatRoundManager] Round {} resolved but its report could not be logged: {}",
                    roundId, e.getMessage(), e);
        }
        return resolved.resolution;
    }

    /**
     * Move the round from active to resolving under its row lock.
     */
    private CombatRound claim(Connection c, long roundId, int resolverId) throws SQLException {
        try {
            RoundStatus status = roundDAO.lockStatus(c, roundId).orElse(null);
            if (status != RoundStatus.ACTIVE
                    || !stateMachine.transition(c, roundId, RoundStatus.ACTIVE, RoundStatus.RESOLVING,
                    resolverId, null)) {
                throw new RoundNotActiveException(roundId);
            }
        } catch (SQLException e) {
            if (Database.isLockConflict(e)) {
                throw new ConcurrentResolutionConflictException(roundId, e);
            }
            throw e;
        }
        return roundDAO.findById(c, roundId).orElseThrow(() -> new RoundNotActiveException(roundId));
    }

    private static RoundResolution.Clash toClash(ClashDetector.ClashPair pair) {
        CombatAction first = pair.getFirst();
        CombatAction second = pair.getSecond();
        Interaction interaction = pair.getInteraction();

        List<RoundResolution.Participant> participants = List.of(
                toParticipant(first, interaction.getDamageToFirst()),
                toParticipant(second, interaction.getDamageToSecond()));
        String protectedTarget = null;
        if (interaction.getProtectedTargetId() != null) {
            CombatAction attack = first.getCategory() == SkillCategory.ATTACK
                    ? first : second;
            protectedTarget = ClashNarrator.targetLabel(attack);
        }
        return new RoundResolution.Clash(true, participants, interaction.getType().name().toLowerCase(),
                ClashNarrator.winnerName(first, second, interaction), interaction.getAbsorbed(),
                protectedTarget, interaction.getProtectedTargetDamage(), interaction.getEffects(),
                ClashNarrator.describeClash(first, second, interaction));
    }

    private static RoundResolution.Participant toParticipant(CombatAction a, int damageTaken) {
        return new RoundResolution.Participant(a.getCharacterId(), a.getCharacterName(), a.getSkillName(),
                a.getCategory().getDisplayName(), ClashNarrator.targetLabel(a), a.getFinalOutput(),
                a.getRollQuality().getLabel(), damageTaken);
    }

    private static RoundResolution.IndependentAction toIndependent(CombatAction a) {
        return new RoundResolution.IndependentAction(a.getCharacterId(), a.getCharacterName(), a.getSkillName(),
                a.getCategory().getDisplayName(), ClashNarrator.targetLabel(a), a.getFinalOutput(),
                a.getRollQuality().getLabel(), ClashNarrator.describeIndependent(a));
    }

    private static boolean isUniqueViolation(CombatStorageException e) {
        return e.getCause() instanceof SQLException && Database.isUniqueViolation((SQLException) e.getCause());
    }
}
