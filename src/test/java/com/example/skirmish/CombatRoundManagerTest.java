package com.example.skirmish;

import com.example.skirmish.combat.CombatAction;
import com.example.skirmish.combat.CombatException;
import com.example.skirmish.combat.CombatReportWriter;
import com.example.skirmish.combat.CombatRound;
import com.example.skirmish.combat.CombatRoundManager;
import com.example.skirmish.combat.DuplicateActionException;
import com.example.skirmish.combat.InsufficientResourceException;
import com.example.skirmish.combat.LocationRequiredException;
import com.example.skirmish.combat.NoActionsToResolveException;
import com.example.skirmish.combat.OutcomeCalculator;
import com.example.skirmish.combat.RoundNotActiveException;
import com.example.skirmish.combat.RoundResolution;
import com.example.skirmish.combat.RoundStatus;
import com.example.skirmish.combat.SkillOutcome;
import com.example.skirmish.combat.TargetNotFoundException;
import com.example.skirmish.event.EventService;
import com.example.skirmish.event.SessionService;
import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.RoleplayEvent;
import com.example.skirmish.model.RollQuality;
import com.example.skirmish.persistence.CharacterDAO;
import com.example.skirmish.persistence.CombatRoundDAO;
import com.example.skirmish.persistence.DataLoader;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.EngineLogDAO;
import com.example.skirmish.util.CombatSettings;
import com.example.skirmish.util.ProficiencyTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.skirmish.CombatFixtures.stats;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatRoundManager Tests")
class CombatRoundManagerTest {

    // Skill ids from data/skills.yaml
    private static final int FIRE_SLASH = 1;
    private static final int EMBER_WARD = 2;
    private static final int FROST_RIPOSTE = 3;
    private static final int GLACIAL_MEND = 4;
    private static final int HOURGLASS_FORGE = 6;

    private static final int LOCATION = 1;

    private Database db;
    private CombatRoundManager manager;
    private CharacterDAO characters;
    private GameCharacter aria;
    private GameCharacter bran;
    private GameCharacter cora;

    @BeforeEach
    void setUp() {
        OutcomeCalculator.clearImpactCache();
        db = CombatFixtures.freshDatabase();
        DataLoader.loadDefaults(db);
        manager = new CombatRoundManager(db, new CombatSettings());
        manager.setDiceSource(() -> 10);
        characters = new CharacterDAO(db);

        // Fire Slash: 12 + floor(20*0.7) + floor(10*0.3) = 29 impact -> 58 at Standard
        aria = characters.create(101, "Aria", "Vance", stats(20, 10, 15, 10, 8, 50), true);
        // Fire Slash: 12 + floor(30*0.7) + floor(10*0.3) = 36 impact -> 72 at Standard
        bran = characters.create(102, "Bran", "Holt", stats(30, 12, 10, 10, 6, 50), true);
        // Glacial Mend: 8 + floor(10*0.7) + floor(8*0.3) = 17 impact -> 34 at Standard
        cora = characters.create(103, "Cora", null, stats(6, 14, 12, 10, 8, 50), true);
    }

    private CombatRound openRound() {
        return manager.createRound(LOCATION, aria.getId(), null, null);
    }

    private int aetherOf(GameCharacter c) {
        return characters.findById(c.getId()).orElseThrow().getAether();
    }

    // ===== Round creation =====

    @Test
    @DisplayName("Rounds at a location are numbered 1, 2, 3")
    void roundNumbersPerLocation() {
        assertEquals(1, openRound().getRoundNumber());
        assertEquals(2, openRound().getRoundNumber());
        assertEquals(3, openRound().getRoundNumber());
        assertEquals(1, manager.createRound(2, aria.getId(), null, null).getRoundNumber());
    }

    @Test
    @DisplayName("Rounds inside an event are numbered from 1 within the event")
    void roundNumbersPerEvent() {
        openRound();
        openRound();
        EventService events = new EventService(db, new SessionService(db));
        RoleplayEvent duel = events.createEvent("Duel at dawn", "duel", LOCATION, aria.getId(), null, null);

        CombatRound first = openRound();
        CombatRound second = openRound();

        assertEquals(Integer.valueOf(duel.getId()), first.getEventId());
        assertEquals(1, first.getRoundNumber());
        assertEquals(2, second.getRoundNumber());
    }

    @Test
    @DisplayName("An explicit event id is used as given")
    void explicitEventId() {
        CombatRound round = manager.createRound(LOCATION, aria.getId(), null, 77);
        assertEquals(Integer.valueOf(77), round.getEventId());
        assertEquals(1, round.getRoundNumber());
    }

    @Test
    @DisplayName("A location is required")
    void locationRequired() {
        CombatException e = assertThrows(LocationRequiredException.class,
                () -> manager.createRound(null, aria.getId(), null, null));
        assertEquals(CombatException.ErrorKind.LOCATION_REQUIRED, e.getKind());
    }

    @Test
    @DisplayName("Rounds join the location's session, creating it once")
    void sessionAutoCreated() {
        CombatRound first = openRound();
        CombatRound second = openRound();

        assertNotNull(first.getSessionId());
        assertEquals(first.getSessionId(), second.getSessionId());
        assertEquals("Auto-created for Location " + LOCATION,
                new SessionService(db).getActiveSession(LOCATION).orElseThrow().getName());
    }

    @Test
    @DisplayName("New rounds start active with no actions")
    void newRoundIsActive() {
        CombatRound round = openRound();

        assertEquals(RoundStatus.ACTIVE, round.getStatus());
        Optional<CombatRound> active = manager.getActiveRound(LOCATION, null);
        assertTrue(active.isPresent());
        assertEquals(round.getId(), active.get().getId());
        assertTrue(active.get().getActions().isEmpty());
    }

    // ===== Submission =====

    @Test
    @DisplayName("Submitting rolls the outcome, pays aether and records the use")
    void submitAction() {
        CombatRound round = openRound();

        CombatRoundManager.Submission s = manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");

        CombatAction action = s.getAction();
        assertEquals(bran.getId(), action.getTargetId());
        assertEquals(58, action.getFinalOutput());
        assertEquals(RollQuality.STANDARD, action.getRollQuality());
        assertEquals("Bran", action.getTargetData().getName());
        assertEquals("Fire Slash", action.getSkillName());
        assertFalse(action.isProcessed());
        assertFalse(s.getOutcome().isPreComputed());

        assertEquals(45, s.getAetherRemaining());
        assertEquals(45, aetherOf(aria));
        assertEquals(1, s.getProficiency().getSkillUses());
        assertEquals(1, s.getProficiency().getBranchUses());
        assertNull(s.getProficiency().getImprovementMessage());
    }

    @Test
    @DisplayName("Targets can be named by user id")
    void targetByUserId() {
        CombatRound round = openRound();
        CombatAction action = manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "102").getAction();
        assertEquals(bran.getId(), action.getTargetId());
    }

    @Test
    @DisplayName("A pre-computed outcome is stored as given and costs nothing")
    void submitPreComputed() {
        CombatRound round = openRound();

        CombatRoundManager.Submission s = manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "bran",
                new SkillOutcome.PreComputed(33, RollQuality.CRITICAL));

        assertEquals(33, s.getAction().getFinalOutput());
        assertEquals(RollQuality.CRITICAL, s.getAction().getRollQuality());
        assertEquals(1.4, s.getAction().getOutcomeMultiplier(), 1e-9);
        assertEquals(50, aetherOf(aria));
        assertEquals(1, manager.getProficiencyTracker()
                .getUsageInfo(aria.getId(), FIRE_SLASH, 1).getSkillUses());
    }

    @Test
    @DisplayName("A character acts at most once per round")
    void duplicateSubmission() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");

        DuplicateActionException e = assertThrows(DuplicateActionException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), EMBER_WARD, null));

        assertEquals(CombatException.ErrorKind.DUPLICATE_ACTION, e.getKind());
        assertEquals(1, manager.getRoundActions(round.getId()).size());
        assertEquals(45, aetherOf(aria));
    }

    @Test
    @DisplayName("A skill for other characters rejects an unknown target and lists who is available")
    void unknownTarget() {
        CombatRound round = openRound();

        TargetNotFoundException e = assertThrows(TargetNotFoundException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Nobody"));

        assertTrue(e.getAvailableTargets().contains(bran.describeForTargeting()));
        assertTrue(e.getAvailableTargets().contains(cora.describeForTargeting()));
        assertFalse(e.getAvailableTargets().contains(aria.describeForTargeting()));
        assertTrue(e.getMessage().contains("Available characters"));
        assertTrue(manager.getRoundActions(round.getId()).isEmpty());
    }

    @Test
    @DisplayName("A skill for other characters cannot target the caster")
    void otherTargetIsSelf() {
        CombatRound round = openRound();
        assertThrows(TargetNotFoundException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Aria"));
        assertThrows(TargetNotFoundException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, ""));
    }

    @Test
    @DisplayName("Inactive characters are not valid targets")
    void inactiveTarget() {
        characters.create(104, "Dorn", null, stats(10, 10, 10, 10, 10, 10), false);
        CombatRound round = openRound();
        assertThrows(TargetNotFoundException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Dorn"));
    }

    @Test
    @DisplayName("A skill for anyone defaults to the caster")
    void anyTargetDefaultsToSelf() {
        CombatRound round = openRound();
        CombatAction action = manager.submitAction(round.getId(), aria.getId(), EMBER_WARD, null).getAction();
        assertEquals(aria.getId(), action.getTargetId());
    }

    @Test
    @DisplayName("Not enough aether rejects the action and changes nothing")
    void insufficientAether() {
        GameCharacter drained = characters.create(105, "Esk", null, stats(20, 10, 10, 10, 10, 2), true);
        CombatRound round = openRound();

        InsufficientResourceException e = assertThrows(InsufficientResourceException.class,
                () -> manager.submitAction(round.getId(), drained.getId(), FIRE_SLASH, "Bran"));

        assertEquals(GameCharacter.AETHER, e.getResource());
        assertEquals(2, aetherOf(drained));
        assertTrue(manager.getRoundActions(round.getId()).isEmpty());
        assertEquals(0, manager.getProficiencyTracker()
                .getUsageInfo(drained.getId(), FIRE_SLASH, 1).getSkillUses());
    }

    @Test
    @DisplayName("A required stat below its minimum rejects the action")
    void requiredStatTooLow() {
        GameCharacter weak = characters.create(106, "Fen", null, stats(3, 10, 10, 10, 10, 50), true);
        CombatRound round = openRound();

        InsufficientResourceException e = assertThrows(InsufficientResourceException.class,
                () -> manager.submitAction(round.getId(), weak.getId(), FIRE_SLASH, "Bran"));
        assertEquals("STR", e.getResource());
    }

    @Test
    @DisplayName("Submissions to a missing or finished round are refused")
    void submitToInactiveRound() {
        assertThrows(RoundNotActiveException.class,
                () -> manager.submitAction(9999L, aria.getId(), FIRE_SLASH, "Bran"));

        CombatRound round = openRound();
        manager.cancelRound(round.getId(), aria.getId());
        assertThrows(RoundNotActiveException.class,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran"));
        assertEquals(50, aetherOf(aria));
    }

    // ===== Resolution =====

    @Test
    @DisplayName("Resolution pairs clashes and leaves the rest independent")
    void resolveRound() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.submitAction(round.getId(), bran.getId(), FIRE_SLASH, "Aria");
        manager.submitAction(round.getId(), cora.getId(), GLACIAL_MEND, null);

        RoundResolution r = manager.resolveRound(round.getId(), aria.getId());

        assertEquals(3, r.getSummary().getTotalActions());
        assertEquals(1, r.getSummary().getClashCount());
        assertEquals(1, r.getSummary().getIndependentCount());

        RoundResolution.Clash clash = r.getClashes().get(0);
        assertTrue(clash.isClash());
        assertEquals("mutual_damage", clash.getInteraction());
        assertEquals("Bran", clash.getWinner());
        RoundResolution.Participant first = clash.getParticipants().get(0);
        RoundResolution.Participant second = clash.getParticipants().get(1);
        assertEquals("Aria", first.getCharacter());
        assertEquals(72, first.getDamageTaken());
        assertEquals("Bran", second.getCharacter());
        assertEquals(58, second.getDamageTaken());
        assertNotNull(clash.getResolution());

        RoundResolution.IndependentAction heal = r.getIndependentActions().get(0);
        assertEquals("Cora used Glacial Mend on Self (Output: 34)", heal.getDetails());
        assertFalse(heal.isClash());
    }

    @Test
    @DisplayName("A resolved round stores its result and marks every action processed")
    void resolvedRoundState() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.submitAction(round.getId(), bran.getId(), FIRE_SLASH, "Aria");
        manager.submitAction(round.getId(), cora.getId(), GLACIAL_MEND, null);

        manager.resolveRound(round.getId(), cora.getId());

        CombatRound stored = new CombatRoundDAO(db).findById(round.getId()).orElseThrow();
        assertEquals(RoundStatus.RESOLVED, stored.getStatus());
        assertEquals(Integer.valueOf(cora.getId()), stored.getResolvedBy());
        assertNotNull(stored.getResolvedAt());
        assertNotNull(stored.getResolution());
        assertEquals(3, stored.getResolution().getSummary().getTotalActions());

        List<CombatAction> actions = manager.getRoundActions(round.getId());
        assertEquals(3, actions.size());
        for (CombatAction a : actions) {
            assertTrue(a.isProcessed(), a.toString());
            if (a.getCharacterId() == cora.getId()) {
                assertNull(a.getClashResult());
            } else {
                assertNotNull(a.getClashResult());
                assertEquals("mutual_damage", a.getClashResult().getInteraction());
            }
        }
        assertFalse(manager.getActiveRound(LOCATION, null).isPresent());
    }

    @Test
    @DisplayName("Defence guarding an attacked ally absorbs for them")
    void defenceProtectsAlly() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), cora.getId(), EMBER_WARD, "Aria",
                new SkillOutcome.PreComputed(30, RollQuality.STANDARD));
        manager.submitAction(round.getId(), bran.getId(), FIRE_SLASH, "Aria",
                new SkillOutcome.PreComputed(50, RollQuality.STANDARD));

        RoundResolution r = manager.resolveRound(round.getId(), aria.getId());

        RoundResolution.Clash clash = r.getClashes().get(0);
        assertEquals("damage_absorbed", clash.getInteraction());
        assertEquals(30, clash.getAbsorbed());
        assertEquals("Aria", clash.getProtectedTarget());
        assertEquals(20, clash.getProtectedTargetDamage());
        assertTrue(clash.getResolution().contains("20 damage reaches Aria"));
    }

    @Test
    @DisplayName("Counter and crafting interactions resolve through the manager")
    void counterAndCrafting() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran",
                new SkillOutcome.PreComputed(40, RollQuality.STANDARD));
        manager.submitAction(round.getId(), bran.getId(), FROST_RIPOSTE, "Aria",
                new SkillOutcome.PreComputed(45, RollQuality.CRITICAL));

        RoundResolution r = manager.resolveRound(round.getId(), aria.getId());
        assertEquals("counter_attack", r.getClashes().get(0).getInteraction());
        assertEquals("Bran", r.getClashes().get(0).getWinner());
        assertEquals(45, r.getClashes().get(0).getParticipants().get(0).getDamageTaken());

        CombatRound next = openRound();
        manager.submitAction(next.getId(), cora.getId(), HOURGLASS_FORGE, null,
                new SkillOutcome.PreComputed(10, RollQuality.STANDARD));
        manager.submitAction(next.getId(), bran.getId(), FIRE_SLASH, "Cora",
                new SkillOutcome.PreComputed(25, RollQuality.POOR));

        RoundResolution crafting = manager.resolveRound(next.getId(), aria.getId());
        assertEquals("crafting_interrupted", crafting.getClashes().get(0).getInteraction());
        assertEquals(25, crafting.getClashes().get(0).getParticipants().get(0).getDamageTaken());
    }

    @Test
    @DisplayName("A round with no actions cannot be resolved and stays active")
    void resolveEmptyRound() {
        CombatRound round = openRound();

        assertThrows(NoActionsToResolveException.class, () -> manager.resolveRound(round.getId(), aria.getId()));

        assertEquals(RoundStatus.ACTIVE, new CombatRoundDAO(db).findById(round.getId()).orElseThrow().getStatus());
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        assertEquals(1, manager.resolveRound(round.getId(), aria.getId()).getSummary().getTotalActions());
    }

    @Test
    @DisplayName("A round resolves only once")
    void resolveTwice() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.resolveRound(round.getId(), aria.getId());

        assertThrows(RoundNotActiveException.class, () -> manager.resolveRound(round.getId(), aria.getId()));
        assertThrows(RoundNotActiveException.class, () -> manager.resolveRound(424242L, aria.getId()));
    }

    @Test
    @DisplayName("The report is written to the engine log after resolution")
    void engineLogReport() {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.submitAction(round.getId(), cora.getId(), GLACIAL_MEND, null);
        manager.resolveRound(round.getId(), aria.getId());

        List<EngineLogDAO.Entry> entries = new EngineLogDAO(db).findByLocation(LOCATION);
        assertEquals(1, entries.size());
        EngineLogDAO.Entry entry = entries.get(0);
        assertEquals(CombatReportWriter.LOG_TYPE, entry.getType());
        assertEquals(CombatReportWriter.ACTOR, entry.getActor());
        assertEquals(round.getSessionId(), entry.getSessionId());
        assertTrue(entry.getDetails().startsWith("=== ROUND 1 RESOLUTION ==="));
        assertTrue(entry.getDetails().contains("Aria used Fire Slash on Bran (Output: 58"));
        assertTrue(entry.getDetails().contains("Cora used Glacial Mend on Self (Output: 34)"));
        assertNotNull(entry.getEngineData());
    }

    // ===== Cancel and history =====

    @Test
    @DisplayName("Cancelling stops an active round and leaves others alone")
    void cancelRound() {
        CombatRound round = openRound();

        Optional<CombatRound> cancelled = manager.cancelRound(round.getId(), bran.getId());
        assertEquals(RoundStatus.CANCELLED, cancelled.orElseThrow().getStatus());
        assertEquals(Integer.valueOf(bran.getId()), cancelled.get().getResolvedBy());

        CombatRound resolved = openRound();
        manager.submitAction(resolved.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.resolveRound(resolved.getId(), aria.getId());
        assertEquals(RoundStatus.RESOLVED, manager.cancelRound(resolved.getId(), bran.getId()).orElseThrow().getStatus());

        assertFalse(manager.cancelRound(31337L, bran.getId()).isPresent());
    }

    @Test
    @DisplayName("Resolved rounds list newest first up to the limit")
    void resolvedHistory() {
        List<Long> resolvedIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            CombatRound round = openRound();
            manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
            manager.resolveRound(round.getId(), aria.getId());
            resolvedIds.add(round.getId());
        }
        manager.cancelRound(openRound().getId(), aria.getId());

        List<CombatRound> history = manager.getResolvedRounds(LOCATION, 2, null);

        assertEquals(2, history.size());
        assertEquals(resolvedIds.get(2), history.get(0).getId());
        assertEquals(resolvedIds.get(1), history.get(1).getId());
        assertEquals(1, history.get(0).getActions().size());
        assertEquals(3, manager.getResolvedRounds(LOCATION, null, null).size());
    }

    // ===== Concurrency =====

    private static <T> List<Future<T>> runTogether(int threads, Callable<T> task) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS), "workers did not finish");
        } finally {
            pool.shutdownNow();
        }
        return futures;
    }

    @Test
    @DisplayName("Concurrent submissions by one character store exactly one action")
    void concurrentDuplicateSubmissions() throws Exception {
        CombatRound round = openRound();

        List<Future<CombatRoundManager.Submission>> results = runTogether(8,
                () -> manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran"));

        int succeeded = 0;
        for (Future<CombatRoundManager.Submission> f : results) {
            try {
                f.get();
                succeeded++;
            } catch (ExecutionException e) {
                assertInstanceOf(DuplicateActionException.class, e.getCause());
            }
        }
        assertEquals(1, succeeded);
        assertEquals(1, manager.getRoundActions(round.getId()).size());
        assertEquals(45, aetherOf(aria));
    }

    @Test
    @DisplayName("Concurrent resolutions produce exactly one result")
    void concurrentResolution() throws Exception {
        CombatRound round = openRound();
        manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran");
        manager.submitAction(round.getId(), bran.getId(), FIRE_SLASH, "Aria");

        List<Future<RoundResolution>> results = runTogether(6,
                () -> manager.resolveRound(round.getId(), cora.getId()));

        int succeeded = 0;
        for (Future<RoundResolution> f : results) {
            try {
                RoundResolution r = f.get();
                assertEquals(1, r.getSummary().getClashCount());
                succeeded++;
            } catch (ExecutionException e) {
                assertInstanceOf(RoundNotActiveException.class, e.getCause());
            }
        }
        assertEquals(1, succeeded);
        assertEquals(RoundStatus.RESOLVED, new CombatRoundDAO(db).findById(round.getId()).orElseThrow().getStatus());
        assertEquals(1, new EngineLogDAO(db).findByLocation(LOCATION).size());
    }

    @Test
    @DisplayName("Different characters can submit at the same time")
    void concurrentDistinctSubmissions() throws Exception {
        CombatRound round = openRound();
        List<GameCharacter> fighters = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            fighters.add(characters.create(200 + i, "Fighter" + i, null, stats(20, 10, 10, 10, 10, 50), true));
        }

        ExecutorService pool = Executors.newFixedThreadPool(fighters.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CombatRoundManager.Submission>> futures = new ArrayList<>();
        try {
            for (GameCharacter f : fighters) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return manager.submitAction(round.getId(), f.getId(), FIRE_SLASH, "Bran");
                }));
            }
            start.countDown();
            for (Future<CombatRoundManager.Submission> f : futures) {
                assertNotNull(f.get(60, TimeUnit.SECONDS).getAction());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(fighters.size(), manager.getRoundActions(round.getId()).size());
    }

    @Test
    @DisplayName("Usage counts accumulate across rounds and report rank-ups")
    void usageAcrossRounds() {
        ProficiencyTracker.Result last = null;
        for (int i = 0; i < 20; i++) {
            CombatRound round = openRound();
            last = manager.submitAction(round.getId(), aria.getId(), FIRE_SLASH, "Bran",
                    new SkillOutcome.PreComputed(10, RollQuality.STANDARD)).getProficiency();
            manager.cancelRound(round.getId(), aria.getId());
        }
        assertNotNull(last);
        assertEquals(20, last.getSkillUses());
        assertEquals(2, last.getSkillRank());
        assertTrue(last.hasSkillRankedUp());
        assertEquals("Your Fire Slash has reached Rank II!", last.getImprovementMessage());
    }
}
