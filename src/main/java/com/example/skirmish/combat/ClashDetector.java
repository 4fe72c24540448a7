package com.example.skirmish.combat;

import com.example.skirmish.model.SkillCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Splits a round's actions into clashing pairs and independent actions.
 *
 * Pairing is greedy: actions are visited in submission order (then id), and each one
 * pairs with the earliest-submitted unpaired candidate it clashes with. An action with
 * several possible partners therefore pairs with whoever submitted first.
 *
 * Candidates come from three indexes (by acting character, by target, by category), so
 * each action only tests the handful of actions aimed at it, aimed by it, or guarding
 * the same target, never the whole round.
 */
public class ClashDetector {
    private static final Logger logger = LoggerFactory.getLogger(ClashDetector.class);

    /** Submission order, ties broken by id. */
    public static final Comparator<CombatAction> SUBMISSION_ORDER = Comparator
            .comparing(CombatAction::getSubmittedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(CombatAction::getId);

    public static class ClashPair {
        private final CombatAction first;
        private final CombatAction second;
        private final Interaction interaction;

        public ClashPair(CombatAction first, CombatAction second, Interaction interaction) {
            this.first = first;
            this.second = second;
            this.interaction = interaction;
        }

        public CombatAction getFirst() { return first; }
        public CombatAction getSecond() { return second; }
        public Interaction getInteraction() { return interaction; }
    }

    public static class Partition {
        private final List<ClashPair> clashes;
        private final List<CombatAction> independent;

        public Partition(List<ClashPair> clashes, List<CombatAction> independent) {
            this.clashes = clashes;
            this.independent = independent;
        }

        public List<ClashPair> getClashes() { return Collections.unmodifiableList(clashes); }
        public List<CombatAction> getIndependent() { return Collections.unmodifiableList(independent); }
    }

    public Partition partition(List<CombatAction> actions) {
        List<CombatAction> ordered = new ArrayList<>(actions);
        ordered.sort(SUBMISSION_ORDER);

        Map<Integer, List<Integer>> byCharacter = new HashMap<>();
        Map<Integer, List<Integer>> byTarget = new HashMap<>();
        Map<SkillCategory, List<Integer>> byCategory = new EnumMap<>(SkillCategory.class);
        for (int i = 0; i < ordered.size(); i++) {
            CombatAction a = ordered.get(i);
            byCharacter.computeIfAbsent(a.getCharacterId(), k -> new ArrayList<>()).add(i);
            if (a.getTargetId() != null) {
                byTarget.computeIfAbsent(a.getTargetId(), k -> new ArrayList<>()).add(i);
            }
            byCategory.computeIfAbsent(a.getCategory(), k -> new ArrayList<>()).add(i);
        }

        boolean[] consumed = new boolean[ordered.size()];
        List<ClashPair> clashes = new ArrayList<>();
        List<CombatAction> independent = new ArrayList<>();

        for (int i = 0; i < ordered.size(); i++) {
            if (consumed[i]) continue;
            CombatAction action = ordered.get(i);
            consumed[i] = true;

            ClashPair pair = null;
            for (int j : candidates(i, action, ordered, byCharacter, byTarget, byCategory)) {
                if (consumed[j]) continue;
                CombatAction other = ordered.get(j);
                Interaction result = ClashRules.resolve(ClashRules.Side.of(action), ClashRules.Side.of(other));
                if (result.isClash()) {
                    consumed[j] = true;
                    pair = new ClashPair(action, other, result);
                    break;
                }
            }

            if (pair != null) {
                logger.debug("[ClashDetector] action {} clashes with {} ({})",
                        action.getId(), pair.getSecond().getId(), pair.getInteraction().getType());
                clashes.add(pair);
            } else {
                independent.add(action);
            }
        }
        return new Partition(clashes, independent);
    }

    /**
     * Positions of actions that could clash with {@code action}, ascending.
     */
    private static TreeSet<Integer> candidates(int self, CombatAction action, List<CombatAction> ordered,
                                               Map<Integer, List<Integer>> byCharacter,
                                               Map<Integer, List<Integer>> byTarget,
                                               Map<SkillCategory, List<Integer>> byCategory) {
        TreeSet<Integer> out = new TreeSet<>();
        // aimed at this character
        out.addAll(byTarget.getOrDefault(action.getCharacterId(), List.of()));
        Integer target = action.getTargetId();
        if (target != null) {
            // actions by this action's target
            out.addAll(byCharacter.getOrDefault(target, List.of()));
            if (action.getCategory() == SkillCategory.ATTACK) {
                // defences guarding the attacked character
                for (int j : byCategory.getOrDefault(SkillCategory.DEFENCE, List.of())) {
                    if (target.equals(ordered.get(j).getTargetId())) out.add(j);
                }
            } else if (action.getCategory() == SkillCategory.DEFENCE) {
                // attacks on the guarded character
                for (int j : byTarget.getOrDefault(target, List.of())) {
                    if (ordered.get(j).getCategory() == SkillCategory.ATTACK) out.add(j);
                }
            }
        }
        out.remove(self);
        return out;
    }
}
