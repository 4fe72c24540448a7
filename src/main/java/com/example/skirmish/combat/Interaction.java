package com.example.skirmish.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of putting two actions against each other.
 *
 * "First" and "second" follow the argument order given to {@link ClashRules#resolve}.
 * Damage to a character outside the pair (an attack on someone a Defence protects)
 * is reported separately as the protected target's damage.
 */
public class Interaction {

    public enum ResultType {
        MUTUAL_DAMAGE,          // Attack vs Attack aimed at each other
        DAMAGE_ABSORBED,        // Defence soaked part of an Attack
        COUNTER_ATTACK,         // Counter beat the Attack
        COUNTER_FAILED,         // Attack beat (or tied) the Counter
        CRAFTING_INTERRUPTED,   // Attack broke a crafting action
        SUPPORT_WITH_ATTACK,    // Buff/Heal alongside an Attack: both apply
        DEBUFF_WITH_ATTACK,     // Debuff alongside an Attack: both apply
        INDEPENDENT,            // Compatible actions, both resolve on their own
        NO_INTERACTION          // Unrelated actions
    }

    public enum Winner { FIRST, SECOND, TIE, NONE }

    private final ResultType type;
    private final boolean clash;
    private final Winner winner;
    private final int damageToFirst;
    private final int damageToSecond;
    private final int absorbed;
    private final Integer protectedTargetId;
    private final int protectedTargetDamage;
    private final List<String> effects = new ArrayList<>();

    private Interaction(ResultType type, boolean clash, Winner winner, int damageToFirst, int damageToSecond,
                        int absorbed, Integer protectedTargetId, int protectedTargetDamage, List<String> effects) {
        this.type = type;
        this.clash = clash;
        this.winner = winner;
        this.damageToFirst = damageToFirst;
        this.damageToSecond = damageToSecond;
        this.absorbed = absorbed;
        this.protectedTargetId = protectedTargetId;
        this.protectedTargetDamage = protectedTargetDamage;
        this.effects.addAll(effects);
    }

    // Static factory methods

    public static Interaction mutualDamage(int firstOutput, int secondOutput) {
        Winner w = firstOutput > secondOutput ? Winner.FIRST
                : secondOutput > firstOutput ? Winner.SECOND : Winner.TIE;
        return new Interaction(ResultType.MUTUAL_DAMAGE, true, w, secondOutput, firstOutput, 0,
                null, 0, List.of("mutual_damage"));
    }

    /**
     * Attack (first) into Defence (second). The residual lands on the defender when the
     * attack was aimed at them, otherwise on the protected target.
     */
    public static Interaction absorbed(int attackOutput, int defenceOutput, boolean defenderIsTarget,
                                       Integer attackedId) {
        int absorbed = Math.min(attackOutput, defenceOutput);
        int residual = Math.max(0, attackOutput - defenceOutput);
        Winner w = residual > 0 ? Winner.FIRST : Winner.SECOND;
        if (defenderIsTarget) {
            return new Interaction(ResultType.DAMAGE_ABSORBED, true, w, 0, residual, absorbed,
                    null, 0, List.of("damage_absorbed"));
        }
        return new Interaction(ResultType.DAMAGE_ABSORBED, true, w, 0, 0, absorbed,
                attackedId, residual, List.of("damage_absorbed"));
    }

    public static Interaction counterAttack(int counterOutput) {
        return new Interaction(ResultType.COUNTER_ATTACK, true, Winner.SECOND, counterOutput, 0, 0,
                null, 0, List.of("counter_attack"));
    }

    public static Interaction counterFailed(int attackOutput) {
        return new Interaction(ResultType.COUNTER_FAILED, true, Winner.FIRST, 0, attackOutput, 0,
                null, 0, List.of("counter_failed"));
    }

    public static Interaction craftingInterrupted(int attackOutput) {
        return new Interaction(ResultType.CRAFTING_INTERRUPTED, true, Winner.FIRST, 0, attackOutput, 0,
                null, 0, List.of("crafting_interrupted"));
    }

    public static Interaction supportWithAttack(int attackOutput) {
        return new Interaction(ResultType.SUPPORT_WITH_ATTACK, false, Winner.NONE, 0, attackOutput, 0,
                null, 0, List.of("buff_heal_executed", "attack_executed"));
    }

    public static Interaction debuffWithAttack(int attackOutput) {
        return new Interaction(ResultType.DEBUFF_WITH_ATTACK, false, Winner.NONE, 0, attackOutput, 0,
                null, 0, List.of("debuff_applied", "attack_executed"));
    }

    public static Interaction independent(String effect) {
        return new Interaction(ResultType.INDEPENDENT, false, Winner.NONE, 0, 0, 0, null, 0, List.of(effect));
    }

    public static Interaction none() {
        return new Interaction(ResultType.NO_INTERACTION, false, Winner.NONE, 0, 0, 0, null, 0, List.of());
    }

    /**
     * The same interaction seen from the other side.
     */
    public Interaction swapped() {
        Winner w = winner == Winner.FIRST ? Winner.SECOND : winner == Winner.SECOND ? Winner.FIRST : winner;
        return new Interaction(type, clash, w, damageToSecond, damageToFirst, absorbed,
                protectedTargetId, protectedTargetDamage, effects);
    }

    // Getters

    public ResultType getType() { return type; }
    public boolean isClash() { return clash; }
    public Winner getWinner() { return winner; }
    public int getDamageToFirst() { return damageToFirst; }
    public int getDamageToSecond() { return damageToSecond; }
    public int getAbsorbed() { return absorbed; }

    /** Character an absorbed attack was aimed at, when that is neither participant. */
    public Integer getProtectedTargetId() { return protectedTargetId; }
    public int getProtectedTargetDamage() { return protectedTargetDamage; }
    public List<String> getEffects() { return Collections.unmodifiableList(effects); }

    @Override
    public String toString() {
        return "Interaction{" + type + ", clash=" + clash + ", winner=" + winner
                + ", damage=" + damageToFirst + "/" + damageToSecond + "}";
    }
}
