package com.example.skirmish.combat;

import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;

/**
 * Player-facing text for resolved actions.
 */
public final class ClashNarrator {

    private ClashNarrator() { }

    /** Name shown as an action's target: the character, "Self", or "Area" for untargeted skills. */
    public static String targetLabel(CombatAction action) {
        if (action.getTargetId() != null && action.getTargetId() != action.getCharacterId()
                && action.getTargetData() != null) {
            return action.getTargetData().getName();
        }
        if (action.getTargetId() == null && action.getSkillData().getTarget() == SkillTarget.NONE) {
            return "Area";
        }
        return "Self";
    }

    public static String describeIndependent(CombatAction action) {
        return action.getCharacterName() + " used " + action.getSkillName() + " on " + targetLabel(action)
                + " (Output: " + action.getFinalOutput() + ")";
    }

    /**
     * Winner's name, "tie", or null.
     */
    public static String winnerName(CombatAction first, CombatAction second, Interaction interaction) {
        switch (interaction.getWinner()) {
            case FIRST: return first.getCharacterName();
            case SECOND: return second.getCharacterName();
            case TIE: return "tie";
            default: return null;
        }
    }

    /**
     * One sentence describing how a clash played out.
     */
    public static String describeClash(CombatAction first, CombatAction second, Interaction interaction) {
        boolean firstAttacks = first.getCategory() == SkillCategory.ATTACK;
        CombatAction attack = firstAttacks ? first : second;
        CombatAction other = firstAttacks ? second : first;
        int damageToAttacker = firstAttacks ? interaction.getDamageToFirst() : interaction.getDamageToSecond();
        int damageToOther = firstAttacks ? interaction.getDamageToSecond() : interaction.getDamageToFirst();

        switch (interaction.getType()) {
            case MUTUAL_DAMAGE: {
                String text = first.getCharacterName() + "'s " + first.getSkillName() + " and "
                        + second.getCharacterName() + "'s " + second.getSkillName() + " collide: "
                        + first.getCharacterName() + " takes " + interaction.getDamageToFirst() + ", "
                        + second.getCharacterName() + " takes " + interaction.getDamageToSecond() + ".";
                String winner = winnerName(first, second, interaction);
                return "tie".equals(winner) ? text + " Neither gives ground."
                        : text + " " + winner + " gets the better of the exchange.";
            }
            case DAMAGE_ABSORBED: {
                String head = other.getCharacterName() + "'s " + other.getSkillName() + " absorbs "
                        + interaction.getAbsorbed() + " of " + attack.getCharacterName() + "'s "
                        + attack.getSkillName();
                int residual = interaction.getProtectedTargetId() != null
                        ? interaction.getProtectedTargetDamage() : damageToOther;
                if (residual == 0) {
                    return head + "; nothing gets through.";
                }
                String victim = interaction.getProtectedTargetId() != null
                        ? targetLabel(attack) : other.getCharacterName();
                return head + "; " + residual + " damage reaches " + victim + ".";
            }
            case COUNTER_ATTACK:
                return other.getCharacterName() + " turns " + attack.getCharacterName() + "'s "
                        + attack.getSkillName() + " aside with " + other.getSkillName() + ": "
                        + attack.getCharacterName() + " takes " + damageToAttacker + ".";
            case COUNTER_FAILED:
                return other.getCharacterName() + "'s " + other.getSkillName() + " fails against "
                        + attack.getCharacterName() + "'s " + attack.getSkillName() + ": "
                        + other.getCharacterName() + " takes " + damageToOther + ".";
            case CRAFTING_INTERRUPTED:
                return attack.getCharacterName() + "'s " + attack.getSkillName() + " interrupts "
                        + other.getCharacterName() + "'s " + other.getSkillName() + ": "
                        + other.getCharacterName() + " takes " + damageToOther + " and the work is lost.";
            default:
                return first.getCharacterName() + " and " + second.getCharacterName() + " act without interfering.";
        }
    }
}
