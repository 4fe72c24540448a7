package com.example.skirmish.combat;

import com.example.skirmish.model.SkillCategory;

import java.util.Objects;

/**
 * The interaction table: what happens when two actions in the same round meet.
 *
 * The table is symmetric. Rows are written with Attack first, then Defence, then
 * Buff/Heal; a pair arriving in the other order is swapped, resolved, and swapped back.
 *
 * <pre>
 * Attack  / Attack    aimed at each other: each takes the other's output
 * Attack  / Defence   defence guards the attack's target: residual = max(0, atk - def)
 * Attack  / Counter   aimed at each other: higher counter hits the attacker, else attack lands
 * Attack  / Crafting  attack aimed at the crafter: crafting interrupted, attack lands
 * Attack  / Buff,Heal not a clash, both apply
 * Attack  / Debuff    not a clash, both apply
 * Defence / Buff,Heal not a clash
 * Buff,Heal / Debuff  not a clash
 * Buff,Heal / Buff,Heal not a clash
 * anything else       no interaction
 * </pre>
 */
public final class ClashRules {

    private ClashRules() { }

    /**
     * The parts of an action the rules look at.
     */
    public static class Side {
        private final int characterId;
        private final Integer targetId;
        private final SkillCategory category;
        private final int output;

        public Side(int characterId, Integer targetId, SkillCategory category, int output) {
            this.characterId = characterId;
            this.targetId = targetId;
            this.category = Objects.requireNonNull(category, "category");
            this.output = output;
        }

        public static Side of(CombatAction action) {
            return new Side(action.getCharacterId(), action.getTargetId(), action.getCategory(),
                    action.getFinalOutput());
        }

        public int getCharacterId() { return characterId; }
        public Integer getTargetId() { return targetId; }
        public SkillCategory getCategory() { return category; }
        public int getOutput() { return output; }

        boolean targets(int otherCharacterId) {
            return targetId != null && targetId == otherCharacterId;
        }
    }

    public static boolean targetEachOther(Side a, Side b) {
        return a.targets(b.characterId) && b.targets(a.characterId);
    }

    public static boolean clashes(Side a, Side b) {
        return resolve(a, b).isClash();
    }

    /**
     * Resolve two actions. The result's first/second follow the argument order.
     */
    public static Interaction resolve(Side a, Side b) {
        if (leadsTable(b.category) < leadsTable(a.category)) {
            return resolveOrdered(b, a).swapped();
        }
        return resolveOrdered(a, b);
    }

    /** Row order of the table: Attack rows, then Defence, then Buff/Heal, then the rest. */
    private static int leadsTable(SkillCategory c) {
        switch (c) {
            case ATTACK: return 0;
            case DEFENCE: return 1;
            case BUFF:
            case HEAL: return 2;
            default: return 3;
        }
    }

    private static Interaction resolveOrdered(Side a, Side b) {
        boolean mutual = targetEachOther(a, b);
        switch (a.category) {
            case ATTACK:
                return attackAgainst(a, b, mutual);
            case DEFENCE:
                return b.category.isSupport() ? Interaction.independent("both_resolve_independently")
                        : Interaction.none();
            case BUFF:
            case HEAL:
                if (b.category == SkillCategory.DEBUFF) return Interaction.independent("both_resolve");
                if (b.category.isSupport()) return Interaction.independent("both_resolve_independently");
                return Interaction.none();
            default:
                return Interaction.none();
        }
    }

    private static Interaction attackAgainst(Side attack, Side other, boolean mutual) {
        switch (other.category) {
            case ATTACK:
                return mutual ? Interaction.mutualDamage(attack.output, other.output) : Interaction.none();
            case DEFENCE: {
                boolean guardsTarget = attack.targetId != null && attack.targetId.equals(other.targetId);
                if (!mutual && !guardsTarget) return Interaction.none();
                boolean defenderIsTarget = attack.targets(other.characterId);
                return Interaction.absorbed(attack.output, other.output, defenderIsTarget, attack.targetId);
            }
            case COUNTER:
                if (!mutual) return Interaction.none();
                return other.output > attack.output
                        ? Interaction.counterAttack(other.output)
                        : Interaction.counterFailed(attack.output);
            case CRAFTING:
                return attack.targets(other.characterId)
                        ? Interaction.craftingInterrupted(attack.output)
                        : Interaction.none();
            case BUFF:
            case HEAL:
                return mutual ? Interaction.supportWithAttack(attack.output) : Interaction.none();
            case DEBUFF:
                return mutual ? Interaction.debuffWithAttack(attack.output) : Interaction.none();
            default:
                return Interaction.none();
        }
    }
}
