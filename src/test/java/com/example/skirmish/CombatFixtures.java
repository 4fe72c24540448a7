package com.example.skirmish;

import com.example.skirmish.combat.ActionSnapshot;
import com.example.skirmish.combat.CombatAction;
import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.RollQuality;
import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;
import com.example.skirmish.persistence.Database;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shared builders for combat tests.
 */
final class CombatFixtures {

    static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

    private CombatFixtures() { }

    /** A private in-memory database that lives until the JVM exits. */
    static Database freshDatabase() {
        return new Database("jdbc:h2:mem:skirmish-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    }

    static Map<String, Integer> stats(int str, int dex, int res, int mn, int cha, int aether) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("STR", str);
        stats.put("DEX", dex);
        stats.put("RES", res);
        stats.put("MN", mn);
        stats.put("CHA", cha);
        stats.put(GameCharacter.AETHER, aether);
        return stats;
    }

    /**
     * An unsaved action. Submission time is {@code T0 + order} seconds.
     */
    static CombatAction action(long id, int characterId, Integer targetId, SkillCategory category,
                               int output, int order) {
        Skill skill = new Skill((int) id, category.getDisplayName() + " skill", null, category.getDisplayName(),
                category, 1, "Pyromancy", 10, 0, targetId == null ? SkillTarget.NONE : SkillTarget.OTHER,
                null, null, false);
        GameCharacter caster = new GameCharacter(characterId, characterId, "C" + characterId, null, Map.of(), true);
        ActionSnapshot.TargetData target = targetId == null ? null
                : new ActionSnapshot.TargetData(targetId, "C" + targetId);
        return new CombatAction(id, 1L, characterId, (int) id, targetId, output, 1.0, RollQuality.STANDARD,
                ActionSnapshot.SkillData.of(skill), ActionSnapshot.CharacterData.of(caster), target,
                T0.plusSeconds(order), false, null);
    }
}
