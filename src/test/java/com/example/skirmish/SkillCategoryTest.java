package com.example.skirmish;

import com.example.skirmish.model.SkillCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SkillCategory Tests")
class SkillCategoryTest {

    @ParameterizedTest
    @DisplayName("Type names classify by keyword")
    @CsvSource({
        "Fire Attack, ATTACK",
        "Offensive Strike, ATTACK",
        "Flame Shield, DEFENCE",
        "Defensive Stance, DEFENCE",
        "Ice Counter, COUNTER",
        "Retaliate, COUNTER",
        "Battle Boost, BUFF",
        "Buff, BUFF",
        "Restore, HEAL",
        "Time Curse, DEBUFF",
        "Weaken Armor, DEBUFF",
        "Debuff, DEBUFF",
        "Mind Debuff, DEBUFF",
        "Craft, CRAFTING",
        "Build Barricade, CRAFTING",
        "Passive Aura, PASSIVE"
    })
    void classifiesByKeyword(String typeName, SkillCategory expected) {
        assertEquals(expected, SkillCategory.classify(typeName));
        assertEquals(expected, SkillCategory.classifyStrict(typeName));
    }

    @Test
    @DisplayName("Earlier categories win when several keywords match")
    void firstCategoryWins() {
        assertEquals(SkillCategory.ATTACK, SkillCategory.classify("Counter Attack"));
        assertEquals(SkillCategory.DEFENCE, SkillCategory.classify("Healing Shield"));
    }

    @Test
    @DisplayName("A debuff is never read as a buff")
    void debuffIsNotBuff() {
        assertEquals(SkillCategory.DEBUFF, SkillCategory.classify("Debuff"));
        assertEquals(SkillCategory.DEBUFF, SkillCategory.classify("Armor Debuff Boost"));
        assertEquals(SkillCategory.DEBUFF, SkillCategory.classifyStrict("DEBUFF"));
        assertEquals(SkillCategory.BUFF, SkillCategory.classify("Team Buff"));
    }

    @Test
    @DisplayName("Matching ignores case")
    void caseInsensitive() {
        assertEquals(SkillCategory.HEAL, SkillCategory.classify("GREATER HEAL"));
    }

    @Test
    @DisplayName("Unknown type names fall back to Attack, strict mode rejects them")
    void unknownTypeName() {
        assertNull(SkillCategory.match("Interpretive Dance"));
        assertEquals(SkillCategory.ATTACK, SkillCategory.classify("Interpretive Dance"));
        assertThrows(IllegalArgumentException.class, () -> SkillCategory.classifyStrict("Interpretive Dance"));
    }

    @ParameterizedTest
    @DisplayName("Blank type names are rejected")
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankTypeName(String typeName) {
        assertThrows(IllegalArgumentException.class, () -> SkillCategory.classify(typeName));
        assertThrows(IllegalArgumentException.class, () -> SkillCategory.classifyStrict(typeName));
    }

    @ParameterizedTest
    @DisplayName("Stored categories parse from enum or display names")
    @CsvSource({
        "DEFENCE, DEFENCE",
        "defence, DEFENCE",
        "Crafting, CRAFTING",
        "' heal ', HEAL"
    })
    void fromString(String stored, SkillCategory expected) {
        assertEquals(expected, SkillCategory.fromString(stored));
    }

    @Test
    @DisplayName("fromString returns null for unknown values")
    void fromStringUnknown() {
        assertNull(SkillCategory.fromString("magic"));
        assertNull(SkillCategory.fromString(null));
    }

    @Test
    @DisplayName("Only Buff and Heal are support categories")
    void supportCategories() {
        for (SkillCategory c : SkillCategory.values()) {
            assertEquals(c == SkillCategory.BUFF || c == SkillCategory.HEAL, c.isSupport(), c.name());
        }
    }
}
