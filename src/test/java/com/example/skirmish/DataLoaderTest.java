package com.example.skirmish;

import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;
import com.example.skirmish.persistence.DataLoader;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.SkillDAO;
import com.example.skirmish.persistence.StatDefinitionDAO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataLoader Tests")
class DataLoaderTest {

    private Database db;

    @BeforeEach
    void setUp() {
        db = CombatFixtures.freshDatabase();
    }

    @Test
    @DisplayName("Default data loads stats, branches and skills")
    void loadDefaults() {
        DataLoader.loadDefaults(db);

        StatDefinitionDAO stats = new StatDefinitionDAO(db);
        assertEquals(Set.of("STR", "DEX", "RES", "MN", "CHA"), stats.getPrimaryStatNames());
        assertEquals(Set.of("aether"), stats.getActiveStatNames("resource"));

        List<Skill> skills = new SkillDAO(db).findAll();
        assertEquals(6, skills.size());
    }

    @Test
    @DisplayName("Skill categories come from the type name")
    void skillCategories() {
        DataLoader.loadDefaults(db);
        SkillDAO dao = new SkillDAO(db);

        assertEquals(SkillCategory.ATTACK, dao.findById(1).orElseThrow().getCategory());
        assertEquals(SkillCategory.DEFENCE, dao.findById(2).orElseThrow().getCategory());
        assertEquals(SkillCategory.COUNTER, dao.findById(3).orElseThrow().getCategory());
        assertEquals(SkillCategory.HEAL, dao.findById(4).orElseThrow().getCategory());
        assertEquals(SkillCategory.DEBUFF, dao.findById(5).orElseThrow().getCategory());
        assertEquals(SkillCategory.CRAFTING, dao.findById(6).orElseThrow().getCategory());
    }

    @Test
    @DisplayName("Skill fields survive the round trip through the database")
    void skillFields() {
        DataLoader.loadDefaults(db);
        Skill fireSlash = new SkillDAO(db).findById(1).orElseThrow();

        assertEquals("Fire Slash", fireSlash.getName());
        assertEquals("Fire Attack", fireSlash.getTypeName());
        assertEquals(1, fireSlash.getBranchId());
        assertEquals("Pyromancy", fireSlash.getBranchName());
        assertEquals(12.0, fireSlash.getBasePower(), 1e-9);
        assertEquals(5, fireSlash.getAetherCost());
        assertEquals(SkillTarget.OTHER, fireSlash.getTarget());
        assertEquals(List.of("STR", "MN"), fireSlash.getScalingStats());
        assertEquals(Map.of("STR", 5), fireSlash.getRequiredStats());

        Skill forge = new SkillDAO(db).findById(6).orElseThrow();
        assertEquals(SkillTarget.SELF, forge.getTarget());
        assertEquals("Chronomancy", forge.getBranchName());
    }

    @Test
    @DisplayName("Loading twice does not duplicate rows")
    void idempotent() {
        DataLoader.loadDefaults(db);
        DataLoader.loadDefaults(db);

        assertEquals(6, new SkillDAO(db).findAll().size());
        assertEquals(5, new StatDefinitionDAO(db).getPrimaryStatNames().size());
    }

    @Test
    @DisplayName("A skill with no base power is rejected")
    void zeroBasePowerRejected() {
        SkillDAO dao = new SkillDAO(db);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DataLoader.loadSkills(dao, "/data/skills-zero-power.yaml"));

        assertTrue(e.getMessage().contains("Idle Hands"));
        assertTrue(dao.findById(9).isEmpty());
    }

    @Test
    @DisplayName("A missing resource loads nothing")
    void missingResource() {
        assertEquals(0, DataLoader.loadSkills(new SkillDAO(db), "/data/missing.yaml"));
        assertEquals(0, DataLoader.loadStats(new StatDefinitionDAO(db), "/data/missing.yaml"));
    }
}
