package com.example.skirmish.combat;

import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display data frozen onto an action when it is submitted.
 * Later edits to the skill or character never change what a round reports.
 */
public final class ActionSnapshot {

    private ActionSnapshot() { }

    public static class SkillData {
        private final int id;
        private final String name;
        private final String typeName;
        private final SkillCategory category;
        private final int branchId;
        private final String branchName;
        private final SkillTarget target;
        private final double basePower;

        @JsonCreator
        public SkillData(@JsonProperty("id") int id,
                         @JsonProperty("name") String name,
                         @JsonProperty("typeName") String typeName,
                         @JsonProperty("category") SkillCategory category,
                         @JsonProperty("branchId") int branchId,
                         @JsonProperty("branchName") String branchName,
                         @JsonProperty("target") SkillTarget target,
                         @JsonProperty("basePower") double basePower) {
            this.id = id;
            this.name = name;
            this.typeName = typeName;
            this.category = category;
            this.branchId = branchId;
            this.branchName = branchName;
            this.target = target;
            this.basePower = basePower;
        }

        public static SkillData of(Skill skill) {
            return new SkillData(skill.getId(), skill.getName(), skill.getTypeName(), skill.getCategory(),
                    skill.getBranchId(), skill.getBranchName(), skill.getTarget(), skill.getBasePower());
        }

        public int getId() { return id; }
        public String getName() { return name; }
        public String getTypeName() { return typeName; }
        public SkillCategory getCategory() { return category; }
        public int getBranchId() { return branchId; }
        public String getBranchName() { return branchName; }
        public SkillTarget getTarget() { return target; }
        public double getBasePower() { return basePower; }
    }

    public static class CharacterData {
        private final int id;
        private final String name;
        private final Map<String, Integer> stats;

        @JsonCreator
        public CharacterData(@JsonProperty("id") int id,
                             @JsonProperty("name") String name,
                             @JsonProperty("stats") Map<String, Integer> stats) {
            this.id = id;
            this.name = name;
            this.stats = stats != null ? new LinkedHashMap<>(stats) : new LinkedHashMap<>();
        }

        public static CharacterData of(GameCharacter character) {
            return new CharacterData(character.getId(), character.getName(), character.getStats());
        }

        public int getId() { return id; }
        public String getName() { return name; }
        public Map<String, Integer> getStats() { return Collections.unmodifiableMap(stats); }
    }

    public static class TargetData {
        private final int id;
        private final String name;

        @JsonCreator
        public TargetData(@JsonProperty("id") int id, @JsonProperty("name") String name) {
            this.id = id;
            this.name = name;
        }

        public static TargetData of(GameCharacter character) {
            return new TargetData(character.getId(), character.getName());
        }

        public int getId() { return id; }
        public String getName() { return name; }
    }
}
