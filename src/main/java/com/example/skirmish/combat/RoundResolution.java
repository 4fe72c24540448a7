package com.example.skirmish.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured result of resolving a round. Stored on the round and handed to the
 * report writer, which renders it without recomputing anything.
 */
public class RoundResolution {
    private final long roundId;
    private final int roundNumber;
    private final List<Clash> clashes;
    private final List<IndependentAction> independentActions;
    private final Summary summary;

    @JsonCreator
    public RoundResolution(@JsonProperty("roundId") long roundId,
                           @JsonProperty("roundNumber") int roundNumber,
                           @JsonProperty("clashes") List<Clash> clashes,
                           @JsonProperty("independentActions") List<IndependentAction> independentActions) {
        this.roundId = roundId;
        this.roundNumber = roundNumber;
        this.clashes = clashes != null ? new ArrayList<>(clashes) : new ArrayList<>();
        this.independentActions = independentActions != null ? new ArrayList<>(independentActions) : new ArrayList<>();
        this.summary = new Summary(this.clashes.size() * 2 + this.independentActions.size(),
                this.clashes.size(), this.independentActions.size());
    }

    public long getRoundId() { return roundId; }
    public int getRoundNumber() { return roundNumber; }
    public List<Clash> getClashes() { return Collections.unmodifiableList(clashes); }
    public List<IndependentAction> getIndependentActions() { return Collections.unmodifiableList(independentActions); }
    public Summary getSummary() { return summary; }

    public static class Summary {
        private final int totalActions;
        private final int clashCount;
        private final int independentCount;

        @JsonCreator
        public Summary(@JsonProperty("totalActions") int totalActions,
                       @JsonProperty("clashCount") int clashCount,
                       @JsonProperty("independentCount") int independentCount) {
            this.totalActions = totalActions;
            this.clashCount = clashCount;
            this.independentCount = independentCount;
        }

        public int getTotalActions() { return totalActions; }
        public int getClashCount() { return clashCount; }
        public int getIndependentCount() { return independentCount; }
    }

    /**
     * One side of a clash as it appears in the report.
     */
    public static class Participant {
        private final int characterId;
        private final String character;
        private final String skill;
        private final String skillType;
        private final String target;
        private final int finalOutput;
        private final String rollQuality;
        private final int damageTaken;

        @JsonCreator
        public Participant(@JsonProperty("characterId") int characterId,
                           @JsonProperty("character") String character,
                           @JsonProperty("skill") String skill,
                           @JsonProperty("skillType") String skillType,
                           @JsonProperty("target") String target,
                           @JsonProperty("finalOutput") int finalOutput,
                           @JsonProperty("rollQuality") String rollQuality,
                           @JsonProperty("damageTaken") int damageTaken) {
            this.characterId = characterId;
            this.character = character;
            this.skill = skill;
            this.skillType = skillType;
            this.target = target;
            this.finalOutput = finalOutput;
            this.rollQuality = rollQuality;
            this.damageTaken = damageTaken;
        }

        public int getCharacterId() { return characterId; }
        public String getCharacter() { return character; }
        public String getSkill() { return skill; }
        public String getSkillType() { return skillType; }
        public String getTarget() { return target; }
        public int getFinalOutput() { return finalOutput; }
        public String getRollQuality() { return rollQuality; }
        public int getDamageTaken() { return damageTaken; }
    }

    public static class Clash {
        private final boolean clash;
        private final List<Participant> participants;
        private final String interaction;
        private final String winner;
        private final int absorbed;
        private final String protectedTarget;
        private final int protectedTargetDamage;
        private final List<String> effects;
        private final String resolution;

        @JsonCreator
        public Clash(@JsonProperty("isClash") boolean clash,
                     @JsonProperty("participants") List<Participant> participants,
                     @JsonProperty("interaction") String interaction,
                     @JsonProperty("winner") String winner,
                     @JsonProperty("absorbed") int absorbed,
                     @JsonProperty("protectedTarget") String protectedTarget,
                     @JsonProperty("protectedTargetDamage") int protectedTargetDamage,
                     @JsonProperty("effects") List<String> effects,
                     @JsonProperty("resolution") String resolution) {
            this.clash = clash;
            this.participants = participants != null ? new ArrayList<>(participants) : new ArrayList<>();
            this.interaction = interaction;
            this.winner = winner;
            this.absorbed = absorbed;
            this.protectedTarget = protectedTarget;
            this.protectedTargetDamage = protectedTargetDamage;
            this.effects = effects != null ? new ArrayList<>(effects) : new ArrayList<>();
            this.resolution = resolution;
        }

        @JsonProperty("isClash")
        public boolean isClash() { return clash; }
        public List<Participant> getParticipants() { return Collections.unmodifiableList(participants); }
        public String getInteraction() { return interaction; }

        /** Winner's name, "tie", or null when the interaction has no winner. */
        public String getWinner() { return winner; }
        public int getAbsorbed() { return absorbed; }

        /** Third party the defender shielded, or null when the defender was the one attacked. */
        public String getProtectedTarget() { return protectedTarget; }
        public int getProtectedTargetDamage() { return protectedTargetDamage; }
        public List<String> getEffects() { return Collections.unmodifiableList(effects); }
        public String getResolution() { return resolution; }
    }

    public static class IndependentAction {
        private final int characterId;
        private final String character;
        private final String skill;
        private final String skillType;
        private final String target;
        private final int finalOutput;
        private final String rollQuality;
        private final String details;

        @JsonCreator
        public IndependentAction(@JsonProperty("characterId") int characterId,
                                 @JsonProperty("character") String character,
                                 @JsonProperty("skill") String skill,
                                 @JsonProperty("skillType") String skillType,
                                 @JsonProperty("target") String target,
                                 @JsonProperty("finalOutput") int finalOutput,
                                 @JsonProperty("rollQuality") String rollQuality,
                                 @JsonProperty("details") String details) {
            this.characterId = characterId;
            this.character = character;
            this.skill = skill;
            this.skillType = skillType;
            this.target = target;
            this.finalOutput = finalOutput;
            this.rollQuality = rollQuality;
            this.details = details;
        }

        @JsonProperty("isClash")
        public boolean isClash() { return false; }
        public int getCharacterId() { return characterId; }
        public String getCharacter() { return character; }
        public String getSkill() { return skill; }
        public String getSkillType() { return skillType; }
        public String getTarget() { return target; }
        public int getFinalOutput() { return finalOutput; }
        public String getRollQuality() { return rollQuality; }
        public String getDetails() { return details; }
    }
}
