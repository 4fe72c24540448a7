package com.example.skirmish.combat;

import com.example.skirmish.model.RollQuality;
import com.example.skirmish.model.SkillCategory;

import java.time.Instant;

/**
 * One character's submitted action in a round.
 * Everything except {@code processed} and {@code clashResult} is fixed at submission.
 */
public class CombatAction {
    private final long id;
    private final long roundId;
    private final int characterId;
    private final int skillId;
    private final Integer targetId;
    private final int finalOutput;
    private final double outcomeMultiplier;
    private final RollQuality rollQuality;
    private final ActionSnapshot.SkillData skillData;
    private final ActionSnapshot.CharacterData characterData;
    private final ActionSnapshot.TargetData targetData;
    private final Instant submittedAt;
    private final boolean processed;
    private final RoundResolution.Clash clashResult;

    public CombatAction(long id, long roundId, int characterId, int skillId, Integer targetId,
                        int finalOutput, double outcomeMultiplier, RollQuality rollQuality,
                        ActionSnapshot.SkillData skillData, ActionSnapshot.CharacterData characterData,
                        ActionSnapshot.TargetData targetData, Instant submittedAt,
                        boolean processed, RoundResolution.Clash clashResult) {
        this.id = id;
        this.roundId = roundId;
        this.characterId = characterId;
        this.skillId = skillId;
        this.targetId = targetId;
        this.finalOutput = finalOutput;
        this.outcomeMultiplier = outcomeMultiplier;
        this.rollQuality = rollQuality;
        this.skillData = skillData;
        this.characterData = characterData;
        this.targetData = targetData;
        this.submittedAt = submittedAt;
        this.processed = processed;
        this.clashResult = clashResult;
    }

    public long getId() { return id; }
    public long getRoundId() { return roundId; }
    public int getCharacterId() { return characterId; }
    public int getSkillId() { return skillId; }

    /** Resolved target character, null for untargeted skills. */
    public Integer getTargetId() { return targetId; }
    public int getFinalOutput() { return finalOutput; }
    public double getOutcomeMultiplier() { return outcomeMultiplier; }
    public RollQuality getRollQuality() { return rollQuality; }
    public ActionSnapshot.SkillData getSkillData() { return skillData; }
    public ActionSnapshot.CharacterData getCharacterData() { return characterData; }
    public ActionSnapshot.TargetData getTargetData() { return targetData; }
    public Instant getSubmittedAt() { return submittedAt; }
    public boolean isProcessed() { return processed; }
    public RoundResolution.Clash getClashResult() { return clashResult; }

    public SkillCategory getCategory() {
        return skillData.getCategory();
    }

    public String getCharacterName() {
        return characterData.getName();
    }

    public String getSkillName() {
        return skillData.getName();
    }

    @Override
    public String toString() {
        return "CombatAction{id=" + id + ", round=" + roundId + ", character=" + characterId
                + ", skill=" + skillId + ", target=" + targetId + ", output=" + finalOutput + "}";
    }
}
