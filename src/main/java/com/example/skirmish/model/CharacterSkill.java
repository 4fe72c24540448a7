package com.example.skirmish.model;

/**
 * A character's usage record for one skill. Created on first use, the count only grows.
 */
public class CharacterSkill {
    private final int characterId;
    private final int skillId;
    private final int uses;
    private final int rank;

    public CharacterSkill(int characterId, int skillId, int uses, int rank) {
        this.characterId = characterId;
        this.skillId = skillId;
        this.uses = uses;
        this.rank = rank;
    }

    public int getCharacterId() { return characterId; }
    public int getSkillId() { return skillId; }
    public int getUses() { return uses; }
    public int getRank() { return rank; }
}
