package com.example.skirmish.model;

/**
 * A character's usage record for a whole skill branch (every skill of the branch counts).
 */
public class CharacterSkillBranch {
    private final int characterId;
    private final int branchId;
    private final int uses;
    private final int rank;

    public CharacterSkillBranch(int characterId, int branchId, int uses, int rank) {
        this.characterId = characterId;
        this.branchId = branchId;
        this.uses = uses;
        this.rank = rank;
    }

    public int getCharacterId() { return characterId; }
    public int getBranchId() { return branchId; }
    public int getUses() { return uses; }
    public int getRank() { return rank; }
}
