package com.example.skirmish.util;

/**
 * Skill and branch use counts for one character, read together.
 */
public final class UsageCounts {
    public static final UsageCounts NONE = new UsageCounts(0, 0);

    private final int skillUses;
    private final int branchUses;

    public UsageCounts(int skillUses, int branchUses) {
        this.skillUses = skillUses;
        this.branchUses = branchUses;
    }

    public int getSkillUses() { return skillUses; }
    public int getBranchUses() { return branchUses; }

    @Override
    public String toString() {
        return "UsageCounts{skill=" + skillUses + ", branch=" + branchUses + "}";
    }
}
