package com.example.skirmish.util;

import com.example.skirmish.model.CharacterSkill;
import com.example.skirmish.model.CharacterSkillBranch;
import com.example.skirmish.model.Skill;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.SkillUsageDAO;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Counts skill uses and derives skill and branch ranks.
 *
 * Every successful use adds one to the skill's counter and one to its branch's counter.
 * Ranks come from the same tables the outcome calculator uses for its multipliers:
 * 5 skill ranks, 10 branch ranks.
 */
public class ProficiencyTracker {

    /**
     * Outcome of recording one use.
     */
    public static class Result {
        private final String skillName;
        private final String branchName;
        private final CharacterSkill skill;
        private final CharacterSkillBranch branch;
        private final int oldSkillRank;
        private final int oldBranchRank;

        public Result(String skillName, String branchName, CharacterSkill skill, CharacterSkillBranch branch,
                      int oldSkillRank, int oldBranchRank) {
            this.skillName = skillName;
            this.branchName = branchName;
            this.skill = skill;
            this.branch = branch;
            this.oldSkillRank = oldSkillRank;
            this.oldBranchRank = oldBranchRank;
        }

        public int getSkillUses() { return skill.getUses(); }
        public int getSkillRank() { return skill.getRank(); }
        public int getBranchUses() { return branch.getUses(); }
        public int getBranchRank() { return branch.getRank(); }
        public boolean hasSkillRankedUp() { return skill.getRank() > oldSkillRank; }
        public boolean hasBranchRankedUp() { return branch.getRank() > oldBranchRank; }

        /**
         * Message for the player, or null when neither rank changed.
         */
        public String getImprovementMessage() {
            StringBuilder sb = new StringBuilder();
            if (hasSkillRankedUp()) {
                sb.append("Your ").append(skillName).append(" has reached ")
                  .append(RankTable.rankLabel(skill.getRank())).append("!");
            }
            if (hasBranchRankedUp()) {
                if (sb.length() > 0) sb.append(' ');
                String branchLabel = branchName != null ? branchName : "this branch";
                sb.append("Your mastery of ").append(branchLabel).append(" has reached ")
                  .append(RankTable.rankLabel(branch.getRank())).append("!");
            }
            return sb.length() > 0 ? sb.toString() : null;
        }
    }

    /**
     * Current uses and ranks; rank 1 with 0 uses when nothing is recorded yet.
     */
    public static class UsageInfo {
        private final int skillUses;
        private final int skillRank;
        private final int branchUses;
        private final int branchRank;

        public UsageInfo(int skillUses, int skillRank, int branchUses, int branchRank) {
            this.skillUses = skillUses;
            this.skillRank = skillRank;
            this.branchUses = branchUses;
            this.branchRank = branchRank;
        }

        public int getSkillUses() { return skillUses; }
        public int getSkillRank() { return skillRank; }
        public int getBranchUses() { return branchUses; }
        public int getBranchRank() { return branchRank; }
    }

    private final Database db;
    private final SkillUsageDAO usageDAO;
    private final CombatSettings settings;

    public ProficiencyTracker(Database db, SkillUsageDAO usageDAO, CombatSettings settings) {
        this.db = db;
        this.usageDAO = usageDAO;
        this.settings = settings;
    }

    /**
     * Record one use inside the caller's transaction.
     */
    public Result recordUse(Connection c, int characterId, Skill skill) throws SQLException {
        CharacterSkill skillRow = usageDAO.incrementSkill(c, characterId, skill.getId(), settings.getSkillRanks());
        CharacterSkillBranch branchRow = usageDAO.incrementBranch(c, characterId, skill.getBranchId(),
                settings.getBranchRanks());
        int oldSkillRank = settings.getSkillRanks().rankFor(skillRow.getUses() - 1);
        int oldBranchRank = settings.getBranchRanks().rankFor(branchRow.getUses() - 1);
        return new Result(skill.getName(), skill.getBranchName(), skillRow, branchRow, oldSkillRank, oldBranchRank);
    }

    /**
     * Record one use in its own transaction.
     */
    public Result recordUse(int characterId, Skill skill) {
        return db.inTransaction("record use of skill " + skill.getId(), c -> recordUse(c, characterId, skill));
    }

    public UsageInfo getUsageInfo(int characterId, int skillId, int branchId) {
        UsageCounts counts = usageDAO.getUsageCounts(characterId, skillId, branchId);
        return new UsageInfo(
                counts.getSkillUses(), settings.getSkillRanks().rankFor(counts.getSkillUses()),
                counts.getBranchUses(), settings.getBranchRanks().rankFor(counts.getBranchUses()));
    }
}
