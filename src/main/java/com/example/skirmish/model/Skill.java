package com.example.skirmish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a skill definition.
 * Output scales with up to three stats; use counts on the skill and on its branch
 * raise the rank multipliers applied on top of that.
 */
public class Skill {
    public static final int MAX_SCALING_STATS = 3;

    private final int id;
    private final String name;
    private final String description;
    private final String typeName;
    private final SkillCategory category;
    private final int branchId;
    private final String branchName;
    private final double basePower;
    private final int aetherCost;
    private final SkillTarget target;
    private final List<String> scalingStats;
    private final Map<String, Integer> requiredStats;
    private final boolean passive;

    public Skill(int id, String name, String typeName, int branchId, double basePower, int aetherCost,
                 SkillTarget target) {
        this(id, name, null, typeName, null, branchId, null, basePower, aetherCost, target, null, null, false);
    }

    /**
     * Full constructor. A null category is classified from the type name.
     */
    public Skill(int id, String name, String description, String typeName, SkillCategory category,
                 int branchId, String branchName, double basePower, int aetherCost, SkillTarget target,
                 List<String> scalingStats, Map<String, Integer> requiredStats, boolean passive) {
        this.id = id;
        this.name = name;
        this.description = description != null ? description : "";
        this.typeName = typeName;
        this.category = category != null ? category : SkillCategory.classify(typeName);
        this.branchId = branchId;
        this.branchName = branchName;
        this.basePower = basePower;
        this.aetherCost = Math.max(0, aetherCost);
        this.target = target != null ? target : SkillTarget.ANY;
        this.scalingStats = scalingStats != null ? new ArrayList<>(scalingStats) : new ArrayList<>();
        if (this.scalingStats.size() > MAX_SCALING_STATS) {
            throw new IllegalArgumentException("Skill " + name + " scales with " + this.scalingStats.size()
                    + " stats; at most " + MAX_SCALING_STATS + " are allowed");
        }
        this.requiredStats = requiredStats != null ? new LinkedHashMap<>(requiredStats) : new LinkedHashMap<>();
        this.passive = passive;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getTypeName() { return typeName; }
    public SkillCategory getCategory() { return category; }
    public int getBranchId() { return branchId; }
    public String getBranchName() { return branchName; }
    public double getBasePower() { return basePower; }
    public int getAetherCost() { return aetherCost; }
    public SkillTarget getTarget() { return target; }
    public List<String> getScalingStats() { return Collections.unmodifiableList(scalingStats); }
    public Map<String, Integer> getRequiredStats() { return Collections.unmodifiableMap(requiredStats); }
    public boolean isPassive() { return passive; }

    @Override
    public String toString() {
        return "Skill{id=" + id + ", name='" + name + "', category=" + category + "}";
    }
}
