package com.example.skirmish.persistence;

import com.example.skirmish.model.Skill;
import com.example.skirmish.model.SkillCategory;
import com.example.skirmish.model.SkillTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds static data from YAML resources on the classpath:
 * <ul>
 *   <li>{@code /data/stats.yaml}: stat definitions</li>
 *   <li>{@code /data/skills.yaml}: skill branches and skills</li>
 * </ul>
 * Rows are merged by key, so loading twice is harmless.
 */
public class DataLoader {
    private static final Logger logger = LoggerFactory.getLogger(DataLoader.class);

    public static final String STATS_RESOURCE = "/data/stats.yaml";
    public static final String SKILLS_RESOURCE = "/data/skills.yaml";

    public static void loadDefaults(Database db) {
        loadStats(new StatDefinitionDAO(db), STATS_RESOURCE);
        loadSkills(new SkillDAO(db), SKILLS_RESOURCE);
    }

    /**
     * @return number of stat definitions loaded
     */
    @SuppressWarnings("unchecked")
    public static int loadStats(StatDefinitionDAO dao, String resource) {
        Map<String, Object> root = readYaml(resource);
        if (root == null) return 0;
        List<Map<String, Object>> stats = (List<Map<String, Object>>) root.get("stats");
        if (stats == null) return 0;

        int count = 0;
        for (Map<String, Object> stat : stats) {
            String internalName = getString(stat, "internalName", null);
            if (internalName == null || internalName.isBlank()) {
                throw new IllegalArgumentException(resource + ": stat entry without internalName");
            }
            dao.save(internalName,
                    getString(stat, "displayName", internalName),
                    getString(stat, "category", StatDefinitionDAO.PRIMARY_STAT),
                    getBoolean(stat, "active", true));
            count++;
        }
        logger.info("[DataLoader] Loaded {} stat definitions from {}", count, resource);
        return count;
    }

    /**
     * @return number of skills loaded
     */
    @SuppressWarnings("unchecked")
    public static int loadSkills(SkillDAO dao, String resource) {
        Map<String, Object> root = readYaml(resource);
        if (root == null) return 0;

        Map<Integer, String> branchNames = new LinkedHashMap<>();
        List<Map<String, Object>> branches = (List<Map<String, Object>>) root.get("branches");
        if (branches != null) {
            for (Map<String, Object> branch : branches) {
                int id = getInt(branch, "id", -1);
                String name = getString(branch, "name", "");
                dao.saveBranch(id, name);
                branchNames.put(id, name);
            }
        }

        List<Map<String, Object>> skills = (List<Map<String, Object>>) root.get("skills");
        if (skills == null) return 0;

        int count = 0;
        for (Map<String, Object> data : skills) {
            int id = getInt(data, "id", -1);
            String name = getString(data, "name", "");
            if (id <= 0 || name.isBlank()) {
                throw new IllegalArgumentException(resource + ": skill entries need a positive id and a name");
            }
            String typeName = getString(data, "type", null);
            // An explicit category wins; otherwise the type name is classified here, once
            String categoryStr = getString(data, "category", null);
            SkillCategory category = categoryStr != null
                    ? SkillCategory.fromString(categoryStr)
                    : SkillCategory.classify(typeName);
            if (category == null) {
                throw new IllegalArgumentException(resource + ": unknown category '" + categoryStr + "' on skill " + name);
            }
            String targetStr = getString(data, "target", "any");
            SkillTarget target = SkillTarget.fromString(targetStr);
            if (target == null) {
                throw new IllegalArgumentException(resource + ": unknown target '" + targetStr + "' on skill " + name);
            }
            int branchId = getInt(data, "branch", 0);
            double basePower = getDouble(data, "basePower", 0);
            if (basePower < 1) {
                throw new IllegalArgumentException(resource + ": basePower of skill " + name + " must be at least 1");
            }

            List<String> scalingStats = new ArrayList<>();
            Object scalingObj = data.get("scalingStats");
            if (scalingObj instanceof List) {
                for (Object s : (List<?>) scalingObj) {
                    scalingStats.add(String.valueOf(s));
                }
            }
            Map<String, Integer> requiredStats = new LinkedHashMap<>();
            Object requiredObj = data.get("requiredStats");
            if (requiredObj instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) requiredObj).entrySet()) {
                    requiredStats.put(String.valueOf(e.getKey()), ((Number) e.getValue()).intValue());
                }
            }

            Skill skill = new Skill(id, name, getString(data, "description", ""), typeName, category, branchId,
                    branchNames.get(branchId), basePower, getInt(data, "aetherCost", 0),
                    target, scalingStats, requiredStats, getBoolean(data, "passive", false));
            dao.saveSkill(skill);
            count++;
        }
        logger.info("[DataLoader] Loaded {} skills from {}", count, resource);
        return count;
    }

    private static Map<String, Object> readYaml(String resource) {
        try (InputStream in = DataLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("[DataLoader] Resource not found: {}", resource);
                return null;
            }
            Yaml yaml = new Yaml();
            return yaml.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }

    // YAML helper methods
    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt((String) val); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble((String) val); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val != null) return Boolean.parseBoolean(val.toString());
        return defaultVal;
    }
}
