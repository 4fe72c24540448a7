package com.example.skirmish.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable numbers for round resolution, loaded from {@code /config/combat.yaml}.
 *
 * Any key missing from the file keeps its built-in default, so an empty or absent
 * file gives the stock d20 bands, rank tables and scaling weights.
 */
public class CombatSettings {
    private static final Logger logger = LoggerFactory.getLogger(CombatSettings.class);

    public static final String DEFAULT_RESOURCE = "/config/combat.yaml";
    public static final String DEFAULT_DB_URL = "jdbc:h2:file:./data/skirmish;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";

    private static volatile CombatSettings instance;

    private String dbUrl = DEFAULT_DB_URL;
    private String dbUser = "sa";
    private String dbPassword = "";

    // d20 bands: roll <= poorMaxRoll is Poor, roll <= standardMaxRoll is Standard, above is Critical
    private int poorMaxRoll = 3;
    private int standardMaxRoll = 17;

    private RankTable skillRanks = RankTable.SKILL_DEFAULT;
    private RankTable branchRanks = RankTable.BRANCH_DEFAULT;

    private final Map<Integer, double[]> scalingWeights = new HashMap<>();

    private long impactCacheTtlSeconds = 30;
    private int roundNumberRetries = 3;
    private int resolvedRoundsPageSize = 10;

    public CombatSettings() {
        scalingWeights.put(1, new double[] {1.0});
        scalingWeights.put(2, new double[] {0.7, 0.3});
        scalingWeights.put(3, new double[] {0.6, 0.25, 0.15});
    }

    /**
     * Shared settings, loaded once from the classpath resource.
     */
    public static CombatSettings getInstance() {
        CombatSettings local = instance;
        if (local == null) {
            synchronized (CombatSettings.class) {
                local = instance;
                if (local == null) {
                    local = loadFromResource(DEFAULT_RESOURCE);
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Load settings from a classpath resource. A missing resource yields defaults.
     */
    public static CombatSettings loadFromResource(String resourcePath) {
        CombatSettings settings = new CombatSettings();
        try (InputStream in = CombatSettings.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.info("[CombatSettings] {} not found, using defaults", resourcePath);
            } else {
                Yaml yaml = new Yaml();
                Map<String, Object> root = yaml.load(in);
                if (root != null) {
                    settings.apply(root);
                }
                logger.info("[CombatSettings] loaded {}", resourcePath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read combat settings from " + resourcePath, e);
        }
        settings.applyOverrides();
        return settings;
    }

    @SuppressWarnings("unchecked")
    void apply(Map<String, Object> root) {
        Map<String, Object> database = section(root, "database");
        if (database != null) {
            if (database.get("url") != null) dbUrl = str(database.get("url"));
            if (database.get("user") != null) dbUser = str(database.get("user"));
            if (database.get("password") != null) dbPassword = str(database.get("password"));
        }

        Map<String, Object> outcome = section(root, "outcome");
        if (outcome != null) {
            poorMaxRoll = intOr(outcome.get("poorMaxRoll"), poorMaxRoll);
            standardMaxRoll = intOr(outcome.get("standardMaxRoll"), standardMaxRoll);
            if (poorMaxRoll < 1 || standardMaxRoll <= poorMaxRoll || standardMaxRoll >= 20) {
                throw new IllegalArgumentException("Invalid d20 bands: poorMaxRoll=" + poorMaxRoll
                        + ", standardMaxRoll=" + standardMaxRoll);
            }
        }

        skillRanks = rankTable(section(root, "skillRanks"), skillRanks);
        branchRanks = rankTable(section(root, "branchRanks"), branchRanks);

        Object weights = root.get("scalingWeights");
        if (weights instanceof Map) {
            // YAML reads the numeric keys as Integer
            for (Map.Entry<?, ?> e : ((Map<?, ?>) weights).entrySet()) {
                int count = Integer.parseInt(String.valueOf(e.getKey()).trim());
                double[] values = doubles((List<Object>) e.getValue());
                if (values.length != count) {
                    throw new IllegalArgumentException("scalingWeights." + count + " needs " + count + " values");
                }
                scalingWeights.put(count, values);
            }
        }

        Map<String, Object> rounds = section(root, "rounds");
        if (rounds != null) {
            roundNumberRetries = intOr(rounds.get("numberRetries"), roundNumberRetries);
            resolvedRoundsPageSize = intOr(rounds.get("resolvedPageSize"), resolvedRoundsPageSize);
        }
        Map<String, Object> cache = section(root, "impactCache");
        if (cache != null) {
            impactCacheTtlSeconds = intOr(cache.get("ttlSeconds"), (int) impactCacheTtlSeconds);
        }
    }

    /**
     * System property {@code skirmish.db.url}, then env {@code SKIRMISH_DB_URL}, win over the file.
     */
    private void applyOverrides() {
        String env = System.getenv("SKIRMISH_DB_URL");
        if (env != null && !env.isBlank()) dbUrl = env;
        String prop = System.getProperty("skirmish.db.url");
        if (prop != null && !prop.isBlank()) dbUrl = prop;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object value = root.get(key);
        if (value == null) return null;
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping under '" + key + "'");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static RankTable rankTable(Map<String, Object> node, RankTable fallback) {
        if (node == null) return fallback;
        List<Object> thresholds = (List<Object>) node.get("thresholds");
        List<Object> multipliers = (List<Object>) node.get("multipliers");
        if (thresholds == null || multipliers == null) return fallback;
        int[] t = new int[thresholds.size()];
        for (int i = 0; i < t.length; i++) {
            t[i] = ((Number) thresholds.get(i)).intValue();
        }
        return new RankTable(t, doubles(multipliers));
    }

    private static double[] doubles(List<Object> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) values.get(i)).doubleValue();
        }
        return out;
    }

    private static int intOr(Object o, int fallback) {
        if (o == null) return fallback;
        if (o instanceof Number) return ((Number) o).intValue();
        return Integer.parseInt(o.toString().trim());
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    // Getters

    public String getDbUrl() { return dbUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }
    public int getPoorMaxRoll() { return poorMaxRoll; }
    public int getStandardMaxRoll() { return standardMaxRoll; }
    public RankTable getSkillRanks() { return skillRanks; }
    public RankTable getBranchRanks() { return branchRanks; }
    public long getImpactCacheTtlSeconds() { return impactCacheTtlSeconds; }
    public int getRoundNumberRetries() { return roundNumberRetries; }
    public int getResolvedRoundsPageSize() { return resolvedRoundsPageSize; }

    /**
     * Positional weights for the given number of scaling stats (1-3).
     */
    public double[] getScalingWeights(int statCount) {
        double[] w = scalingWeights.get(statCount);
        if (w == null) {
            throw new IllegalArgumentException("No scaling weights for " + statCount + " stats");
        }
        return w.clone();
    }
}
