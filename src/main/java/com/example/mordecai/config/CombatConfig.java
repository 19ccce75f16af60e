package com.example.mordecai.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

/**
 * Tunables for the combat core, read from {@code /config/combat.yaml} on the
 * classpath. Every key is optional and falls back to its default.
 */
public class CombatConfig {

    private static final Logger logger = LoggerFactory.getLogger(CombatConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/combat.yaml";

    private final long healthTickMillis;
    private final long effectTickMillis;
    private final int roundSeconds;
    private final int passiveVitalityRegenMinutes;
    private final int woundHealIntervalHours;
    private final double defaultFleeThreshold;
    private final int minFatigueForDodge;
    private final int maxExplosionRerolls;

    private CombatConfig(Map<String, Object> map) {
        this.healthTickMillis = getLong(map, "healthTickMillis", 3000L);
        this.effectTickMillis = getLong(map, "effectTickMillis", 1000L);
        this.roundSeconds = getInt(map, "roundSeconds", 3);
        this.passiveVitalityRegenMinutes = getInt(map, "passiveVitalityRegenMinutes", 60);
        this.woundHealIntervalHours = getInt(map, "woundHealIntervalHours", 4);
        this.defaultFleeThreshold = getDouble(map, "defaultFleeThreshold", 0.25);
        this.minFatigueForDodge = getInt(map, "minFatigueForDodge", 3);
        this.maxExplosionRerolls = getInt(map, "maxExplosionRerolls", 20);
    }

    public static CombatConfig defaults() {
        return new CombatConfig(Collections.emptyMap());
    }

    public static CombatConfig fromMap(Map<String, Object> map) {
        return new CombatConfig(map == null ? Collections.emptyMap() : map);
    }

    public static CombatConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource. A missing or unreadable file yields the defaults.
     */
    public static CombatConfig load(String resource) {
        try (InputStream in = CombatConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("[CombatConfig] {} not found, using defaults", resource);
                return defaults();
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            CombatConfig config = fromMap(root);
            logger.info("[CombatConfig] loaded {}", resource);
            return config;
        } catch (Exception e) {
            logger.error("[CombatConfig] failed to read {}, using defaults", resource, e);
            return defaults();
        }
    }

    public long getHealthTickMillis() { return healthTickMillis; }
    public long getEffectTickMillis() { return effectTickMillis; }
    public int getRoundSeconds() { return roundSeconds; }
    public int getPassiveVitalityRegenMinutes() { return passiveVitalityRegenMinutes; }
    public int getWoundHealIntervalHours() { return woundHealIntervalHours; }
    public double getDefaultFleeThreshold() { return defaultFleeThreshold; }
    public int getMinFatigueForDodge() { return minFatigueForDodge; }
    public int getMaxExplosionRerolls() { return maxExplosionRerolls; }

    public long getRoundMillis() { return roundSeconds * 1000L; }
    public long getPassiveVitalityRegenMillis() { return passiveVitalityRegenMinutes * 60_000L; }
    public long getWoundHealIntervalMillis() { return woundHealIntervalHours * 3_600_000L; }

    // YAML helper methods
    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try {
                return Integer.parseInt(((String) val).trim());
            } catch (NumberFormatException e) {
                logger.warn("[CombatConfig] bad value for {}: '{}', using {}", key, val, defaultVal);
            }
        }
        return defaultVal;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).longValue();
        if (val instanceof String) {
            try {
                return Long.parseLong(((String) val).trim());
            } catch (NumberFormatException e) {
                logger.warn("[CombatConfig] bad value for {}: '{}', using {}", key, val, defaultVal);
            }
        }
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try {
                return Double.parseDouble(((String) val).trim());
            } catch (NumberFormatException e) {
                logger.warn("[CombatConfig] bad value for {}: '{}', using {}", key, val, defaultVal);
            }
        }
        return defaultVal;
    }
}
