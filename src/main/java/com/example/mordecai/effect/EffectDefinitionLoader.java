package com.example.mordecai.effect;

import com.example.mordecai.model.Attribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads effect definitions from {@code /data/effects.yaml} into an
 * {@link EffectRegistry}. Malformed entries are skipped with a warning.
 */
public final class EffectDefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(EffectDefinitionLoader.class);

    public static final String DEFAULT_RESOURCE = "/data/effects.yaml";

    private EffectDefinitionLoader() {}

    public static int loadInto(EffectRegistry registry) {
        return loadInto(registry, DEFAULT_RESOURCE);
    }

    /**
     * @return number of definitions registered
     */
    @SuppressWarnings("unchecked")
    public static int loadInto(EffectRegistry registry, String resource) {
        try (InputStream in = EffectDefinitionLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("[EffectDefinitionLoader] {} not found, no effects loaded", resource);
                return 0;
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            if (root == null) return 0;

            Object listObj = root.get("effects");
            if (!(listObj instanceof List)) {
                logger.warn("[EffectDefinitionLoader] {} has no 'effects' list", resource);
                return 0;
            }

            int count = 0;
            for (Object entry : (List<Object>) listObj) {
                if (!(entry instanceof Map)) continue;
                EffectDefinition def = parseDefinition((Map<String, Object>) entry);
                if (def == null) continue;
                registry.registerDefinition(def);
                count++;
            }
            logger.info("[EffectDefinitionLoader] loaded {} effect definitions from {}", count, resource);
            return count;
        } catch (Exception e) {
            logger.error("[EffectDefinitionLoader] failed to load {}", resource, e);
            return 0;
        }
    }

    @SuppressWarnings("unchecked")
    static EffectDefinition parseDefinition(Map<String, Object> data) {
        String name = getString(data, "name", null);
        if (name == null || name.isBlank()) {
            logger.warn("[EffectDefinitionLoader] skipping effect with no name");
            return null;
        }
        EffectDefinition.Category category = EffectDefinition.Category.fromString(getString(data, "category", null));
        if (category == null) {
            logger.warn("[EffectDefinitionLoader] effect '{}' has an unknown category, skipping", name);
            return null;
        }

        List<EffectImpact> impacts = new ArrayList<>();
        Object impactsObj = data.get("impacts");
        if (impactsObj instanceof List) {
            int order = 0;
            for (Object o : (List<Object>) impactsObj) {
                if (!(o instanceof Map)) continue;
                Map<String, Object> im = (Map<String, Object>) o;
                EffectImpact.ImpactType type = EffectImpact.ImpactType.fromString(getString(im, "type", null));
                if (type == null) {
                    logger.warn("[EffectDefinitionLoader] effect '{}' has an impact of unknown type {}", name, im.get("type"));
                    order++;
                    continue;
                }
                Attribute attr = Attribute.fromKey(getString(im, "attribute", null));
                impacts.add(new EffectImpact(type, attr, getString(im, "skill", null),
                    getDouble(im, "value", 0.0),
                    getBoolean(im, "percentage", false),
                    getBoolean(im, "scalesWithIntensity", true),
                    getInt(im, "order", order)));
                order++;
            }
        }

        return new EffectDefinition(name.trim(),
            getString(data, "description", ""),
            category,
            getBoolean(data, "stackable", false),
            getInt(data, "maxStacks", 1),
            getInt(data, "tickIntervalSeconds", 0),
            getInt(data, "defaultDurationSeconds", 0),
            getDouble(data, "defaultIntensity", 1.0),
            impacts);
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
            try {
                return Integer.parseInt(((String) val).trim());
            } catch (NumberFormatException e) {
                logger.warn("[EffectDefinitionLoader] bad integer for {}: '{}'", key, val);
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
                logger.warn("[EffectDefinitionLoader] bad number for {}: '{}'", key, val);
            }
        }
        return defaultVal;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) return Boolean.parseBoolean(((String) val).trim());
        return defaultVal;
    }
}
