package com.example.mordecai.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Combat properties of an armor template: per-damage-type absorption, class
 * tier, dodge penalty, optional explicit hit location coverage and the layer
 * priority used to order overlapping pieces.
 */
public class ArmorProperties {

    private final DamageClass damageClass;
    private final Map<DamageType, Integer> absorption;
    private final int dodgeModifier;
    /** Lower-case coverage tags, e.g. "head", "torso", "arms". Empty means infer from slot. */
    private final Set<String> coverage;
    private final int layerPriority;

    public ArmorProperties(DamageClass damageClass, Map<DamageType, Integer> absorption,
                           int dodgeModifier, String coverage, int layerPriority) {
        this.damageClass = damageClass == null ? DamageClass.CLASS_1 : damageClass;
        this.absorption = new EnumMap<>(DamageType.class);
        if (absorption != null) this.absorption.putAll(absorption);
        this.dodgeModifier = dodgeModifier;
        this.coverage = parseCoverage(coverage);
        this.layerPriority = layerPriority;
    }

    private static Set<String> parseCoverage(String coverage) {
        if (coverage == null || coverage.isBlank()) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        for (String part : coverage.split("[,;|]")) {
            String p = part.trim().toLowerCase();
            if (!p.isEmpty()) out.add(p);
        }
        return Collections.unmodifiableSet(out);
    }

    public DamageClass getDamageClass() { return damageClass; }
    public int getDodgeModifier() { return dodgeModifier; }
    public int getLayerPriority() { return layerPriority; }
    public Set<String> getCoverage() { return coverage; }

    public int getAbsorption(DamageType type) {
        Integer v = absorption.get(type);
        return v == null ? 0 : v;
    }

    public boolean hasExplicitCoverage() {
        return !coverage.isEmpty();
    }

    /**
     * Check the explicit coverage list against a hit location, accepting the
     * usual aliases (chest/body for torso, arm(s), leg(s)).
     */
    public boolean coversExplicitly(HitLocation location) {
        if (coverage.contains(location.getCoverageKey())) return true;
        switch (location) {
            case TORSO:
                return coverage.contains("torso") || coverage.contains("chest") || coverage.contains("body");
            case LEFT_ARM:
            case RIGHT_ARM:
                return coverage.contains("arms") || coverage.contains("arm");
            case LEFT_LEG:
            case RIGHT_LEG:
                return coverage.contains("legs") || coverage.contains("leg");
            default:
                return false;
        }
    }
}
