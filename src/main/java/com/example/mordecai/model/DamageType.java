package com.example.mordecai.model;

/**
 * Damage types a weapon can deal. Armor absorbs each type separately.
 */
public enum DamageType {
    BASHING("bashing"),
    CUTTING("cutting"),
    PIERCING("piercing"),
    PROJECTILE("projectile"),
    ENERGY("energy"),
    HEAT("heat"),
    COLD("cold"),
    ACID("acid");

    public final String key;

    DamageType(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static DamageType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (DamageType t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
