package com.example.mordecai.model;

/**
 * Scaling tier for weapons and armor. A weapon whose tier exceeds the armor's
 * loses one point of that armor's absorption per tier of difference.
 */
public enum DamageClass {
    CLASS_1(1),
    CLASS_2(2),
    CLASS_3(3),
    CLASS_4(4);

    private final int tier;

    DamageClass(int tier) {
        this.tier = tier;
    }

    public int getTier() { return tier; }

    public static DamageClass fromTier(int tier) {
        for (DamageClass c : values()) if (c.tier == tier) return c;
        return null;
    }
}
