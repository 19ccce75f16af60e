package com.example.mordecai.model;

/**
 * Body location tag carried by wound effects. GENERAL is used when a wound
 * is applied without a specific hit.
 */
public enum BodyLocation {
    GENERAL,
    HEAD,
    TORSO,
    LEFT_ARM,
    RIGHT_ARM,
    LEFT_LEG,
    RIGHT_LEG;

    public static BodyLocation fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return BodyLocation.valueOf(str.trim().toUpperCase().replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
