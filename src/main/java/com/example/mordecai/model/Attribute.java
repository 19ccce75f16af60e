package com.example.mordecai.model;

/**
 * Core attributes every combatant exposes. Weapon skill, dodge and the
 * physicality damage check all read from these.
 */
public enum Attribute {
    PHYSICALITY("physicality", "Physicality"),
    DODGE("dodge", "Dodge"),
    DRIVE("drive", "Drive"),
    REASONING("reasoning", "Reasoning"),
    AWARENESS("awareness", "Awareness"),
    FOCUS("focus", "Focus"),
    BEARING("bearing", "Bearing");

    public final String key;
    public final String displayName;

    Attribute(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static Attribute fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Attribute a : values()) if (a.key.equals(k) || a.name().toLowerCase().equals(k)) return a;
        return null;
    }
}
