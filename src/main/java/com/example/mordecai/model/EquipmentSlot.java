package com.example.mordecai.model;

public enum EquipmentSlot {
    HEAD("head", "Head"),
    FACE("face", "Face"),
    NECK("neck", "Neck"),
    SHOULDERS("shoulders", "Shoulders"),
    BACK("back", "Back"),
    CHEST("chest", "Chest"),
    ARM_LEFT("arm_left", "Left Arm"),
    ARM_RIGHT("arm_right", "Right Arm"),
    HANDS("hands", "Hands"),
    WAIST("waist", "Waist"),
    LEGS("legs", "Legs"),
    FEET("feet", "Feet"),
    MAIN_HAND("main_hand", "Main Hand"),
    OFF_HAND("off_hand", "Off Hand"),
    TWO_HAND("two_hand", "Two Hands");

    public final String key;
    public final String displayName;

    EquipmentSlot(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /**
     * Whether armor worn in this slot protects the given hit location when the
     * armor carries no explicit coverage list.
     */
    public boolean defaultCovers(HitLocation location) {
        switch (this) {
            case HEAD: return location == HitLocation.HEAD;
            case CHEST: return location == HitLocation.TORSO;
            case ARM_LEFT: return location == HitLocation.LEFT_ARM;
            case ARM_RIGHT: return location == HitLocation.RIGHT_ARM;
            case LEGS: return location.isLeg();
            default: return false;
        }
    }

    public static EquipmentSlot fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        // Handle common aliases
        if (k.equals("main") || k.equals("mainhand")) return MAIN_HAND;
        if (k.equals("off") || k.equals("offhand")) return OFF_HAND;
        if (k.equals("twohand") || k.equals("two-hand")) return TWO_HAND;
        for (EquipmentSlot s : values()) if (s.key.equals(k) || s.name().toLowerCase().equals(k)) return s;
        return null;
    }
}
