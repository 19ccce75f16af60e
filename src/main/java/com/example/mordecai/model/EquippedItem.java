package com.example.mordecai.model;

import java.util.UUID;

/**
 * An item currently worn or wielded by a combatant. Weapons carry
 * {@link WeaponProperties}, armor carries {@link ArmorProperties}; a shield
 * or similar piece may carry both.
 */
public class EquippedItem {

    private final UUID id;
    private final String name;
    private final EquipmentSlot slot;
    private final WeaponProperties weapon;
    private final ArmorProperties armor;
    private volatile boolean broken;

    public EquippedItem(UUID id, String name, EquipmentSlot slot,
                        WeaponProperties weapon, ArmorProperties armor, boolean broken) {
        this.id = id == null ? UUID.randomUUID() : id;
        this.name = name;
        this.slot = slot;
        this.weapon = weapon;
        this.armor = armor;
        this.broken = broken;
    }

    public static EquippedItem weapon(String name, EquipmentSlot slot, WeaponProperties props) {
        return new EquippedItem(null, name, slot, props, null, false);
    }

    public static EquippedItem armor(String name, EquipmentSlot slot, ArmorProperties props) {
        return new EquippedItem(null, name, slot, null, props, false);
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public EquipmentSlot getSlot() { return slot; }
    public WeaponProperties getWeapon() { return weapon; }
    public ArmorProperties getArmor() { return armor; }
    public boolean isWeapon() { return weapon != null; }
    public boolean isArmor() { return armor != null; }
    public boolean isBroken() { return broken; }
    public void setBroken(boolean broken) { this.broken = broken; }

    /** Whether this piece of armor protects the given hit location. */
    public boolean covers(HitLocation location) {
        if (armor == null) return false;
        if (armor.hasExplicitCoverage()) return armor.coversExplicitly(location);
        return slot != null && slot.defaultCovers(location);
    }
}
