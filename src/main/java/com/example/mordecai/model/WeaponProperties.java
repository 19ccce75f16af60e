package com.example.mordecai.model;

/**
 * Combat properties of a weapon template.
 */
public class WeaponProperties {

    private final DamageType damageType;
    private final DamageClass damageClass;
    /** Added to the success value once a hit is confirmed */
    private final int baseSuccessValueModifier;
    /** Added directly to the attack value */
    private final int attackValueModifier;
    /** Applied to the wielder's dodge while equipped */
    private final int dodgeModifier;
    /** Flat bonus added on top of the wielder's physicality for weapon skill */
    private final int skillBonus;
    private final boolean twoHanded;

    public WeaponProperties(DamageType damageType, DamageClass damageClass,
                            int baseSuccessValueModifier, int attackValueModifier,
                            int dodgeModifier, int skillBonus, boolean twoHanded) {
        this.damageType = damageType == null ? DamageType.CUTTING : damageType;
        this.damageClass = damageClass == null ? DamageClass.CLASS_1 : damageClass;
        this.baseSuccessValueModifier = baseSuccessValueModifier;
        this.attackValueModifier = attackValueModifier;
        this.dodgeModifier = dodgeModifier;
        this.skillBonus = skillBonus;
        this.twoHanded = twoHanded;
    }

    public DamageType getDamageType() { return damageType; }
    public DamageClass getDamageClass() { return damageClass; }
    public int getBaseSuccessValueModifier() { return baseSuccessValueModifier; }
    public int getAttackValueModifier() { return attackValueModifier; }
    public int getDodgeModifier() { return dodgeModifier; }
    public int getSkillBonus() { return skillBonus; }
    public boolean isTwoHanded() { return twoHanded; }
}
