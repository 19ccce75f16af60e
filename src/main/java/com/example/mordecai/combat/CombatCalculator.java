package com.example.mordecai.combat;

import com.example.mordecai.model.DamageClass;
import com.example.mordecai.model.DamageType;
import com.example.mordecai.model.EquippedItem;
import com.example.mordecai.model.HitLocation;
import com.example.mordecai.util.FudgeDice;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed tables used by melee resolution.
 *
 * Result value bonus: RV = physicality roll - 8, then
 *   RV &gt;= 12: +4, &gt;= 8: +3, &gt;= 4: +2, &gt;= 2: +1, otherwise 0.
 *
 * Over-extension penalty (keyed off SV or RV):
 *   &lt;= -9: -3 for 3 rounds, &lt;= -7: -2 for 2, &lt;= -5: -2 for 1, &lt;= -3: -1 for 1.
 *
 * Damage goes SV -&gt; raw damage dice -&gt; (fatigue, vitality, wounds).
 */
public final class CombatCalculator {

    /** Subtracted from the physicality roll to get the result value */
    public static final int RESULT_VALUE_BASE = 8;

    /** Attack value penalty for an off-hand attack */
    public static final int OFF_HAND_PENALTY = 2;

    private CombatCalculator() {}

    /**
     * Penalty magnitude and duration in rounds.
     */
    public record PenaltySeverity(int amount, int rounds) {}

    /**
     * How raw damage lands on the defender's pools.
     */
    public record DamageSplit(int fatigue, int vitality, int wounds) {}

    /**
     * SV bonus for a physicality result value.
     */
    public static int resultValueBonus(int rv) {
        if (rv >= 12) return 4;
        if (rv >= 8) return 3;
        if (rv >= 4) return 2;
        if (rv >= 2) return 1;
        return 0;
    }

    /**
     * Over-extension penalty for a success or result value.
     *
     * @return the penalty, or null when the value is above -3
     */
    public static PenaltySeverity penaltySeverity(int value) {
        if (value <= -9) return new PenaltySeverity(-3, 3);
        if (value <= -7) return new PenaltySeverity(-2, 2);
        if (value <= -5) return new PenaltySeverity(-2, 1);
        if (value <= -3) return new PenaltySeverity(-1, 1);
        return null;
    }

    /**
     * Weighted d12 hit location. Head is only reachable through a second d12
     * when the first shows 1.
     */
    public static HitLocation rollHitLocation(FudgeDice dice) {
        int roll = dice.rollD12();
        if (roll == 1) {
            return dice.rollD12() <= 6 ? HitLocation.HEAD : HitLocation.TORSO;
        }
        return hitLocationFor(roll);
    }

    /** Location for a d12 face of 2-12. */
    static HitLocation hitLocationFor(int roll) {
        if (roll <= 6) return HitLocation.TORSO;
        if (roll == 7) return HitLocation.LEFT_ARM;
        if (roll == 8) return HitLocation.RIGHT_ARM;
        if (roll <= 10) return HitLocation.LEFT_LEG;
        return HitLocation.RIGHT_LEG;
    }

    /**
     * Intact armor pieces covering a location, innermost layer first.
     */
    public static List<EquippedItem> armorCovering(List<EquippedItem> equipment, HitLocation location) {
        List<EquippedItem> out = new ArrayList<>();
        for (EquippedItem item : equipment) {
            if (item.isArmor() && !item.isBroken() && item.covers(location)) out.add(item);
        }
        out.sort(Comparator.comparingInt(i -> i.getArmor().getLayerPriority()));
        return out;
    }

    /**
     * Absorption of one armor piece against a weapon. Each tier the weapon
     * has above the armor strips one point; the result never goes below 0.
     */
    public static int absorption(EquippedItem armor, DamageType damageType, DamageClass weaponClass) {
        int base = armor.getArmor().getAbsorption(damageType);
        int bypass = Math.max(0, weaponClass.getTier() - armor.getArmor().getDamageClass().getTier());
        return Math.max(0, base - bypass);
    }

    /** Total absorption of every intact layer covering the location. */
    public static int totalAbsorption(List<EquippedItem> equipment, HitLocation location,
                                      DamageType damageType, DamageClass weaponClass) {
        int total = 0;
        for (EquippedItem piece : armorCovering(equipment, location)) {
            total += absorption(piece, damageType, weaponClass);
        }
        return total;
    }

    /** Success value left after armor; never negative. */
    public static int mitigate(int successValue, int totalAbsorption) {
        return Math.max(0, successValue - Math.max(0, totalAbsorption));
    }

    /**
     * Roll raw damage for a final success value.
     *
     * <pre>
     *  0: 1d6/3    4: 1d10   8: 2d10   12-14: 4d10
     *  1: 1d6/2    5: 1d12   9: 2d12   15+:   1d6 x 10
     *  2: 1d6      6: 2d8   10: 3d10
     *  3: 1d8      7: 2d8   11: 3d12
     * </pre>
     */
    public static int rollRawDamage(int successValue, FudgeDice dice) {
        int sv = Math.max(0, successValue);
        switch (sv) {
            case 0: return dice.rollDice(1, 6) / 3;
            case 1: return dice.rollDice(1, 6) / 2;
            case 2: return dice.rollDice(1, 6);
            case 3: return dice.rollDice(1, 8);
            case 4: return dice.rollDice(1, 10);
            case 5: return dice.rollDice(1, 12);
            case 6:
            case 7: return dice.rollDice(2, 8);
            case 8: return dice.rollDice(2, 10);
            case 9: return dice.rollDice(2, 12);
            case 10: return dice.rollDice(3, 10);
            case 11: return dice.rollDice(3, 12);
            case 12:
            case 13:
            case 14: return dice.rollDice(4, 10);
            default: return dice.rollDice(1, 6) * 10;
        }
    }

    /**
     * Apply damage-dealt and damage-received multipliers (e.g. -0.25 for a
     * curse); floored at 0.
     */
    public static int scaleDamage(int rawDamage, double dealtModifier, double receivedModifier) {
        double factor = 1.0 + dealtModifier + receivedModifier;
        return Math.max(0, (int) Math.floor(rawDamage * factor));
    }

    /**
     * Split damage into fatigue, vitality and wounds. Light hits only tire
     * the defender; from 7 upward they start to injure.
     */
    public static DamageSplit splitDamage(int damage) {
        int d = Math.max(0, damage);
        if (d <= 4) return new DamageSplit(d, 0, 0);
        switch (d) {
            case 5: return new DamageSplit(5, 1, 0);
            case 6: return new DamageSplit(6, 2, 0);
            case 7: return new DamageSplit(7, 4, 1);
            case 8: return new DamageSplit(8, 6, 1);
            case 9: return new DamageSplit(9, 8, 1);
            case 10: return new DamageSplit(10, 10, 2);
            case 15: return new DamageSplit(15, 15, 3);
            default:
                break;
        }
        if (d <= 14) return new DamageSplit(d, d, 2);
        return new DamageSplit(d, d, 3 + (d - 16) / 5);
    }
}
