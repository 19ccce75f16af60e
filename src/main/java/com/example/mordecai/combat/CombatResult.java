package com.example.mordecai.combat;

import com.example.mordecai.model.Combatant;
import com.example.mordecai.model.HitLocation;

/**
 * Result of a melee attack attempt. Refusals (wrong room, no fatigue, broken
 * weapon and so on) are reported through the type rather than thrown.
 */
public class CombatResult {

    public enum ResultType {
        HIT,                  // Attack landed; damage queued on the defender
        MISS,                 // Resolved, but the defense held
        ROOM_MISMATCH,        // Attacker cannot reach the target's session
        INSUFFICIENT_FATIGUE, // Too tired to pay the attack cost
        NO_WEAPON,            // Nothing to attack with
        BROKEN_WEAPON,        // Wielded weapon is broken
        MISSING_COMBATANT,    // Attacker or defender unknown
        ACTION_PREVENTED,     // An effect forbids acting
        NOT_IMPLEMENTED,      // Attack kind not supported
        ERROR                 // Something went wrong
    }

    private final ResultType type;
    private final Combatant attacker;
    private final Combatant defender;
    private final String message;

    /** Roll values for display */
    private int attackValue;
    private int defenseValue;
    private int attackRoll;
    private int defenseRoll;
    private int successValue;
    private int resultValue;
    private int finalSuccessValue;
    private int totalAbsorption;

    private HitLocation hitLocation;
    private int rawDamage;
    private int fatigueDamage;
    private int vitalityDamage;
    private int wounds;
    private boolean defenderDied;

    private CombatResult(ResultType type, Combatant attacker, Combatant defender, String message) {
        this.type = type;
        this.attacker = attacker;
        this.defender = defender;
        this.message = message;
    }

    // Static factory methods

    public static CombatResult hit(Combatant attacker, Combatant defender, String message) {
        return new CombatResult(ResultType.HIT, attacker, defender, message);
    }

    public static CombatResult miss(Combatant attacker, Combatant defender, String message) {
        return new CombatResult(ResultType.MISS, attacker, defender, message);
    }

    public static CombatResult failure(ResultType type, Combatant attacker, Combatant defender, String message) {
        return new CombatResult(type, attacker, defender, message);
    }

    public static CombatResult notImplemented(Combatant attacker, Combatant defender, String what) {
        return new CombatResult(ResultType.NOT_IMPLEMENTED, attacker, defender, what + " is not implemented");
    }

    public static CombatResult error(String message) {
        return new CombatResult(ResultType.ERROR, null, null, message);
    }

    // Getters

    public ResultType getType() { return type; }
    public Combatant getAttacker() { return attacker; }
    public Combatant getDefender() { return defender; }
    public String getMessage() { return message; }

    /** True when the attack was actually resolved (hit or miss). */
    public boolean isResolved() { return type == ResultType.HIT || type == ResultType.MISS; }
    public boolean isHit() { return type == ResultType.HIT; }
    public boolean isMiss() { return type == ResultType.MISS; }

    public int getAttackValue() { return attackValue; }
    public int getDefenseValue() { return defenseValue; }
    public int getAttackRoll() { return attackRoll; }
    public int getDefenseRoll() { return defenseRoll; }
    public int getSuccessValue() { return successValue; }
    public int getResultValue() { return resultValue; }
    public int getFinalSuccessValue() { return finalSuccessValue; }
    public int getTotalAbsorption() { return totalAbsorption; }
    public HitLocation getHitLocation() { return hitLocation; }
    public int getRawDamage() { return rawDamage; }
    public int getFatigueDamage() { return fatigueDamage; }
    public int getVitalityDamage() { return vitalityDamage; }
    public int getWounds() { return wounds; }
    public boolean isDefenderDied() { return defenderDied; }

    CombatResult withValues(int attackValue, int attackRoll, int defenseValue, int defenseRoll, int successValue) {
        this.attackValue = attackValue;
        this.attackRoll = attackRoll;
        this.defenseValue = defenseValue;
        this.defenseRoll = defenseRoll;
        this.successValue = successValue;
        return this;
    }

    CombatResult withDamage(int resultValue, HitLocation hitLocation, int totalAbsorption, int finalSuccessValue,
                            int rawDamage, CombatCalculator.DamageSplit split) {
        this.resultValue = resultValue;
        this.hitLocation = hitLocation;
        this.totalAbsorption = totalAbsorption;
        this.finalSuccessValue = finalSuccessValue;
        this.rawDamage = rawDamage;
        this.fatigueDamage = split.fatigue();
        this.vitalityDamage = split.vitality();
        this.wounds = split.wounds();
        return this;
    }

    CombatResult withDefenderDied(boolean died) {
        this.defenderDied = died;
        return this;
    }

    @Override
    public String toString() {
        if (type == ResultType.ERROR) {
            return "CombatResult[ERROR: " + message + "]";
        }
        String attackerName = attacker != null ? attacker.getName() : "?";
        String defenderName = defender != null ? defender.getName() : "?";
        return String.format("CombatResult[%s %s -> %s, SV=%d, FAT=%d, VIT=%d, wounds=%d]",
            type, attackerName, defenderName, successValue, fatigueDamage, vitalityDamage, wounds);
    }
}
