package com.example.mordecai.combat;

import com.example.mordecai.model.DamageType;
import com.example.mordecai.model.HitLocation;

import java.util.UUID;

/**
 * Immutable record of one action inside a combat session, kept for
 * spectators and debugging.
 */
public record CombatActionLog(
    long timestamp,
    UUID actorId,
    String actorName,
    UUID targetId,
    String targetName,
    ActionType actionType,
    int attackValue,
    int defenseValue,
    int successValue,
    int damageDealt,
    int fatigueDamage,
    int vitalityDamage,
    int wounds,
    HitLocation hitLocation,
    DamageType damageType,
    String description
) {

    public enum ActionType {
        MELEE_ATTACK,
        FLEE,
        DEFENSE_MODE,
        DEATH
    }

    /** A log line with no dice attached (flee, death, defense switch). */
    public static CombatActionLog simple(long timestamp, UUID actorId, String actorName,
                                         ActionType type, String description) {
        return new CombatActionLog(timestamp, actorId, actorName, null, null, type,
            0, 0, 0, 0, 0, 0, 0, null, null, description);
    }
}
