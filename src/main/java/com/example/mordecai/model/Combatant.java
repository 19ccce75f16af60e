package com.example.mordecai.model;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anything that can take part in a fight: a player character or a spawned NPC.
 *
 * Pools come in pairs: fatigue (short-term stamina) and vitality (long-term
 * health). Incoming damage and healing are queued as pending deltas and are
 * drained into the current values by the health tick. Pending values may be
 * negative (queued healing); current values always stay within [0, max].
 *
 * Every read-modify-write of these fields must happen while holding
 * {@link #getLock()}.
 */
public interface Combatant {

    UUID getId();

    String getName();

    int getRoomId();
    void setRoomId(int roomId);

    int getCurrentFatigue();
    void setCurrentFatigue(int value);
    int getMaxFatigue();

    int getCurrentVitality();
    void setCurrentVitality(int value);
    int getMaxVitality();

    int getPendingFatigueDamage();
    void setPendingFatigueDamage(int value);

    int getPendingVitalityDamage();
    void setPendingVitalityDamage(int value);

    int getWoundCount();
    void setWoundCount(int value);

    /**
     * Base level of an attribute, or null when this combatant has no such attribute.
     */
    Integer getAttribute(Attribute attribute);

    /** Epoch ms of the last passive fatigue recovery, null when recovery is suspended. */
    Long getLastFatigueRegenAt();
    void setLastFatigueRegenAt(Long timestamp);

    /** Epoch ms of the last passive vitality recovery, null when recovery is paused. */
    Long getLastVitalityRegenAt();
    void setLastVitalityRegenAt(Long timestamp);

    boolean isAlive();
    void setAlive(boolean alive);

    /** True for player characters; NPC targeting picks these. */
    boolean isPlayerControlled();

    /**
     * Called when vitality is found at 0 after a hit. NPCs despawn; player
     * death is left to the outer game layers.
     */
    void handleDeath(long now);

    ReentrantLock getLock();
}
