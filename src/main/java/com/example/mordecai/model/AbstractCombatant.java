package com.example.mordecai.model;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared pool bookkeeping for players and NPCs. Subclasses supply the
 * attribute source and the max pool sizes.
 */
public abstract class AbstractCombatant implements Combatant {

    private final UUID id;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();

    private int roomId;

    private int currentFatigue;
    private int currentVitality;
    private int pendingFatigueDamage;
    private int pendingVitalityDamage;
    private int woundCount;

    private Long lastFatigueRegenAt;
    private Long lastVitalityRegenAt;

    private boolean alive = true;

    protected AbstractCombatant(UUID id, String name, int roomId) {
        this.id = id == null ? UUID.randomUUID() : id;
        this.name = name;
        this.roomId = roomId;
    }

    /** Fill both pools; call once the subclass can answer the max values. */
    protected void fillPools() {
        this.currentFatigue = getMaxFatigue();
        this.currentVitality = getMaxVitality();
    }

    @Override public UUID getId() { return id; }
    @Override public String getName() { return name; }

    @Override public int getRoomId() { return roomId; }
    @Override public void setRoomId(int roomId) { this.roomId = roomId; }

    @Override public int getCurrentFatigue() { return currentFatigue; }
    @Override public void setCurrentFatigue(int value) { this.currentFatigue = Math.max(0, Math.min(value, getMaxFatigue())); }

    @Override public int getCurrentVitality() { return currentVitality; }
    @Override public void setCurrentVitality(int value) { this.currentVitality = Math.max(0, Math.min(value, getMaxVitality())); }

    @Override public int getPendingFatigueDamage() { return pendingFatigueDamage; }
    @Override public void setPendingFatigueDamage(int value) { this.pendingFatigueDamage = value; }

    @Override public int getPendingVitalityDamage() { return pendingVitalityDamage; }
    @Override public void setPendingVitalityDamage(int value) { this.pendingVitalityDamage = value; }

    @Override public int getWoundCount() { return woundCount; }
    @Override public void setWoundCount(int value) { this.woundCount = Math.max(0, value); }

    @Override public Long getLastFatigueRegenAt() { return lastFatigueRegenAt; }
    @Override public void setLastFatigueRegenAt(Long timestamp) { this.lastFatigueRegenAt = timestamp; }

    @Override public Long getLastVitalityRegenAt() { return lastVitalityRegenAt; }
    @Override public void setLastVitalityRegenAt(Long timestamp) { this.lastVitalityRegenAt = timestamp; }

    @Override public boolean isAlive() { return alive; }
    @Override public void setAlive(boolean alive) { this.alive = alive; }

    @Override public ReentrantLock getLock() { return lock; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", FAT " + currentFatigue + "/" + getMaxFatigue()
            + ", VIT " + currentVitality + "/" + getMaxVitality() + "}";
    }
}
