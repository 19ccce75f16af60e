package com.example.mordecai.model;

import java.util.UUID;

/**
 * A live NPC instance spawned from an {@link NpcTemplate}. Max pools are
 * derived from the template instead of being stored.
 */
public class NpcSpawn extends AbstractCombatant {

    private final NpcTemplate template;
    private final long spawnedAt;
    private Long despawnedAt;
    private String despawnReason;

    public NpcSpawn(UUID id, NpcTemplate template, int roomId, long spawnedAt) {
        super(id, template.getName(), roomId);
        this.template = template;
        this.spawnedAt = spawnedAt;
        fillPools();
    }

    public NpcTemplate getTemplate() { return template; }
    public long getSpawnedAt() { return spawnedAt; }
    public Long getDespawnedAt() { return despawnedAt; }
    public String getDespawnReason() { return despawnReason; }

    /**
     * Remove this NPC from the world.
     */
    public void despawn(String reason, long now) {
        setAlive(false);
        this.despawnedAt = now;
        this.despawnReason = reason;
    }

    @Override
    public Integer getAttribute(Attribute attribute) {
        return template.getAttribute(attribute);
    }

    @Override public int getMaxFatigue() { return template.getMaxFatigue(); }
    @Override public int getMaxVitality() { return template.getMaxVitality(); }

    @Override public boolean isPlayerControlled() { return false; }

    @Override
    public void handleDeath(long now) {
        despawn("Death", now);
    }
}
