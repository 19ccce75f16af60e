package com.example.mordecai.effect;

import com.example.mordecai.model.BodyLocation;

import java.util.UUID;

/**
 * An effect currently (or formerly) on a combatant. Mutated only while the
 * owning combatant's lock is held.
 */
public class EffectInstance {

    private final UUID id;
    private final UUID combatantId;
    private final EffectDefinition definition;
    private final BodyLocation bodyLocation;
    private final UUID sourceId;

    private int stacks;
    private double intensity;
    private long appliedAt;
    private Long expiresAt;     // null = permanent
    private Long lastTickAt;    // null = never ticked

    private boolean active = true;
    private Long removedAt;
    private String removalReason;

    public EffectInstance(UUID id, UUID combatantId, EffectDefinition definition, BodyLocation bodyLocation,
                          UUID sourceId, double intensity, long appliedAt, Long expiresAt) {
        this.id = id == null ? UUID.randomUUID() : id;
        this.combatantId = combatantId;
        this.definition = definition;
        this.bodyLocation = bodyLocation;
        this.sourceId = sourceId;
        this.stacks = 1;
        this.intensity = intensity;
        this.appliedAt = appliedAt;
        this.expiresAt = expiresAt;
    }

    public UUID getId() { return id; }
    public UUID getCombatantId() { return combatantId; }
    public EffectDefinition getDefinition() { return definition; }
    public BodyLocation getBodyLocation() { return bodyLocation; }
    public UUID getSourceId() { return sourceId; }

    public int getStacks() { return stacks; }
    void setStacks(int stacks) { this.stacks = stacks; }

    public double getIntensity() { return intensity; }
    void setIntensity(double intensity) { this.intensity = intensity; }

    public long getAppliedAt() { return appliedAt; }
    void setAppliedAt(long appliedAt) { this.appliedAt = appliedAt; }

    public Long getExpiresAt() { return expiresAt; }
    void setExpiresAt(Long expiresAt) { this.expiresAt = expiresAt; }

    public Long getLastTickAt() { return lastTickAt; }
    void setLastTickAt(Long lastTickAt) { this.lastTickAt = lastTickAt; }

    public boolean isActive() { return active; }
    public Long getRemovedAt() { return removedAt; }
    public String getRemovalReason() { return removalReason; }

    void deactivate(String reason, long now) {
        this.active = false;
        this.removedAt = now;
        this.removalReason = reason;
    }

    public boolean isExpired(long nowMs) {
        return expiresAt != null && nowMs >= expiresAt;
    }

    /** Active and not past its expiry. */
    public boolean isInEffect(long nowMs) {
        return active && !isExpired(nowMs);
    }

    public String displayName() {
        return stacks > 1 ? definition.getName() + " x" + stacks : definition.getName();
    }
}
