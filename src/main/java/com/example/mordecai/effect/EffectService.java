package com.example.mordecai.effect;

import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.model.BodyLocation;
import com.example.mordecai.model.Combatant;
import com.example.mordecai.persistence.CombatantRepository;
import com.example.mordecai.util.CombatantLocks;
import com.example.mordecai.util.SaturatingMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Applies, stacks, ticks, heals and removes status effects on combatants.
 *
 * All mutations of an effect instance happen under the owning combatant's
 * lock, so the health tick, the effect tick and attack resolution never see
 * a half-updated pool.
 */
public class EffectService {

    private static final Logger logger = LoggerFactory.getLogger(EffectService.class);

    public static final String WOUND_EFFECT = "Wound";

    public static final String REASON_EXPIRED = "expired";
    public static final String REASON_HEALED = "healed";
    public static final String REASON_NATURAL_HEALING = "natural_healing";

    private final EffectRegistry registry;
    private final CombatantRepository combatants;
    private final Clock clock;
    private final long woundHealIntervalMillis;

    public EffectService(EffectRegistry registry, CombatantRepository combatants, Clock clock, CombatConfig config) {
        this.registry = registry;
        this.combatants = combatants;
        this.clock = clock;
        this.woundHealIntervalMillis = config.getWoundHealIntervalMillis();
    }

    public EffectRegistry getRegistry() {
        return registry;
    }

    // ---- application ----

    /**
     * Apply an effect by definition name.
     *
     * @param durationSeconds null uses the definition default, 0 expires immediately
     * @param intensity       null uses the definition default
     * @param location        body location for wounds; also narrows the stacking lookup
     */
    public EffectApplicationResult applyEffect(Combatant target, String effectName, UUID sourceId,
                                               Integer durationSeconds, Double intensity, BodyLocation location) {
        EffectDefinition def = registry.getDefinition(effectName);
        if (def == null) {
            return EffectApplicationResult.failure("Effect '" + effectName + "' not found");
        }
        return applyEffect(target, def, sourceId, durationSeconds, intensity, location);
    }

    public EffectApplicationResult applyEffectByName(Combatant target, String effectName) {
        return applyEffect(target, effectName, null, null, null, null);
    }

    /**
     * Add one wound stack at a body location. The combatant's wound counter is
     * maintained by the caller that inflicted the wound.
     */
    public EffectApplicationResult applyWound(Combatant target, BodyLocation location, UUID sourceId) {
        return applyEffect(target, WOUND_EFFECT, sourceId, null, null, location == null ? BodyLocation.GENERAL : location);
    }

    public EffectApplicationResult applyEffect(Combatant target, EffectDefinition def, UUID sourceId,
                                               Integer durationSeconds, Double intensity, BodyLocation location) {
        if (target == null || def == null) {
            return EffectApplicationResult.failure("No target or effect given");
        }
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            double resolvedIntensity = intensity != null ? intensity : def.getDefaultIntensity();
            EffectInstance existing = findExisting(target.getId(), def, location, now);

            if (existing != null && def.isStackable()) {
                if (existing.getStacks() < def.getMaxStacks()) {
                    existing.setStacks(existing.getStacks() + 1);
                    existing.setAppliedAt(now);
                    refreshExpiry(existing, durationSeconds, def, now);
                    logger.debug("[EffectService] {} on {} stacked to {}", def.getName(), target.getName(), existing.getStacks());
                    return EffectApplicationResult.stacked(existing);
                }
                existing.setAppliedAt(now);
                existing.setIntensity(resolvedIntensity);
                refreshExpiry(existing, durationSeconds, def, now);
                return EffectApplicationResult.refreshedAtMaxStacks(existing);
            }

            if (existing != null) {
                existing.setAppliedAt(now);
                existing.setIntensity(resolvedIntensity);
                refreshExpiry(existing, durationSeconds, def, now);
                return EffectApplicationResult.refreshed(existing);
            }

            EffectInstance instance = new EffectInstance(UUID.randomUUID(), target.getId(), def, location,
                sourceId, resolvedIntensity, now, initialExpiry(durationSeconds, def, now));
            registry.addInstance(instance);
            logger.debug("[EffectService] applied {} to {}", def.getName(), target.getName());
            return EffectApplicationResult.applied(instance);
        });
    }

    private EffectInstance findExisting(UUID combatantId, EffectDefinition def, BodyLocation location, long now) {
        for (EffectInstance ei : registry.getInstances(combatantId)) {
            if (!ei.isInEffect(now)) continue;
            if (!ei.getDefinition().getName().equalsIgnoreCase(def.getName())) continue;
            if (location != null && location != ei.getBodyLocation()) continue;
            return ei;
        }
        return null;
    }

    private static Long initialExpiry(Integer durationSeconds, EffectDefinition def, long now) {
        if (durationSeconds != null) {
            if (durationSeconds <= 0) return now;
            return now + durationSeconds * 1000L;
        }
        if (def.getDefaultDurationSeconds() > 0) {
            return now + def.getDefaultDurationSeconds() * 1000L;
        }
        return null;
    }

    private static void refreshExpiry(EffectInstance instance, Integer durationSeconds, EffectDefinition def, long now) {
        int duration = durationSeconds != null ? durationSeconds : def.getDefaultDurationSeconds();
        if (duration > 0) {
            instance.setExpiresAt(now + duration * 1000L);
        }
    }

    // ---- removal ----

    public boolean removeEffect(UUID effectId, String reason) {
        EffectInstance instance = registry.getInstance(effectId);
        if (instance == null) return false;
        return underLock(instance.getCombatantId(), () -> {
            if (!instance.isActive()) return false;
            deactivate(instance, reason, clock.millis());
            return true;
        });
    }

    public int removeEffectsByCategory(Combatant target, EffectDefinition.Category category, String reason) {
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            int removed = 0;
            for (EffectInstance ei : registry.getInstances(target.getId())) {
                if (ei.isActive() && ei.getDefinition().getCategory() == category) {
                    deactivate(ei, reason, now);
                    removed++;
                }
            }
            return removed;
        });
    }

    /** Drop every instance on a combatant, e.g. when it leaves the world. */
    public int clearEffects(UUID combatantId, String reason) {
        return underLock(combatantId, () -> {
            long now = clock.millis();
            int removed = 0;
            for (EffectInstance ei : registry.getInstances(combatantId)) {
                deactivate(ei, reason, now);
                removed++;
            }
            return removed;
        });
    }

    /**
     * Heal wound stacks, oldest first.
     *
     * @param count    stacks to heal; 0 heals every matching wound
     * @param location restrict to one body location, or null for any
     * @return stacks healed
     */
    public int healWounds(Combatant target, int count, BodyLocation location) {
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            int remaining = count <= 0 ? Integer.MAX_VALUE : count;
            int healed = 0;
            for (EffectInstance ei : woundsOldestFirst(target.getId(), now)) {
                if (remaining <= 0) break;
                if (location != null && ei.getBodyLocation() != location) continue;
                int take = Math.min(remaining, ei.getStacks());
                if (take >= ei.getStacks()) {
                    deactivate(ei, REASON_HEALED, now);
                } else {
                    ei.setStacks(ei.getStacks() - take);
                    target.setWoundCount(target.getWoundCount() - take);
                }
                healed += take;
                remaining -= take;
            }
            if (healed > 0) {
                logger.debug("[EffectService] healed {} wound(s) on {}", healed, target.getName());
            }
            return healed;
        });
    }

    private void deactivate(EffectInstance instance, String reason, long now) {
        instance.deactivate(reason, now);
        registry.removeInstance(instance);
        if (instance.getDefinition().isWound()) {
            Combatant owner = combatants.findById(instance.getCombatantId());
            if (owner != null) {
                owner.setWoundCount(owner.getWoundCount() - instance.getStacks());
            }
        }
    }

    // ---- queries ----

    public List<EffectInstance> getActiveEffects(UUID combatantId) {
        long now = clock.millis();
        List<EffectInstance> out = new ArrayList<>();
        for (EffectInstance ei : registry.getInstances(combatantId)) {
            if (ei.isInEffect(now)) out.add(ei);
        }
        return out;
    }

    public List<EffectInstance> getActiveEffectsByCategory(UUID combatantId, EffectDefinition.Category category) {
        List<EffectInstance> out = new ArrayList<>();
        for (EffectInstance ei : getActiveEffects(combatantId)) {
            if (ei.getDefinition().getCategory() == category) out.add(ei);
        }
        return out;
    }

    public boolean hasEffect(UUID combatantId, String effectName) {
        for (EffectInstance ei : getActiveEffects(combatantId)) {
            if (ei.getDefinition().getName().equalsIgnoreCase(effectName)) return true;
        }
        return false;
    }

    /** Total wound stacks across all locations. */
    public int getWoundCount(UUID combatantId) {
        int total = 0;
        for (EffectInstance ei : getActiveEffects(combatantId)) {
            if (ei.getDefinition().isWound()) total += ei.getStacks();
        }
        return total;
    }

    public Map<BodyLocation, Integer> getWoundsByLocation(UUID combatantId) {
        Map<BodyLocation, Integer> out = new EnumMap<>(BodyLocation.class);
        for (EffectInstance ei : getActiveEffects(combatantId)) {
            if (!ei.getDefinition().isWound()) continue;
            BodyLocation loc = ei.getBodyLocation() == null ? BodyLocation.GENERAL : ei.getBodyLocation();
            out.merge(loc, ei.getStacks(), Integer::sum);
        }
        return out;
    }

    /**
     * Aggregate every active effect into one set of modifiers.
     */
    public EffectSummary getEffectSummary(UUID combatantId) {
        EffectSummary summary = new EffectSummary(combatantId);
        for (EffectInstance ei : getActiveEffects(combatantId)) {
            summary.accumulate(ei);
        }
        return summary;
    }

    // ---- periodic processing ----

    /**
     * Run every tick that has elapsed since the last one for each periodic
     * effect. Damage goes into the pending pools, healing is queued as
     * negative pending. Ticks never run past an effect's expiry.
     *
     * @return one message per applied impact
     */
    public List<String> processPeriodicEffects(Combatant target) {
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            List<String> messages = new ArrayList<>();
            for (EffectInstance ei : registry.getInstances(target.getId())) {
                if (!ei.isActive()) continue;
                EffectDefinition def = ei.getDefinition();
                if (!def.isPeriodic()) continue;

                long intervalMs = def.getTickIntervalSeconds() * 1000L;
                long last = ei.getLastTickAt() != null ? ei.getLastTickAt() : ei.getAppliedAt();
                long windowEnd = ei.getExpiresAt() != null ? Math.min(now, ei.getExpiresAt()) : now;
                if (windowEnd <= last) continue;
                long ticks = (windowEnd - last) / intervalMs;
                if (ticks <= 0) continue;

                for (EffectImpact impact : def.getImpacts()) {
                    if (!impact.getType().isPeriodic()) continue;
                    int perTick = (int) Math.round(impact.scaledValue(ei.getIntensity(), ei.getStacks()));
                    int total = SaturatingMath.multiply(perTick, SaturatingMath.clamp(ticks));
                    if (total == 0) continue;
                    applyPeriodic(target, impact.getType(), total);
                    messages.add(describePeriodic(def.getName(), impact.getType(), total));
                }
                ei.setLastTickAt(last + ticks * intervalMs);
            }
            return messages;
        });
    }

    private static void applyPeriodic(Combatant target, EffectImpact.ImpactType type, int total) {
        switch (type) {
            case PERIODIC_FATIGUE_DAMAGE:
                target.setPendingFatigueDamage(SaturatingMath.add(target.getPendingFatigueDamage(), total));
                break;
            case PERIODIC_VITALITY_DAMAGE:
                target.setPendingVitalityDamage(SaturatingMath.add(target.getPendingVitalityDamage(), total));
                break;
            case PERIODIC_FATIGUE_HEALING:
                target.setPendingFatigueDamage(SaturatingMath.subtract(target.getPendingFatigueDamage(), total));
                break;
            case PERIODIC_VITALITY_HEALING:
                target.setPendingVitalityDamage(SaturatingMath.subtract(target.getPendingVitalityDamage(), total));
                break;
            default:
                break;
        }
    }

    private static String describePeriodic(String name, EffectImpact.ImpactType type, int total) {
        switch (type) {
            case PERIODIC_FATIGUE_DAMAGE: return name + " deals " + total + " fatigue damage";
            case PERIODIC_VITALITY_DAMAGE: return name + " deals " + total + " vitality damage";
            case PERIODIC_FATIGUE_HEALING: return name + " restores " + total + " fatigue";
            case PERIODIC_VITALITY_HEALING: return name + " restores " + total + " vitality";
            default: return name;
        }
    }

    /**
     * Heal one wound stack per elapsed healing interval, oldest wound first.
     *
     * @return stacks healed
     */
    public int processNaturalWoundHealing(Combatant target) {
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            int healed = 0;
            for (EffectInstance ei : woundsOldestFirst(target.getId(), now)) {
                long elapsed = now - ei.getAppliedAt();
                if (elapsed < woundHealIntervalMillis) continue;
                long due = elapsed / woundHealIntervalMillis;
                if (due >= ei.getStacks()) {
                    healed += ei.getStacks();
                    deactivate(ei, REASON_NATURAL_HEALING, now);
                } else {
                    int n = (int) due;
                    ei.setStacks(ei.getStacks() - n);
                    ei.setAppliedAt(now);
                    target.setWoundCount(target.getWoundCount() - n);
                    healed += n;
                }
            }
            if (healed > 0) {
                logger.info("[EffectService] {} naturally healed {} wound(s)", target.getName(), healed);
            }
            return healed;
        });
    }

    /**
     * Deactivate every instance on the combatant whose expiry has passed.
     *
     * @return number removed
     */
    public int cleanupExpiredEffects(Combatant target) {
        return CombatantLocks.withLock(target, () -> {
            long now = clock.millis();
            int removed = 0;
            for (EffectInstance ei : registry.getInstances(target.getId())) {
                if (ei.isActive() && ei.isExpired(now)) {
                    deactivate(ei, REASON_EXPIRED, now);
                    removed++;
                }
            }
            return removed;
        });
    }

    private List<EffectInstance> woundsOldestFirst(UUID combatantId, long now) {
        List<EffectInstance> wounds = new ArrayList<>();
        for (EffectInstance ei : registry.getInstances(combatantId)) {
            if (ei.isInEffect(now) && ei.getDefinition().isWound()) wounds.add(ei);
        }
        wounds.sort(Comparator.comparingLong(EffectInstance::getAppliedAt));
        return wounds;
    }

    private <T> T underLock(UUID combatantId, Supplier<T> work) {
        Combatant owner = combatants.findById(combatantId);
        if (owner == null) {
            // nobody else can touch an unknown combatant's pools
            return work.get();
        }
        return CombatantLocks.withLock(owner, work);
    }
}
