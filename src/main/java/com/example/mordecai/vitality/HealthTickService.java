package com.example.mordecai.vitality;

import com.example.mordecai.ai.NpcAiService;
import com.example.mordecai.combat.CombatManager;
import com.example.mordecai.combat.CombatParticipant;
import com.example.mordecai.combat.CombatSession;
import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.model.Combatant;
import com.example.mordecai.persistence.CombatantRepository;
import com.example.mordecai.util.CombatantLocks;
import com.example.mordecai.util.SaturatingMath;
import com.example.mordecai.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Drains pending damage and healing into the fatigue and vitality pools.
 *
 * Each tick moves half of a pending amount (at least 1) into the pool.
 * Fatigue damage beyond what is left spills into pending vitality, and a
 * fatigue pool that crashes to 0 queues 2 more vitality damage. Healing
 * never spills. Passive recovery runs alongside: one fatigue point per
 * interval (slower as vitality runs out) and one vitality point per hour.
 *
 * A combatant whose vitality drains to 0 dies and leaves combat.
 * After the pools, expired combat penalties are pruned and every NPC still
 * fighting gets its turn.
 */
public class HealthTickService {

    private static final Logger logger = LoggerFactory.getLogger(HealthTickService.class);

    public static final String TASK_NAME = "health-tick";

    /** Extra pending vitality damage when fatigue crashes to 0 */
    public static final int FATIGUE_CRASH_DAMAGE = 2;

    private final CombatantRepository combatants;
    private final CombatManager combatManager;
    private final NpcAiService npcAi;
    private final Clock clock;
    private final long tickMillis;
    private final long vitalityRegenMillis;

    public HealthTickService(CombatantRepository combatants, CombatManager combatManager,
                             NpcAiService npcAi, Clock clock, CombatConfig config) {
        this.combatants = combatants;
        this.combatManager = combatManager;
        this.npcAi = npcAi;
        this.clock = clock;
        this.tickMillis = config.getHealthTickMillis();
        this.vitalityRegenMillis = config.getPassiveVitalityRegenMillis();
    }

    public void initialize(TickService tickService) {
        tickService.scheduleAtFixedRate(TASK_NAME, this::tick, tickMillis, tickMillis);
        logger.info("[HealthTickService] Initialized with {}ms interval", tickMillis);
    }

    public void tick() {
        long now = clock.millis();
        int updated = 0;
        for (Combatant c : combatants.findAll()) {
            if (Thread.currentThread().isInterrupted()) return;
            if (!c.isAlive()) continue;
            try {
                if (processCombatant(c, now)) updated++;
            } catch (Exception e) {
                logger.error("[HealthTickService] failed to process {}", c.getName(), e);
            }
        }
        if (updated > 0) {
            logger.debug("[HealthTickService] applied health updates for {} combatants", updated);
        }

        try {
            combatManager.pruneExpiredPenalties();
        } catch (Exception e) {
            logger.error("[HealthTickService] failed to prune combat penalties", e);
        }

        processNpcDecisions();
    }

    private void processNpcDecisions() {
        if (npcAi == null) return;
        for (CombatSession session : combatManager.getActiveSessions()) {
            for (CombatParticipant p : session.getActiveParticipants()) {
                Combatant c = p.getCombatant();
                if (c.isPlayerControlled() || !c.isAlive()) continue;
                if (!session.isActive()) break;
                try {
                    npcAi.decideAndAct(session, c);
                } catch (Exception e) {
                    logger.error("[HealthTickService] NPC AI failed for {}", c.getName(), e);
                }
            }
        }
    }

    /** What one combatant's tick did. */
    private record TickOutcome(boolean changed, boolean died) {}

    /**
     * One tick for one combatant. A combatant drained to 0 vitality dies and
     * leaves its session; the session is touched only after the combatant's
     * lock is released.
     *
     * @return true if any pool or pending value changed
     */
    public boolean processCombatant(Combatant c, long now) {
        TickOutcome outcome = CombatantLocks.withLock(c, () -> processPools(c, now));
        if (outcome.died()) {
            combatManager.removeDeadCombatant(c, c.getName() + " died");
        }
        return outcome.changed();
    }

    private TickOutcome processPools(Combatant c, long now) {
        boolean needsWork = c.getPendingFatigueDamage() != 0
            || c.getPendingVitalityDamage() != 0
            || c.getCurrentFatigue() < c.getMaxFatigue()
            || c.getCurrentVitality() < c.getMaxVitality();
        if (!needsWork) {
            // keep recovery clocks fresh so a later hit does not heal instantly
            c.setLastFatigueRegenAt(now);
            c.setLastVitalityRegenAt(now);
            return new TickOutcome(false, false);
        }

        int vitalityBefore = c.getCurrentVitality();
        boolean changed = processFatigueRegen(c, now);
        changed |= processVitalityRegen(c, now);
        changed |= processFatiguePool(c);
        changed |= processVitalityPool(c);

        boolean died = vitalityBefore > 0 && c.getCurrentVitality() <= 0;
        if (died) {
            c.handleDeath(now);
            logger.info("[HealthTickService] {} succumbed to their wounds", c.getName());
        }
        return new TickOutcome(changed, died);
    }

    boolean processFatigueRegen(Combatant c, long now) {
        Long interval = VitalityRules.fatigueRegenIntervalMillis(VitalityRules.availableVitality(c), tickMillis);
        if (interval == null) {
            c.setLastFatigueRegenAt(null);
            return false;
        }
        Long last = c.getLastFatigueRegenAt();
        if (last == null || c.getCurrentFatigue() >= c.getMaxFatigue()) {
            c.setLastFatigueRegenAt(now);
            return false;
        }
        if (now - last < interval) return false;
        c.setPendingFatigueDamage(SaturatingMath.subtract(c.getPendingFatigueDamage(), 1));
        c.setLastFatigueRegenAt(now);
        return true;
    }

    boolean processVitalityRegen(Combatant c, long now) {
        int current = c.getCurrentVitality();
        int max = c.getMaxVitality();
        if (current <= 0) {
            c.setLastVitalityRegenAt(null);
            return false;
        }
        Long last = c.getLastVitalityRegenAt();
        if (last == null || current >= max) {
            c.setLastVitalityRegenAt(now);
            return false;
        }
        long ticks = (now - last) / vitalityRegenMillis;
        if (ticks <= 0) return false;

        int heal = (int) Math.min(ticks, max - current);
        c.setCurrentVitality(current + heal);
        if (c.getCurrentVitality() >= max) {
            c.setLastVitalityRegenAt(now);
        } else {
            c.setLastVitalityRegenAt(last + ticks * vitalityRegenMillis);
        }
        return heal > 0;
    }

    boolean processFatiguePool(Combatant c) {
        int pending = c.getPendingFatigueDamage();
        if (pending == 0) return false;
        int amount = drainAmount(pending);
        int current = c.getCurrentFatigue();

        if (pending > 0) {
            int applied = Math.min(amount, current);
            c.setCurrentFatigue(current - applied);
            c.setPendingFatigueDamage(Math.max(0, pending - amount));

            int overflow = amount - applied;
            if (overflow > 0) {
                c.setPendingVitalityDamage(SaturatingMath.add(c.getPendingVitalityDamage(), overflow));
            }
            if (current > 0 && c.getCurrentFatigue() == 0) {
                c.setPendingVitalityDamage(SaturatingMath.add(c.getPendingVitalityDamage(), FATIGUE_CRASH_DAMAGE));
                logger.debug("[HealthTickService] {} crashed from exhaustion", c.getName());
            }
            return true;
        }

        int capacity = c.getMaxFatigue() - current;
        if (capacity <= 0) {
            c.setPendingFatigueDamage(0);
            return true;
        }
        c.setCurrentFatigue(current + Math.min(amount, capacity));
        c.setPendingFatigueDamage(Math.min(0, SaturatingMath.add(pending, amount)));
        return true;
    }

    boolean processVitalityPool(Combatant c) {
        int pending = c.getPendingVitalityDamage();
        if (pending == 0) return false;
        int amount = drainAmount(pending);
        int current = c.getCurrentVitality();

        if (pending > 0) {
            int applied = Math.min(amount, current);
            c.setCurrentVitality(current - applied);
            c.setPendingVitalityDamage(Math.max(0, pending - amount));
            return true;
        }

        int capacity = c.getMaxVitality() - current;
        if (capacity <= 0) {
            c.setPendingVitalityDamage(0);
            return true;
        }
        c.setCurrentVitality(current + Math.min(amount, capacity));
        c.setPendingVitalityDamage(Math.min(0, SaturatingMath.add(pending, amount)));
        return true;
    }

    /** max(1, ceil(|pending| / 2)) */
    static int drainAmount(int pending) {
        long magnitude = Math.abs((long) pending);
        return (int) Math.max(1L, (magnitude + 1) / 2);
    }
}
