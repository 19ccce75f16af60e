package com.example.mordecai.effect;

import com.example.mordecai.model.Combatant;
import com.example.mordecai.persistence.CombatantRepository;
import com.example.mordecai.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives periodic effect ticks, natural wound healing and expiry cleanup.
 * Integrates with TickService.
 */
public class EffectScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EffectScheduler.class);

    public static final String TASK_NAME = "effect-scheduler";

    private final EffectService effectService;
    private final CombatantRepository combatants;
    private final long periodMillis;
    private volatile boolean initialized = false;

    public EffectScheduler(EffectService effectService, CombatantRepository combatants, long periodMillis) {
        this.effectService = effectService;
        this.combatants = combatants;
        this.periodMillis = periodMillis;
    }

    public synchronized void initialize(TickService tickService) {
        if (initialized) return;
        tickService.scheduleAtFixedRate(TASK_NAME, this::tickOnce, periodMillis, periodMillis);
        initialized = true;
        logger.info("[EffectScheduler] running every {}ms", periodMillis);
    }

    /**
     * One sweep over every combatant carrying effects. A failure on one
     * combatant is logged and the sweep moves on.
     */
    public void tickOnce() {
        List<UUID> ids = new ArrayList<>(effectService.getRegistry().getCombatantsWithEffects());
        for (UUID id : ids) {
            Combatant c = combatants.findById(id);
            if (c == null) {
                int dropped = effectService.clearEffects(id, "combatant_gone");
                logger.debug("[EffectScheduler] dropped {} effect(s) of unknown combatant {}", dropped, id);
                continue;
            }
            try {
                List<String> messages = effectService.processPeriodicEffects(c);
                for (String m : messages) {
                    logger.debug("[EffectScheduler] {}: {}", c.getName(), m);
                }
                effectService.processNaturalWoundHealing(c);
                effectService.cleanupExpiredEffects(c);
            } catch (Exception e) {
                logger.warn("[EffectScheduler] tick error for {}", c.getName(), e);
            }
        }
    }
}
