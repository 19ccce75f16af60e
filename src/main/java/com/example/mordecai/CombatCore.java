package com.example.mordecai;

import com.example.mordecai.ai.NpcAiService;
import com.example.mordecai.combat.CombatManager;
import com.example.mordecai.combat.CombatService;
import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.effect.EffectDefinitionLoader;
import com.example.mordecai.effect.EffectRegistry;
import com.example.mordecai.effect.EffectScheduler;
import com.example.mordecai.effect.EffectService;
import com.example.mordecai.event.GameEventPublisher;
import com.example.mordecai.event.LoggingEventPublisher;
import com.example.mordecai.persistence.CombatantRepository;
import com.example.mordecai.persistence.EquipmentRepository;
import com.example.mordecai.persistence.InMemoryCombatantRepository;
import com.example.mordecai.persistence.InMemoryEquipmentRepository;
import com.example.mordecai.util.FudgeDice;
import com.example.mordecai.util.TickService;
import com.example.mordecai.vitality.ActionGate;
import com.example.mordecai.vitality.HealthTickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Wires the combat core together: repositories, effect registry, services
 * and the background ticks. The host server supplies its own repositories
 * and publisher; {@link #main} runs the core standalone with in-memory ones.
 */
public class CombatCore {

    private static final Logger logger = LoggerFactory.getLogger(CombatCore.class);

    private final CombatConfig config;
    private final CombatantRepository combatants;
    private final EquipmentRepository equipment;
    private final GameEventPublisher publisher;
    private final Clock clock;

    private final FudgeDice dice;
    private final EffectRegistry effectRegistry;
    private final EffectService effectService;
    private final EffectScheduler effectScheduler;
    private final CombatManager combatManager;
    private final CombatService combatService;
    private final NpcAiService npcAiService;
    private final HealthTickService healthTickService;
    private final ActionGate actionGate;

    private TickService tickService;

    public CombatCore(CombatConfig config, CombatantRepository combatants, EquipmentRepository equipment,
                      GameEventPublisher publisher, Clock clock, Random random) {
        this.config = config;
        this.combatants = combatants;
        this.equipment = equipment;
        this.publisher = publisher;
        this.clock = clock;

        this.dice = new FudgeDice(random, config.getMaxExplosionRerolls());
        this.effectRegistry = new EffectRegistry();
        EffectDefinitionLoader.loadInto(effectRegistry);

        this.effectService = new EffectService(effectRegistry, combatants, clock, config);
        this.effectScheduler = new EffectScheduler(effectService, combatants, config.getEffectTickMillis());
        this.combatManager = new CombatManager(publisher, clock, config);
        this.combatService = new CombatService(combatManager, effectService, combatants, equipment, dice, publisher, clock);
        this.npcAiService = new NpcAiService(combatManager, combatService, publisher, config);
        this.healthTickService = new HealthTickService(combatants, combatManager, npcAiService, clock, config);
        this.actionGate = new ActionGate(effectService, dice, publisher);
    }

    /** Standalone wiring: default config, in-memory stores, logging publisher. */
    public static CombatCore createDefault() {
        return new CombatCore(CombatConfig.load(), new InMemoryCombatantRepository(), new InMemoryEquipmentRepository(),
            new LoggingEventPublisher(), Clock.systemUTC(), new SecureRandom());
    }

    /**
     * Start the health and effect ticks.
     */
    public synchronized void start() {
        if (tickService != null) return;
        tickService = new TickService();
        healthTickService.initialize(tickService);
        effectScheduler.initialize(tickService);
        logger.info("[CombatCore] started (health tick {}ms, effect tick {}ms, {} effect definitions)",
            config.getHealthTickMillis(), config.getEffectTickMillis(), effectRegistry.getDefinitionCount());
    }

    public synchronized void shutdown() {
        if (tickService == null) return;
        tickService.shutdown();
        tickService = null;
        logger.info("[CombatCore] stopped");
    }

    public CombatConfig getConfig() { return config; }
    public CombatantRepository getCombatants() { return combatants; }
    public EquipmentRepository getEquipment() { return equipment; }
    public GameEventPublisher getPublisher() { return publisher; }
    public Clock getClock() { return clock; }
    public FudgeDice getDice() { return dice; }
    public EffectRegistry getEffectRegistry() { return effectRegistry; }
    public EffectService getEffectService() { return effectService; }
    public EffectScheduler getEffectScheduler() { return effectScheduler; }
    public CombatManager getCombatManager() { return combatManager; }
    public CombatService getCombatService() { return combatService; }
    public NpcAiService getNpcAiService() { return npcAiService; }
    public HealthTickService getHealthTickService() { return healthTickService; }
    public ActionGate getActionGate() { return actionGate; }

    public static void main(String[] args) throws InterruptedException {
        CombatCore core = createDefault();
        core.start();
        Runtime.getRuntime().addShutdownHook(new Thread(core::shutdown, "mordecai-shutdown"));
        Thread.currentThread().join();
    }
}
