package com.example.mordecai;

import com.example.mordecai.ai.NpcAiService;
import com.example.mordecai.combat.CombatManager;
import com.example.mordecai.combat.CombatService;
import com.example.mordecai.combat.CombatSession;
import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.effect.EffectDefinitionLoader;
import com.example.mordecai.effect.EffectRegistry;
import com.example.mordecai.effect.EffectService;
import com.example.mordecai.event.CombatActionEvent;
import com.example.mordecai.event.CombatEnded;
import com.example.mordecai.model.NpcBehavior;
import com.example.mordecai.model.NpcSpawn;
import com.example.mordecai.model.PlayerCharacter;
import com.example.mordecai.persistence.InMemoryCombatantRepository;
import com.example.mordecai.persistence.InMemoryEquipmentRepository;
import com.example.mordecai.util.FudgeDice;
import com.example.mordecai.vitality.HealthTickService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NpcAiService Tests")
public class NpcAiServiceTest {

    private ManualClock clock;
    private CapturingPublisher publisher;
    private InMemoryCombatantRepository combatants;
    private CombatManager manager;
    private ScriptedRandom random;
    private NpcAiService ai;
    private CombatConfig config;

    private PlayerCharacter hero;

    @BeforeEach
    void setUp() {
        config = CombatConfig.defaults();
        clock = new ManualClock(CombatFixtures.T0);
        publisher = new CapturingPublisher();
        combatants = new InMemoryCombatantRepository();
        EffectRegistry registry = new EffectRegistry();
        EffectDefinitionLoader.loadInto(registry);
        EffectService effects = new EffectService(registry, combatants, clock, config);
        manager = new CombatManager(publisher, clock, config);
        random = new ScriptedRandom();
        CombatService combat = new CombatService(manager, effects, combatants, new InMemoryEquipmentRepository(),
            new FudgeDice(random, 20), publisher, clock);
        ai = new NpcAiService(manager, combat, publisher, config);

        hero = CombatFixtures.player("Hero", 1);
        combatants.save(hero);
    }

    private NpcSpawn goblin(NpcBehavior behavior) {
        NpcSpawn goblin = CombatFixtures.npc("Goblin", 1, behavior);
        combatants.save(goblin);
        return goblin;
    }

    @Test
    @DisplayName("Badly hurt NPC flees before it attacks")
    void testFleeAtLowVitality() {
        NpcSpawn goblin = goblin(null);
        goblin.setCurrentVitality(3);
        CombatSession session = manager.initiateCombat(hero, goblin);

        assertEquals(NpcAiService.NpcAction.FLED, ai.decideAndAct(session, goblin));

        assertFalse(session.isActive());
        assertEquals(CombatManager.REASON_ONE_FLED, session.getEndReason());
        assertEquals(hero.getId(), publisher.ofType(CombatEnded.class).get(0).winnerId());

        List<CombatActionEvent> actions = publisher.ofType(CombatActionEvent.class);
        assertEquals(1, actions.size());
        assertEquals("Goblin flees from combat!", actions.get(0).description());
        assertEquals(NpcAiService.FLEE_SKILL, actions.get(0).skillUsed());
        assertNull(actions.get(0).defenderId());
        assertEquals(15, hero.getCurrentFatigue());
    }

    @Test
    @DisplayName("An NPC with 1 available vitality neither flees nor attacks")
    void testTooInjuredNpcDoesNothing() {
        NpcSpawn goblin = goblin(null);
        goblin.setCurrentVitality(1);
        CombatSession session = manager.initiateCombat(hero, goblin);

        assertEquals(NpcAiService.NpcAction.INCAPACITATED, ai.decideAndAct(session, goblin));

        assertTrue(session.isActive());
        assertEquals(15, goblin.getCurrentFatigue());
        assertEquals(15, hero.getCurrentFatigue());
        assertTrue(publisher.ofType(CombatActionEvent.class).isEmpty());
    }

    @Test
    @DisplayName("An NPC killed by the health tick takes no turn")
    void testHealthTickDeathStopsNpcTurn() {
        NpcSpawn goblin = goblin(new NpcBehavior(null, true, 10));
        CombatSession session = manager.initiateCombat(hero, goblin);
        goblin.setPendingVitalityDamage(100);
        HealthTickService tick = new HealthTickService(combatants, manager, ai, clock, config);

        tick.tick();

        assertFalse(goblin.isAlive());
        assertFalse(session.isActive());
        assertEquals("Goblin died", session.getEndReason());
        assertEquals(15, hero.getCurrentFatigue());
        assertTrue(publisher.ofType(CombatActionEvent.class).isEmpty());
    }

    @Test
    void testNeverFleeKeepsFighting() {
        NpcSpawn berserker = goblin(new NpcBehavior(null, true, 10));
        berserker.setCurrentVitality(2);
        CombatSession session = manager.initiateCombat(hero, berserker);
        random.fudge(-3).fudge(0);

        assertFalse(ai.shouldFlee(berserker));
        assertEquals(NpcAiService.NpcAction.ATTACKED, ai.decideAndAct(session, berserker));
        assertTrue(session.isActive());
        assertEquals(14, berserker.getCurrentFatigue());
        assertEquals("Goblin attacks Hero but misses!",
            publisher.ofType(CombatActionEvent.class).get(0).description());
    }

    @Test
    @DisplayName("Tired NPC switches to parry")
    void testLowFatigueParry() {
        NpcSpawn goblin = goblin(null);
        goblin.setCurrentFatigue(2);
        CombatSession session = manager.initiateCombat(hero, goblin);
        random.fudge(-3).fudge(0);

        assertTrue(ai.shouldUseParryMode(goblin));
        ai.decideAndAct(session, goblin);
        assertTrue(session.findActiveParticipant(goblin.getId()).isParryMode());

        goblin.setCurrentFatigue(10);
        random.fudge(-3).fudge(0);
        ai.decideAndAct(session, goblin);
        assertFalse(session.findActiveParticipant(goblin.getId()).isParryMode());
    }

    @Test
    void testNoPlayerTarget() {
        NpcSpawn goblin = goblin(null);
        NpcSpawn rat = CombatFixtures.npc("Rat", 1);
        combatants.save(rat);
        CombatSession session = manager.initiateCombat(goblin, rat);

        assertNull(ai.selectTarget(session, goblin));
        assertEquals(NpcAiService.NpcAction.NO_TARGET, ai.decideAndAct(session, goblin));
        assertTrue(session.isActive());
    }

    @Test
    @DisplayName("Template flee threshold overrides the default")
    void testCustomThreshold() {
        NpcSpawn coward = goblin(new NpcBehavior(0.5, false, 1));
        NpcSpawn plain = CombatFixtures.npc("Orc", 1);
        coward.setCurrentVitality(7);
        plain.setCurrentVitality(7);

        assertEquals(0.5, ai.getFleeThreshold(coward), 1e-9);
        assertEquals(config.getDefaultFleeThreshold(), ai.getFleeThreshold(plain), 1e-9);
        assertTrue(ai.shouldFlee(coward));
        assertFalse(ai.shouldFlee(plain));
    }

    @Test
    @DisplayName("Health tick gives fighting NPCs their turn")
    void testHealthTickDrivesAi() {
        NpcSpawn goblin = goblin(null);
        goblin.setCurrentVitality(3);
        manager.initiateCombat(hero, goblin);
        HealthTickService ticks = new HealthTickService(combatants, manager, ai, clock, config);

        ticks.tick();

        assertFalse(manager.isInCombat(goblin.getId()));
        assertFalse(manager.isInCombat(hero.getId()));
        assertEquals(1, publisher.ofType(CombatEnded.class).size());
    }
}
