package com.example.mordecai;

import com.example.mordecai.combat.CombatManager;
import com.example.mordecai.combat.CombatResult;
import com.example.mordecai.combat.CombatService;
import com.example.mordecai.combat.CombatSession;
import com.example.mordecai.combat.TimedPenalty;
import com.example.mordecai.config.CombatConfig;
import com.example.mordecai.effect.EffectDefinitionLoader;
import com.example.mordecai.effect.EffectRegistry;
import com.example.mordecai.effect.EffectService;
import com.example.mordecai.event.CombatActionEvent;
import com.example.mordecai.event.CombatEnded;
import com.example.mordecai.model.Attribute;
import com.example.mordecai.model.BodyLocation;
import com.example.mordecai.model.DamageClass;
import com.example.mordecai.model.DamageType;
import com.example.mordecai.model.EquipmentSlot;
import com.example.mordecai.model.EquippedItem;
import com.example.mordecai.model.HitLocation;
import com.example.mordecai.model.NpcSpawn;
import com.example.mordecai.model.PlayerCharacter;
import com.example.mordecai.model.WeaponProperties;
import com.example.mordecai.persistence.InMemoryCombatantRepository;
import com.example.mordecai.persistence.InMemoryEquipmentRepository;
import com.example.mordecai.util.FudgeDice;
import com.example.mordecai.vitality.VitalityRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatService Tests")
public class CombatServiceTest {

    private ManualClock clock;
    private CapturingPublisher publisher;
    private InMemoryCombatantRepository combatants;
    private InMemoryEquipmentRepository equipment;
    private EffectService effects;
    private CombatManager manager;

    private PlayerCharacter hero;
    private NpcSpawn goblin;

    @BeforeEach
    void setUp() {
        CombatConfig config = CombatConfig.defaults();
        clock = new ManualClock(CombatFixtures.T0);
        publisher = new CapturingPublisher();
        combatants = new InMemoryCombatantRepository();
        equipment = new InMemoryEquipmentRepository();
        EffectRegistry registry = new EffectRegistry();
        EffectDefinitionLoader.loadInto(registry);
        effects = new EffectService(registry, combatants, clock, config);
        manager = new CombatManager(publisher, clock, config);

        hero = CombatFixtures.player("Hero", 1);
        goblin = CombatFixtures.npc("Goblin", 1);
        combatants.save(hero);
        combatants.save(goblin);
    }

    private CombatService service(ScriptedRandom random) {
        return new CombatService(manager, effects, combatants, equipment, new FudgeDice(random, 20), publisher, clock);
    }

    private void giveSword(PlayerCharacter who) {
        equipment.equip(who.getId(), EquippedItem.weapon("short sword", EquipmentSlot.MAIN_HAND,
            new WeaponProperties(DamageType.CUTTING, DamageClass.CLASS_1, 0, 0, 0, 2, false)));
    }

    @Test
    @DisplayName("Worked example: SV 4, RV 5, torso, 2d8 = 9")
    void testMeleeAttack_workedExample() {
        giveSword(hero);
        ScriptedRandom random = new ScriptedRandom()
            .fudge(2)      // attack
            .fudge(0)      // defense
            .fudge(3)      // physicality
            .face(2)       // hit location
            .face(4).face(5);
        CombatResult result = service(random).performMeleeAttack(hero.getId(), goblin.getId(), false, false);

        assertEquals(CombatResult.ResultType.HIT, result.getType());
        assertEquals(14, result.getAttackValue());
        assertEquals(10, result.getDefenseValue());
        assertEquals(4, result.getSuccessValue());
        assertEquals(5, result.getResultValue());
        assertEquals(HitLocation.TORSO, result.getHitLocation());
        assertEquals(0, result.getTotalAbsorption());
        assertEquals(6, result.getFinalSuccessValue());
        assertEquals(9, result.getRawDamage());
        assertEquals(9, result.getFatigueDamage());
        assertEquals(8, result.getVitalityDamage());
        assertEquals(1, result.getWounds());
        assertFalse(result.isDefenderDied());
        assertEquals(0, random.remaining());

        // damage is queued, not applied
        assertEquals(15, goblin.getCurrentVitality());
        assertEquals(9, goblin.getPendingFatigueDamage());
        assertEquals(8, goblin.getPendingVitalityDamage());
        assertEquals(1, goblin.getWoundCount());
        assertEquals(Map.of(BodyLocation.TORSO, 1), effects.getWoundsByLocation(goblin.getId()));

        // attack costs 1, dodging costs 1
        assertEquals(14, hero.getCurrentFatigue());
        assertEquals(14, goblin.getCurrentFatigue());

        List<CombatActionEvent> events = publisher.ofType(CombatActionEvent.class);
        assertEquals(1, events.size());
        assertEquals("Hero hits Goblin dealing 9 FAT and 8 VIT damage!", events.get(0).description());
        assertTrue(events.get(0).hit());
        assertEquals("short sword", events.get(0).skillUsed());

        CombatSession session = manager.getActiveSession(hero.getId());
        assertNotNull(session);
        assertEquals(1, session.getLog().size());
        assertEquals("Hero hits Goblin for 9 damage!", session.getLog().get(0).description());
    }

    @Test
    @DisplayName("A bad miss applies a timed penalty that expires after its rounds")
    void testMeleeAttack_missWithPenalty() {
        ScriptedRandom random = new ScriptedRandom().fudge(-3).fudge(3);
        CombatResult result = service(random).performMeleeAttack(hero, goblin, false, false);

        assertTrue(result.isMiss());
        assertEquals(7, result.getAttackValue());
        assertEquals(13, result.getDefenseValue());
        assertEquals(-6, result.getSuccessValue());
        assertEquals(0, goblin.getPendingFatigueDamage());

        List<TimedPenalty> penalties = manager.getActiveSession(hero.getId())
            .findParticipant(hero.getId()).getPenalties();
        assertEquals(1, penalties.size());
        assertEquals(-2, penalties.get(0).amount());
        assertEquals(CombatFixtures.T0 + 3000L, penalties.get(0).expiresAt());
        assertEquals(-2, manager.getTotalTimedPenalties(hero));

        clock.advanceSeconds(3);
        assertEquals(0, manager.getTotalTimedPenalties(hero));

        CombatActionEvent event = publisher.ofType(CombatActionEvent.class).get(0);
        assertEquals("Hero attacks Goblin but misses!", event.description());
        assertFalse(event.hit());
        assertEquals(CombatService.UNARMED_SKILL, event.skillUsed());
    }

    @Test
    void testMeleeAttack_roomMismatch() {
        goblin.setRoomId(2);
        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, false, false);
        assertEquals(CombatResult.ResultType.ROOM_MISMATCH, result.getType());
        assertFalse(manager.isInCombat(hero.getId()));
        assertEquals(15, hero.getCurrentFatigue());
    }

    @Test
    @DisplayName("Dual wielding needs two fatigue")
    void testMeleeAttack_insufficientFatigue() {
        hero.setCurrentFatigue(1);
        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, true, false);
        assertEquals(CombatResult.ResultType.INSUFFICIENT_FATIGUE, result.getType());
        assertEquals(1, hero.getCurrentFatigue());
    }

    @Test
    void testMeleeAttack_brokenWeapon() {
        EquippedItem axe = EquippedItem.weapon("rusty axe", EquipmentSlot.MAIN_HAND,
            new WeaponProperties(DamageType.CUTTING, DamageClass.CLASS_2, 1, 0, 0, 0, false));
        axe.setBroken(true);
        equipment.equip(hero.getId(), axe);

        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, false, false);
        assertEquals(CombatResult.ResultType.BROKEN_WEAPON, result.getType());
        assertEquals("Hero's rusty axe is broken and unusable!", result.getMessage());
        assertEquals(1, publisher.ofType(CombatActionEvent.class).size());
        assertEquals(15, hero.getCurrentFatigue());
    }

    @Test
    @DisplayName("No weapon and no physicality means no attack")
    void testMeleeAttack_noWeapon() {
        Map<Attribute, Integer> attrs = new EnumMap<>(Attribute.class);
        attrs.put(Attribute.DRIVE, 10);
        attrs.put(Attribute.FOCUS, 10);
        PlayerCharacter ghost = new PlayerCharacter(UUID.randomUUID(), "Ghost", 1, attrs);
        combatants.save(ghost);

        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(ghost, goblin, false, false);
        assertEquals(CombatResult.ResultType.NO_WEAPON, result.getType());
    }

    @Test
    void testMeleeAttack_stunnedAttackerCannotAct() {
        effects.applyEffectByName(hero, "Stunned");
        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, false, false);
        assertEquals(CombatResult.ResultType.ACTION_PREVENTED, result.getType());
        assertFalse(manager.isInCombat(hero.getId()));
    }

    @Test
    @DisplayName("A hit on a defender at zero vitality kills and ends combat")
    void testMeleeAttack_defenderDies() {
        goblin.setCurrentVitality(0);
        ScriptedRandom random = new ScriptedRandom().fudge(2).fudge(0).fudge(0).face(3).face(4);
        CombatResult result = service(random).performMeleeAttack(hero, goblin, false, false);

        assertTrue(result.isHit());
        assertTrue(result.isDefenderDied());
        assertFalse(goblin.isAlive());
        assertEquals("Death", goblin.getDespawnReason());
        assertFalse(manager.isInCombat(hero.getId()));

        List<CombatEnded> ended = publisher.ofType(CombatEnded.class);
        assertEquals(1, ended.size());
        assertEquals("Goblin died", ended.get(0).reason());
        assertEquals(hero.getId(), ended.get(0).winnerId());

        CombatResult again = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, false, false);
        assertEquals(CombatResult.ResultType.MISSING_COMBATANT, again.getType());
    }

    @Test
    void testMeleeAttack_unknownCombatant() {
        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero.getId(), UUID.randomUUID(), false, false);
        assertEquals(CombatResult.ResultType.MISSING_COMBATANT, result.getType());
        assertFalse(result.isResolved());
    }

    @Test
    @DisplayName("Defender in parry mode defends with weapon skill and pays no fatigue")
    void testMeleeAttack_parry() {
        manager.initiateCombat(hero, goblin);
        manager.setParryMode(goblin, true);
        ScriptedRandom random = new ScriptedRandom().fudge(0).fudge(0).fudge(0).face(3).face(2);
        CombatResult result = service(random).performMeleeAttack(hero, goblin, false, false);

        assertEquals(10, result.getDefenseValue());
        assertEquals(15, goblin.getCurrentFatigue());
        assertTrue(result.isHit());
    }

    @Test
    @DisplayName("A parrying defender fighting in another session still parries")
    void testMeleeAttack_parryInOtherSession() {
        PlayerCharacter other = CombatFixtures.player("Other", 1);
        NpcSpawn grunt = CombatFixtures.npc("Grunt", 1);
        combatants.save(other);
        combatants.save(grunt);
        CombatSession heroSession = manager.initiateCombat(hero, goblin);
        CombatSession gruntSession = manager.initiateCombat(other, grunt);
        manager.setParryMode(grunt, true);

        ScriptedRandom random = new ScriptedRandom().fudge(0).fudge(0).fudge(0).face(3).face(2);
        CombatResult result = service(random).performMeleeAttack(hero, grunt, false, false);

        assertTrue(result.isHit());
        assertEquals(10, result.getDefenseValue());
        assertEquals(15, grunt.getCurrentFatigue());
        assertEquals(14, hero.getCurrentFatigue());
        assertSame(heroSession, manager.getActiveSession(hero.getId()));
        assertSame(gruntSession, manager.getActiveSession(grunt.getId()));
    }

    @Test
    @DisplayName("An attacker with 1 available vitality cannot attack")
    void testMeleeAttack_tooInjuredToAttack() {
        hero.setCurrentVitality(3);
        hero.setPendingVitalityDamage(2);
        CombatResult result = service(new ScriptedRandom()).performMeleeAttack(hero, goblin, false, false);

        assertEquals(CombatResult.ResultType.ACTION_PREVENTED, result.getType());
        assertEquals(VitalityRules.TOO_INJURED_MESSAGE, result.getMessage());
        assertEquals(15, hero.getCurrentFatigue());
        assertFalse(manager.isInCombat(hero.getId()));
    }

    @Test
    @DisplayName("A wound at max stacks is refreshed and the wound counter does not grow")
    void testMeleeAttack_woundAtMaxStacks() {
        giveSword(hero);
        for (int i = 0; i < 10; i++) {
            effects.applyWound(goblin, BodyLocation.TORSO, null);
        }
        goblin.setWoundCount(10);

        ScriptedRandom random = new ScriptedRandom().fudge(2).fudge(0).fudge(3).face(2).face(4).face(5);
        CombatResult result = service(random).performMeleeAttack(hero, goblin, false, false);

        assertEquals(HitLocation.TORSO, result.getHitLocation());
        assertEquals(1, result.getWounds());
        assertEquals(10, goblin.getWoundCount());
        assertEquals(10, effects.getWoundCount(goblin.getId()));

        assertEquals(10, effects.healWounds(goblin, 0, null));
        assertEquals(0, goblin.getWoundCount());
        assertEquals(0, effects.getWoundCount(goblin.getId()));
    }

    @Test
    void testRangedAndKnockback_notImplemented() {
        CombatService service = service(new ScriptedRandom());
        assertEquals(CombatResult.ResultType.NOT_IMPLEMENTED, service.performRangedAttack(hero, goblin).getType());
        assertEquals(CombatResult.ResultType.NOT_IMPLEMENTED, service.performKnockback(hero, goblin).getType());
        assertFalse(manager.isInCombat(hero.getId()));
    }
}
