package com.example.mordecai.combat;

import com.example.mordecai.effect.EffectApplicationResult;
import com.example.mordecai.effect.EffectService;
import com.example.mordecai.effect.EffectSummary;
import com.example.mordecai.event.CombatActionEvent;
import com.example.mordecai.event.GameEventPublisher;
import com.example.mordecai.model.Attribute;
import com.example.mordecai.model.Combatant;
import com.example.mordecai.model.DamageClass;
import com.example.mordecai.model.DamageType;
import com.example.mordecai.model.EquipmentSlot;
import com.example.mordecai.model.EquippedItem;
import com.example.mordecai.model.HitLocation;
import com.example.mordecai.model.WeaponProperties;
import com.example.mordecai.persistence.CombatantRepository;
import com.example.mordecai.persistence.EquipmentRepository;
import com.example.mordecai.util.CombatantLocks;
import com.example.mordecai.util.FudgeDice;
import com.example.mordecai.util.SaturatingMath;
import com.example.mordecai.vitality.ActionRestriction;
import com.example.mordecai.vitality.VitalityRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Melee attack resolution.
 *
 * <ol>
 *   <li>refuse when stunned or at 1 available vitality or less</li>
 *   <li>join or open a combat session (same room only)</li>
 *   <li>pay fatigue: 2 when dual wielding, else 1</li>
 *   <li>AV = weapon skill (-2 off hand) + weapon AV modifier + timed penalties + effects + 4dF!</li>
 *   <li>DV = parry ? weapon skill : dodge + equipment dodge modifiers; + effects + 4dF!</li>
 *   <li>SV = AV - DV; a miss below 0, over-extension penalty at -3 or worse</li>
 *   <li>physicality check adds an RV bonus to SV</li>
 *   <li>hit location, armor absorption, SV to damage dice, damage to pools</li>
 * </ol>
 *
 * Damage is queued on the defender's pending pools; the health tick drains it.
 */
public class CombatService {

    private static final Logger logger = LoggerFactory.getLogger(CombatService.class);

    public static final String UNARMED_SKILL = "Unarmed Combat";

    /** Skill level assumed when an attribute or weapon skill is missing */
    public static final int DEFAULT_SKILL_LEVEL = 10;

    private final CombatManager combatManager;
    private final EffectService effectService;
    private final CombatantRepository combatants;
    private final EquipmentRepository equipment;
    private final FudgeDice dice;
    private final GameEventPublisher publisher;
    private final Clock clock;

    public CombatService(CombatManager combatManager, EffectService effectService,
                         CombatantRepository combatants, EquipmentRepository equipment,
                         FudgeDice dice, GameEventPublisher publisher, Clock clock) {
        this.combatManager = combatManager;
        this.effectService = effectService;
        this.combatants = combatants;
        this.equipment = equipment;
        this.dice = dice;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * The weapon (or bare hands) an attack or parry is made with.
     */
    record WeaponChoice(String skillName, int skillLevel, DamageType damageType, DamageClass damageClass,
                        int attackValueModifier, int baseSuccessValueModifier, EquippedItem item) {

        boolean isBroken() {
            return item != null && item.isBroken();
        }
    }

    public CombatResult performMeleeAttack(UUID attackerId, UUID defenderId, boolean dualWield, boolean offHand) {
        Combatant attacker;
        Combatant defender;
        try {
            attacker = combatants.findById(attackerId);
            defender = combatants.findById(defenderId);
        } catch (RuntimeException e) {
            logger.error("[CombatService] could not load combatants {} / {}", attackerId, defenderId, e);
            return CombatResult.error("Combatant lookup failed");
        }
        return performMeleeAttack(attacker, defender, dualWield, offHand);
    }

    public CombatResult performMeleeAttack(Combatant attacker, Combatant defender, boolean dualWield, boolean offHand) {
        if (attacker == null || defender == null) {
            return CombatResult.failure(CombatResult.ResultType.MISSING_COMBATANT, attacker, defender, "Combatant not found");
        }
        try {
            return CombatantLocks.withBoth(attacker, defender, () -> resolveMelee(attacker, defender, dualWield, offHand));
        } catch (RuntimeException e) {
            logger.error("[CombatService] melee attack {} -> {} failed", attacker.getName(), defender.getName(), e);
            return CombatResult.error("Attack failed: " + e.getMessage());
        }
    }

    public CombatResult performRangedAttack(Combatant attacker, Combatant defender) {
        return CombatResult.notImplemented(attacker, defender, "Ranged attack");
    }

    public CombatResult performKnockback(Combatant attacker, Combatant defender) {
        return CombatResult.notImplemented(attacker, defender, "Knockback");
    }

    private CombatResult resolveMelee(Combatant attacker, Combatant defender, boolean dualWield, boolean offHand) {
        if (!attacker.isAlive() || !defender.isAlive()) {
            return CombatResult.failure(CombatResult.ResultType.MISSING_COMBATANT, attacker, defender,
                (attacker.isAlive() ? defender : attacker).getName() + " is not here");
        }

        EffectSummary attackerEffects = effectService.getEffectSummary(attacker.getId());
        if (!attackerEffects.canAct()) {
            return CombatResult.failure(CombatResult.ResultType.ACTION_PREVENTED, attacker, defender,
                attacker.getName() + " is unable to act!");
        }
        ActionRestriction vitality = VitalityRules.evaluate(VitalityRules.availableVitality(attacker));
        if (!vitality.canAttempt()) {
            return CombatResult.failure(CombatResult.ResultType.ACTION_PREVENTED, attacker, defender,
                vitality.getFailureMessage());
        }

        CombatSession session = combatManager.initiateCombat(attacker, defender);
        if (session == null) {
            return CombatResult.failure(CombatResult.ResultType.ROOM_MISMATCH, attacker, defender,
                defender.getName() + " is not here");
        }

        int cost = dualWield ? 2 : 1;
        if (attacker.getCurrentFatigue() < cost) {
            return CombatResult.failure(CombatResult.ResultType.INSUFFICIENT_FATIGUE, attacker, defender,
                attacker.getName() + " is too exhausted to attack");
        }

        List<EquippedItem> attackerGear = equipment.getEquippedItems(attacker.getId());
        WeaponChoice weapon = resolveWeapon(attacker, attackerGear, offHand, attackerEffects);
        if (weapon == null) {
            return CombatResult.failure(CombatResult.ResultType.NO_WEAPON, attacker, defender,
                attacker.getName() + " has nothing to attack with");
        }
        if (weapon.isBroken()) {
            String msg = attacker.getName() + "'s " + weapon.item().getName() + " is broken and unusable!";
            publisher.publish(new CombatActionEvent(attacker.getId(), attacker.getName(), defender.getId(),
                defender.getName(), session.getRoomId(), msg, 0, false, weapon.skillName()));
            return CombatResult.failure(CombatResult.ResultType.BROKEN_WEAPON, attacker, defender, msg);
        }

        EffectSummary defenderEffects = effectService.getEffectSummary(defender.getId());
        CombatParticipant attackerPart = session.findActiveParticipant(attacker.getId());
        // the defender may be fighting in another session in this room
        CombatSession defenderSession = combatManager.getActiveSession(defender.getId());
        CombatParticipant defenderPart = defenderSession == null ? null
            : defenderSession.findActiveParticipant(defender.getId());
        boolean parry = defenderPart != null && defenderPart.isParryMode();

        // Attack value
        int attackRoll = dice.rollExploding4dF();
        int attackValue = weapon.skillLevel()
            - (offHand ? CombatCalculator.OFF_HAND_PENALTY : 0)
            + weapon.attackValueModifier()
            + combatManager.getTotalTimedPenalties(attacker)
            + attackerEffects.getAttackValueModifier()
            + attackRoll;

        // Defense value
        List<EquippedItem> defenderGear = equipment.getEquippedItems(defender.getId());
        int defenseBase;
        if (parry) {
            WeaponChoice parryWeapon = resolveWeapon(defender, defenderGear, false, defenderEffects);
            defenseBase = parryWeapon != null ? parryWeapon.skillLevel() : DEFAULT_SKILL_LEVEL;
        } else {
            Integer dodge = effectiveAttribute(defender, Attribute.DODGE, defenderEffects);
            defenseBase = (dodge != null ? dodge : DEFAULT_SKILL_LEVEL) + equipmentDodgeModifier(defenderGear);
        }
        int defenseRoll = dice.rollExploding4dF();
        int defenseValue = defenseBase + defenderEffects.getDefenseValueModifier() + defenseRoll;

        int successValue = attackValue - defenseValue;

        attacker.setCurrentFatigue(attacker.getCurrentFatigue() - cost);
        if (!parry && defender.getCurrentFatigue() > 0) {
            defender.setCurrentFatigue(defender.getCurrentFatigue() - 1);
        }

        if (successValue <= -3 && attackerPart != null) {
            combatManager.applyTimedPenalty(attackerPart, successValue);
        }

        long now = clock.millis();
        if (successValue < 0) {
            String msg = attacker.getName() + " attacks " + defender.getName() + " but misses!";
            combatManager.recordAction(session, new CombatActionLog(now, attacker.getId(), attacker.getName(),
                defender.getId(), defender.getName(), CombatActionLog.ActionType.MELEE_ATTACK,
                attackValue, defenseValue, successValue, 0, 0, 0, 0, null, weapon.damageType(), msg));
            publisher.publish(new CombatActionEvent(attacker.getId(), attacker.getName(), defender.getId(),
                defender.getName(), session.getRoomId(), msg, 0, false, weapon.skillName()));
            logger.debug("[CombatService] {} AV {} vs DV {}: miss", attacker.getName(), attackValue, defenseValue);
            return CombatResult.miss(attacker, defender, msg)
                .withValues(attackValue, attackRoll, defenseValue, defenseRoll, successValue);
        }

        // Physicality check
        Integer physicality = effectiveAttribute(attacker, Attribute.PHYSICALITY, attackerEffects);
        int physicalityRoll = (physicality != null ? physicality : DEFAULT_SKILL_LEVEL) + dice.rollExploding4dF();
        int resultValue = physicalityRoll - CombatCalculator.RESULT_VALUE_BASE;
        int boostedSv = successValue + CombatCalculator.resultValueBonus(resultValue) + weapon.baseSuccessValueModifier();
        if (resultValue <= -3 && attackerPart != null) {
            combatManager.applyTimedPenalty(attackerPart, resultValue);
        }

        // Location and armor
        HitLocation location = CombatCalculator.rollHitLocation(dice);
        int absorption = CombatCalculator.totalAbsorption(defenderGear, location, weapon.damageType(), weapon.damageClass());
        int finalSv = CombatCalculator.mitigate(boostedSv, absorption);

        // Damage
        int rawDamage = CombatCalculator.rollRawDamage(finalSv, dice);
        int damage = CombatCalculator.scaleDamage(rawDamage,
            attackerEffects.getDamageDealtModifier(), defenderEffects.getDamageReceivedModifier());
        CombatCalculator.DamageSplit split = CombatCalculator.splitDamage(damage);

        defender.setPendingFatigueDamage(SaturatingMath.add(defender.getPendingFatigueDamage(), split.fatigue()));
        defender.setPendingVitalityDamage(SaturatingMath.add(defender.getPendingVitalityDamage(), split.vitality()));
        if (split.wounds() > 0) {
            int added = addWounds(defender, attacker, location, split.wounds());
            defender.setWoundCount(SaturatingMath.add(defender.getWoundCount(), added));
        }

        String logText = attacker.getName() + " hits " + defender.getName() + " for " + damage + " damage!";
        String eventText = attacker.getName() + " hits " + defender.getName() + " dealing "
            + split.fatigue() + " FAT and " + split.vitality() + " VIT damage!";
        combatManager.recordAction(session, new CombatActionLog(now, attacker.getId(), attacker.getName(),
            defender.getId(), defender.getName(), CombatActionLog.ActionType.MELEE_ATTACK,
            attackValue, defenseValue, finalSv, damage, split.fatigue(), split.vitality(), split.wounds(),
            location, weapon.damageType(), logText));
        publisher.publish(new CombatActionEvent(attacker.getId(), attacker.getName(), defender.getId(),
            defender.getName(), session.getRoomId(), eventText, damage, true, weapon.skillName()));
        logger.debug("[CombatService] {} AV {} vs DV {}: SV {} -> {} after armor at {}, {} damage",
            attacker.getName(), attackValue, defenseValue, boostedSv, finalSv, location, damage);

        CombatResult result = CombatResult.hit(attacker, defender, eventText)
            .withValues(attackValue, attackRoll, defenseValue, defenseRoll, successValue)
            .withDamage(resultValue, location, absorption, finalSv, rawDamage, split);

        if (defender.getCurrentVitality() <= 0) {
            defender.handleDeath(now);
            combatManager.endCombat(session, defender.getName() + " died", attacker);
            result.withDefenderDied(true);
        }
        return result;
    }

    /**
     * Add wound stacks at the hit location.
     *
     * @return stacks actually added; a wound already at max stacks is only refreshed
     */
    private int addWounds(Combatant defender, Combatant attacker, HitLocation location, int wounds) {
        if (effectService.getRegistry().getDefinition(EffectService.WOUND_EFFECT) == null) {
            return wounds;
        }
        int added = 0;
        for (int i = 0; i < wounds; i++) {
            EffectApplicationResult applied = effectService.applyWound(defender, location.toBodyLocation(), attacker.getId());
            if (applied.isSuccess() && !applied.wasRefreshed()) added++;
        }
        return added;
    }

    /**
     * Pick the weapon for an attack or parry. Falls back to bare hands.
     *
     * @return null when there is no weapon and the combatant has no physicality
     */
    WeaponChoice resolveWeapon(Combatant combatant, List<EquippedItem> gear, boolean offHand, EffectSummary effects) {
        EquipmentSlot hand = offHand ? EquipmentSlot.OFF_HAND : EquipmentSlot.MAIN_HAND;
        EquippedItem item = findWeapon(gear, hand);
        if (item == null) {
            item = findWeapon(gear, EquipmentSlot.TWO_HAND);
        }

        Integer physicality = effectiveAttribute(combatant, Attribute.PHYSICALITY, effects);
        if (item != null) {
            WeaponProperties w = item.getWeapon();
            int level = (physicality != null ? physicality : DEFAULT_SKILL_LEVEL) + w.getSkillBonus();
            return new WeaponChoice(item.getName(), level, w.getDamageType(), w.getDamageClass(),
                w.getAttackValueModifier(), w.getBaseSuccessValueModifier(), item);
        }
        if (physicality == null) {
            return null;
        }
        return new WeaponChoice(UNARMED_SKILL, physicality, DamageType.BASHING, DamageClass.CLASS_1, 0, 0, null);
    }

    private static EquippedItem findWeapon(List<EquippedItem> gear, EquipmentSlot slot) {
        for (EquippedItem item : gear) {
            if (item.isWeapon() && item.getSlot() == slot) return item;
        }
        return null;
    }

    /** Dodge modifiers of every intact weapon and armor piece. */
    static int equipmentDodgeModifier(List<EquippedItem> gear) {
        int total = 0;
        for (EquippedItem item : gear) {
            if (item.isBroken()) continue;
            if (item.isWeapon()) total += item.getWeapon().getDodgeModifier();
            if (item.isArmor()) total += item.getArmor().getDodgeModifier();
        }
        return total;
    }

    private static Integer effectiveAttribute(Combatant c, Attribute attribute, EffectSummary effects) {
        Integer base = c.getAttribute(attribute);
        if (base == null) return null;
        return base + effects.getAttributeModifier(attribute);
    }
}
