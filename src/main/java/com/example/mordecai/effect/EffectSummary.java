package com.example.mordecai.effect;

import com.example.mordecai.model.Attribute;
import com.example.mordecai.model.BodyLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Net effect of everything active on a combatant, as consumed by attack
 * resolution and the action gates.
 */
public class EffectSummary {

    /** Each active wound stack costs this much attack value */
    public static final int WOUND_ATTACK_PENALTY = -2;

    private final UUID combatantId;

    private int attackValueModifier;
    private int defenseValueModifier;
    private final Map<Attribute, Integer> attributeModifiers = new EnumMap<>(Attribute.class);
    private final Map<String, Integer> skillModifiers = new HashMap<>();
    private int maxFatigueModifier;
    private int maxVitalityModifier;
    private double damageDealtModifier;
    private double damageReceivedModifier;

    private boolean canMove = true;
    private boolean canCastSpells = true;
    private boolean canAct = true;
    private boolean invisible;

    private int woundCount;
    private final Map<BodyLocation, Integer> woundsByLocation = new EnumMap<>(BodyLocation.class);
    private final List<String> activeEffectNames = new ArrayList<>();

    public EffectSummary(UUID combatantId) {
        this.combatantId = combatantId;
    }

    /**
     * Fold one active instance into the totals.
     */
    void accumulate(EffectInstance instance) {
        EffectDefinition def = instance.getDefinition();
        int stacks = instance.getStacks();
        double intensity = instance.getIntensity();

        activeEffectNames.add(instance.displayName());

        if (def.isWound()) {
            woundCount += stacks;
            BodyLocation loc = instance.getBodyLocation() == null ? BodyLocation.GENERAL : instance.getBodyLocation();
            woundsByLocation.merge(loc, stacks, Integer::sum);
            attackValueModifier += WOUND_ATTACK_PENALTY * stacks;
        }

        for (EffectImpact impact : def.getImpacts()) {
            double mod = impact.scaledValue(intensity, stacks);
            int intMod = (int) Math.round(mod);
            switch (impact.getType()) {
                case MODIFY_ATTRIBUTE:
                    if (impact.getAttribute() != null) attributeModifiers.merge(impact.getAttribute(), intMod, Integer::sum);
                    break;
                case MODIFY_SKILL:
                    if (impact.getSkillName() != null) skillModifiers.merge(impact.getSkillName().toLowerCase(), intMod, Integer::sum);
                    break;
                case MODIFY_ATTACK_VALUE:
                    attackValueModifier += intMod;
                    break;
                case MODIFY_DEFENSE_VALUE:
                    defenseValueModifier += intMod;
                    break;
                case MODIFY_MAX_FATIGUE:
                    maxFatigueModifier += intMod;
                    break;
                case MODIFY_MAX_VITALITY:
                    maxVitalityModifier += intMod;
                    break;
                case MODIFY_DAMAGE_DEALT:
                    damageDealtModifier += mod;
                    break;
                case MODIFY_DAMAGE_RECEIVED:
                    damageReceivedModifier += mod;
                    break;
                case PREVENT_MOVEMENT:
                    canMove = false;
                    break;
                case PREVENT_SPELLCASTING:
                    canCastSpells = false;
                    break;
                case PREVENT_ACTIONS:
                    canAct = false;
                    break;
                case INVISIBILITY:
                    invisible = true;
                    break;
                default:
                    // periodic impacts are handled by the effect tick
                    break;
            }
        }
    }

    public UUID getCombatantId() { return combatantId; }
    public int getAttackValueModifier() { return attackValueModifier; }
    public int getDefenseValueModifier() { return defenseValueModifier; }
    public Map<Attribute, Integer> getAttributeModifiers() { return Collections.unmodifiableMap(attributeModifiers); }
    public Map<String, Integer> getSkillModifiers() { return Collections.unmodifiableMap(skillModifiers); }
    public int getMaxFatigueModifier() { return maxFatigueModifier; }
    public int getMaxVitalityModifier() { return maxVitalityModifier; }
    public double getDamageDealtModifier() { return damageDealtModifier; }
    public double getDamageReceivedModifier() { return damageReceivedModifier; }
    public boolean canMove() { return canMove; }
    public boolean canCastSpells() { return canCastSpells; }
    public boolean canAct() { return canAct; }
    public boolean isInvisible() { return invisible; }
    public int getWoundCount() { return woundCount; }
    public Map<BodyLocation, Integer> getWoundsByLocation() { return Collections.unmodifiableMap(woundsByLocation); }
    public List<String> getActiveEffectNames() { return Collections.unmodifiableList(activeEffectNames); }

    public int getAttributeModifier(Attribute attribute) {
        Integer v = attributeModifiers.get(attribute);
        return v == null ? 0 : v;
    }

    public int getSkillModifier(String skillName) {
        if (skillName == null) return 0;
        Integer v = skillModifiers.get(skillName.toLowerCase());
        return v == null ? 0 : v;
    }
}
