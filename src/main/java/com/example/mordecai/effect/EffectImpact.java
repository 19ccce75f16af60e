package com.example.mordecai.effect;

import com.example.mordecai.model.Attribute;

/**
 * One typed modifier carried by an effect definition.
 */
public class EffectImpact {

    public enum ImpactType {
        MODIFY_ATTRIBUTE,
        MODIFY_SKILL,
        MODIFY_ATTACK_VALUE,
        MODIFY_DEFENSE_VALUE,
        PERIODIC_FATIGUE_DAMAGE,
        PERIODIC_VITALITY_DAMAGE,
        PERIODIC_FATIGUE_HEALING,
        PERIODIC_VITALITY_HEALING,
        MODIFY_MAX_FATIGUE,
        MODIFY_MAX_VITALITY,
        PREVENT_MOVEMENT,
        PREVENT_SPELLCASTING,
        PREVENT_ACTIONS,
        INVISIBILITY,
        MODIFY_DAMAGE_DEALT,
        MODIFY_DAMAGE_RECEIVED;

        public boolean isPeriodic() {
            return this == PERIODIC_FATIGUE_DAMAGE || this == PERIODIC_VITALITY_DAMAGE
                || this == PERIODIC_FATIGUE_HEALING || this == PERIODIC_VITALITY_HEALING;
        }

        public static ImpactType fromString(String str) {
            if (str == null || str.isEmpty()) return null;
            try {
                return ImpactType.valueOf(str.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    private final ImpactType type;
    private final Attribute attribute;       // MODIFY_ATTRIBUTE only
    private final String skillName;          // MODIFY_SKILL only
    private final double value;
    private final boolean percentage;        // value is a fraction, e.g. -0.20
    private final boolean scalesWithIntensity;
    private final int applyOrder;

    public EffectImpact(ImpactType type, Attribute attribute, String skillName, double value,
                        boolean percentage, boolean scalesWithIntensity, int applyOrder) {
        this.type = type;
        this.attribute = attribute;
        this.skillName = skillName;
        this.value = value;
        this.percentage = percentage;
        this.scalesWithIntensity = scalesWithIntensity;
        this.applyOrder = applyOrder;
    }

    public static EffectImpact of(ImpactType type, double value) {
        return new EffectImpact(type, null, null, value, false, true, 0);
    }

    public ImpactType getType() { return type; }
    public Attribute getAttribute() { return attribute; }
    public String getSkillName() { return skillName; }
    public double getValue() { return value; }
    public boolean isPercentage() { return percentage; }
    public boolean isScalesWithIntensity() { return scalesWithIntensity; }
    public int getApplyOrder() { return applyOrder; }

    /**
     * Value after intensity (when flagged) and stack scaling.
     */
    public double scaledValue(double intensity, int stacks) {
        double v = value;
        if (scalesWithIntensity) {
            v *= intensity;
        }
        return v * stacks;
    }
}
