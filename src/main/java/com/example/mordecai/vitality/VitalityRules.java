package com.example.mordecai.vitality;

import com.example.mordecai.model.Combatant;

/**
 * Vitality thresholds that restrict actions and slow fatigue recovery.
 * Everything keys off available vitality: current minus any pending damage.
 */
public final class VitalityRules {

    public static final String DEAD_MESSAGE = "You have died.";
    public static final String TOO_INJURED_MESSAGE = "You are too grievously injured to move.";
    public static final String EDGE_OF_DEATH_MESSAGE = "You hover on the edge of death and your limbs refuse to move.";
    public static final String PAIN_MESSAGE = "Pain grips every nerve; you cannot force your body to respond.";

    private static final long HOUR_MS = 3_600_000L;
    private static final long HALF_HOUR_MS = 1_800_000L;
    private static final long MINUTE_MS = 60_000L;

    private VitalityRules() {}

    /** max(0, current - max(0, pending)) */
    public static int availableVitality(int current, int pending) {
        return Math.max(0, current - Math.max(0, pending));
    }

    public static int availableVitality(Combatant c) {
        return availableVitality(c.getCurrentVitality(), c.getPendingVitalityDamage());
    }

    public static ActionRestriction evaluate(int availableVitality) {
        if (availableVitality <= 0) return ActionRestriction.blocked(DEAD_MESSAGE);
        if (availableVitality == 1) return ActionRestriction.blocked(TOO_INJURED_MESSAGE);
        if (availableVitality == 2) return ActionRestriction.focusCheck(12, EDGE_OF_DEATH_MESSAGE);
        if (availableVitality == 3) return ActionRestriction.focusCheck(7, PAIN_MESSAGE);
        return ActionRestriction.none();
    }

    /**
     * How often one point of fatigue comes back.
     *
     * @return interval in ms, or null when fatigue does not recover at all
     */
    public static Long fatigueRegenIntervalMillis(int availableVitality, long baseMillis) {
        if (availableVitality <= 1) return null;
        if (availableVitality == 2) return HOUR_MS;
        if (availableVitality == 3) return HALF_HOUR_MS;
        if (availableVitality == 4) return MINUTE_MS;
        return baseMillis;
    }
}
