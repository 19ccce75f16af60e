package com.example.mordecai.vitality;

import com.example.mordecai.model.Combatant;

/**
 * Low-fatigue focus checks. Exhaustion never blocks an action outright; it
 * demands a focus check whose target rises as fatigue runs out.
 */
public final class FatigueRules {

    private FatigueRules() {}

    public static int availableFatigue(int current, int pending) {
        return Math.max(0, current - Math.max(0, pending));
    }

    public static int availableFatigue(Combatant c) {
        return availableFatigue(c.getCurrentFatigue(), c.getPendingFatigueDamage());
    }

    public static ActionRestriction evaluate(int availableFatigue) {
        switch (availableFatigue) {
            case 3:
                return ActionRestriction.focusCheck(5, "You force yourself to stay upright, but you can't muster the focus to act.");
            case 2:
                return ActionRestriction.focusCheck(7, "Your vision swims as exhaustion overtakes you.");
            case 1:
                return ActionRestriction.focusCheck(12, "You sway on your feet and blackness creeps at the edge of your sight.");
            default:
                return ActionRestriction.none();
        }
    }
}
