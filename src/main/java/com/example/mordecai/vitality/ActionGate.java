package com.example.mordecai.vitality;

import com.example.mordecai.effect.EffectService;
import com.example.mordecai.effect.EffectSummary;
import com.example.mordecai.event.GameEventPublisher;
import com.example.mordecai.event.SkillUsageEvent;
import com.example.mordecai.event.SkillUsageType;
import com.example.mordecai.model.Attribute;
import com.example.mordecai.model.Combatant;
import com.example.mordecai.util.CombatantLocks;
import com.example.mordecai.util.FudgeDice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a combatant may act right now: status effects first, then
 * vitality, then fatigue. Focus checks are FOCUS + 4dF against a target and
 * report their outcome to the progression subsystem.
 *
 * <p>The command layer calls {@link #check} through
 * {@code CombatCore.getActionGate()} before running a player command.
 * Melee attacks and NPC turns enforce the hard blocks themselves (stun and
 * 1 available vitality or less) without rolling focus checks.
 */
public class ActionGate {

    private static final Logger logger = LoggerFactory.getLogger(ActionGate.class);

    public static final String FOCUS_SKILL = "Focus";
    public static final String UNABLE_TO_ACT_MESSAGE = "You are unable to act!";

    /**
     * Result of a gate check - either allowed (null message) or refused with a reason.
     */
    public static class GateResult {
        private final boolean allowed;
        private final String failureMessage;

        private GateResult(boolean allowed, String failureMessage) {
            this.allowed = allowed;
            this.failureMessage = failureMessage;
        }

        public static GateResult allowed() {
            return new GateResult(true, null);
        }

        public static GateResult refused(String message) {
            return new GateResult(false, message);
        }

        public boolean isAllowed() { return allowed; }
        public String getFailureMessage() { return failureMessage; }
    }

    private final EffectService effectService;
    private final FudgeDice dice;
    private final GameEventPublisher publisher;

    public ActionGate(EffectService effectService, FudgeDice dice, GameEventPublisher publisher) {
        this.effectService = effectService;
        this.dice = dice;
        this.publisher = publisher;
    }

    public GateResult check(Combatant combatant) {
        EffectSummary effects = effectService.getEffectSummary(combatant.getId());
        if (!effects.canAct()) {
            return GateResult.refused(UNABLE_TO_ACT_MESSAGE);
        }

        int availableVitality = CombatantLocks.withLock(combatant, () -> VitalityRules.availableVitality(combatant));
        GateResult vitality = apply(combatant, VitalityRules.evaluate(availableVitality), "low-vitality", effects);
        if (!vitality.isAllowed()) return vitality;

        int availableFatigue = CombatantLocks.withLock(combatant, () -> FatigueRules.availableFatigue(combatant));
        return apply(combatant, FatigueRules.evaluate(availableFatigue), "low-fatigue", effects);
    }

    private GateResult apply(Combatant combatant, ActionRestriction restriction, String context, EffectSummary effects) {
        if (!restriction.canAttempt()) {
            return GateResult.refused(restriction.getFailureMessage());
        }
        if (!restriction.requiresFocusCheck()) {
            return GateResult.allowed();
        }
        boolean passed = rollFocusCheck(combatant, restriction.getFocusCheckTarget(), context, effects);
        return passed ? GateResult.allowed() : GateResult.refused(restriction.getFailureMessage());
    }

    /**
     * FOCUS + 4dF against the target. A pass counts as a challenging use of
     * Focus; a failure still counts as a routine use.
     */
    boolean rollFocusCheck(Combatant combatant, int target, String context, EffectSummary effects) {
        Integer focus = combatant.getAttribute(Attribute.FOCUS);
        int level = (focus == null ? 0 : focus) + effects.getAttributeModifier(Attribute.FOCUS);
        int roll = level + dice.roll4dF();
        boolean passed = roll >= target;
        publisher.publish(new SkillUsageEvent(combatant.getId(), FOCUS_SKILL,
            passed ? SkillUsageType.CHALLENGING_USE : SkillUsageType.ROUTINE_USE, 1, context));
        logger.debug("[ActionGate] {} focus check {} vs {}: {}", combatant.getName(), roll, target, passed ? "pass" : "fail");
        return passed;
    }
}
