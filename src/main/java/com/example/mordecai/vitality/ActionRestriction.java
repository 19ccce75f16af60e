package com.example.mordecai.vitality;

/**
 * What a low pool does to a combatant's next action: nothing, a hard block,
 * or a focus check that must be passed first.
 */
public class ActionRestriction {

    private static final ActionRestriction NONE = new ActionRestriction(true, null, null);

    private final boolean canAttempt;
    private final Integer focusCheckTarget;
    private final String failureMessage;

    private ActionRestriction(boolean canAttempt, Integer focusCheckTarget, String failureMessage) {
        this.canAttempt = canAttempt;
        this.focusCheckTarget = focusCheckTarget;
        this.failureMessage = failureMessage;
    }

    public static ActionRestriction none() {
        return NONE;
    }

    public static ActionRestriction blocked(String message) {
        return new ActionRestriction(false, null, message);
    }

    public static ActionRestriction focusCheck(int target, String failureMessage) {
        return new ActionRestriction(true, target, failureMessage);
    }

    /** False when the action is refused outright. */
    public boolean canAttempt() { return canAttempt; }
    public boolean requiresFocusCheck() { return focusCheckTarget != null; }
    public Integer getFocusCheckTarget() { return focusCheckTarget; }
    public String getFailureMessage() { return failureMessage; }
}
