package com.example.mordecai.effect;

/**
 * Outcome of applying an effect to a combatant.
 */
public class EffectApplicationResult {

    private final boolean success;
    private final EffectInstance effect;
    private final String message;
    private final boolean stacked;
    private final boolean refreshed;
    private final int newStackCount;

    private EffectApplicationResult(boolean success, EffectInstance effect, String message,
                                    boolean stacked, boolean refreshed, int newStackCount) {
        this.success = success;
        this.effect = effect;
        this.message = message;
        this.stacked = stacked;
        this.refreshed = refreshed;
        this.newStackCount = newStackCount;
    }

    public static EffectApplicationResult failure(String message) {
        return new EffectApplicationResult(false, null, message, false, false, 0);
    }

    public static EffectApplicationResult applied(EffectInstance effect) {
        return new EffectApplicationResult(true, effect, effect.getDefinition().getName() + " applied", false, false, 1);
    }

    public static EffectApplicationResult stacked(EffectInstance effect) {
        String msg = effect.getDefinition().getName() + " stacked (" + effect.getStacks() + "/"
            + effect.getDefinition().getMaxStacks() + ")";
        return new EffectApplicationResult(true, effect, msg, true, false, effect.getStacks());
    }

    public static EffectApplicationResult refreshedAtMaxStacks(EffectInstance effect) {
        return new EffectApplicationResult(true, effect, effect.getDefinition().getName() + " refreshed (max stacks)",
            false, true, effect.getStacks());
    }

    public static EffectApplicationResult refreshed(EffectInstance effect) {
        return new EffectApplicationResult(true, effect, effect.getDefinition().getName() + " refreshed",
            false, true, effect.getStacks());
    }

    public boolean isSuccess() { return success; }
    public EffectInstance getEffect() { return effect; }
    public String getMessage() { return message; }
    public boolean wasStacked() { return stacked; }
    public boolean wasRefreshed() { return refreshed; }
    public int getNewStackCount() { return newStackCount; }
}
