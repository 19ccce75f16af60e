package com.example.mordecai.effect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Content definition of a status effect (wound, buff, debuff, damage or heal
 * over time, status). Instances on combatants refer back to one of these.
 */
public class EffectDefinition {

    public enum Category {
        WOUND, BUFF, DEBUFF, DAMAGE_OVER_TIME, HEAL_OVER_TIME, STATUS;

        public static Category fromString(String str) {
            if (str == null || str.isEmpty()) return null;
            try {
                return Category.valueOf(str.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    private final String name;
    private final String description;
    private final Category category;
    private final boolean stackable;
    private final int maxStacks;
    private final int tickIntervalSeconds;     // 0 = no periodic processing
    private final int defaultDurationSeconds;  // 0 = permanent until removed
    private final double defaultIntensity;
    private final List<EffectImpact> impacts;

    public EffectDefinition(String name, String description, Category category,
                            boolean stackable, int maxStacks, int tickIntervalSeconds,
                            int defaultDurationSeconds, double defaultIntensity,
                            List<EffectImpact> impacts) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.category = category;
        this.stackable = stackable;
        this.maxStacks = Math.max(1, maxStacks);
        this.tickIntervalSeconds = Math.max(0, tickIntervalSeconds);
        this.defaultDurationSeconds = Math.max(0, defaultDurationSeconds);
        this.defaultIntensity = defaultIntensity;
        List<EffectImpact> sorted = impacts == null ? new ArrayList<>() : new ArrayList<>(impacts);
        sorted.sort(Comparator.comparingInt(EffectImpact::getApplyOrder));
        this.impacts = Collections.unmodifiableList(sorted);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public Category getCategory() { return category; }
    public boolean isStackable() { return stackable; }
    public int getMaxStacks() { return maxStacks; }
    public int getTickIntervalSeconds() { return tickIntervalSeconds; }
    public int getDefaultDurationSeconds() { return defaultDurationSeconds; }
    public double getDefaultIntensity() { return defaultIntensity; }
    public List<EffectImpact> getImpacts() { return impacts; }

    public boolean isWound() { return category == Category.WOUND; }

    public boolean isPeriodic() { return tickIntervalSeconds > 0; }
}
