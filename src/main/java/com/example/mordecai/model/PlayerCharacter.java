package com.example.mordecai.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * A player-controlled combatant. Max pools are stored on the character and
 * default to the attribute formulas: fatigue = DRIVE + FOCUS - 5,
 * vitality = PHYSICALITY x 2 - 5, each at least 1.
 */
public class PlayerCharacter extends AbstractCombatant {

    private final Map<Attribute, Integer> attributes = new EnumMap<>(Attribute.class);
    private int maxFatigue;
    private int maxVitality;

    public PlayerCharacter(UUID id, String name, int roomId, Map<Attribute, Integer> attributes) {
        this(id, name, roomId, attributes, null, null);
    }

    public PlayerCharacter(UUID id, String name, int roomId, Map<Attribute, Integer> attributes,
                           Integer maxFatigue, Integer maxVitality) {
        super(id, name, roomId);
        if (attributes != null) this.attributes.putAll(attributes);
        this.maxFatigue = maxFatigue != null ? Math.max(1, maxFatigue) : defaultMaxFatigue(this.attributes);
        this.maxVitality = maxVitality != null ? Math.max(1, maxVitality) : defaultMaxVitality(this.attributes);
        fillPools();
    }

    public static int defaultMaxFatigue(Map<Attribute, Integer> attributes) {
        return Math.max(1, level(attributes, Attribute.DRIVE) + level(attributes, Attribute.FOCUS) - 5);
    }

    public static int defaultMaxVitality(Map<Attribute, Integer> attributes) {
        return Math.max(1, level(attributes, Attribute.PHYSICALITY) * 2 - 5);
    }

    private static int level(Map<Attribute, Integer> attributes, Attribute a) {
        Integer v = attributes.get(a);
        return v == null ? 0 : v;
    }

    @Override
    public Integer getAttribute(Attribute attribute) {
        return attributes.get(attribute);
    }

    public void setAttribute(Attribute attribute, int level) {
        attributes.put(attribute, level);
    }

    @Override public int getMaxFatigue() { return maxFatigue; }
    public void setMaxFatigue(int maxFatigue) { this.maxFatigue = Math.max(1, maxFatigue); }

    @Override public int getMaxVitality() { return maxVitality; }
    public void setMaxVitality(int maxVitality) { this.maxVitality = Math.max(1, maxVitality); }

    @Override public boolean isPlayerControlled() { return true; }

    @Override
    public void handleDeath(long now) {
        // Respawn and corpse handling live outside the combat core
    }
}
