package com.example.mordecai.model;

/**
 * Template defining a type of NPC. Spawned instances read their attributes
 * and max pools from here.
 */
public class NpcTemplate {

    private final String key;              // Unique string identifier (e.g., "goblin_warrior")
    private final String name;             // Display name (e.g., "Goblin Warrior")
    private final String description;
    private final int level;

    // Base attributes
    private final int strength;
    private final int endurance;
    private final int coordination;
    private final int quickness;
    private final int intelligence;
    private final int willpower;
    private final int charisma;

    private final boolean hostile;
    private final NpcBehavior behavior;

    public NpcTemplate(String key, String name, String description, int level,
                       int strength, int endurance, int coordination, int quickness,
                       int intelligence, int willpower, int charisma,
                       boolean hostile, NpcBehavior behavior) {
        this.key = key;
        this.name = name;
        this.description = description;
        this.level = level;
        this.strength = strength;
        this.endurance = endurance;
        this.coordination = coordination;
        this.quickness = quickness;
        this.intelligence = intelligence;
        this.willpower = willpower;
        this.charisma = charisma;
        this.hostile = hostile;
        this.behavior = behavior == null ? NpcBehavior.DEFAULT : behavior;
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getLevel() { return level; }

    public int getStrength() { return strength; }
    public int getEndurance() { return endurance; }
    public int getCoordination() { return coordination; }
    public int getQuickness() { return quickness; }
    public int getIntelligence() { return intelligence; }
    public int getWillpower() { return willpower; }
    public int getCharisma() { return charisma; }

    public boolean isHostile() { return hostile; }
    public NpcBehavior getBehavior() { return behavior; }

    /** (END + WIL) - 5, at least 1 */
    public int getMaxFatigue() {
        return Math.max(1, endurance + willpower - 5);
    }

    /** (STR x 2) - 5, at least 1 */
    public int getMaxVitality() {
        return Math.max(1, strength * 2 - 5);
    }

    /**
     * Map a combat attribute onto the template's native attribute.
     */
    public int getAttribute(Attribute attribute) {
        switch (attribute) {
            case PHYSICALITY: return strength;
            case DODGE: return quickness;
            case DRIVE: return endurance;
            case REASONING: return intelligence;
            case AWARENESS: return coordination;
            case FOCUS: return willpower;
            case BEARING: return charisma;
            default: return 0;
        }
    }
}
