package com.example.mordecai.model;

/**
 * Per-template combat behaviour overrides for NPCs.
 */
public class NpcBehavior {

    public static final NpcBehavior DEFAULT = new NpcBehavior(null, false, 5);

    /** Vitality fraction (0.0-1.0) at or below which the NPC tries to flee; null uses the configured default */
    private final Double fleeThreshold;
    /** Fights to the death */
    private final boolean neverFlee;
    private final int aggressionLevel;

    public NpcBehavior(Double fleeThreshold, boolean neverFlee, int aggressionLevel) {
        this.fleeThreshold = fleeThreshold;
        this.neverFlee = neverFlee;
        this.aggressionLevel = aggressionLevel;
    }

    public Double getFleeThreshold() { return fleeThreshold; }
    public boolean isNeverFlee() { return neverFlee; }
    public int getAggressionLevel() { return aggressionLevel; }
}
