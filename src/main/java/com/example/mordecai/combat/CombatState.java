package com.example.mordecai.combat;

/**
 * Represents the current state of a combat session.
 */
public enum CombatState {

    /** Participants are exchanging attacks */
    ACTIVE("Active"),

    /** Combat has ended (death, flight or explicit stop) */
    ENDED("Ended");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
