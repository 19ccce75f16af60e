package com.example.mordecai.model;

/**
 * Where a successful melee attack lands.
 */
public enum HitLocation {
    HEAD("head", BodyLocation.HEAD),
    TORSO("torso", BodyLocation.TORSO),
    LEFT_ARM("leftarm", BodyLocation.LEFT_ARM),
    RIGHT_ARM("rightarm", BodyLocation.RIGHT_ARM),
    LEFT_LEG("leftleg", BodyLocation.LEFT_LEG),
    RIGHT_LEG("rightleg", BodyLocation.RIGHT_LEG);

    /** Lower-case name used when matching armor coverage lists */
    public final String coverageKey;
    private final BodyLocation bodyLocation;

    HitLocation(String coverageKey, BodyLocation bodyLocation) {
        this.coverageKey = coverageKey;
        this.bodyLocation = bodyLocation;
    }

    public String getCoverageKey() { return coverageKey; }

    /** Body location a wound at this hit location is tagged with. */
    public BodyLocation toBodyLocation() { return bodyLocation; }

    public boolean isArm() { return this == LEFT_ARM || this == RIGHT_ARM; }

    public boolean isLeg() { return this == LEFT_LEG || this == RIGHT_LEG; }
}
