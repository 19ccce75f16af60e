package com.example.mordecai.event;

/**
 * How a skill was exercised, for the progression subsystem.
 */
public enum SkillUsageType {
    /** Ordinary use; also recorded for failed attempts */
    ROUTINE_USE,
    /** Succeeded against a meaningful challenge */
    CHALLENGING_USE
}
