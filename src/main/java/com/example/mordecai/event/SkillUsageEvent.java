package com.example.mordecai.event;

import java.util.UUID;

public record SkillUsageEvent(
    UUID combatantId,
    String skillName,
    SkillUsageType usageType,
    int basePoints,
    String context
) implements GameMessage {

    @Override
    public String summary() {
        return "skill " + skillName + " " + usageType + " +" + basePoints + " by " + combatantId + " [" + context + "]";
    }
}
