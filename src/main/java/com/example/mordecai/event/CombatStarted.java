package com.example.mordecai.event;

import java.util.UUID;

public record CombatStarted(
    UUID initiatorId,
    String initiatorName,
    UUID targetId,
    String targetName,
    int roomId
) implements GameMessage {

    @Override
    public String summary() {
        return initiatorName + " attacks " + targetName + " (room " + roomId + ")";
    }
}
