package com.example.mordecai.event;

import java.util.UUID;

public record CombatEnded(
    int roomId,
    String reason,
    UUID winnerId,
    String winnerName
) implements GameMessage {

    @Override
    public String summary() {
        String s = "Combat in room " + roomId + " ended: " + reason;
        return winnerName == null ? s : s + " (winner " + winnerName + ")";
    }
}
