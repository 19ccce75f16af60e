package com.example.mordecai.event;

import java.util.UUID;

/**
 * One resolved (or refused) combat action, for sound propagation and room output.
 */
public record CombatActionEvent(
    UUID attackerId,
    String attackerName,
    UUID defenderId,
    String defenderName,
    int roomId,
    String description,
    int damage,
    boolean hit,
    String skillUsed
) implements GameMessage {

    @Override
    public String summary() {
        return description;
    }
}
