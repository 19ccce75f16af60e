package com.example.mordecai.event;

/**
 * An outbound notification from the combat core (sound/log broadcast,
 * progression tracking).
 */
public interface GameMessage {

    /** One-line human readable form, used for logging. */
    String summary();
}
