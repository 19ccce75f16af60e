package com.example.mordecai.event;

/**
 * Sink for messages the combat core produces. Implementations forward them to
 * whatever bus the host server runs; publishing must not throw for ordinary
 * delivery problems.
 */
@FunctionalInterface
public interface GameEventPublisher {

    void publish(GameMessage message);
}
