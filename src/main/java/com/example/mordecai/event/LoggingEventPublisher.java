package com.example.mordecai.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default publisher: writes every message to the log.
 */
public class LoggingEventPublisher implements GameEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingEventPublisher.class);

    @Override
    public void publish(GameMessage message) {
        if (message instanceof SkillUsageEvent) {
            logger.debug("[event] {}", message.summary());
        } else {
            logger.info("[event] {}", message.summary());
        }
    }
}
