package com.example.mordecai.combat;

/**
 * A temporary attack-value penalty on a participant, e.g. from over-extending
 * on a bad miss.
 *
 * @param amount    negative modifier added to attack value
 * @param expiresAt epoch ms after which the penalty no longer applies
 */
public record TimedPenalty(int amount, long expiresAt) {

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }
}
