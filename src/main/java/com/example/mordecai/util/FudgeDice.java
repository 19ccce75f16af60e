package com.example.mordecai.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Dice used by combat resolution.
 *
 * A Fudge die has six faces: two blank (0), two plus (+1) and two minus (-1).
 * 4dF sums four of them for a result in [-4, +4]. The exploding variant keeps
 * rolling on a perfect +4 or -4: each further set of four dice adds the number
 * of faces that match the first roll's sign, and only another perfect set keeps
 * the explosion going.
 */
public class FudgeDice {

    private static final Logger logger = LoggerFactory.getLogger(FudgeDice.class);

    public static final int DEFAULT_MAX_EXPLOSION_REROLLS = 20;

    private static final int[] FACES = { 0, 0, 1, 1, -1, -1 };

    private final Random random;
    private final int maxExplosionRerolls;

    public FudgeDice() {
        this(new SecureRandom(), DEFAULT_MAX_EXPLOSION_REROLLS);
    }

    public FudgeDice(Random random, int maxExplosionRerolls) {
        this.random = random;
        this.maxExplosionRerolls = Math.max(0, maxExplosionRerolls);
    }

    /** One Fudge die: -1, 0 or +1. */
    public int rollDie() {
        return FACES[random.nextInt(FACES.length)];
    }

    /** Four Fudge dice summed, -4 to +4. */
    public int roll4dF() {
        int total = 0;
        for (int i = 0; i < 4; i++) {
            total += rollDie();
        }
        return total;
    }

    /**
     * 4dF that explodes on +4 or -4. The number of re-rolls is capped at
     * {@code maxExplosionRerolls}.
     */
    public int rollExploding4dF() {
        int total = roll4dF();
        if (total != 4 && total != -4) {
            return total;
        }

        int sign = total > 0 ? 1 : -1;
        int rerolls = 0;
        while (true) {
            if (rerolls >= maxExplosionRerolls) {
                logger.warn("[FudgeDice] explosion stopped at the re-roll cap of {} (total {})", maxExplosionRerolls, total);
                break;
            }
            rerolls++;

            int matches = 0;
            for (int i = 0; i < 4; i++) {
                if (rollDie() == sign) matches++;
            }
            total = SaturatingMath.add(total, sign * matches);

            if (matches < 4) {
                break;
            }
        }
        return total;
    }

    /** NdS, e.g. rollDice(2, 8) for 2d8. Returns 0 for a non-positive count or sides. */
    public int rollDice(int count, int sides) {
        if (count <= 0 || sides <= 0) return 0;
        int total = 0;
        for (int i = 0; i < count; i++) {
            total += random.nextInt(sides) + 1;
        }
        return total;
    }

    public int rollD12() {
        return rollDice(1, 12);
    }

    public int getMaxExplosionRerolls() {
        return maxExplosionRerolls;
    }
}
