package com.example.mordecai;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random whose nextInt(bound) answers come from a script. Once the script
 * runs out every call returns 0.
 *
 * For Fudge dice the answer is a face index: 0/1 blank, 2/3 plus, 4/5 minus.
 * For NdS dice the answer is the face minus one.
 */
public class ScriptedRandom extends Random {

    public static final int BLANK = 0;
    public static final int PLUS = 2;
    public static final int MINUS = 4;

    private final Deque<Integer> script = new ArrayDeque<>();

    public ScriptedRandom(int... values) {
        then(values);
    }

    public ScriptedRandom then(int... values) {
        for (int v : values) script.addLast(v);
        return this;
    }

    /** Queue four Fudge faces summing to the given total (-4..4). */
    public ScriptedRandom fudge(int total) {
        int sign = total >= 0 ? PLUS : MINUS;
        int n = Math.abs(total);
        for (int i = 0; i < 4; i++) {
            script.addLast(i < n ? sign : BLANK);
        }
        return this;
    }

    /** Queue one NdS face (1-based). */
    public ScriptedRandom face(int face) {
        script.addLast(face - 1);
        return this;
    }

    public int remaining() {
        return script.size();
    }

    @Override
    public int nextInt(int bound) {
        Integer v = script.pollFirst();
        if (v == null) return 0;
        if (v < 0 || v >= bound) {
            throw new IllegalStateException("scripted value " + v + " out of range for bound " + bound);
        }
        return v;
    }
}
