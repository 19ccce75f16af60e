package com.example.mordecai.util;

/**
 * Integer arithmetic that clamps to the int range instead of wrapping.
 * Pool and pending-damage bookkeeping goes through here.
 */
public final class SaturatingMath {

    private SaturatingMath() {}

    public static int add(int a, int b) {
        return clamp((long) a + (long) b);
    }

    public static int subtract(int a, int b) {
        return clamp((long) a - (long) b);
    }

    public static int multiply(int a, int b) {
        return clamp((long) a * (long) b);
    }

    public static int clamp(long value) {
        if (value > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (value < Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) value;
    }
}
