package com.lucidchart.imagediff;

/** Converts raw channel samples into z-score-like values using an image's own channel statistics. */
public final class Normalizer {

    private Normalizer() {}

    /** Returns (value - mean) / std.
     * A channel without variance cannot be z-scored, so the raw value is returned unchanged (not 0).
     * A negative std is applied as-is.
     */
    public static double normalize(double value, double mean, double std) {
        if (std == 0) return value;
        return (value - mean) / std;
    }
}
