package com.lucidchart.imagediff;

/** Channel access for the packed ARGB ints returned by BufferedImage.getRGB() */
final class Pixels {

    static final int MAX_CHANNEL_VALUE = 255;

    private Pixels() {}

    /** An efficient way of extracting alpha from the rgb int value obtained from getRGB() */
    static int getAlpha(int argb) {
        return (argb >>> 24) & 0x000000FF;
    }

    /** An efficient way of extracting red from the rgb int value obtained from getRGB() */
    static int getRed(int argb) {
        return (argb >> 16) & 0x000000FF;
    }

    /** An efficient way of extracting green from the rgb int value obtained from getRGB() */
    static int getGreen(int argb) {
        return (argb >> 8) & 0x000000FF;
    }

    /** An efficient way of extracting blue from the rgb int value obtained from getRGB() */
    static int getBlue(int argb) {
        return (argb) & 0x000000FF;
    }

    static int argb(int alpha, int red, int green, int blue) {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    /** Clips a scaled difference into a displayable channel value, truncating any fraction */
    static int clip(double value) {
        if (value >= MAX_CHANNEL_VALUE) return MAX_CHANNEL_VALUE;
        if (value <= 0 || Double.isNaN(value)) return 0;
        return (int) value;
    }
}
