package com.lucidchart.imagediff;

import java.awt.image.BufferedImage;
import java.util.Random;

public class TestUtil {

    /** A solid image of one ARGB color */
    static BufferedImage createTestImage(int width, int height, int red, int green, int blue, int alpha) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int argb = argb(red, green, blue, alpha);
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                image.setRGB(x, y, argb);
        return image;
    }

    /** A reproducible noisy image, so that every chunk sees different pixels */
    static BufferedImage createNoiseImage(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                image.setRGB(x, y, argb(random.nextInt(256), random.nextInt(256), random.nextInt(256), 255));
        return image;
    }

    static int argb(int red, int green, int blue, int alpha) {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    /** Returns {red, green, blue, alpha} of a pixel */
    static int[] channels(BufferedImage image, int x, int y) {
        int argb = image.getRGB(x, y);
        return new int[]{(argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF};
    }

    static boolean samePixels(BufferedImage first, BufferedImage second) {
        if (first.getWidth() != second.getWidth() || first.getHeight() != second.getHeight()) return false;
        for (int y = 0; y < first.getHeight(); y++)
            for (int x = 0; x < first.getWidth(); x++)
                if (first.getRGB(x, y) != second.getRGB(x, y)) return false;
        return true;
    }
}
