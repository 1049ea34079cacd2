package com.lucidchart.imagediff;

import java.awt.image.BufferedImage;

import static com.lucidchart.imagediff.Pixels.*;

/** Per-channel mean and population standard deviation of an entire image.
 *
 * Computed once per source image when a normalized difference is requested, and read-only afterwards.
 * The standard deviation divides by the pixel count, not count - 1.
 */
public class ImageStats {
    public final double meanR;
    public final double meanG;
    public final double meanB;
    public final double meanA;
    public final double stdR;
    public final double stdG;
    public final double stdB;
    public final double stdA;

    private ImageStats(double meanR, double meanG, double meanB, double meanA,
                       double stdR, double stdG, double stdB, double stdA) {
        this.meanR = meanR;
        this.meanG = meanG;
        this.meanB = meanB;
        this.meanA = meanA;
        this.stdR = stdR;
        this.stdG = stdG;
        this.stdB = stdB;
        this.stdA = stdA;
    }

    /** Two passes over every pixel: the channel means first, then the mean squared deviation from them. */
    public static ImageStats apply(BufferedImage image) {
        if (image == null) throw new IllegalArgumentException("An image is required to compute statistics");
        int width = image.getWidth();
        int height = image.getHeight();
        double count = (double) width * height;

        double sumR = 0, sumG = 0, sumB = 0, sumA = 0;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                sumR += getRed(argb);
                sumG += getGreen(argb);
                sumB += getBlue(argb);
                sumA += getAlpha(argb);
            }

        double meanR = sumR / count;
        double meanG = sumG / count;
        double meanB = sumB / count;
        double meanA = sumA / count;

        double sqR = 0, sqG = 0, sqB = 0, sqA = 0;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                double dR = getRed(argb) - meanR;
                double dG = getGreen(argb) - meanG;
                double dB = getBlue(argb) - meanB;
                double dA = getAlpha(argb) - meanA;
                sqR += dR * dR;
                sqG += dG * dG;
                sqB += dB * dB;
                sqA += dA * dA;
            }

        return new ImageStats(meanR, meanG, meanB, meanA,
                Math.sqrt(sqR / count),
                Math.sqrt(sqG / count),
                Math.sqrt(sqB / count),
                Math.sqrt(sqA / count));
    }

    @Override
    public String toString() {
        return String.format("mean (r%.2f, g%.2f, b%.2f, a%.2f) std (r%.2f, g%.2f, b%.2f, a%.2f)",
                meanR, meanG, meanB, meanA, stdR, stdG, stdB, stdA);
    }
}
