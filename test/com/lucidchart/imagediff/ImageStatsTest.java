package com.lucidchart.imagediff;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.awt.image.BufferedImage;

import static com.lucidchart.imagediff.TestUtil.argb;
import static com.lucidchart.imagediff.TestUtil.createTestImage;

public class ImageStatsTest {

    private static final double TOLERANCE = 0.1;

    private void assertStats(ImageStats stats, double[] means, double[] stds) {
        Assert.assertEquals(stats.meanR, means[0], TOLERANCE);
        Assert.assertEquals(stats.meanG, means[1], TOLERANCE);
        Assert.assertEquals(stats.meanB, means[2], TOLERANCE);
        Assert.assertEquals(stats.meanA, means[3], TOLERANCE);
        Assert.assertEquals(stats.stdR, stds[0], TOLERANCE);
        Assert.assertEquals(stats.stdG, stds[1], TOLERANCE);
        Assert.assertEquals(stats.stdB, stds[2], TOLERANCE);
        Assert.assertEquals(stats.stdA, stds[3], TOLERANCE);
    }

    @Test
    public void solidWhiteTest() {
        ImageStats stats = ImageStats.apply(createTestImage(2, 2, 255, 255, 255, 255));
        assertStats(stats, new double[]{255, 255, 255, 255}, new double[]{0, 0, 0, 0});
    }

    @Test
    public void checkerboardUsesPopulationDeviationTest() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, argb(255, 255, 255, 255));
        image.setRGB(0, 1, argb(0, 0, 0, 255));
        image.setRGB(1, 0, argb(0, 0, 0, 255));
        image.setRGB(1, 1, argb(255, 255, 255, 255));

        // A sample deviation would give 147.2
        assertStats(ImageStats.apply(image), new double[]{127.5, 127.5, 127.5, 255}, new double[]{127.5, 127.5, 127.5, 0});
    }

    @Test
    public void singlePixelTest() {
        ImageStats stats = ImageStats.apply(createTestImage(1, 1, 100, 150, 200, 255));
        assertStats(stats, new double[]{100, 150, 200, 255}, new double[]{0, 0, 0, 0});
    }

    @Test
    public void transparentTest() {
        ImageStats stats = ImageStats.apply(createTestImage(2, 2, 100, 100, 100, 0));
        assertStats(stats, new double[]{100, 100, 100, 0}, new double[]{0, 0, 0, 0});
    }

    @Test
    public void constantColorHasZeroDeviationOnLargeImageTest() {
        ImageStats stats = ImageStats.apply(createTestImage(97, 41, 12, 34, 56, 78));
        assertStats(stats, new double[]{12, 34, 56, 78}, new double[]{0, 0, 0, 0});
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void missingImageTest() {
        ImageStats.apply(null);
    }
}
