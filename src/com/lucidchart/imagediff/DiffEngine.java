package com.lucidchart.imagediff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

import static com.lucidchart.imagediff.Pixels.*;

/** Computes the per-pixel difference of one chunk and renders it into the shared diff image.
 *
 * Each invocation writes only the pixels of its own chunk, so chunks of the same image can run concurrently
 * against one diff image without locking.
 */
public final class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    private static final int OPAQUE = MAX_CHANNEL_VALUE;
    private static final int WHITE = argb(OPAQUE, MAX_CHANNEL_VALUE, MAX_CHANNEL_VALUE, MAX_CHANNEL_VALUE);
    private static final int BLACK = argb(OPAQUE, 0, 0, 0);

    private DiffEngine() {}

    /**
     * Processes every pixel of the chunk.
     *
     * @param left The left source image.
     * @param right The right source image, same size as left.
     * @param diffImage The output raster; only the chunk's pixels are written.
     * @param chunk The region to process.
     * @param leftStats Statistics of the left image.  Only read for normalized runs, may be null otherwise.
     * @param rightStats Statistics of the right image.  Only read for normalized runs, may be null otherwise.
     * @param config The diff mode, scale factor, normalization and tracing settings.
     * @return the non-background pixel counts of both images and the differing pixel count, for this chunk only.
     */
    public static DiffCounts computeChunk(BufferedImage left, BufferedImage right, BufferedImage diffImage, Chunk chunk,
                                          ImageStats leftStats, ImageStats rightStats, DiffConfig config) {
        if (config.verbose) {
            logger.info("Processing chunk: startX={}, endX={}, startY={}, endY={}", chunk.startX, chunk.endX, chunk.startY, chunk.endY);
        } else {
            logger.debug("Processing {}", chunk);
        }

        boolean normalized = config.normalized;
        double scaleFactor = config.getScaleFactor();
        DiffMode diffMode = config.diffMode;

        long leftCount = 0;
        long rightCount = 0;
        long diffCount = 0;

        for (int y = chunk.startY; y < chunk.endY; y++)
            for (int x = chunk.startX; x < chunk.endX; x++) {
                int leftPixel = left.getRGB(x, y);
                int rightPixel = right.getRGB(x, y);

                int r1 = getRed(leftPixel), g1 = getGreen(leftPixel), b1 = getBlue(leftPixel), a1 = getAlpha(leftPixel);
                int r2 = getRed(rightPixel), g2 = getGreen(rightPixel), b2 = getBlue(rightPixel), a2 = getAlpha(rightPixel);

                if (r1 + g1 + b1 + a1 > 0) leftCount++;
                if (r2 + g2 + b2 + a2 > 0) rightCount++;

                double rDiff, gDiff, bDiff, aDiff;
                if (normalized) {
                    rDiff = Math.abs(Normalizer.normalize(r1, leftStats.meanR, leftStats.stdR) - Normalizer.normalize(r2, rightStats.meanR, rightStats.stdR));
                    gDiff = Math.abs(Normalizer.normalize(g1, leftStats.meanG, leftStats.stdG) - Normalizer.normalize(g2, rightStats.meanG, rightStats.stdG));
                    bDiff = Math.abs(Normalizer.normalize(b1, leftStats.meanB, leftStats.stdB) - Normalizer.normalize(b2, rightStats.meanB, rightStats.stdB));
                    aDiff = Math.abs(Normalizer.normalize(a1, leftStats.meanA, leftStats.stdA) - Normalizer.normalize(a2, rightStats.meanA, rightStats.stdA));
                } else {
                    rDiff = Math.abs(r1 - r2);
                    gDiff = Math.abs(g1 - g2);
                    bDiff = Math.abs(b1 - b2);
                    aDiff = Math.abs(a1 - a2);
                }

                // Alpha counts as a difference, but is never drawn
                if (rDiff + gDiff + bDiff + aDiff > 0) diffCount++;

                diffImage.setRGB(x, y, render(diffMode, scaleFactor, rDiff, gDiff, bDiff));
            }

        return DiffCounts.apply(leftCount, rightCount, diffCount);
    }

    /** Renders the red, green and blue differences into an opaque output pixel */
    static int render(DiffMode diffMode, double scaleFactor, double rDiff, double gDiff, double bDiff) {
        switch (diffMode) {
            case BW:
                return (rDiff > 0 || gDiff > 0 || bDiff > 0) ? WHITE : BLACK;
            case GRAY:
                int gray = clip((rDiff + gDiff + bDiff) / 3.0 * scaleFactor);
                return argb(OPAQUE, gray, gray, gray);
            case COLOR:
            default:
                return argb(OPAQUE, clip(rDiff * scaleFactor), clip(gDiff * scaleFactor), clip(bDiff * scaleFactor));
        }
    }
}
