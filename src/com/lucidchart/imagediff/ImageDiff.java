package com.lucidchart.imagediff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** A utility to visualize the per-pixel difference of two images of the same size.
 *
 * The image is divided into a grid of chunks sized to the available parallelism, and every chunk is compared on its
 * own worker.  Each output pixel shows the channel differences of the two inputs, rendered in black-and-white,
 * grayscale or color, and optionally computed on normalized channels so that a global brightness or contrast shift
 * does not light up the whole image.
 *
 * The result is computed eagerly when the ImageDiff is created; the composite and any saved files are produced on request.
 */
public class ImageDiff {

    private static final Logger logger = LoggerFactory.getLogger(ImageDiff.class);

    public final BufferedImage left;
    public final BufferedImage right;
    private final int width;
    private final int height;
    private final DiffConfig config;

    /** Only computed for normalized runs */
    private final ImageStats leftStats;
    private final ImageStats rightStats;

    private final int chunkCount;
    private final BufferedImage diffImage;
    private final DiffCounts counts;

    /** Holds the side by side result, when and if created */
    private BufferedImage composite;

    /** Computes the difference of two images.
     * Both images must exist and have the same, non-empty size, or the comparison fails before any work starts.
     *
     * @param left The left image.
     * @param right The right image.
     * @param config Rendering, normalization and parallelism settings.
     */
    private ImageDiff(BufferedImage left, BufferedImage right, DiffConfig config) {
        require(left != null && right != null, "Both left and right images are required");
        require(left.getWidth() > 0 && left.getHeight() > 0, "Images must have a positive area");
        require(left.getWidth() == right.getWidth() && left.getHeight() == right.getHeight(),
                "Images must have the same dimensions, left is (w" + left.getWidth() + ",h" + left.getHeight() +
                        ") and right is (w" + right.getWidth() + ",h" + right.getHeight() + ")");

        this.left = left;
        this.right = right;
        this.width = left.getWidth();
        this.height = left.getHeight();
        this.config = config;

        if (config.normalized) {
            logger.debug("Calculating statistics for left image");
            this.leftStats = ImageStats.apply(left);
            logger.debug("Calculating statistics for right image");
            this.rightStats = ImageStats.apply(right);
            logger.debug("Left {}, right {}", leftStats, rightStats);
        } else {
            this.leftStats = null;
            this.rightStats = null;
        }

        ChunkPartitioner.Grid grid = ChunkPartitioner.gridFor(width, height, config.parallelism, ChunkPartitioner.MIN_CHUNK_SIZE);
        List<Chunk> chunks = ChunkPartitioner.createChunks(new Rectangle(0, 0, width, height), grid.columns, grid.rows);
        this.chunkCount = chunks.size();
        logger.debug("Splitting image into {} chunks ({})", chunkCount, grid);

        this.diffImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        this.counts = ParallelScheduler.run(chunks, left, right, diffImage, leftStats, rightStats, config);

        if (config.verbose) {
            logger.info("Non-zero pixels left {} right {} diff {}", counts.left, counts.right, counts.diff);
        }
    }



    /*
       ___          _                                 _   _               _
      / __\_ _  ___| |_ ___  _ __ _   _    /\/\   ___| |_| |__   ___   __| |___
     / _\/ _` |/ __| __/ _ \| '__| | | |  /    \ / _ \ __| '_ \ / _ \ / _` / __|
    / / | (_| | (__| || (_) | |  | |_| | / /\/\ \  __/ |_| | | | (_) | (_| \__ \
    \/   \__,_|\___|\__\___/|_|   \__, | \/    \/\___|\__|_| |_|\___/ \__,_|___/
                                  |___/
     */

    /** Difference of two images using the default color mode, scale and host parallelism */
    public static ImageDiff apply(BufferedImage left, BufferedImage right) {
        return apply(left, right, With.context());
    }

    /** Difference of two images with the options specified in the context */
    public static ImageDiff apply(BufferedImage left, BufferedImage right, With context) {
        require(context != null, "A context must be supplied");
        return new ImageDiff(left, right, DiffConfig.of(context));
    }

    public static ImageDiff apply(Path left, Path right, With context) {
        return apply(getImage(left), getImage(right), context);
    }

    public static ImageDiff apply(File left, File right, With context) {
        return apply(getImage(left), getImage(right), context);
    }

    public static ImageDiff apply(byte[] left, byte[] right, With context) {
        return apply(getImage(left), getImage(right), context);
    }

    public static ImageDiff apply(Path left, Path right) {
        return apply(left, right, With.context());
    }

    public static ImageDiff apply(File left, File right) {
        return apply(left, right, With.context());
    }



    /*
       ___       _     _ _              _   _ _ _ _   _
      / _ \_   _| |__ | (_) ___   /\ /\| |_(_) (_) |_(_) ___  ___
     / /_)/ | | | '_ \| | |/ __| / / \ \ __| | | | __| |/ _ \/ __|
    / ___/| |_| | |_) | | | (__  \ \_/ / |_| | | | |_| |  __/\__ \
    \/     \__,_|_.__/|_|_|\___|  \___/ \__|_|_|_|\__|_|\___||___/

     */

    /** The rendered difference, the same size as the inputs */
    public BufferedImage getDiffImage() {
        return diffImage;
    }

    /** Left input, diff and right input side by side */
    public BufferedImage getComposite() {
        if (composite == null) {
            logger.debug("Creating composite image with inputs");
            composite = CompositeAssembler.sideBySide(left, right, diffImage);
        }
        return composite;
    }

    /** The image to hand to an encoder: the composite if inputs are included, the plain diff otherwise */
    public BufferedImage getOutputImage() {
        return config.includeInputs ? getComposite() : diffImage;
    }

    public DiffConfig getConfig() {
        return config;
    }

    public DiffCounts getCounts() {
        return counts;
    }

    /** Pixels of the left image with any non-zero channel */
    public long getLeftCount() {
        return counts.left;
    }

    /** Pixels of the right image with any non-zero channel */
    public long getRightCount() {
        return counts.right;
    }

    /** Pixels whose channels differ, alpha included */
    public long getDiffCount() {
        return counts.diff;
    }

    /** Differing pixels as a percentage of the image area */
    public double getDifferingPercentage() {
        return counts.diff * 100.0 / ((long) width * height);
    }

    /** True if no channel of any pixel differs */
    public boolean isIdentical() {
        return counts.diff == 0;
    }

    public Optional<ImageStats> getLeftStats() {
        return Optional.ofNullable(leftStats);
    }

    public Optional<ImageStats> getRightStats() {
        return Optional.ofNullable(rightStats);
    }

    /** Number of chunks the image was split into */
    public int getChunkCount() {
        return chunkCount;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /** Describes the result, e.g. "Grayscale difference image successfully created with scale factor 2.0 (1.25% 50 differing pixels)".
     * The differing pixel count is only reported for non-normalized runs.
     */
    public String getSummary() {
        return describeHead() + describeCount();
    }

    /** The summary, naming the file the output was written to */
    public String getSummary(Path output) {
        return describeHead() + ": " + output + describeCount();
    }

    /** Writes the output image as a PNG */
    public Path save(Path output) {
        require(output != null, "An output path must be provided");
        logger.debug("Encoding image to {}", output);
        try {
            if (!ImageIO.write(getOutputImage(), "png", output.toFile()))
                throw new ImageDiffException("No PNG writer available to encode " + output);
        } catch (IOException ioe) {
            throw new ImageDiffException("Unable to write difference image to " + output, ioe);
        }
        logger.info("{}", getSummary(output));
        return output;
    }

    /** Writes the output image as a PNG to a new temporary file */
    public Path saveToTempFile() {
        Path output;
        try {
            output = Files.createTempFile("imagediff-", ".png");
        } catch (IOException ioe) {
            throw new ImageDiffException("Unable to create temporary output file", ioe);
        }
        logger.debug("Created temporary output file: {}", output);
        return save(output);
    }



    /*
      _____       _                        _         _   _ _ _ _   _
      \_   \_ __ | |_ ___ _ __ _ __   __ _| |  /\ /\| |_(_) (_) |_(_) ___  ___
       / /\/ '_ \| __/ _ \ '__| '_ \ / _` | | / / \ \ __| | | | __| |/ _ \/ __|
    /\/ /_ | | | | ||  __/ |  | | | | (_| | | \ \_/ / |_| | | | |_| |  __/\__ \
    \____/ |_| |_|\__\___|_|  |_| |_|\__,_|_|  \___/ \__|_|_|_|\__|_|\___||___/

     */

    private String describeHead() {
        return String.format(Locale.ROOT, "%s%s difference image successfully created with scale factor %.1f",
                config.normalized ? "Normalized " : "", config.diffMode.text, config.getScaleFactor());
    }

    private String describeCount() {
        if (config.normalized) return "";
        return String.format(Locale.ROOT, " (%.2f%% %d differing pixels)", getDifferingPercentage(), counts.diff);
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    /** Obtain an image from an array of bytes */
    public static BufferedImage getImage(byte[] image) {
        require(image != null, "Image bytes must be provided");
        try {
            return decoded(ImageIO.read(new ByteArrayInputStream(image)), "array of bytes");
        } catch (IOException ioe) {
            throw new ImageDiffException("Unable to obtain image from array of bytes", ioe);
        }
    }

    /** Obtain an image from a path */
    private static BufferedImage getImage(Path image) {
        require(image != null, "An image path must be provided");
        return getImage(image.toFile());
    }

    /** Obtain an image from a file */
    private static BufferedImage getImage(File image) {
        require(image != null, "An image file must be provided");
        try {
            return decoded(ImageIO.read(image), image.getPath());
        } catch (IOException ioe) {
            throw new ImageDiffException("Unable to obtain image from file " + image.getPath(), ioe);
        }
    }

    /** ImageIO returns null rather than failing when no reader understands the input */
    private static BufferedImage decoded(BufferedImage image, String source) {
        if (image == null) throw new ImageDiffException("Unsupported image format: " + source);
        return image;
    }


    @Override
    public String toString() {
        return "Image Difference: " +
                "\n\nImage Size = (w" + width + ",h" + height + ")" +
                "\nDiff Mode = " + config.diffMode.key +
                "\nNormalized = " + config.normalized +
                "\nScale Factor = " + config.getScaleFactor() +
                "\nChunks = " + chunkCount +
                "\nLeft Non-Zero Pixels = " + counts.left +
                "\nRight Non-Zero Pixels = " + counts.right +
                "\nDiffering Pixels = " + counts.diff +
                (config.normalized ? (
                        "\nLeft Stats = " + leftStats +
                        "\nRight Stats = " + rightStats) : "") +
                "";
    }
}
