package com.lucidchart.imagediff;

import java.awt.image.BufferedImage;

/** Places the left input, the diff and the right input side by side in a single image. */
public final class CompositeAssembler {

    private CompositeAssembler() {}

    /** Returns an image three times as wide as the inputs: left in [0,w), diff in [w,2w), right in [2w,3w).
     * Pixels are copied exactly, without blending, scaling or borders.
     */
    public static BufferedImage sideBySide(BufferedImage left, BufferedImage right, BufferedImage diff) {
        require(left != null && right != null && diff != null, "Left, right and diff images are all required for a composite");
        int width = left.getWidth();
        int height = left.getHeight();
        require(right.getWidth() == width && right.getHeight() == height && diff.getWidth() == width && diff.getHeight() == height,
                "Composite images must share the same size, left is (w" + width + ",h" + height + "), right (w" + right.getWidth() + ",h" + right.getHeight() +
                        "), diff (w" + diff.getWidth() + ",h" + diff.getHeight() + ")");

        BufferedImage composite = new BufferedImage(width * 3, height, BufferedImage.TYPE_INT_ARGB);
        copyInto(composite, left, 0);
        copyInto(composite, diff, width);
        copyInto(composite, right, width * 2);
        return composite;
    }

    /** Copies the source block row by row at the horizontal offset */
    private static void copyInto(BufferedImage target, BufferedImage source, int offsetX) {
        int width = source.getWidth();
        int[] row = new int[width];
        for (int y = 0; y < source.getHeight(); y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            target.setRGB(offsetX, y, width, 1, row, 0, width);
        }
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
