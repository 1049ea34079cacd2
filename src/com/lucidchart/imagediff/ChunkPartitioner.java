package com.lucidchart.imagediff;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Divides an image into a grid of non-overlapping chunks, balanced for the available parallelism.
 *
 * The chunks of one image always tile its bounds exactly: the last chunk of every row and column
 * absorbs the remainder of the integer division, so no strip is ever left uncovered.
 */
public final class ChunkPartitioner {

    /** Chunks narrower or shorter than this are not worth a separate task */
    public static final int MIN_CHUNK_SIZE = 32;

    private ChunkPartitioner() {}

    /** Number of chunk columns and rows chosen for an image */
    public static final class Grid {
        public final int columns;
        public final int rows;

        private Grid(int columns, int rows) {
            this.columns = columns;
            this.rows = rows;
        }

        public int getChunkCount() {
            return columns * rows;
        }

        @Override
        public String toString() {
            return columns + "x" + rows;
        }
    }

    /** Chooses a near-square grid with at least as many cells as the parallelism hint,
     * then shrinks any axis whose chunks would fall below the minimum edge length.
     */
    public static Grid gridFor(int width, int height, int parallelism, int minChunkSize) {
        int hint = Math.max(1, parallelism);
        int columns = (int) Math.sqrt(hint);
        int rows = hint / columns;
        if (columns * rows < hint) rows++;

        if (width / columns < minChunkSize) columns = width / minChunkSize;
        if (height / rows < minChunkSize) rows = height / minChunkSize;

        return new Grid(Math.max(1, columns), Math.max(1, rows));
    }

    /** Splits the bounds into columns x rows chunks, emitted row-major. */
    public static List<Chunk> createChunks(Rectangle bounds, int columns, int rows) {
        require(bounds != null && !bounds.isEmpty(), "Bounds must have a positive area");
        require(columns >= 1 && rows >= 1, "A grid needs at least one column and one row");
        require(columns <= bounds.width && rows <= bounds.height,
                "Grid " + columns + "x" + rows + " is finer than the bounds (w" + bounds.width + ",h" + bounds.height + ")");

        int chunkWidth = bounds.width / columns;
        int chunkHeight = bounds.height / rows;
        int maxX = bounds.x + bounds.width;
        int maxY = bounds.y + bounds.height;

        List<Chunk> chunks = new ArrayList<>(columns * rows);
        for (int row = 0; row < rows; row++)
            for (int column = 0; column < columns; column++) {
                int startX = bounds.x + column * chunkWidth;
                int startY = bounds.y + row * chunkHeight;
                int endX = (column == columns - 1) ? maxX : startX + chunkWidth;
                int endY = (row == rows - 1) ? maxY : startY + chunkHeight;
                chunks.add(Chunk.apply(startX, endX, startY, endY));
            }
        return Collections.unmodifiableList(chunks);
    }

    /** Partitions an image of the given size for the parallelism hint, using the default minimum chunk size */
    public static List<Chunk> partition(int width, int height, int parallelism) {
        Grid grid = gridFor(width, height, parallelism, MIN_CHUNK_SIZE);
        return createChunks(new Rectangle(0, 0, width, height), grid.columns, grid.rows);
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
