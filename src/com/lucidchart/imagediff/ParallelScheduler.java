package com.lucidchart.imagediff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/** Runs the diff engine over every chunk concurrently and sums the chunk counters.
 *
 * One task is submitted per chunk to a pool no larger than the parallelism hint.  The caller blocks until all
 * tasks are done; the counters are only returned once every chunk has been written.
 */
public final class ParallelScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ParallelScheduler.class);

    private static final AtomicInteger poolCounter = new AtomicInteger();

    private ParallelScheduler() {}

    /**
     * @param chunks Chunks tiling the diff image, see {@link ChunkPartitioner}.
     * @param diffImage The output raster, allocated by the caller with the size of the inputs.
     * @return the counters summed over all chunks.
     */
    public static DiffCounts run(List<Chunk> chunks, BufferedImage left, BufferedImage right, BufferedImage diffImage,
                                 ImageStats leftStats, ImageStats rightStats, DiffConfig config) {
        if (chunks.isEmpty()) return DiffCounts.ZERO;

        LongAdder leftCount = new LongAdder();
        LongAdder rightCount = new LongAdder();
        LongAdder diffCount = new LongAdder();

        int poolSize = Math.max(1, Math.min(config.parallelism, chunks.size()));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(chunks.size());
            for (Chunk chunk : chunks) {
                futures.add(executor.submit(() -> {
                    DiffCounts counts = DiffEngine.computeChunk(left, right, diffImage, chunk, leftStats, rightStats, config);
                    leftCount.add(counts.left);
                    rightCount.add(counts.right);
                    diffCount.add(counts.diff);
                }));
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            throw new ImageDiffException("A chunk worker failed while computing the difference", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageDiffException("Interrupted while waiting for chunk workers", e);
        } finally {
            executor.shutdownNow();
        }

        DiffCounts total = DiffCounts.apply(leftCount.sum(), rightCount.sum(), diffCount.sum());
        logger.debug("Processed {} chunks on {} workers: {}", chunks.size(), poolSize, total);
        return total;
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = poolCounter.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "imagediff-worker-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
