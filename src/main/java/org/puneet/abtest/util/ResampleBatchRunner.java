package org.puneet.abtest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntToLongFunction;

/**
 * Runs independent resampling blocks and adds up the per-block counts.
 * 
 * <p>Each block is identified by its index, so a block task that seeds its own
 * random generator from the index yields the same total whether blocks run
 * one after another or on the shared pool.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class ResampleBatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(ResampleBatchRunner.class);
    
    /** Thread pool size for parallel block processing */
    private static final int THREAD_POOL_SIZE = Math.max(1,
        Runtime.getRuntime().availableProcessors() / 2);
    
    private static final ExecutorService executorService =
        Executors.newFixedThreadPool(THREAD_POOL_SIZE, runnable -> {
            Thread thread = new Thread(runnable, "resample-worker");
            thread.setDaemon(true);
            return thread;
        });
    
    private ResampleBatchRunner() {
    }
    
    /**
     * Splits {@code iterations} into blocks of at most {@code blockSize}.
     * 
     * @return the size of every block, the last one possibly shorter
     * @throws IllegalArgumentException if either argument is not positive
     */
    public static int[] blockSizes(int iterations, int blockSize) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Iterations must be positive: " + iterations);
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        int blocks = (iterations + blockSize - 1) / blockSize;
        int[] sizes = new int[blocks];
        for (int i = 0; i < blocks; i++) {
            sizes[i] = Math.min(blockSize, iterations - i * blockSize);
        }
        return sizes;
    }
    
    /**
     * Runs the block task for every index in {@code [0, blockCount)} on the calling thread.
     */
    public static long sumBlocks(int blockCount, IntToLongFunction blockTask) {
        long total = 0;
        for (int block = 0; block < blockCount; block++) {
            total += blockTask.applyAsLong(block);
        }
        logger.debug("Sequential resampling finished: {} blocks", blockCount);
        return total;
    }
    
    /**
     * Runs the block tasks concurrently and waits for all of them.
     * 
     * @throws IllegalStateException if a block task fails
     */
    public static long sumBlocksParallel(int blockCount, IntToLongFunction blockTask) {
        logger.debug("Starting parallel resampling: {} blocks, threads: {}", blockCount, THREAD_POOL_SIZE);
        
        List<CompletableFuture<Long>> futures = new ArrayList<>(blockCount);
        for (int block = 0; block < blockCount; block++) {
            final int index = block;
            futures.add(CompletableFuture.supplyAsync(() -> blockTask.applyAsLong(index), executorService));
        }
        
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            logger.error("Error processing resampling block", e.getCause());
            throw new IllegalStateException("Resampling block failed", e.getCause());
        }
        
        long total = 0;
        for (CompletableFuture<Long> future : futures) {
            total += future.join();
        }
        return total;
    }
}
