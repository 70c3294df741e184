package org.puneet.abtest.unit;

import org.junit.jupiter.api.Test;
import org.puneet.abtest.util.ResampleBatchRunner;
import static org.junit.jupiter.api.Assertions.*;

class ResampleBatchRunnerTest {

    @Test
    void testBlockSizes() {
        assertArrayEquals(new int[] {1000, 1000, 500}, ResampleBatchRunner.blockSizes(2500, 1000));
        assertArrayEquals(new int[] {10}, ResampleBatchRunner.blockSizes(10, 1000));
    }

    @Test
    void testInvalidBlockArguments() {
        assertThrows(IllegalArgumentException.class, () -> ResampleBatchRunner.blockSizes(0, 10));
        assertThrows(IllegalArgumentException.class, () -> ResampleBatchRunner.blockSizes(10, -1));
    }

    @Test
    void testSequentialAndParallelSumsAgree() {
        long sequential = ResampleBatchRunner.sumBlocks(20, block -> (long) block * block);
        long parallel = ResampleBatchRunner.sumBlocksParallel(20, block -> (long) block * block);
        assertEquals(2470L, sequential);
        assertEquals(sequential, parallel);
    }

    @Test
    void testParallelFailureIsReported() {
        assertThrows(IllegalStateException.class, () -> ResampleBatchRunner.sumBlocksParallel(4, block -> {
            if (block == 2) {
                throw new IllegalArgumentException("boom");
            }
            return 1L;
        }));
    }
}
