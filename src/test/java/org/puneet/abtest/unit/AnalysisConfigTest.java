package org.puneet.abtest.unit;

import org.junit.jupiter.api.Test;
import org.puneet.abtest.util.AnalysisConfig;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    @Test
    void testDefaultsFromProperties() {
        assertEquals(0.05, AnalysisConfig.getAlpha(), 1e-12);
        assertEquals(0.8, AnalysisConfig.getTargetPower(), 1e-12);
        assertEquals("two-sided", AnalysisConfig.getDefaultAlternative());
        assertEquals("auto", AnalysisConfig.getDefaultMethod());
    }

    @Test
    void testPermutationSettings() {
        assertEquals(10_000, AnalysisConfig.getPermutationIterations());
        assertEquals(123456L, AnalysisConfig.getPermutationSeed());
        assertEquals(1_000, AnalysisConfig.getPermutationBlockSize());
        assertFalse(AnalysisConfig.isPermutationParallel());
    }

    @Test
    void testImbalanceThresholdsAreOrdered() {
        assertTrue(AnalysisConfig.BALANCED_RATIO > AnalysisConfig.MILD_RATIO);
        assertTrue(AnalysisConfig.MILD_RATIO > AnalysisConfig.Z_TEST_UPPER_RATIO);
        assertTrue(AnalysisConfig.Z_TEST_UPPER_RATIO > AnalysisConfig.MODERATE_RATIO);
    }
}
