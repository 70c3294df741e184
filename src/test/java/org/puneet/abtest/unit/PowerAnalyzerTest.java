package org.puneet.abtest.unit;

import org.junit.jupiter.api.Test;
import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.abtest.model.PowerReport;
import org.puneet.abtest.model.SampleSizePlan;
import org.puneet.abtest.model.Trial;
import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.statistical.PowerAnalyzer;
import static org.junit.jupiter.api.Assertions.*;

class PowerAnalyzerTest {

    private static final double[] RATIOS = {0.1, 0.5, 1.0, 2.0, 5.0};

    private final PowerAnalyzer analyzer = new PowerAnalyzer();

    private static TrialPair pair(int nA, double rateA, int nB, double rateB) {
        return new TrialPair("A", new Trial(nA, rateA), "B", new Trial(nB, rateB));
    }

    @Test
    void testImbalancedPairPower() throws Exception {
        PowerReport report = analyzer.analyze(pair(1000, 0.52, 50, 0.62), 0.05, 0.8);
        assertEquals(0.20235517668497427, report.getCohensH(), 1e-9);
        assertEquals(0.20235517668497427, report.getObservedEffectSize(), 1e-9);
        assertEquals(0.2869146919658165, report.getCurrentPower(), 1e-6);
        assertEquals(4026L, report.getRequiredSampleSizePerGroup().getAsLong());
        assertEquals(4228L, report.getRequiredTotalSamples().getAsLong());
        assertEquals(1050L, report.getCurrentTotalSamples());
        assertTrue(report.getInterpretation().contains("very low"));
    }

    @Test
    void testBalancedRequiredSampleSize() {
        double h = PowerAnalyzer.cohensH(0.5, 0.6);
        assertEquals(388L, PowerAnalyzer.requiredSampleSize(h, 0.05, 0.8, 1.0));
        assertTrue(PowerAnalyzer.power(h, 388, 1.0, 0.05) >= 0.8);
        assertTrue(PowerAnalyzer.power(h, 387, 1.0, 0.05) < 0.8);
    }

    @Test
    void testPowerIsMonotoneInSampleSize() {
        double h = PowerAnalyzer.cohensH(0.4, 0.45);
        double previous = 0.0;
        for (int n = 10; n <= 5000; n *= 2) {
            double power = PowerAnalyzer.power(h, n, 0.5, 0.05);
            assertTrue(power > previous);
            previous = power;
        }
    }

    @Test
    void testZeroEffectPowerEqualsAlpha() {
        assertEquals(0.05, PowerAnalyzer.power(0.0, 100, 1.0, 0.05), 1e-9);
    }

    @Test
    void testZeroEffectHasNoRequiredSize() throws Exception {
        PowerReport report = analyzer.analyze(pair(100, 0.5, 100, 0.5), 0.05, 0.8);
        assertFalse(report.isTargetAttainable());
        assertTrue(report.getRequiredSampleSizePerGroup().isEmpty());
        assertTrue(report.getRequiredTotalSamples().isEmpty());
    }

    @Test
    void testLargeEffectNeedsSingleTrial() {
        assertEquals(1L, PowerAnalyzer.requiredSampleSize(Math.PI, 0.05, 0.5, 1.0));
    }

    @Test
    void testNonPositiveSampleSizeIsUndefined() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> analyzer.analyze(0, 0.5, 10, 0.6, 0.05, 0.8));
        assertEquals(StatisticalErrorType.UNDEFINED_POWER, ex.getErrorType());
    }

    @Test
    void testTargetPowerOutsideUnitIntervalIsUndefined() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> analyzer.analyze(pair(100, 0.5, 100, 0.6), 0.05, 1.0));
        assertEquals(StatisticalErrorType.UNDEFINED_POWER, ex.getErrorType());
        assertThrows(StatisticalValidationException.class,
                () -> analyzer.analyze(pair(100, 0.5, 100, 0.6), 0.0, 0.8));
    }

    @Test
    void testSevereImbalancePlansBalancedDesign() throws Exception {
        SampleSizePlan plan = analyzer.planSampleSize(pair(1000, 0.52, 50, 0.62), 0.05, 0.8, null);
        assertEquals(1.0, plan.getOptimalRatio(), 0.0);
        assertEquals(4026L, plan.getSampleSizePerGroup());
        assertEquals(plan.getSuggestedSizeA(), plan.getSuggestedSizeB());
        assertEquals(0.05, plan.getCurrentRatio(), 1e-12);
    }

    @Test
    void testModerateImbalancePlan() throws Exception {
        SampleSizePlan plan = analyzer.planSampleSize(pair(1000, 0.5, 300, 0.6), 0.05, 0.8, null);
        assertEquals(0.7, plan.getOptimalRatio(), 0.0);
        assertEquals((long) (plan.getSampleSizePerGroup() * 0.7), plan.getSuggestedSizeB());
    }

    @Test
    void testEffectSizeOverride() throws Exception {
        SampleSizePlan plan = analyzer.planSampleSize(pair(1000, 0.52, 50, 0.62), 0.05, 0.8, -0.5);
        assertEquals(0.5, plan.getEffectSize(), 0.0);
        assertEquals(660L, plan.getSampleSizePerGroup());
    }

    @Test
    void testPlanWithoutEffectIsUndefined() {
        assertThrows(StatisticalValidationException.class,
                () -> analyzer.planSampleSize(pair(100, 0.5, 100, 0.5), 0.05, 0.8, null));
    }

    @Test
    void testCurrentTotalBeyondIntRange() throws Exception {
        PowerReport report = analyzer.analyze(pair(1_500_000_000, 0.5, 1_500_000_000, 0.5001), 0.05, 0.8);
        assertEquals(3_000_000_000L, report.getCurrentTotalSamples());
        assertEquals(0L, report.getSampleShortfall().getAsLong());
    }

    @Test
    void testRequiredSizeShrinksWithEffectSize() {
        for (double ratio : RATIOS) {
            long previous = Long.MAX_VALUE;
            for (int step = 1; step <= 300; step++) {
                double h = step / 100.0;
                long required = PowerAnalyzer.requiredSampleSize(h, 0.05, 0.8, ratio);
                assertTrue(required > 0 && required <= previous, "ratio=" + ratio + ", h=" + h);
                previous = required;
            }
        }
    }

    @Test
    void testRequiredSizeGrowsWithTargetPower() {
        for (double ratio : RATIOS) {
            long previous = 0L;
            for (int percent = 6; percent <= 99; percent++) {
                double target = percent / 100.0;
                long required = PowerAnalyzer.requiredSampleSize(0.2, 0.05, target, ratio);
                assertTrue(required >= previous, "ratio=" + ratio + ", power=" + target);
                previous = required;
            }
        }
    }
}
