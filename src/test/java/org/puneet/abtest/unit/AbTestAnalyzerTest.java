package org.puneet.abtest.unit;

import org.junit.jupiter.api.Test;
import org.puneet.abtest.AbTestAnalyzer;
import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.abtest.exceptions.ValidationException;
import org.puneet.abtest.exceptions.ValidationException.ValidationType;
import org.puneet.abtest.model.Advisory;
import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.AnalysisReport;
import org.puneet.abtest.model.AnalysisRequest;
import org.puneet.abtest.model.BalanceLevel;
import org.puneet.abtest.model.OutcomeStatus;
import org.puneet.abtest.model.Recommendation.Decision;
import org.puneet.abtest.model.SampleSizePlan;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.statistical.HypothesisTestDispatcher;
import org.puneet.abtest.statistical.PermutationTest;
import org.puneet.abtest.statistical.PowerAnalyzer;
import static org.junit.jupiter.api.Assertions.*;

class AbTestAnalyzerTest {

    private static AbTestAnalyzer newAnalyzer() {
        PermutationTest permutation = new PermutationTest(new PermutationTest.Settings(3000, 2024L, 1000, false));
        return new AbTestAnalyzer(new HypothesisTestDispatcher(permutation), new PowerAnalyzer(), 0.8);
    }

    private static AnalysisRequest.Builder imbalancedRequest() {
        return AnalysisRequest.builder()
                .groupA("Strategy A", 1000, 0.52)
                .groupB("Strategy B", 50, 0.62)
                .alternative(Alternative.GREATER);
    }

    @Test
    void testAutoMethodResolvesToClassifierChoice() throws Exception {
        AnalysisReport report = newAnalyzer().analyze(imbalancedRequest().build());

        assertEquals(BalanceLevel.SEVERE, report.getImbalanceReport().getBalanceLevel());
        assertEquals(TestMethod.FISHER, report.getExecutedMethod());
        TestOutcome outcome = report.getOutcome();
        assertEquals(0.10769876097243736, outcome.getPValue(), 1e-6);
        assertFalse(outcome.isSignificant());
        assertEquals(Decision.KEEP_TESTING, report.getRecommendation().getDecision());
        assertEquals(4026L, report.getPowerReport().getRequiredSampleSizePerGroup().getAsLong());
        assertEquals(0.1, report.getBasicStats().getWinRateDelta(), 1e-12);
    }

    @Test
    void testSameRequestGivesEqualReports() throws Exception {
        AnalysisRequest request = imbalancedRequest().method(TestMethod.PERMUTATION).build();
        AnalysisReport first = newAnalyzer().analyze(request);
        AnalysisReport second = newAnalyzer().analyze(request);
        assertEquals(first, second);
        assertEquals(first.getOutcome().getPValue(), second.getOutcome().getPValue(), 0.0);
    }

    @Test
    void testExplicitMethodIsHonoured() throws Exception {
        AnalysisReport report = newAnalyzer().analyze(imbalancedRequest().method("z").build());
        assertEquals(TestMethod.Z_TEST, report.getExecutedMethod());
        assertEquals(1.3818266983779006, report.getOutcome().getStatistic(), 1e-9);
    }

    @Test
    void testSingleTrialBoundaryForEveryMethod() throws Exception {
        AbTestAnalyzer analyzer = newAnalyzer();
        for (TestMethod method : TestMethod.values()) {
            AnalysisRequest request = AnalysisRequest.builder()
                    .groupA("A", 1, 1.0)
                    .groupB("B", 1, 0.0)
                    .method(method)
                    .build();
            AnalysisReport report = analyzer.analyze(request);
            TestOutcome outcome = report.getOutcome();
            assertEquals(method, outcome.getMethod());
            assertEquals(OutcomeStatus.OK, outcome.getStatus(), method.getId());
            assertTrue(outcome.getPValue() >= 0.0 && outcome.getPValue() <= 1.0, method.getId());
            assertFalse(outcome.isSignificant(), method.getId());
            assertEquals(2, report.getAdvisories().size());
            assertTrue(report.getAdvisories().stream().allMatch(a -> a.getType() == Advisory.Type.SMALL_SAMPLE));
        }
    }

    @Test
    void testAllWinsIsDegenerateButAnalyzed() throws Exception {
        AnalysisRequest request = AnalysisRequest.builder()
                .groupA("A", 40, 1.0)
                .groupB("B", 40, 1.0)
                .method(TestMethod.CHI_SQUARE)
                .build();
        AnalysisReport report = newAnalyzer().analyze(request);
        assertTrue(report.getOutcome().isDegenerate());
        assertEquals(Decision.EQUIVALENT, report.getRecommendation().getDecision());
        assertFalse(report.getPowerReport().isTargetAttainable());
    }

    @Test
    void testCompareAllMethodsKeepsExecutedMethod() throws Exception {
        AbTestAnalyzer analyzer = newAnalyzer();
        AnalysisReport report = analyzer.compareAllMethods(analyzer.analyze(imbalancedRequest().build()));
        assertEquals(4, report.getOutcomes().size());
        assertEquals(TestMethod.FISHER, report.getExecutedMethod());
        assertEquals(Alternative.TWO_SIDED, report.getOutcome(TestMethod.CHI_SQUARE).getAlternative());
        assertEquals(Alternative.GREATER, report.getOutcome(TestMethod.Z_TEST).getAlternative());
    }

    @Test
    void testPlanSampleSize() throws Exception {
        AbTestAnalyzer analyzer = newAnalyzer();
        SampleSizePlan plan = analyzer.planSampleSize(analyzer.analyze(imbalancedRequest().build()), null);
        assertEquals(1.0, plan.getOptimalRatio(), 0.0);
        assertEquals(2 * plan.getSampleSizePerGroup(), plan.getSuggestedTotal());
    }

    @Test
    void testUnsupportedMethodRejected() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> newAnalyzer().analyze(imbalancedRequest().method("bayes").build()));
        assertEquals(StatisticalErrorType.UNSUPPORTED_METHOD, ex.getErrorType());
    }

    @Test
    void testInvalidInputsRejected() {
        ValidationException alpha = assertThrows(ValidationException.class,
                () -> newAnalyzer().analyze(imbalancedRequest().alpha(1.5).build()));
        assertEquals(ValidationType.RANGE_VALIDATION, alpha.getValidationType());

        ValidationException size = assertThrows(ValidationException.class,
                () -> newAnalyzer().analyze(imbalancedRequest().groupA("A", 0, 0.5).build()));
        assertEquals(ValidationType.INVALID_SAMPLE_SIZE, size.getValidationType());

        assertThrows(ValidationException.class,
                () -> newAnalyzer().analyze(imbalancedRequest().alternative("sideways").build()));
    }
}
