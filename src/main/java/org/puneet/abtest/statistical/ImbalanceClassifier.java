package org.puneet.abtest.statistical;

import org.puneet.abtest.model.BalanceLevel;
import org.puneet.abtest.model.ImbalanceReport;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.util.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies how unbalanced the two groups are and recommends a test method.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class ImbalanceClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ImbalanceClassifier.class);
    
    private ImbalanceClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
    
    public static ImbalanceReport classify(TrialPair pair) {
        int nA = pair.getTrialA().getN();
        int nB = pair.getTrialB().getN();
        double ratio = pair.getImbalanceRatio();
        BalanceLevel level = classifyBalance(ratio);
        boolean smallSample = Math.min(nA, nB) < AnalysisConfig.SMALL_SAMPLE_THRESHOLD;
        int minExpected = pair.toContingencyTable().minCellCount();
        
        MethodSelector.SampleProfile profile = new MethodSelector.SampleProfile(ratio, smallSample, minExpected);
        TestMethod method = MethodSelector.select(profile);
        int minRecommended = minRecommendedSampleSize(nA, nB);
        
        logger.info("Sample ratio {} classified as {} ({}), recommending {}",
            String.format("%.4f", ratio), level.getDisplayName(), MethodSelector.matchingRule(profile), method.getId());
        
        return new ImbalanceReport(nA, nB, ratio, level, smallSample, method, minExpected, minRecommended,
            buildAdvice(level, smallSample, ratio, method, minRecommended));
    }
    
    /**
     * Maps a size ratio in (0, 1] to a balance level; each threshold is an inclusive lower bound.
     */
    public static BalanceLevel classifyBalance(double ratio) {
        if (ratio >= AnalysisConfig.BALANCED_RATIO) {
            return BalanceLevel.BALANCED;
        } else if (ratio >= AnalysisConfig.MILD_RATIO) {
            return BalanceLevel.MILD;
        } else if (ratio >= AnalysisConfig.MODERATE_RATIO) {
            return BalanceLevel.MODERATE;
        }
        return BalanceLevel.SEVERE;
    }
    
    /**
     * @return max(50, round(0.3 * max(nA, nB)))
     */
    public static int minRecommendedSampleSize(int nA, int nB) {
        long scaled = Math.round(AnalysisConfig.RECOMMENDED_SAMPLE_FRACTION * Math.max(nA, nB));
        return (int) Math.max(AnalysisConfig.MIN_RECOMMENDED_SAMPLE, scaled);
    }
    
    private static List<String> buildAdvice(BalanceLevel level, boolean smallSample, double ratio,
                                            TestMethod method, int minRecommended) {
        List<String> advice = new ArrayList<>();
        if (level == BalanceLevel.SEVERE) {
            advice.add("Sample sizes are extremely unbalanced (" + level.getDisplayName() + ")");
            advice.add("Statistical power may be severely limited");
            advice.add("Results for the smaller group carry large uncertainty");
            advice.add("Recommended test: " + method.getDisplayName());
            advice.add("Collect at least " + minRecommended + " samples for the smaller group");
        } else if (smallSample) {
            advice.add("At least one group is a small sample (" + level.getDisplayName() + ")");
            advice.add("At least one group has fewer than " + AnalysisConfig.SMALL_SAMPLE_THRESHOLD + " trials");
            advice.add("The normal approximation may not hold");
            advice.add("Recommended test: " + method.getDisplayName());
            advice.add("Confidence intervals may be wide, interpret with care");
        } else {
            advice.add("Sample sizes are acceptable (" + level.getDisplayName() + ")");
            advice.add(String.format("Sample size ratio: %.2f%%", ratio * 100));
            advice.add("Recommended test: " + method.getDisplayName());
            advice.add("Most test methods are applicable");
        }
        return advice;
    }
}
