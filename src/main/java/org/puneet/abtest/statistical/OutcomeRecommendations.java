package org.puneet.abtest.statistical;

import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.util.AnalysisConfig;

/**
 * Short recommendation attached to every test outcome.
 */
final class OutcomeRecommendations {
    
    private OutcomeRecommendations() {
    }
    
    /**
     * @param significant whether the test rejected equal rates
     * @param effect the method's effect measure; only its magnitude is used
     */
    static String describe(TrialPair pair, boolean significant, double effect) {
        if (significant) {
            // the winner follows the observed rates, not the sign of the effect measure
            double direction = pair.getRateDifference() != 0.0 ? pair.getRateDifference() : effect;
            if (direction > 0) {
                return String.format("Use %s (significantly better than %s)", pair.getNameB(), pair.getNameA());
            }
            return String.format("Use %s (significantly better than %s)", pair.getNameA(), pair.getNameB());
        }
        if (Math.abs(effect) > AnalysisConfig.PRACTICAL_EFFECT_THRESHOLD) {
            return "Difference is not significant but the effect is large, collect more data";
        }
        return "No significant difference, both strategies perform similarly";
    }
    
    static String degenerate(TrialPair pair) {
        return String.format("%s and %s share a pooled win rate of 0 or 1, the test statistic is undefined",
            pair.getNameA(), pair.getNameB());
    }
}
