package org.puneet.abtest.statistical;

import org.puneet.abtest.model.BalanceLevel;
import org.puneet.abtest.model.ImbalanceReport;
import org.puneet.abtest.model.Recommendation;
import org.puneet.abtest.model.Recommendation.Decision;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.util.AnalysisConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a test outcome into the final decision for the analyst.
 * Margins are stated in percentage points of the reported win rates.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class RecommendationComposer {
    
    private RecommendationComposer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
    
    public static Recommendation compose(TestOutcome outcome, TrialPair pair, ImbalanceReport imbalance) {
        double rateA = pair.getTrialA().getWinRate();
        double rateB = pair.getTrialB().getWinRate();
        double margin = Math.abs(rateB - rateA) * 100;
        
        Decision decision;
        String headline;
        String reason;
        if (outcome.isSignificant()) {
            boolean bWins = rateB > rateA;
            String winner = bWins ? pair.getNameB() : pair.getNameA();
            String loser = bWins ? pair.getNameA() : pair.getNameB();
            decision = bWins ? Decision.ADOPT_B : Decision.ADOPT_A;
            headline = bWins ? "Strongly recommend " + winner : "Keep using " + winner;
            reason = String.format("Significantly better than %s, win rate higher by %.1f percentage points",
                loser, margin);
        } else if (margin > AnalysisConfig.PRACTICAL_EFFECT_THRESHOLD * 100) {
            decision = Decision.KEEP_TESTING;
            headline = "Keep testing and collect more data";
            reason = String.format("The difference is large (%.1f percentage points) but not significant, "
                + "the sample may be too small", margin);
        } else {
            decision = Decision.EQUIVALENT;
            headline = "Both strategies perform similarly";
            reason = String.format("The difference is small (%.1f percentage points) and not significant, "
                + "either strategy can be chosen", margin);
        }
        if (outcome.isDegenerate()) {
            reason += ". The " + outcome.getMethod().getDisplayName()
                + " statistic is undefined because every trial had the same result";
        }
        
        return new Recommendation(decision, headline, reason, actions(pair, imbalance));
    }
    
    private static List<String> actions(TrialPair pair, ImbalanceReport imbalance) {
        List<String> actions = new ArrayList<>();
        BalanceLevel level = imbalance.getBalanceLevel();
        if (level == BalanceLevel.MODERATE || level == BalanceLevel.SEVERE) {
            actions.add("Current imbalance: " + level.getDisplayName());
            actions.add("Recommended method: " + imbalance.getRecommendedMethodLabel());
            actions.add("Collect more data for " + pair.getSmallerGroupName());
            actions.add("Target: at least " + imbalance.getMinRecommendedSampleSize() + " samples");
        } else {
            actions.add("Sample balance is acceptable (" + level.getDisplayName() + ")");
            actions.add("Test method: " + imbalance.getRecommendedMethodLabel());
            actions.add("Keep tracking the win rates of both strategies");
        }
        return actions;
    }
}
