package org.puneet.abtest.statistical;

import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.TrialPair;

/**
 * A two-sample test of equal win rates.
 * Implementations are stateless and safe to share between threads.
 */
public interface HypothesisTest {
    
    TestMethod getMethod();
    
    /**
     * Runs the test. The alternative is read as "rate of B compared with rate of A".
     * 
     * @param pair validated trials
     * @param alpha significance level in (0, 1)
     * @param alternative alternative hypothesis
     * @return the outcome, with status DEGENERATE_STATISTIC when the pooled win rate is 0 or 1
     * @throws IllegalArgumentException if the method cannot handle the size of the pair
     */
    TestOutcome run(TrialPair pair, double alpha, Alternative alternative);
}
