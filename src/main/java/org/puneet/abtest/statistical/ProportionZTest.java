package org.puneet.abtest.statistical;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.ContingencyTable;
import org.puneet.abtest.model.OutcomeStatus;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.Trial;
import org.puneet.abtest.model.TrialPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asymptotic two-proportion z-test.
 * 
 * <p>The test statistic uses the pooled variance, which is the variance under
 * the null hypothesis of equal rates. The confidence interval for the rate
 * difference uses the unpooled variance, because it describes the difference
 * without assuming the null. Keep the two variances distinct.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class ProportionZTest implements HypothesisTest {
    private static final Logger logger = LoggerFactory.getLogger(ProportionZTest.class);
    
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);
    
    @Override
    public TestMethod getMethod() {
        return TestMethod.Z_TEST;
    }
    
    @Override
    public TestOutcome run(TrialPair pair, double alpha, Alternative alternative) {
        Trial a = pair.getTrialA();
        Trial b = pair.getTrialB();
        ContingencyTable table = pair.toContingencyTable();
        
        double pA = a.getObservedRate();
        double pB = b.getObservedRate();
        double diff = pB - pA;
        double pooled = table.pooledProportion();
        
        double[] interval = confidenceInterval(a, b, alpha, alternative);
        TestOutcome.Builder builder = TestOutcome.builder(TestMethod.Z_TEST, alternative, alpha)
            .confidenceInterval(interval[0], interval[1])
            .effect(diff)
            .rateDifference(diff);
        
        double pooledVariance = pooled * (1 - pooled) * (1.0 / a.getN() + 1.0 / b.getN());
        if (pooledVariance == 0.0) {
            logger.warn("Pooled proportion {} leaves no variance, z statistic is undefined", pooled);
            return builder
                .statistic("z", Double.NaN)
                .pValue(Double.NaN)
                .status(OutcomeStatus.DEGENERATE_STATISTIC)
                .recommendation(OutcomeRecommendations.degenerate(pair))
                .build();
        }
        
        double z = diff / Math.sqrt(pooledVariance);
        double pValue = pValue(z, alternative);
        logger.debug("z-test: pooled={}, z={}, p={}", pooled, z, pValue);
        
        return builder
            .statistic("z", z)
            .pValue(pValue)
            .recommendation(OutcomeRecommendations.describe(pair, pValue < alpha, diff))
            .build();
    }
    
    static double pValue(double z, Alternative alternative) {
        switch (alternative) {
            case GREATER:
                return 1 - STANDARD_NORMAL.cumulativeProbability(z);
            case LESS:
                return STANDARD_NORMAL.cumulativeProbability(z);
            case TWO_SIDED:
            default:
                return 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z)));
        }
    }
    
    /**
     * Wald interval for rateB - rateA. A one-sided alternative leaves one bound open.
     * 
     * @return {lower, upper}
     */
    static double[] confidenceInterval(Trial a, Trial b, double alpha, Alternative alternative) {
        double pA = a.getObservedRate();
        double pB = b.getObservedRate();
        double diff = pB - pA;
        double se = Math.sqrt(pA * (1 - pA) / a.getN() + pB * (1 - pB) / b.getN());
        
        switch (alternative) {
            case GREATER: {
                double zCrit = STANDARD_NORMAL.inverseCumulativeProbability(1 - alpha);
                return new double[] {diff - zCrit * se, Double.POSITIVE_INFINITY};
            }
            case LESS: {
                double zCrit = STANDARD_NORMAL.inverseCumulativeProbability(1 - alpha);
                return new double[] {Double.NEGATIVE_INFINITY, diff + zCrit * se};
            }
            case TWO_SIDED:
            default: {
                double zCrit = STANDARD_NORMAL.inverseCumulativeProbability(1 - alpha / 2);
                return new double[] {diff - zCrit * se, diff + zCrit * se};
            }
        }
    }
}
