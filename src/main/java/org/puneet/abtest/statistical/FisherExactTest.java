package org.puneet.abtest.statistical;

import org.apache.commons.math3.distribution.HypergeometricDistribution;
import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.ContingencyTable;
import org.puneet.abtest.model.OutcomeStatus;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.TrialPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fisher's exact test on the 2x2 table.
 * 
 * <p>With the margins fixed, the number of wins in group A follows a
 * hypergeometric distribution. A higher rate for B means fewer wins in A than
 * expected, so the "greater" alternative is the lower tail of that count.
 * The two-sided p-value sums every table no more probable than the observed one.</p>
 * 
 * <p>The odds ratio is odds(B) / odds(A), so a value above 1 favours B. The
 * combined sample may not exceed {@link ContingencyTable#MAX_HYPERGEOMETRIC_POPULATION}
 * trials.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class FisherExactTest implements HypothesisTest {
    private static final Logger logger = LoggerFactory.getLogger(FisherExactTest.class);
    
    /** Relative slack when comparing table probabilities with the observed one */
    private static final double RELATIVE_ERROR = 1.0 + 1e-7;
    
    @Override
    public TestMethod getMethod() {
        return TestMethod.FISHER;
    }
    
    @Override
    public TestOutcome run(TrialPair pair, double alpha, Alternative alternative) {
        ContingencyTable table = pair.toContingencyTable();
        checkPopulation(table);
        double oddsRatio = oddsRatio(table);
        
        TestOutcome.Builder builder = TestOutcome.builder(TestMethod.FISHER, alternative, alpha)
            .statistic("odds ratio", oddsRatio)
            .rateDifference(pair.getRateDifference())
            .effect(oddsRatio - 1.0);
        
        if (table.isPooledDegenerate()) {
            logger.warn("Contingency table {} has an empty outcome column, every table is equally likely", table);
            return builder
                .pValue(1.0)
                .status(OutcomeStatus.DEGENERATE_STATISTIC)
                .recommendation(OutcomeRecommendations.degenerate(pair))
                .build();
        }
        
        double pValue = pValue(table, alternative);
        logger.debug("Fisher exact: table={}, odds ratio={}, p={}", table, oddsRatio, pValue);
        
        return builder
            .pValue(pValue)
            .recommendation(OutcomeRecommendations.describe(pair, pValue < alpha, oddsRatio - 1.0))
            .build();
    }
    
    /**
     * Odds of winning in B divided by the odds in A. Infinite when only the
     * numerator is non-zero, NaN when both are zero.
     */
    static double oddsRatio(ContingencyTable table) {
        double numerator = (double) table.get(1, 0) * table.get(0, 1);
        double denominator = (double) table.get(0, 0) * table.get(1, 1);
        if (denominator == 0.0) {
            return numerator == 0.0 ? Double.NaN : Double.POSITIVE_INFINITY;
        }
        return numerator / denominator;
    }
    
    static double pValue(ContingencyTable table, Alternative alternative) {
        checkPopulation(table);
        int population = (int) table.total();
        int wins = (int) table.columnTotal(0);
        int sizeA = (int) table.rowTotal(0);
        int winsA = table.get(0, 0);
        HypergeometricDistribution distribution =
            new HypergeometricDistribution(null, population, wins, sizeA);
        
        double p;
        switch (alternative) {
            case GREATER:
                p = distribution.cumulativeProbability(winsA);
                break;
            case LESS:
                p = distribution.upperCumulativeProbability(winsA);
                break;
            case TWO_SIDED:
            default:
                p = twoSided(distribution, winsA);
                break;
        }
        return Math.min(1.0, Math.max(0.0, p));
    }
    
    /**
     * @throws IllegalArgumentException if the combined sample is too large for the hypergeometric model
     */
    static void checkPopulation(ContingencyTable table) {
        if (!table.fitsHypergeometric()) {
            throw new IllegalArgumentException(String.format(
                "Combined sample of %d trials exceeds the %d supported by exact tests, use the z-test",
                table.total(), ContingencyTable.MAX_HYPERGEOMETRIC_POPULATION));
        }
    }
    
    private static double twoSided(HypergeometricDistribution distribution, int observed) {
        double threshold = distribution.logProbability(observed) + Math.log(RELATIVE_ERROR);
        double p = 0.0;
        for (int x = distribution.getSupportLowerBound(); x <= distribution.getSupportUpperBound(); x++) {
            double logP = distribution.logProbability(x);
            if (logP <= threshold) {
                p += Math.exp(logP);
            }
        }
        return p;
    }
}
