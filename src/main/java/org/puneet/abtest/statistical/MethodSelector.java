package org.puneet.abtest.statistical;

import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.util.AnalysisConfig;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered rule table that picks a test method from the sample characteristics.
 * Rules are evaluated top to bottom and the first match wins; the last rule
 * always matches.
 * 
 * <ol>
 *   <li>small sample or ratio below 0.1: Fisher if every cell has at least 5, else permutation</li>
 *   <li>ratio in [0.1, 0.3): z-test</li>
 *   <li>otherwise: chi-square if every cell has at least 5, else Fisher</li>
 * </ol>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class MethodSelector {
    
    /**
     * Inputs the rules are evaluated against.
     */
    public static final class SampleProfile {
        private final double ratio;
        private final boolean smallSample;
        private final int minExpectedCount;
        
        public SampleProfile(double ratio, boolean smallSample, int minExpectedCount) {
            this.ratio = ratio;
            this.smallSample = smallSample;
            this.minExpectedCount = minExpectedCount;
        }
        
        public double getRatio() {
            return ratio;
        }
        
        public boolean isSmallSample() {
            return smallSample;
        }
        
        public int getMinExpectedCount() {
            return minExpectedCount;
        }
        
        boolean hasEnoughPerCell() {
            return minExpectedCount >= AnalysisConfig.MIN_EXPECTED_CELL_COUNT;
        }
    }
    
    private static final class Rule {
        private final String name;
        private final Predicate<SampleProfile> condition;
        private final Function<SampleProfile, TestMethod> choice;
        
        Rule(String name, Predicate<SampleProfile> condition, Function<SampleProfile, TestMethod> choice) {
            this.name = name;
            this.condition = condition;
            this.choice = choice;
        }
    }
    
    private static final List<Rule> RULES = List.of(
        new Rule("small or extremely imbalanced sample",
            p -> p.isSmallSample() || p.getRatio() < AnalysisConfig.MODERATE_RATIO,
            p -> p.hasEnoughPerCell() ? TestMethod.FISHER : TestMethod.PERMUTATION),
        new Rule("moderately imbalanced sample",
            p -> p.getRatio() < AnalysisConfig.Z_TEST_UPPER_RATIO,
            p -> TestMethod.Z_TEST),
        new Rule("balanced sample",
            p -> true,
            p -> p.hasEnoughPerCell() ? TestMethod.CHI_SQUARE : TestMethod.FISHER)
    );
    
    private MethodSelector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
    
    public static TestMethod select(double ratio, boolean smallSample, int minExpectedCount) {
        return select(new SampleProfile(ratio, smallSample, minExpectedCount));
    }
    
    public static TestMethod select(SampleProfile profile) {
        for (Rule rule : RULES) {
            if (rule.condition.test(profile)) {
                return rule.choice.apply(profile);
            }
        }
        throw new IllegalStateException("No method selection rule matched");
    }
    
    /**
     * @return the name of the rule that decides for this profile, for logging
     */
    public static String matchingRule(SampleProfile profile) {
        for (Rule rule : RULES) {
            if (rule.condition.test(profile)) {
                return rule.name;
            }
        }
        throw new IllegalStateException("No method selection rule matched");
    }
}
