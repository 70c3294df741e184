package org.puneet.abtest.model;

import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.StatisticalValidationException.StatisticalErrorType;

import java.util.Objects;

/**
 * Result of one hypothesis test on one trial pair.
 * 
 * <p>The statistic is method specific: z for the z-test, the Yates-corrected
 * chi-square for the chi-square test, the odds ratio (B relative to A) for the
 * Fisher test and the observed rate difference for the permutation test.
 * Optional values are {@code NaN} (or {@code null} for degrees of freedom) when
 * a method does not produce them. One-sided intervals carry an infinite bound.</p>
 * 
 * <p>The Fisher odds ratio is odds(B) / odds(A), and its "greater" alternative
 * means B wins more often. Tools that report odds(A) / odds(B) give the
 * reciprocal, with the one-sided alternatives swapped.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class TestOutcome {
    
    private final TestMethod method;
    private final Alternative alternative;
    private final double alpha;
    private final String statisticName;
    private final double statistic;
    private final double pValue;
    private final boolean significant;
    private final double ciLower;
    private final double ciUpper;
    private final Integer degreesOfFreedom;
    private final double effectCoefficient;
    private final double effect;
    private final double rateDifference;
    private final int iterations;
    private final Long seed;
    private final OutcomeStatus status;
    private final String recommendation;
    
    private TestOutcome(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method cannot be null");
        this.alternative = Objects.requireNonNull(builder.alternative, "alternative cannot be null");
        this.alpha = builder.alpha;
        this.statisticName = builder.statisticName;
        this.statistic = builder.statistic;
        this.pValue = builder.pValue;
        this.significant = builder.pValue < builder.alpha;
        this.ciLower = builder.ciLower;
        this.ciUpper = builder.ciUpper;
        this.degreesOfFreedom = builder.degreesOfFreedom;
        this.effectCoefficient = builder.effectCoefficient;
        this.effect = builder.effect;
        this.rateDifference = builder.rateDifference;
        this.iterations = builder.iterations;
        this.seed = builder.seed;
        this.status = builder.status;
        this.recommendation = builder.recommendation;
    }
    
    public static Builder builder(TestMethod method, Alternative alternative, double alpha) {
        return new Builder(method, alternative, alpha);
    }
    
    public TestMethod getMethod() {
        return method;
    }
    
    public Alternative getAlternative() {
        return alternative;
    }
    
    public double getAlpha() {
        return alpha;
    }
    
    public String getStatisticName() {
        return statisticName;
    }
    
    public double getStatistic() {
        return statistic;
    }
    
    public double getPValue() {
        return pValue;
    }
    
    /**
     * @return {@code pValue < alpha}; never true for a degenerate statistic
     */
    public boolean isSignificant() {
        return significant;
    }
    
    public boolean hasConfidenceInterval() {
        return !Double.isNaN(ciLower) && !Double.isNaN(ciUpper);
    }
    
    public double getCiLower() {
        return ciLower;
    }
    
    public double getCiUpper() {
        return ciUpper;
    }
    
    public Integer getDegreesOfFreedom() {
        return degreesOfFreedom;
    }
    
    /**
     * @return phi coefficient for the chi-square test, NaN otherwise
     */
    public double getEffectCoefficient() {
        return effectCoefficient;
    }
    
    /**
     * @return the effect magnitude the recommendation text was based on
     */
    public double getEffect() {
        return effect;
    }
    
    /**
     * @return observed rate of B minus observed rate of A
     */
    public double getRateDifference() {
        return rateDifference;
    }
    
    /**
     * @return resample count of a permutation test, 0 for the other methods
     */
    public int getIterations() {
        return iterations;
    }
    
    public Long getSeed() {
        return seed;
    }
    
    public OutcomeStatus getStatus() {
        return status;
    }
    
    public boolean isDegenerate() {
        return status == OutcomeStatus.DEGENERATE_STATISTIC;
    }
    
    public String getRecommendation() {
        return recommendation;
    }
    
    /**
     * Returns the p-value, failing when the statistic is degenerate.
     * 
     * @throws StatisticalValidationException of type DEGENERATE_STATISTIC
     */
    public double requirePValue() throws StatisticalValidationException {
        if (isDegenerate()) {
            throw new StatisticalValidationException(StatisticalErrorType.DEGENERATE_STATISTIC,
                method.getDisplayName() + " has no p-value: pooled win rate is 0 or 1");
        }
        return pValue;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestOutcome)) return false;
        TestOutcome other = (TestOutcome) o;
        return method == other.method && alternative == other.alternative
            && Double.compare(alpha, other.alpha) == 0
            && Objects.equals(statisticName, other.statisticName)
            && Double.compare(statistic, other.statistic) == 0
            && Double.compare(pValue, other.pValue) == 0
            && Double.compare(ciLower, other.ciLower) == 0
            && Double.compare(ciUpper, other.ciUpper) == 0
            && Objects.equals(degreesOfFreedom, other.degreesOfFreedom)
            && Double.compare(effectCoefficient, other.effectCoefficient) == 0
            && Double.compare(effect, other.effect) == 0
            && Double.compare(rateDifference, other.rateDifference) == 0
            && iterations == other.iterations && Objects.equals(seed, other.seed)
            && status == other.status && Objects.equals(recommendation, other.recommendation);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(method, alternative, alpha, statistic, pValue, ciLower, ciUpper,
            degreesOfFreedom, effect, iterations, seed, status);
    }
    
    @Override
    public String toString() {
        return String.format("%s: %s=%.4f, p-value=%.4f, significant=%s, status=%s",
            method.getDisplayName(), statisticName, statistic, pValue, significant, status);
    }
    
    /**
     * Builder for {@link TestOutcome}. Every optional value defaults to NaN.
     */
    public static final class Builder {
        private final TestMethod method;
        private final Alternative alternative;
        private final double alpha;
        private String statisticName = "statistic";
        private double statistic = Double.NaN;
        private double pValue = Double.NaN;
        private double ciLower = Double.NaN;
        private double ciUpper = Double.NaN;
        private Integer degreesOfFreedom;
        private double effectCoefficient = Double.NaN;
        private double effect = Double.NaN;
        private double rateDifference = Double.NaN;
        private int iterations;
        private Long seed;
        private OutcomeStatus status = OutcomeStatus.OK;
        private String recommendation = "";
        
        private Builder(TestMethod method, Alternative alternative, double alpha) {
            this.method = method;
            this.alternative = alternative;
            this.alpha = alpha;
        }
        
        public Builder statistic(String name, double value) {
            this.statisticName = name;
            this.statistic = value;
            return this;
        }
        
        public Builder pValue(double pValue) {
            this.pValue = pValue;
            return this;
        }
        
        public Builder confidenceInterval(double lower, double upper) {
            this.ciLower = lower;
            this.ciUpper = upper;
            return this;
        }
        
        public Builder degreesOfFreedom(int degreesOfFreedom) {
            this.degreesOfFreedom = degreesOfFreedom;
            return this;
        }
        
        public Builder effectCoefficient(double effectCoefficient) {
            this.effectCoefficient = effectCoefficient;
            return this;
        }
        
        public Builder effect(double effect) {
            this.effect = effect;
            return this;
        }
        
        public Builder rateDifference(double rateDifference) {
            this.rateDifference = rateDifference;
            return this;
        }
        
        public Builder resampling(int iterations, long seed) {
            this.iterations = iterations;
            this.seed = seed;
            return this;
        }
        
        public Builder status(OutcomeStatus status) {
            this.status = status;
            return this;
        }
        
        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }
        
        public TestOutcome build() {
            return new TestOutcome(this);
        }
    }
}
