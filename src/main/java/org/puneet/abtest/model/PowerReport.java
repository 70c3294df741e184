package org.puneet.abtest.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Power of the observed comparison and the sample size needed to reach a target power.
 * 
 * <p>The required sample size is empty when no finite sample reaches the target,
 * which happens when both groups show the same rate.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class PowerReport {
    
    private final double cohensH;
    private final double alpha;
    private final double targetPower;
    private final double currentPower;
    private final long requiredSampleSizePerGroup;
    private final long currentTotalSamples;
    private final long requiredTotalSamples;
    private final String interpretation;
    
    /**
     * @param requiredSampleSizePerGroup required size of group A, or a negative value when unattainable
     * @param requiredTotalSamples required size of both groups, or a negative value when unattainable
     */
    public PowerReport(double cohensH, double alpha, double targetPower, double currentPower,
                      long requiredSampleSizePerGroup, long currentTotalSamples,
                      long requiredTotalSamples, String interpretation) {
        this.cohensH = cohensH;
        this.alpha = alpha;
        this.targetPower = targetPower;
        this.currentPower = currentPower;
        this.requiredSampleSizePerGroup = requiredSampleSizePerGroup;
        this.currentTotalSamples = currentTotalSamples;
        this.requiredTotalSamples = requiredTotalSamples;
        this.interpretation = Objects.requireNonNull(interpretation, "interpretation cannot be null");
    }
    
    /**
     * @return |h|, the effect size the power figures were computed for
     */
    public double getObservedEffectSize() {
        return Math.abs(cohensH);
    }
    
    /**
     * @return signed Cohen's h, positive when B has the higher rate
     */
    public double getCohensH() {
        return cohensH;
    }
    
    public double getAlpha() {
        return alpha;
    }
    
    public double getTargetPower() {
        return targetPower;
    }
    
    public double getCurrentPower() {
        return currentPower;
    }
    
    public boolean isTargetAttainable() {
        return requiredSampleSizePerGroup >= 0;
    }
    
    public OptionalLong getRequiredSampleSizePerGroup() {
        return isTargetAttainable() ? OptionalLong.of(requiredSampleSizePerGroup) : OptionalLong.empty();
    }
    
    public long getCurrentTotalSamples() {
        return currentTotalSamples;
    }
    
    public OptionalLong getRequiredTotalSamples() {
        return isTargetAttainable() ? OptionalLong.of(requiredTotalSamples) : OptionalLong.empty();
    }
    
    /**
     * @return additional samples still needed across both groups, 0 when already enough
     */
    public OptionalLong getSampleShortfall() {
        return isTargetAttainable()
            ? OptionalLong.of(Math.max(0, requiredTotalSamples - currentTotalSamples))
            : OptionalLong.empty();
    }
    
    public String getInterpretation() {
        return interpretation;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PowerReport)) return false;
        PowerReport other = (PowerReport) o;
        return Double.compare(cohensH, other.cohensH) == 0 && Double.compare(alpha, other.alpha) == 0
            && Double.compare(targetPower, other.targetPower) == 0
            && Double.compare(currentPower, other.currentPower) == 0
            && requiredSampleSizePerGroup == other.requiredSampleSizePerGroup
            && currentTotalSamples == other.currentTotalSamples
            && requiredTotalSamples == other.requiredTotalSamples
            && interpretation.equals(other.interpretation);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(cohensH, alpha, targetPower, currentPower, requiredSampleSizePerGroup,
            currentTotalSamples, requiredTotalSamples, interpretation);
    }
    
    @Override
    public String toString() {
        return String.format("PowerReport[h=%.4f, power=%.4f, requiredPerGroup=%s, %s]",
            cohensH, currentPower, getRequiredSampleSizePerGroup(), interpretation);
    }
}
