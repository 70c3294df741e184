package org.puneet.abtest.model;

import java.util.Objects;

/**
 * Data collection plan sized for a target power, with the group allocation
 * adjusted to the current imbalance.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class SampleSizePlan {
    
    private final double effectSize;
    private final double alpha;
    private final double targetPower;
    private final double currentRatio;
    private final long sampleSizePerGroup;
    private final long suggestedSizeA;
    private final long suggestedSizeB;
    private final double optimalRatio;
    private final String recommendation;
    
    public SampleSizePlan(double effectSize, double alpha, double targetPower, double currentRatio,
                         long sampleSizePerGroup, double optimalRatio, String recommendation) {
        this.effectSize = effectSize;
        this.alpha = alpha;
        this.targetPower = targetPower;
        this.currentRatio = currentRatio;
        this.sampleSizePerGroup = sampleSizePerGroup;
        this.suggestedSizeA = sampleSizePerGroup;
        this.suggestedSizeB = (long) (sampleSizePerGroup * optimalRatio);
        this.optimalRatio = optimalRatio;
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation cannot be null");
    }
    
    public double getEffectSize() {
        return effectSize;
    }
    
    public double getAlpha() {
        return alpha;
    }
    
    public double getTargetPower() {
        return targetPower;
    }
    
    /**
     * @return nB / nA of the data collected so far
     */
    public double getCurrentRatio() {
        return currentRatio;
    }
    
    public long getSampleSizePerGroup() {
        return sampleSizePerGroup;
    }
    
    public long getSuggestedSizeA() {
        return suggestedSizeA;
    }
    
    public long getSuggestedSizeB() {
        return suggestedSizeB;
    }
    
    public long getSuggestedTotal() {
        return suggestedSizeA + suggestedSizeB;
    }
    
    public double getOptimalRatio() {
        return optimalRatio;
    }
    
    public String getRecommendation() {
        return recommendation;
    }
    
    @Override
    public String toString() {
        return String.format("SampleSizePlan[A=%d, B=%d, ratio=%.2f]", suggestedSizeA, suggestedSizeB, optimalRatio);
    }
}
