package org.puneet.abtest.model;

import java.util.List;
import java.util.Objects;

/**
 * Sample-size imbalance of a trial pair and the test method it calls for.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class ImbalanceReport {
    
    private final long totalSamples;
    private final int sampleSizeA;
    private final int sampleSizeB;
    private final double ratio;
    private final BalanceLevel balanceLevel;
    private final boolean smallSample;
    private final TestMethod recommendedMethod;
    private final int minExpectedCount;
    private final int minRecommendedSampleSize;
    private final List<String> advice;
    
    public ImbalanceReport(int sampleSizeA, int sampleSizeB, double ratio, BalanceLevel balanceLevel,
                          boolean smallSample, TestMethod recommendedMethod, int minExpectedCount,
                          int minRecommendedSampleSize, List<String> advice) {
        this.totalSamples = (long) sampleSizeA + sampleSizeB;
        this.sampleSizeA = sampleSizeA;
        this.sampleSizeB = sampleSizeB;
        this.ratio = ratio;
        this.balanceLevel = Objects.requireNonNull(balanceLevel, "balanceLevel cannot be null");
        this.smallSample = smallSample;
        this.recommendedMethod = Objects.requireNonNull(recommendedMethod, "recommendedMethod cannot be null");
        this.minExpectedCount = minExpectedCount;
        this.minRecommendedSampleSize = minRecommendedSampleSize;
        this.advice = List.copyOf(advice);
    }
    
    public long getTotalSamples() {
        return totalSamples;
    }
    
    public int getSampleSizeA() {
        return sampleSizeA;
    }
    
    public int getSampleSizeB() {
        return sampleSizeB;
    }
    
    public double getRatio() {
        return ratio;
    }
    
    public BalanceLevel getBalanceLevel() {
        return balanceLevel;
    }
    
    public boolean isSmallSample() {
        return smallSample;
    }
    
    public TestMethod getRecommendedMethod() {
        return recommendedMethod;
    }
    
    public String getRecommendedMethodLabel() {
        return recommendedMethod.getDisplayName();
    }
    
    /**
     * @return the smallest of the four table cells
     */
    public int getMinExpectedCount() {
        return minExpectedCount;
    }
    
    /**
     * @return minimum number of samples suggested for the smaller group
     */
    public int getMinRecommendedSampleSize() {
        return minRecommendedSampleSize;
    }
    
    public List<String> getAdvice() {
        return advice;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImbalanceReport)) return false;
        ImbalanceReport other = (ImbalanceReport) o;
        return sampleSizeA == other.sampleSizeA && sampleSizeB == other.sampleSizeB
            && Double.compare(ratio, other.ratio) == 0 && balanceLevel == other.balanceLevel
            && smallSample == other.smallSample && recommendedMethod == other.recommendedMethod
            && minExpectedCount == other.minExpectedCount
            && minRecommendedSampleSize == other.minRecommendedSampleSize
            && advice.equals(other.advice);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(sampleSizeA, sampleSizeB, ratio, balanceLevel, smallSample,
            recommendedMethod, minExpectedCount, minRecommendedSampleSize, advice);
    }
    
    @Override
    public String toString() {
        return String.format("ImbalanceReport[ratio=%.4f, level=%s, smallSample=%s, method=%s, minRecommended=%d]",
            ratio, balanceLevel, smallSample, recommendedMethod.getId(), minRecommendedSampleSize);
    }
}
