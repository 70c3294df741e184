package org.puneet.abtest.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one analysis run produced for the presentation layer.
 * Outcomes are keyed by method so results of several tests on the same pair
 * can be kept side by side.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class AnalysisReport {
    
    private final AnalysisRequest request;
    private final TrialPair trialPair;
    private final List<Advisory> advisories;
    private final BasicStats basicStats;
    private final ImbalanceReport imbalanceReport;
    private final TestMethod executedMethod;
    private final Map<TestMethod, TestOutcome> outcomes;
    private final PowerReport powerReport;
    private final Recommendation recommendation;
    
    public AnalysisReport(AnalysisRequest request, TrialPair trialPair, List<Advisory> advisories,
                         ImbalanceReport imbalanceReport, TestOutcome outcome,
                         PowerReport powerReport, Recommendation recommendation) {
        this(request, trialPair, advisories, imbalanceReport, outcome.getMethod(),
            singleOutcome(outcome), powerReport, recommendation);
    }
    
    private AnalysisReport(AnalysisRequest request, TrialPair trialPair, List<Advisory> advisories,
                          ImbalanceReport imbalanceReport, TestMethod executedMethod,
                          Map<TestMethod, TestOutcome> outcomes, PowerReport powerReport,
                          Recommendation recommendation) {
        this.request = Objects.requireNonNull(request, "request cannot be null");
        this.trialPair = Objects.requireNonNull(trialPair, "trialPair cannot be null");
        this.advisories = List.copyOf(advisories);
        this.basicStats = BasicStats.of(trialPair);
        this.imbalanceReport = Objects.requireNonNull(imbalanceReport, "imbalanceReport cannot be null");
        this.executedMethod = executedMethod;
        this.outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
        this.powerReport = Objects.requireNonNull(powerReport, "powerReport cannot be null");
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation cannot be null");
    }
    
    private static Map<TestMethod, TestOutcome> singleOutcome(TestOutcome outcome) {
        Map<TestMethod, TestOutcome> map = new EnumMap<>(TestMethod.class);
        map.put(outcome.getMethod(), outcome);
        return map;
    }
    
    /**
     * Returns a copy of this report that also holds the given outcome,
     * replacing an earlier outcome of the same method.
     */
    public AnalysisReport withOutcome(TestOutcome outcome) {
        Map<TestMethod, TestOutcome> merged = new EnumMap<>(TestMethod.class);
        merged.putAll(outcomes);
        merged.put(outcome.getMethod(), outcome);
        return new AnalysisReport(request, trialPair, advisories, imbalanceReport, executedMethod,
            merged, powerReport, recommendation);
    }
    
    public AnalysisRequest getRequest() {
        return request;
    }
    
    public TrialPair getTrialPair() {
        return trialPair;
    }
    
    public List<Advisory> getAdvisories() {
        return advisories;
    }
    
    public BasicStats getBasicStats() {
        return basicStats;
    }
    
    public ImbalanceReport getImbalanceReport() {
        return imbalanceReport;
    }
    
    /**
     * @return the method the recommendation is based on
     */
    public TestMethod getExecutedMethod() {
        return executedMethod;
    }
    
    public TestOutcome getOutcome() {
        return outcomes.get(executedMethod);
    }
    
    public TestOutcome getOutcome(TestMethod method) {
        return outcomes.get(method);
    }
    
    public Map<TestMethod, TestOutcome> getOutcomes() {
        return outcomes;
    }
    
    public PowerReport getPowerReport() {
        return powerReport;
    }
    
    public Recommendation getRecommendation() {
        return recommendation;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisReport)) return false;
        AnalysisReport other = (AnalysisReport) o;
        return request.equals(other.request) && trialPair.equals(other.trialPair)
            && advisories.equals(other.advisories) && basicStats.equals(other.basicStats)
            && imbalanceReport.equals(other.imbalanceReport) && executedMethod == other.executedMethod
            && outcomes.equals(other.outcomes) && powerReport.equals(other.powerReport)
            && recommendation.equals(other.recommendation);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(request, trialPair, imbalanceReport, executedMethod, outcomes, powerReport);
    }
}
