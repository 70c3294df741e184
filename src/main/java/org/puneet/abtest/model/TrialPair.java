package org.puneet.abtest.model;

import java.util.Objects;

/**
 * Ordered pair of trials under comparison, A being the baseline and B the challenger.
 * All rate differences are reported as B minus A.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class TrialPair {
    
    private final String nameA;
    private final Trial trialA;
    private final String nameB;
    private final Trial trialB;
    
    public TrialPair(String nameA, Trial trialA, String nameB, Trial trialB) {
        this.nameA = Objects.requireNonNull(nameA, "nameA cannot be null");
        this.trialA = Objects.requireNonNull(trialA, "trialA cannot be null");
        this.nameB = Objects.requireNonNull(nameB, "nameB cannot be null");
        this.trialB = Objects.requireNonNull(trialB, "trialB cannot be null");
    }
    
    public String getNameA() {
        return nameA;
    }
    
    public Trial getTrialA() {
        return trialA;
    }
    
    public String getNameB() {
        return nameB;
    }
    
    public Trial getTrialB() {
        return trialB;
    }
    
    public long getTotalTrials() {
        return (long) trialA.getN() + trialB.getN();
    }
    
    /**
     * @return min(nA, nB) / max(nA, nB), in (0, 1]
     */
    public double getImbalanceRatio() {
        return (double) Math.min(trialA.getN(), trialB.getN()) / Math.max(trialA.getN(), trialB.getN());
    }
    
    /**
     * @return nB / nA, the allocation ratio used by power calculations
     */
    public double getAllocationRatio() {
        return (double) trialB.getN() / trialA.getN();
    }
    
    /**
     * @return observed rate of B minus observed rate of A
     */
    public double getRateDifference() {
        return trialB.getObservedRate() - trialA.getObservedRate();
    }
    
    /**
     * @return the name of the group with fewer trials, A on a tie
     */
    public String getSmallerGroupName() {
        return trialB.getN() < trialA.getN() ? nameB : nameA;
    }
    
    public ContingencyTable toContingencyTable() {
        return new ContingencyTable(trialA.getWins(), trialA.getLosses(), trialB.getWins(), trialB.getLosses());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrialPair)) return false;
        TrialPair other = (TrialPair) o;
        return nameA.equals(other.nameA) && trialA.equals(other.trialA)
            && nameB.equals(other.nameB) && trialB.equals(other.trialB);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(nameA, trialA, nameB, trialB);
    }
    
    @Override
    public String toString() {
        return String.format("TrialPair[%s=%s, %s=%s]", nameA, trialA, nameB, trialB);
    }
}
