package org.puneet.abtest.model;

import java.util.Objects;

/**
 * One group's aggregate win/loss record over {@code n} trials.
 * 
 * <p>The win count is derived from the reported win rate and rounded to the
 * nearest integer (ties to even), so {@code 0 <= wins <= n} always holds.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class Trial {
    
    private final int n;
    private final double winRate;
    private final int wins;
    private final int losses;
    
    /**
     * Creates a trial record.
     * 
     * @param n total number of trials, must be positive
     * @param winRate reported win rate in [0, 1]
     * @throws IllegalArgumentException if either argument is out of range
     */
    public Trial(int n, double winRate) {
        if (n <= 0) {
            throw new IllegalArgumentException("Number of trials must be positive: " + n);
        }
        if (Double.isNaN(winRate) || winRate < 0.0 || winRate > 1.0) {
            throw new IllegalArgumentException("Win rate must be in [0, 1]: " + winRate);
        }
        this.n = n;
        this.winRate = winRate;
        this.wins = (int) Math.min(n, Math.max(0, Math.rint(n * winRate)));
        this.losses = n - wins;
    }
    
    public int getN() {
        return n;
    }
    
    /**
     * @return the win rate as reported by the caller
     */
    public double getWinRate() {
        return winRate;
    }
    
    public double getLossRate() {
        return 1.0 - winRate;
    }
    
    public int getWins() {
        return wins;
    }
    
    public int getLosses() {
        return losses;
    }
    
    /**
     * @return wins / n, the rate actually used by the hypothesis tests
     */
    public double getObservedRate() {
        return (double) wins / n;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trial)) return false;
        Trial other = (Trial) o;
        return n == other.n && Double.compare(winRate, other.winRate) == 0;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(n, winRate);
    }
    
    @Override
    public String toString() {
        return String.format("Trial[n=%d, winRate=%.4f, wins=%d, losses=%d]", n, winRate, wins, losses);
    }
}
