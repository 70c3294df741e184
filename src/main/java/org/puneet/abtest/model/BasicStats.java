package org.puneet.abtest.model;

import java.util.Objects;

/**
 * Descriptive figures of both groups and their B minus A deltas.
 * Shares are fractions of the combined sample; rates are the reported ones.
 */
public final class BasicStats {
    
    /**
     * Figures of a single group.
     */
    public static final class GroupStats {
        private final String name;
        private final int total;
        private final int wins;
        private final int losses;
        private final double winRate;
        private final double lossRate;
        private final double sampleShare;
        
        GroupStats(String name, Trial trial, long combinedTotal) {
            this.name = name;
            this.total = trial.getN();
            this.wins = trial.getWins();
            this.losses = trial.getLosses();
            this.winRate = trial.getWinRate();
            this.lossRate = trial.getLossRate();
            this.sampleShare = (double) trial.getN() / combinedTotal;
        }
        
        public String getName() {
            return name;
        }
        
        public int getTotal() {
            return total;
        }
        
        public int getWins() {
            return wins;
        }
        
        public int getLosses() {
            return losses;
        }
        
        public double getWinRate() {
            return winRate;
        }
        
        public double getLossRate() {
            return lossRate;
        }
        
        public double getSampleShare() {
            return sampleShare;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GroupStats)) return false;
            GroupStats other = (GroupStats) o;
            return name.equals(other.name) && total == other.total && wins == other.wins
                && Double.compare(winRate, other.winRate) == 0;
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(name, total, wins, winRate);
        }
    }
    
    private final GroupStats groupA;
    private final GroupStats groupB;
    
    private BasicStats(GroupStats groupA, GroupStats groupB) {
        this.groupA = groupA;
        this.groupB = groupB;
    }
    
    public static BasicStats of(TrialPair pair) {
        long combined = pair.getTotalTrials();
        return new BasicStats(
            new GroupStats(pair.getNameA(), pair.getTrialA(), combined),
            new GroupStats(pair.getNameB(), pair.getTrialB(), combined));
    }
    
    public GroupStats getGroupA() {
        return groupA;
    }
    
    public GroupStats getGroupB() {
        return groupB;
    }
    
    public int getTotalDelta() {
        return groupB.total - groupA.total;
    }
    
    public int getWinsDelta() {
        return groupB.wins - groupA.wins;
    }
    
    public int getLossesDelta() {
        return groupB.losses - groupA.losses;
    }
    
    public double getWinRateDelta() {
        return groupB.winRate - groupA.winRate;
    }
    
    public double getLossRateDelta() {
        return groupB.lossRate - groupA.lossRate;
    }
    
    public double getSampleShareDelta() {
        return groupB.sampleShare - groupA.sampleShare;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BasicStats)) return false;
        BasicStats other = (BasicStats) o;
        return groupA.equals(other.groupA) && groupB.equals(other.groupB);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(groupA, groupB);
    }
}
