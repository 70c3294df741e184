package org.puneet.abtest.model;

import org.puneet.abtest.util.AnalysisConfig;

import java.util.Objects;

/**
 * Raw analysis input as collected by a form or command line. Nothing here is
 * validated yet; the analyzer rejects bad values before computing anything.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class AnalysisRequest {
    
    /** Method identifier that defers the choice to the imbalance classifier */
    public static final String AUTO_METHOD = "auto";
    
    private final String nameA;
    private final String nameB;
    private final int nA;
    private final double winRateA;
    private final int nB;
    private final double winRateB;
    private final double alpha;
    private final String alternative;
    private final String method;
    
    private AnalysisRequest(Builder builder) {
        this.nameA = builder.nameA;
        this.nameB = builder.nameB;
        this.nA = builder.nA;
        this.winRateA = builder.winRateA;
        this.nB = builder.nB;
        this.winRateB = builder.winRateB;
        this.alpha = builder.alpha;
        this.alternative = builder.alternative;
        this.method = builder.method;
    }
    
    /**
     * Starts a request with alpha, alternative and method taken from {@code config.properties}.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public String getNameA() {
        return nameA;
    }
    
    public String getNameB() {
        return nameB;
    }
    
    public int getNA() {
        return nA;
    }
    
    public double getWinRateA() {
        return winRateA;
    }
    
    public int getNB() {
        return nB;
    }
    
    public double getWinRateB() {
        return winRateB;
    }
    
    public double getAlpha() {
        return alpha;
    }
    
    public String getAlternative() {
        return alternative;
    }
    
    public String getMethod() {
        return method;
    }
    
    public boolean isAutoMethod() {
        return method != null && AUTO_METHOD.equalsIgnoreCase(method.trim());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisRequest)) return false;
        AnalysisRequest other = (AnalysisRequest) o;
        return nA == other.nA && nB == other.nB
            && Double.compare(winRateA, other.winRateA) == 0
            && Double.compare(winRateB, other.winRateB) == 0
            && Double.compare(alpha, other.alpha) == 0
            && Objects.equals(nameA, other.nameA) && Objects.equals(nameB, other.nameB)
            && Objects.equals(alternative, other.alternative) && Objects.equals(method, other.method);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(nameA, nameB, nA, winRateA, nB, winRateB, alpha, alternative, method);
    }
    
    @Override
    public String toString() {
        return String.format("AnalysisRequest[%s: n=%d rate=%.4f, %s: n=%d rate=%.4f, alpha=%s, %s, method=%s]",
            nameA, nA, winRateA, nameB, nB, winRateB, alpha, alternative, method);
    }
    
    public static final class Builder {
        private String nameA = "Strategy A";
        private String nameB = "Strategy B";
        private int nA;
        private double winRateA;
        private int nB;
        private double winRateB;
        private double alpha = AnalysisConfig.getAlpha();
        private String alternative = AnalysisConfig.getDefaultAlternative();
        private String method = AnalysisConfig.getDefaultMethod();
        
        private Builder() {
        }
        
        public Builder groupA(String name, int n, double winRate) {
            this.nameA = name;
            this.nA = n;
            this.winRateA = winRate;
            return this;
        }
        
        public Builder groupB(String name, int n, double winRate) {
            this.nameB = name;
            this.nB = n;
            this.winRateB = winRate;
            return this;
        }
        
        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }
        
        public Builder alternative(String alternative) {
            this.alternative = alternative;
            return this;
        }
        
        public Builder alternative(Alternative alternative) {
            this.alternative = alternative.getId();
            return this;
        }
        
        public Builder method(String method) {
            this.method = method;
            return this;
        }
        
        public Builder method(TestMethod method) {
            this.method = method.getId();
            return this;
        }
        
        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}
