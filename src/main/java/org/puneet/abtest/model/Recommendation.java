package org.puneet.abtest.model;

import java.util.List;
import java.util.Objects;

/**
 * Final decision shown to the analyst, with the reason and follow-up actions.
 */
public final class Recommendation {
    
    public enum Decision {
        ADOPT_A,
        ADOPT_B,
        KEEP_TESTING,
        EQUIVALENT
    }
    
    private final Decision decision;
    private final String headline;
    private final String reason;
    private final List<String> actions;
    
    public Recommendation(Decision decision, String headline, String reason, List<String> actions) {
        this.decision = Objects.requireNonNull(decision, "decision cannot be null");
        this.headline = headline;
        this.reason = reason;
        this.actions = List.copyOf(actions);
    }
    
    public Decision getDecision() {
        return decision;
    }
    
    public String getHeadline() {
        return headline;
    }
    
    public String getReason() {
        return reason;
    }
    
    public List<String> getActions() {
        return actions;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recommendation)) return false;
        Recommendation other = (Recommendation) o;
        return decision == other.decision && Objects.equals(headline, other.headline)
            && Objects.equals(reason, other.reason) && actions.equals(other.actions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(decision, headline, reason, actions);
    }
    
    @Override
    public String toString() {
        return headline + " - " + reason;
    }
}
