package org.puneet.abtest.validation;

import org.puneet.abtest.model.Advisory;
import org.puneet.abtest.model.TrialPair;

import java.util.List;
import java.util.Objects;

/**
 * A validated trial pair together with the advisories raised while validating it.
 */
public final class ValidatedTrials {
    
    private final TrialPair trialPair;
    private final List<Advisory> advisories;
    
    public ValidatedTrials(TrialPair trialPair, List<Advisory> advisories) {
        this.trialPair = Objects.requireNonNull(trialPair, "trialPair cannot be null");
        this.advisories = List.copyOf(advisories);
    }
    
    public TrialPair getTrialPair() {
        return trialPair;
    }
    
    public List<Advisory> getAdvisories() {
        return advisories;
    }
    
    public boolean hasAdvisory(Advisory.Type type) {
        return advisories.stream().anyMatch(a -> a.getType() == type);
    }
}
