package org.puneet.abtest.model;

/**
 * Severity of the sample-size imbalance between the two groups.
 */
public enum BalanceLevel {
    BALANCED("Balanced"),
    MILD("Mild imbalance"),
    MODERATE("Moderate imbalance"),
    SEVERE("Severe imbalance");
    
    private final String displayName;
    
    BalanceLevel(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
