package org.puneet.abtest.model;

/**
 * Whether a test produced a usable statistic.
 */
public enum OutcomeStatus {
    OK,
    /** pooled win rate is 0 or 1, so the statistic has no defined value */
    DEGENERATE_STATISTIC
}
