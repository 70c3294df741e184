package org.puneet.abtest.validation;

import org.puneet.abtest.exceptions.ValidationException;
import org.puneet.abtest.model.Advisory;
import org.puneet.abtest.model.Trial;
import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.util.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw {@code (n, winRate)} inputs into an immutable {@link TrialPair}.
 * 
 * <p>Non-positive sample sizes and rates outside [0, 1] are rejected. Small
 * samples and win rates that do not give a whole number of wins are reported
 * as advisories and do not stop the analysis.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class TrialValidator {
    private static final Logger logger = LoggerFactory.getLogger(TrialValidator.class);
    
    private TrialValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
    
    /**
     * Validates both groups.
     * 
     * @return the trial pair and any advisories, A's before B's
     * @throws ValidationException of type INVALID_SAMPLE_SIZE or INVALID_RATE
     */
    public static ValidatedTrials validate(String nameA, int nA, double winRateA,
                                           String nameB, int nB, double winRateB)
            throws ValidationException {
        if (nameA == null) {
            throw ValidationException.nullValue("nameA");
        }
        if (nameB == null) {
            throw ValidationException.nullValue("nameB");
        }
        
        // both groups are checked before any advisory is produced
        checkSampleSize(nameA, nA);
        checkSampleSize(nameB, nB);
        checkRate(nameA, winRateA);
        checkRate(nameB, winRateB);
        
        List<Advisory> advisories = new ArrayList<>();
        collectAdvisories(nameA, nA, winRateA, advisories);
        collectAdvisories(nameB, nB, winRateB, advisories);
        
        TrialPair pair = new TrialPair(nameA, new Trial(nA, winRateA), nameB, new Trial(nB, winRateB));
        logger.debug("Validated {} with {} advisories", pair, advisories.size());
        return new ValidatedTrials(pair, advisories);
    }
    
    private static void checkSampleSize(String name, int n) throws ValidationException {
        if (n <= 0) {
            logger.error("Invalid sample size for {}: {}", name, n);
            throw ValidationException.invalidSampleSize(name, n);
        }
    }
    
    private static void checkRate(String name, double winRate) throws ValidationException {
        if (Double.isNaN(winRate) || winRate < 0.0 || winRate > 1.0) {
            logger.error("Invalid win rate for {}: {}", name, winRate);
            throw ValidationException.invalidRate(name, winRate);
        }
    }
    
    private static void collectAdvisories(String name, int n, double winRate, List<Advisory> advisories) {
        if (n < AnalysisConfig.SMALL_SAMPLE_THRESHOLD) {
            String message = String.format("%s has only %d trials (< %d), test results may be unreliable",
                name, n, AnalysisConfig.SMALL_SAMPLE_THRESHOLD);
            logger.warn(message);
            advisories.add(new Advisory(Advisory.Type.SMALL_SAMPLE, name, message));
        }
        
        double rawWins = n * winRate;
        if (Math.abs(rawWins - Math.rint(rawWins)) > AnalysisConfig.WIN_COUNT_TOLERANCE) {
            String message = String.format("%s win count %.2f is not a whole number, rounded to %d",
                name, rawWins, (long) Math.rint(rawWins));
            logger.warn(message);
            advisories.add(new Advisory(Advisory.Type.NON_INTEGER_WIN_COUNT, name, message));
        }
    }
}
