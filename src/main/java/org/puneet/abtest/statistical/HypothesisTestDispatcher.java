package org.puneet.abtest.statistical;

import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.abtest.exceptions.ValidationException;
import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.TrialPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a trial pair to the hypothesis test of the requested method and
 * checks the result before handing it back.
 * 
 * <p>Outcomes are cached per (pair, method, alpha, alternative). All tests are
 * deterministic, so a cached outcome equals a fresh one.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class HypothesisTestDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(HypothesisTestDispatcher.class);
    
    private static final int CACHE_SIZE_LIMIT = 100;
    
    private final Map<TestMethod, HypothesisTest> registry;
    private final Map<CacheKey, TestOutcome> outcomeCache = new ConcurrentHashMap<>();
    
    /**
     * Registers all four methods, with permutation settings read from the configuration.
     */
    public HypothesisTestDispatcher() {
        this(new PermutationTest());
    }
    
    public HypothesisTestDispatcher(PermutationTest permutationTest) {
        Map<TestMethod, HypothesisTest> tests = new EnumMap<>(TestMethod.class);
        register(tests, new ProportionZTest());
        register(tests, new ChiSquareTest());
        register(tests, new FisherExactTest());
        register(tests, Objects.requireNonNull(permutationTest, "permutationTest cannot be null"));
        this.registry = Collections.unmodifiableMap(tests);
    }
    
    private static void register(Map<TestMethod, HypothesisTest> tests, HypothesisTest test) {
        tests.put(test.getMethod(), test);
    }
    
    /**
     * Parses the identifiers and runs the test.
     * 
     * @throws StatisticalValidationException if the method identifier is unknown
     * @throws ValidationException if alpha or the alternative is invalid
     */
    public TestOutcome run(TrialPair pair, String methodId, double alpha, String alternative)
            throws ValidationException, StatisticalValidationException {
        return run(pair, TestMethod.fromId(methodId), alpha, Alternative.fromId(alternative));
    }
    
    /**
     * Runs one test on the pair.
     * 
     * @param pair validated trials
     * @param method test method
     * @param alpha significance level, strictly between 0 and 1
     * @param alternative alternative hypothesis, rate of B compared with rate of A
     * @return the checked outcome
     * @throws ValidationException if alpha is outside (0, 1) or an argument is null
     * @throws StatisticalValidationException if the test fails or yields an invalid p-value
     */
    public TestOutcome run(TrialPair pair, TestMethod method, double alpha, Alternative alternative)
            throws ValidationException, StatisticalValidationException {
        if (pair == null) {
            throw ValidationException.nullValue("trials");
        }
        if (method == null) {
            throw ValidationException.nullValue("method");
        }
        if (alternative == null) {
            throw ValidationException.nullValue("alternative");
        }
        checkAlpha(alpha);
        
        CacheKey key = new CacheKey(pair, method, alpha, alternative);
        TestOutcome cached = outcomeCache.get(key);
        if (cached != null) {
            logger.debug("Returning cached {} outcome", method.getId());
            return cached;
        }
        
        HypothesisTest test = registry.get(method);
        if (test == null) {
            throw StatisticalValidationException.unsupportedMethod(method.getId(), TestMethod.ids());
        }
        
        TestOutcome outcome;
        try {
            outcome = test.run(pair, alpha, alternative);
        } catch (RuntimeException e) {
            logger.error("Error while running {} on {}", method.getDisplayName(), pair, e);
            StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.SIGNIFICANCE_TEST_ERROR,
                method.getDisplayName() + " failed: " + e.getMessage(), e);
            ex.addContext("method", method.getId());
            throw ex;
        }
        checkPValue(outcome);
        
        logger.info("{}: {}={}, p={}, significant={}", method.getDisplayName(),
            outcome.getStatisticName(), outcome.getStatistic(), outcome.getPValue(), outcome.isSignificant());
        
        cleanupCacheIfNeeded();
        outcomeCache.put(key, outcome);
        return outcome;
    }
    
    public HypothesisTest getTest(TestMethod method) {
        return registry.get(method);
    }
    
    static void checkAlpha(double alpha) throws ValidationException {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw ValidationException.outOfRange("alpha", alpha, "(0, 1)");
        }
    }
    
    private static void checkPValue(TestOutcome outcome) throws StatisticalValidationException {
        double p = outcome.getPValue();
        if (Double.isNaN(p) && outcome.isDegenerate()) {
            return;
        }
        if (!(p >= 0.0 && p <= 1.0)) {
            throw StatisticalValidationException.invalidPValue(p, outcome.getMethod().getDisplayName());
        }
    }
    
    private void cleanupCacheIfNeeded() {
        if (outcomeCache.size() >= CACHE_SIZE_LIMIT) {
            outcomeCache.clear();
        }
    }
    
    private static final class CacheKey {
        private final TrialPair pair;
        private final TestMethod method;
        private final double alpha;
        private final Alternative alternative;
        
        CacheKey(TrialPair pair, TestMethod method, double alpha, Alternative alternative) {
            this.pair = pair;
            this.method = method;
            this.alpha = alpha;
            this.alternative = alternative;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey)) return false;
            CacheKey other = (CacheKey) o;
            return Double.compare(alpha, other.alpha) == 0
                && method == other.method
                && alternative == other.alternative
                && pair.equals(other.pair);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(pair, method, alpha, alternative);
        }
    }
}
