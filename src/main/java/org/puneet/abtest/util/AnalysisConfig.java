package org.puneet.abtest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for the A/B test engine.
 * Holds the statistical thresholds used across components and the defaults
 * loaded from {@code config.properties} on the classpath.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class AnalysisConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);
    
    // ===================================================================================
    // STATISTICAL CONSTANTS
    // ===================================================================================
    
    /** Significance level for hypothesis testing (α = 0.05) */
    public static final double SIGNIFICANCE_LEVEL = 0.05;
    
    /** Target power (1 - β) for sample size calculations */
    public static final double TARGET_POWER = 0.8;
    
    /** Random seed for reproducible permutation tests */
    public static final long RANDOM_SEED = 123456L;
    
    /** Default number of Monte-Carlo resamples for the permutation test */
    public static final int PERMUTATION_ITERATIONS = 10_000;
    
    /** Resamples drawn per independently seeded block */
    public static final int PERMUTATION_BLOCK_SIZE = 1_000;
    
    // ===================================================================================
    // SAMPLE THRESHOLDS
    // ===================================================================================
    
    /** Groups below this many trials are flagged as small samples */
    public static final int SMALL_SAMPLE_THRESHOLD = 30;
    
    /** Minimum cell count for the chi-square and Fisher rules */
    public static final int MIN_EXPECTED_CELL_COUNT = 5;
    
    /** Tolerance on n × winRate before a win count is reported as rounded */
    public static final double WIN_COUNT_TOLERANCE = 0.001;
    
    /** Balance ratio lower bounds */
    public static final double BALANCED_RATIO = 0.67;
    public static final double MILD_RATIO = 0.33;
    public static final double MODERATE_RATIO = 0.10;
    
    /** Ratio band in which the asymptotic z-test is preferred */
    public static final double Z_TEST_UPPER_RATIO = 0.3;
    
    /** Floor and fraction of the larger group for the smaller group's recommended size */
    public static final int MIN_RECOMMENDED_SAMPLE = 50;
    public static final double RECOMMENDED_SAMPLE_FRACTION = 0.3;
    
    /** Rate difference above which a non-significant result means "keep testing" */
    public static final double PRACTICAL_EFFECT_THRESHOLD = 0.05;
    
    // ===================================================================================
    // CONFIG PROPERTIES LOADING
    // ===================================================================================
    
    private static final String CONFIG_FILE = "config.properties";
    private static final Properties properties = new Properties();
    static {
        try (InputStream input = AnalysisConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded {} entries from {}", properties.size(), CONFIG_FILE);
            } else {
                logger.warn("{} not found in classpath, using built-in defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load " + CONFIG_FILE, e);
        }
    }
    
    private AnalysisConfig() {
        throw new AssertionError("AnalysisConfig is a utility class and cannot be instantiated");
    }
    
    public static double getAlpha() {
        return getDoubleProperty("analysis.alpha", SIGNIFICANCE_LEVEL);
    }
    
    public static double getTargetPower() {
        return getDoubleProperty("analysis.power", TARGET_POWER);
    }
    
    public static String getDefaultAlternative() {
        return properties.getProperty("analysis.alternative", "two-sided").trim();
    }
    
    public static String getDefaultMethod() {
        return properties.getProperty("analysis.method", "auto").trim();
    }
    
    public static int getPermutationIterations() {
        return getIntProperty("permutation.iterations", PERMUTATION_ITERATIONS);
    }
    
    public static long getPermutationSeed() {
        return getLongProperty("permutation.seed", RANDOM_SEED);
    }
    
    public static boolean isPermutationParallel() {
        return Boolean.parseBoolean(properties.getProperty("permutation.parallel", "false").trim());
    }
    
    public static int getPermutationBlockSize() {
        return getIntProperty("permutation.block.size", PERMUTATION_BLOCK_SIZE);
    }
    
    private static double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "' in config.properties: " + value);
        }
    }
    
    private static long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "' in config.properties: " + value);
        }
    }
    
    private static int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "' in config.properties: " + value);
        }
    }
}
