package org.puneet.abtest.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Exception class for statistical failures in the A/B test engine.
 * Covers unsupported test methods, power calculations that cannot be
 * performed and invalid statistics produced by a test.
 * 
 * <p>A degenerate test statistic (zero pooled variance) is not raised through
 * this exception; it is reported on the test outcome itself.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class StatisticalValidationException extends Exception implements Serializable {
    
    @Serial
    private static final long serialVersionUID = 1L;
    
    private static final Logger logger = LoggerFactory.getLogger(StatisticalValidationException.class);
    
    /**
     * Types of statistical failures
     */
    public enum StatisticalErrorType {
        UNSUPPORTED_METHOD("STAT001", "Unsupported hypothesis test method"),
        UNDEFINED_POWER("STAT002", "Statistical power cannot be computed"),
        DEGENERATE_STATISTIC("STAT003", "Test statistic is degenerate"),
        INVALID_P_VALUE("STAT004", "Invalid p-value calculated"),
        SIGNIFICANCE_TEST_ERROR("STAT005", "Significance test execution failed");
        
        private final String code;
        private final String description;
        
        StatisticalErrorType(String code, String description) {
            this.code = code;
            this.description = description;
        }
        
        public String getCode() {
            return code;
        }
        
        public String getDescription() {
            return description;
        }
    }
    
    private final StatisticalErrorType errorType;
    private final LocalDateTime timestamp;
    private final Map<String, Object> statisticalContext;
    
    /**
     * Constructs a new StatisticalValidationException with error type and message.
     * 
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message) {
        this(errorType, message, null);
    }
    
    /**
     * Constructs a new StatisticalValidationException with error type, message, and cause.
     * 
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, 
                                        String message, Throwable cause) {
        super(formatMessage(errorType, message), cause);
        
        Objects.requireNonNull(errorType, "Error type cannot be null");
        
        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
        this.statisticalContext = new LinkedHashMap<>();
        
        logger.debug("StatisticalValidationException created: [{}] {}", errorType.getCode(), getMessage());
    }
    
    /**
     * Creates an exception for a test method identifier the dispatcher does not know.
     * 
     * @param methodId The rejected identifier
     * @param supported The identifiers that are accepted
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException unsupportedMethod(String methodId, Collection<String> supported) {
        String message = String.format("Method '%s' is not supported (expected one of %s)", methodId, supported);
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.UNSUPPORTED_METHOD, message);
        ex.addContext("method", methodId);
        return ex;
    }
    
    /**
     * Creates an exception for a power calculation that has no defined value.
     * 
     * @param reason Why the power cannot be computed
     * @param nA Sample size of group A
     * @param nB Sample size of group B
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException undefinedPower(String reason, long nA, long nB) {
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.UNDEFINED_POWER, reason);
        ex.addContext("nA", nA);
        ex.addContext("nB", nB);
        return ex;
    }
    
    /**
     * Creates an exception for invalid p-value.
     * 
     * @param pValue The invalid p-value
     * @param testName The test that produced the invalid p-value
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException invalidPValue(double pValue, String testName) {
        String message = String.format(
                "Invalid p-value %.6f calculated for %s (must be in range [0, 1])",
                pValue, testName
        );
        
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.INVALID_P_VALUE, message
        );
        ex.addContext("pValue", pValue);
        ex.addContext("testName", testName);
        
        return ex;
    }
    
    private static String formatMessage(StatisticalErrorType errorType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorType.getCode()).append("] ");
        sb.append(errorType.getDescription());
        
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        
        return sb.toString();
    }
    
    /**
     * Adds statistical context information.
     * 
     * @param key The context key
     * @param value The context value
     */
    public void addContext(String key, Object value) {
        if (key != null) {
            statisticalContext.put(key, value);
        }
    }
    
    public StatisticalErrorType getErrorType() {
        return errorType;
    }
    
    public LocalDateTime getTimestamp() {
        return timestamp;
    }
    
    /**
     * Gets the statistical context.
     * 
     * @return An unmodifiable map of statistical context
     */
    public Map<String, Object> getStatisticalContext() {
        return Collections.unmodifiableMap(statisticalContext);
    }
    
    /**
     * Gets a detailed message for logging.
     * 
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("StatisticalValidationException Details:\n");
        sb.append("  Error Type: ").append(errorType.getCode()).append(" - ")
          .append(errorType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");
        
        if (!statisticalContext.isEmpty()) {
            sb.append("  Statistical Context:\n");
            statisticalContext.forEach((key, value) -> 
                    sb.append("    ").append(key).append(": ").append(value).append("\n"));
        }
        
        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }
        
        return sb.toString();
    }
    
    /**
     * Checks if this is a caller error rather than a property of the data.
     * 
     * @return true for unsupported methods, invalid p-values and failed test runs
     */
    public boolean isCritical() {
        return switch (errorType) {
            case UNSUPPORTED_METHOD, INVALID_P_VALUE, SIGNIFICANCE_TEST_ERROR -> true;
            default -> false;
        };
    }
    
    @Override
    public String toString() {
        return String.format("StatisticalValidationException[type=%s, timestamp=%s]: %s",
                errorType.getCode(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
