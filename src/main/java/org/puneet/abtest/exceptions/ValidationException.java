package org.puneet.abtest.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Input validation exception for the A/B test engine.
 * Raised before any computation when trial counts, win rates or test
 * parameters are rejected. A validation failure never carries a partial result.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ValidationException extends Exception implements Serializable {
    
    @Serial
    private static final long serialVersionUID = 1L;
    
    private static final Logger logger = LoggerFactory.getLogger(ValidationException.class);
    
    /**
     * Types of validation failures
     */
    public enum ValidationType {
        INPUT_VALIDATION("VAL001", "Input validation failed"),
        INVALID_SAMPLE_SIZE("VAL002", "Sample size must be a positive integer"),
        INVALID_RATE("VAL003", "Win rate must lie in [0, 1]"),
        RANGE_VALIDATION("VAL004", "Value out of valid range"),
        NULL_VALIDATION("VAL005", "Null value not allowed");
        
        private final String code;
        private final String description;
        
        ValidationType(String code, String description) {
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
    
    /**
     * Validation error details
     */
    public static class ValidationError implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
        
        private final String fieldName;
        private final Object actualValue;
        private final Object expectedValue;
        private final String constraint;
        
        public ValidationError(String fieldName, Object actualValue, 
                             Object expectedValue, String constraint) {
            this.fieldName = fieldName;
            this.actualValue = actualValue;
            this.expectedValue = expectedValue;
            this.constraint = constraint;
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        public Object getActualValue() {
            return actualValue;
        }
        
        public Object getExpectedValue() {
            return expectedValue;
        }
        
        public String getConstraint() {
            return constraint;
        }
        
        @Override
        public String toString() {
            return String.format("Field '%s': expected %s %s, but got %s",
                    fieldName, constraint, expectedValue, actualValue);
        }
    }
    
    private final ValidationType validationType;
    private final List<ValidationError> validationErrors;
    private final LocalDateTime timestamp;
    
    /**
     * Constructs a new ValidationException with type and message.
     * 
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message) {
        this(validationType, message, new ArrayList<>(), null);
    }
    
    /**
     * Constructs a new ValidationException with type, message and validation errors.
     * 
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                             List<ValidationError> validationErrors) {
        this(validationType, message, validationErrors, null);
    }
    
    /**
     * Constructs a new ValidationException with all parameters.
     * 
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @param cause The underlying cause
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                             List<ValidationError> validationErrors, Throwable cause) {
        super(formatMessage(validationType, message), cause);
        
        Objects.requireNonNull(validationType, "Validation type cannot be null");
        
        this.validationType = validationType;
        this.validationErrors = validationErrors != null ? 
                new ArrayList<>(validationErrors) : new ArrayList<>();
        this.timestamp = LocalDateTime.now();
        
        logger.debug("ValidationException created: [{}] {}", validationType.getCode(), getMessage());
    }
    
    /**
     * Creates a validation exception for a non-positive number of trials.
     * 
     * @param groupName The group the sample size belongs to
     * @param n The rejected sample size
     * @return A new ValidationException of type INVALID_SAMPLE_SIZE
     */
    public static ValidationException invalidSampleSize(String groupName, long n) {
        String message = String.format("Group '%s' has %d trials, expected a positive count", groupName, n);
        List<ValidationError> errors = List.of(
                new ValidationError(groupName + ".n", n, 0, ">")
        );
        return new ValidationException(ValidationType.INVALID_SAMPLE_SIZE, message, errors);
    }
    
    /**
     * Creates a validation exception for a win rate outside [0, 1].
     * 
     * @param groupName The group the win rate belongs to
     * @param winRate The rejected win rate
     * @return A new ValidationException of type INVALID_RATE
     */
    public static ValidationException invalidRate(String groupName, double winRate) {
        String message = String.format("Group '%s' has win rate %s, expected a value in [0, 1]", groupName, winRate);
        List<ValidationError> errors = List.of(
                new ValidationError(groupName + ".winRate", winRate, "[0, 1]", "IN")
        );
        return new ValidationException(ValidationType.INVALID_RATE, message, errors);
    }
    
    /**
     * Creates a validation exception for null value scenarios.
     * 
     * @param fieldName The name of the field that is null
     * @return A new ValidationException configured for null validation
     */
    public static ValidationException nullValue(String fieldName) {
        String message = String.format("Null value not allowed for field '%s'", fieldName);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, null, "non-null", "NOT_NULL")
        );
        
        return new ValidationException(ValidationType.NULL_VALIDATION, message, errors);
    }
    
    /**
     * Creates a validation exception for a value outside an open or closed range.
     * 
     * @param fieldName The name of the field
     * @param value The actual value
     * @param expectedRange The expected range in interval notation, e.g. "(0, 1)"
     * @return A new ValidationException configured for range validation
     */
    public static ValidationException outOfRange(String fieldName, Number value, String expectedRange) {
        String message = String.format(
                "Value %s for field '%s' is out of range %s", value, fieldName, expectedRange);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, value, expectedRange, "RANGE")
        );
        
        return new ValidationException(ValidationType.RANGE_VALIDATION, message, errors);
    }
    
    private static String formatMessage(ValidationType validationType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(validationType.getCode()).append("] ");
        sb.append(validationType.getDescription());
        
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        
        return sb.toString();
    }
    
    public ValidationType getValidationType() {
        return validationType;
    }
    
    /**
     * Gets the list of validation errors.
     * 
     * @return An unmodifiable list of validation errors
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }
    
    public LocalDateTime getTimestamp() {
        return timestamp;
    }
    
    /**
     * Gets a detailed string representation for logging.
     * 
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationException Details:\n");
        sb.append("  Type: ").append(validationType.getCode()).append(" - ")
          .append(validationType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");
        
        if (!validationErrors.isEmpty()) {
            sb.append("  Validation Errors (").append(validationErrors.size()).append("):\n");
            for (ValidationError error : validationErrors) {
                sb.append("    - ").append(error).append("\n");
            }
        }
        
        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }
        
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return String.format("ValidationException[type=%s, errors=%d, timestamp=%s]: %s",
                validationType.getCode(),
                validationErrors.size(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
