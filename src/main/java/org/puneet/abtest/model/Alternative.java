package org.puneet.abtest.model;

import org.puneet.abtest.exceptions.ValidationException;
import org.puneet.abtest.exceptions.ValidationException.ValidationType;

/**
 * Alternative hypothesis, always stated for the rate of B relative to the rate of A.
 */
public enum Alternative {
    TWO_SIDED("two-sided"),
    /** rate B greater than rate A */
    GREATER("greater"),
    /** rate B less than rate A */
    LESS("less");
    
    private final String id;
    
    Alternative(String id) {
        this.id = id;
    }
    
    public String getId() {
        return id;
    }
    
    /**
     * Parses an alternative identifier such as {@code "two-sided"}.
     * 
     * @throws ValidationException if the identifier is unknown
     */
    public static Alternative fromId(String id) throws ValidationException {
        if (id == null) {
            throw ValidationException.nullValue("alternative");
        }
        String normalized = id.trim().toLowerCase().replace('_', '-');
        for (Alternative alternative : values()) {
            if (alternative.id.equals(normalized)) {
                return alternative;
            }
        }
        throw new ValidationException(ValidationType.INPUT_VALIDATION,
            "Unknown alternative '" + id + "', expected two-sided, greater or less");
    }
}
