package org.puneet.abtest.model;

import java.util.Objects;

/**
 * Non-fatal observation made while validating input. Advisories travel with
 * the result and never block the analysis.
 */
public final class Advisory {
    
    public enum Type {
        SMALL_SAMPLE,
        NON_INTEGER_WIN_COUNT
    }
    
    private final Type type;
    private final String groupName;
    private final String message;
    
    public Advisory(Type type, String groupName, String message) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.groupName = groupName;
        this.message = message;
    }
    
    public Type getType() {
        return type;
    }
    
    public String getGroupName() {
        return groupName;
    }
    
    public String getMessage() {
        return message;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Advisory)) return false;
        Advisory other = (Advisory) o;
        return type == other.type && Objects.equals(groupName, other.groupName)
            && Objects.equals(message, other.message);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, groupName, message);
    }
    
    @Override
    public String toString() {
        return type + "(" + groupName + "): " + message;
    }
}
