package org.puneet.abtest.model;

import org.puneet.abtest.exceptions.StatisticalValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * The hypothesis test families the dispatcher can run.
 */
public enum TestMethod {
    Z_TEST("z", "Two-proportion z-test"),
    CHI_SQUARE("chi2", "Chi-square test (Yates corrected)"),
    FISHER("fisher", "Fisher exact test"),
    PERMUTATION("permutation", "Monte-Carlo permutation test (Barnard-style approximation)");
    
    private final String id;
    private final String displayName;
    
    TestMethod(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }
    
    public String getId() {
        return id;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Parses a method identifier. {@code z_test} and {@code barnard} are
     * accepted as aliases of {@code z} and {@code permutation}.
     * 
     * @throws StatisticalValidationException of type UNSUPPORTED_METHOD for unknown identifiers
     */
    public static TestMethod fromId(String id) throws StatisticalValidationException {
        if (id != null) {
            String normalized = id.trim().toLowerCase();
            switch (normalized) {
                case "z_test":
                    return Z_TEST;
                case "barnard":
                    return PERMUTATION;
                default:
                    for (TestMethod method : values()) {
                        if (method.id.equals(normalized)) {
                            return method;
                        }
                    }
            }
        }
        throw StatisticalValidationException.unsupportedMethod(id, ids());
    }
    
    public static List<String> ids() {
        List<String> ids = new ArrayList<>();
        for (TestMethod method : values()) {
            ids.add(method.id);
        }
        return ids;
    }
}
