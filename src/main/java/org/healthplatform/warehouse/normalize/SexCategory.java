package org.healthplatform.warehouse.normalize;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Sex dimension of an observation. Each category lists every source token known to encode it:
 * the CSV export uses display labels, the OData export uses coded values.
 * New tokens seen upstream must be added here explicitly.
 */
public enum SexCategory {
    BOTH("both", "Both sexes", "SEX_BTSX"),
    MALE("male", "Male", "SEX_MLE"),
    FEMALE("female", "Female", "SEX_FMLE");

    private final String label;
    private final Set<String> sourceTokens;

    SexCategory(String label, String... sourceTokens) {
        this.label = label;
        this.sourceTokens = Set.of(sourceTokens);
    }

    /**
     * Value stored in the warehouse {@code sex} column.
     */
    public String getLabel() {
        return label;
    }

    public Set<String> getSourceTokens() {
        return sourceTokens;
    }

    public boolean matches(String token) {
        return token != null && sourceTokens.contains(token);
    }

    public static Optional<SexCategory> fromToken(String token) {
        return Arrays.stream(values()).filter(c -> c.matches(token)).findFirst();
    }
}
