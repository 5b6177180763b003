package com.nodeguardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Comparison operators for a condition's threshold check.
 *
 * <p>Rule documents spell them in CamelCase ({@code GreaterThan}); the enum constant name is
 * accepted as well. Comparison uses {@link BigDecimal#compareTo} so that {@code 80} and
 * {@code 80.0} are equal.
 */
public enum ComparisonOperator {
    /** Current value > threshold. */
    GREATER_THAN("GreaterThan"),
    /** Current value < threshold. */
    LESS_THAN("LessThan"),
    /** Current value == threshold. */
    EQUAL_TO("EqualTo"),
    /** Current value != threshold. */
    NOT_EQUAL_TO("NotEqualTo"),
    /** Current value >= threshold. */
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqual"),
    /** Current value <= threshold. */
    LESS_THAN_OR_EQUAL("LessThanOrEqual");

    private final String documentName;

    ComparisonOperator(String documentName) {
        this.documentName = documentName;
    }

    @JsonValue
    public String getDocumentName() {
        return documentName;
    }

    public boolean matches(BigDecimal currentValue, BigDecimal threshold) {
        int cmp = currentValue.compareTo(threshold);
        return switch (this) {
            case GREATER_THAN -> cmp > 0;
            case LESS_THAN -> cmp < 0;
            case EQUAL_TO -> cmp == 0;
            case NOT_EQUAL_TO -> cmp != 0;
            case GREATER_THAN_OR_EQUAL -> cmp >= 0;
            case LESS_THAN_OR_EQUAL -> cmp <= 0;
        };
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(op -> op.documentName.equalsIgnoreCase(value) || op.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown comparison operator: " + value));
    }
}
