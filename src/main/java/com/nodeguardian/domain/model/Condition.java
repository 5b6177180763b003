package com.nodeguardian.domain.model;

import com.nodeguardian.domain.enums.ComparisonOperator;
import com.nodeguardian.domain.enums.MetricKind;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * One threshold check of a rule: {@code metric operator threshold}, which must hold
 * continuously for at least {@code duration} before it counts as satisfied.
 *
 * <p>A zero duration is satisfied on the first matching observation.
 */
@Value
@Builder
public class Condition {

    MetricKind metric;
    ComparisonOperator operator;
    BigDecimal threshold;

    @Builder.Default
    Duration duration = Duration.ZERO;

    String description;

    /** Instantaneous match against the threshold, ignoring duration. */
    public boolean matches(BigDecimal currentValue) {
        return operator.matches(currentValue, threshold);
    }

    public String describe() {
        return metric.getDocumentName() + " " + operator.getDocumentName() + " " + threshold.toPlainString();
    }
}
