package com.nodeguardian.engine;

import com.nodeguardian.domain.model.Condition;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Continuous-satisfaction clocks for conditions.
 *
 * <p>The clock map belongs to one (rule, node) pair and one side (trigger or recovery); keys
 * are condition indexes. A matching observation starts the clock if it is not running. A
 * non-matching observation, or a missing value (metric unavailable), clears it, so any gap in
 * satisfaction restarts the window. The caller holds the per-key lock of the map's owner.
 */
@Component
public class DurationTracker {

    private static final Logger log = LoggerFactory.getLogger(DurationTracker.class);

    /**
     * Records one observation and returns whether the condition is duration-satisfied.
     *
     * @param currentValue metric value, or null when it could not be fetched
     */
    public boolean track(
            Map<Integer, Instant> clocks, int index, Condition condition, BigDecimal currentValue, Instant now) {
        if (currentValue == null || !condition.matches(currentValue)) {
            if (clocks.remove(index) != null) {
                log.debug("Duration clock reset for condition #{} ({})", index, condition.describe());
            }
            return false;
        }

        Instant firstObservedAt = clocks.computeIfAbsent(index, i -> now);
        Duration required = condition.getDuration() != null ? condition.getDuration() : Duration.ZERO;
        Duration held = Duration.between(firstObservedAt, now);
        return held.compareTo(required) >= 0;
    }
}
