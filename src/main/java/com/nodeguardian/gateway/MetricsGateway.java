package com.nodeguardian.gateway;

import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.exception.MetricUnavailableException;
import java.math.BigDecimal;

/** Source of live node metrics. */
public interface MetricsGateway {

    /**
     * Current value of {@code metric} on {@code nodeName}.
     *
     * @throws MetricUnavailableException when the backend has no value or cannot be reached
     */
    BigDecimal get(String nodeName, MetricKind metric);
}
