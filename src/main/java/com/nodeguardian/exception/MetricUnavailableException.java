package com.nodeguardian.exception;

import com.nodeguardian.domain.enums.MetricKind;
import java.util.Map;
import lombok.Getter;

@Getter
public class MetricUnavailableException extends BaseException {

    /** Why the value is missing, without the node and metric prefix of the message. */
    private final String reason;

    public MetricUnavailableException(String nodeName, MetricKind metric, String reason) {
        super(
                ErrorCode.METRIC_UNAVAILABLE,
                String.format("Metric %s unavailable for node %s: %s", metric.getDocumentName(), nodeName, reason),
                Map.of("node", nodeName, "metric", metric.getDocumentName()));
        this.reason = reason;
    }

    public MetricUnavailableException(String nodeName, MetricKind metric, Throwable cause) {
        super(
                ErrorCode.METRIC_UNAVAILABLE,
                String.format(
                        "Metric %s unavailable for node %s: %s", metric.getDocumentName(), nodeName, cause.getMessage()),
                Map.of("node", nodeName, "metric", metric.getDocumentName()),
                cause);
        this.reason = cause.getMessage();
    }
}
