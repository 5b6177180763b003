package com.nodeguardian.action;

import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.exception.ErrorCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one action batch against one node.
 *
 * <p>Batches are best-effort: every action is attempted and failures are collected here rather
 * than aborting the batch. Channels an alert could not reach while others succeeded are kept in
 * {@link #notificationErrors}; they do not fail the alert action but are still reported.
 */
@Data
@Builder
public class BatchResult {

    private String ruleId;
    private String nodeName;
    private AlertType kind;
    private Instant executedAt;

    @Builder.Default
    private List<String> succeeded = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /** "channel: error" of channels that failed while the alert reached at least one other. */
    @Builder.Default
    private List<String> notificationErrors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    /** Null when the batch had no errors, otherwise a one-line summary for status publishing. */
    public String errorSummary() {
        if (!hasErrors()) {
            return null;
        }
        return errors.size() + " of " + (errors.size() + succeeded.size()) + " actions failed: "
                + String.join("; ", errors);
    }

    public boolean hasNotificationErrors() {
        return notificationErrors != null && !notificationErrors.isEmpty();
    }

    /**
     * Error to record on the node state: the action failures and the undelivered notifications,
     * each prefixed with its error code. Null when the batch was clean.
     */
    public String statusError() {
        List<String> parts = new ArrayList<>();
        if (hasErrors()) {
            parts.add(ErrorCode.ACTION_EXECUTION_ERROR.getCode() + ": " + errorSummary());
        }
        if (hasNotificationErrors()) {
            parts.add(ErrorCode.NOTIFICATION_ERROR.getCode() + ": " + String.join("; ", notificationErrors));
        }
        return parts.isEmpty() ? null : String.join(" | ", parts);
    }
}
