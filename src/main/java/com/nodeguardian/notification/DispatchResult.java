package com.nodeguardian.notification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Per-channel outcome of one dispatch. A failing channel never prevents delivery to the others,
 * so the overall outcome can be partial.
 */
@Data
@Builder
public class DispatchResult {

    public enum Outcome {
        SUCCESS,
        PARTIAL,
        FAILED,
        NO_CHANNELS
    }

    @Builder.Default
    private List<String> delivered = new ArrayList<>();

    /** channel description -> error message */
    @Builder.Default
    private Map<String, String> failed = new LinkedHashMap<>();

    public Outcome getOutcome() {
        if (delivered.isEmpty() && failed.isEmpty()) {
            return Outcome.NO_CHANNELS;
        }
        if (failed.isEmpty()) {
            return Outcome.SUCCESS;
        }
        return delivered.isEmpty() ? Outcome.FAILED : Outcome.PARTIAL;
    }

    public boolean hasErrors() {
        return !failed.isEmpty();
    }
}
