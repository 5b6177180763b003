package com.nodeguardian.rule;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of one snapshot reconciliation of the rule source against the registry. */
@Data
@Builder
public class SyncResult {

    /** False when the source could not be listed; nothing was changed. */
    private boolean sourceAvailable;

    @Builder.Default
    private List<String> added = new ArrayList<>();

    @Builder.Default
    private List<String> modified = new ArrayList<>();

    @Builder.Default
    private List<String> removed = new ArrayList<>();

    @Builder.Default
    private List<String> unchanged = new ArrayList<>();

    /** Document names (or sources) rejected by validation. */
    @Builder.Default
    private List<String> rejected = new ArrayList<>();

    public boolean hasChanges() {
        return !added.isEmpty() || !modified.isEmpty() || !removed.isEmpty();
    }
}
