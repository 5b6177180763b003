package com.nodeguardian.rule;

import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import java.util.List;

/**
 * External store of rule documents. {@link RuleSyncService} lists it as a full snapshot at
 * startup and on every resync.
 */
public interface RuleSource {

    /**
     * @throws RuntimeException when the store cannot be listed; the caller then keeps the
     *     current registry untouched
     */
    List<SourcedDocument> listDocuments();

    String describe();
}
