package com.nodeguardian.gateway;

import com.nodeguardian.domain.model.NodeSelectorSpec;
import java.util.List;

/** Resolves a rule's node selector to the names of the nodes it currently matches. */
public interface NodeSelectorClient {

    List<String> resolve(NodeSelectorSpec selector);
}
