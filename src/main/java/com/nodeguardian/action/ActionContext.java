package com.nodeguardian.action;

import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.gateway.NodeControlClient;
import com.nodeguardian.notification.AlertDispatcher;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Everything an action needs to run against one node: the rule and node it fires for, whether
 * it is part of a trigger or a recovery batch, and the collaborators it may call.
 *
 * <p>{@code notificationErrors} collects non-fatal delivery failures into the batch result.
 */
public record ActionContext(
        Rule rule,
        String nodeName,
        AlertType alertType,
        Instant timestamp,
        NodeControlClient nodeControl,
        AlertDispatcher alertDispatcher,
        List<String> defaultExcludeNamespaces,
        Consumer<String> notificationErrors) {}
