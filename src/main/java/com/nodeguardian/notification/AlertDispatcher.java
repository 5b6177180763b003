package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.ExternalCallExecutor;
import com.nodeguardian.exception.NotificationException;
import com.nodeguardian.observability.GuardianMetricsService;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders alerts from templates and fans them out to channels.
 *
 * <p>The channel set is the de-duplicated union of the alert action's channels and the
 * template's own channels, falling back to {@code notifications.default-channels} when both are
 * empty. Each channel is sent independently through the {@link ExternalCallExecutor}; a failure
 * is logged, counted and recorded in the {@link DispatchResult} and never stops the other
 * channels or propagates to the caller.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final AlertTemplateRegistry alertTemplateRegistry;
    private final AlertTemplateEngine alertTemplateEngine;
    private final ExternalCallExecutor externalCallExecutor;
    private final NotificationConfig notificationConfig;
    private final GuardianMetricsService guardianMetricsService;
    private final Map<ChannelType, NotificationTransport> transports = new EnumMap<>(ChannelType.class);

    public AlertDispatcher(
            AlertTemplateRegistry alertTemplateRegistry,
            AlertTemplateEngine alertTemplateEngine,
            ExternalCallExecutor externalCallExecutor,
            NotificationConfig notificationConfig,
            GuardianMetricsService guardianMetricsService,
            List<NotificationTransport> transports) {
        this.alertTemplateRegistry = alertTemplateRegistry;
        this.alertTemplateEngine = alertTemplateEngine;
        this.externalCallExecutor = externalCallExecutor;
        this.notificationConfig = notificationConfig;
        this.guardianMetricsService = guardianMetricsService;
        transports.forEach(transport -> this.transports.put(transport.getType(), transport));
    }

    public AlertMessage render(String templateName, Rule rule, List<String> nodes, AlertType alertType, Instant now) {
        AlertTemplate template = alertTemplateRegistry.resolve(templateName, alertType);
        return alertTemplateEngine.render(template, rule, nodes, alertType, now);
    }

    public DispatchResult dispatch(AlertMessage message, List<ChannelConfig> actionChannels) {
        DispatchResult result = DispatchResult.builder().build();

        for (ChannelConfig channel : resolveChannels(actionChannels, message.getTemplateChannels())) {
            if (!channel.isActive()) {
                log.debug("Channel {} disabled, skipping alert {}", channel.describe(), message.getTitle());
                continue;
            }
            String channelName = channel.describe();
            try {
                NotificationTransport transport = transports.get(channel.getType());
                if (transport == null) {
                    throw new NotificationException("No transport for channel type " + channel.getType());
                }
                externalCallExecutor.run(
                        () -> transport.send(channel, message),
                        e -> e instanceof NotificationException ne
                                ? ne
                                : new NotificationException(channelName + " delivery failed: " + e.getMessage(), e));
                result.getDelivered().add(channelName);
            } catch (Exception e) {
                log.error(
                        "Alert '{}' for rule {} not delivered via {}: {}",
                        message.getTitle(),
                        message.getRuleName(),
                        channelName,
                        e.getMessage());
                result.getFailed().put(channelName, e.getMessage());
                guardianMetricsService.recordNotificationFailure(channel.getType());
            }
        }

        log.info(
                "Alert '{}' for rule {} dispatched: {} (delivered={}, failed={})",
                message.getTitle(),
                message.getRuleName(),
                result.getOutcome(),
                result.getDelivered(),
                result.getFailed().keySet());
        return result;
    }

    List<ChannelConfig> resolveChannels(List<ChannelConfig> actionChannels, List<ChannelConfig> templateChannels) {
        Set<ChannelConfig> union = new LinkedHashSet<>();
        if (actionChannels != null) {
            actionChannels.stream().filter(c -> c != null && c.getType() != null).forEach(union::add);
        }
        if (templateChannels != null) {
            templateChannels.stream().filter(c -> c != null && c.getType() != null).forEach(union::add);
        }
        if (union.isEmpty()) {
            notificationConfig.getDefaultChannels().forEach(type -> union.add(ChannelConfig.of(type)));
        }
        return new ArrayList<>(union);
    }
}
