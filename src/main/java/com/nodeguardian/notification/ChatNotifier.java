package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.exception.NotificationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/** Posts alerts to a Slack-compatible incoming webhook. */
@Component
public class ChatNotifier implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(ChatNotifier.class);

    private final NotificationConfig notificationConfig;
    private final RestTemplate restTemplate;

    public ChatNotifier(
            NotificationConfig notificationConfig, @Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.notificationConfig = notificationConfig;
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.CHAT;
    }

    @Override
    public void send(ChannelConfig channel, AlertMessage message) {
        String url = channel.getUrl() != null ? channel.getUrl() : notificationConfig.getChat().getWebhookUrl();
        if (url == null || url.isBlank()) {
            throw new NotificationException("Chat webhook URL not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(payload(message), headers), String.class);
            log.debug("Chat alert sent for rule {}", message.getRuleName());
        } catch (RestClientException e) {
            throw new NotificationException("Chat webhook failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> payload(AlertMessage message) {
        String color =
                switch (message.getSeverity()) {
                    case CRITICAL -> "danger";
                    case WARNING -> "warning";
                    case INFO -> "good";
                };

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color);
        attachment.put("title", message.getTitle());
        attachment.put("text", message.getDescription() != null ? message.getDescription() : message.getSummary());
        attachment.put(
                "fields",
                List.of(
                        Map.of("title", "Rule", "value", message.getRuleName(), "short", true),
                        Map.of("title", "Severity", "value", message.getSeverity().toValue(), "short", true),
                        Map.of("title", "Nodes", "value", String.join(", ", message.getTriggeredNodes()), "short", false)));
        attachment.put("ts", message.getTimestamp().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", message.getSummary());
        payload.put("username", notificationConfig.getChat().getUsername());
        if (notificationConfig.getChat().getChannel() != null) {
            payload.put("channel", notificationConfig.getChat().getChannel());
        }
        payload.put("attachments", List.of(attachment));
        return payload;
    }
}
