package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.exception.NotificationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs the rendered alert as JSON to a webhook.
 *
 * <p>The channel's {@code url} wins over {@code notifications.webhook.url}; channel headers are
 * added on top of the configured ones.
 */
@Component
public class WebhookNotifier implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final NotificationConfig notificationConfig;
    private final RestTemplate restTemplate;

    public WebhookNotifier(
            NotificationConfig notificationConfig, @Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.notificationConfig = notificationConfig;
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public void send(ChannelConfig channel, AlertMessage message) {
        String url = channel.getUrl() != null ? channel.getUrl() : notificationConfig.getWebhook().getUrl();
        if (url == null || url.isBlank()) {
            throw new NotificationException("Webhook URL not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        notificationConfig.getWebhook().getHeaders().forEach(headers::set);
        if (channel.getHeaders() != null) {
            channel.getHeaders().forEach(headers::set);
        }

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(payload(message), headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new NotificationException("Webhook " + url + " answered " + response.getStatusCode());
            }
            log.debug("Webhook alert sent to {}", url);
        } catch (RestClientException e) {
            throw new NotificationException("Webhook " + url + " failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> payload(AlertMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", message.getTitle());
        payload.put("summary", message.getSummary());
        payload.put("description", message.getDescription());
        payload.put("severity", message.getSeverity().toValue());
        payload.put("ruleName", message.getRuleName());
        payload.put("triggeredNodes", message.getTriggeredNodes());
        payload.put("alertType", message.getAlertType().toValue());
        payload.put("timestamp", message.getTimestamp().toString());
        return payload;
    }
}
