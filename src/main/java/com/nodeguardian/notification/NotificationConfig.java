package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Global channel settings under the {@code notifications} prefix.
 *
 * <p>Per-channel entries in alert actions and templates may override {@code url}, {@code headers}
 * and {@code to}; these values are the fallback. {@code defaultChannels} is used when neither the
 * action nor the template names any channel.
 */
@Configuration
@ConfigurationProperties(prefix = "notifications")
@Getter
@Setter
public class NotificationConfig {

    private List<ChannelType> defaultChannels = new ArrayList<>(List.of(ChannelType.LOG));

    private Webhook webhook = new Webhook();
    private Chat chat = new Chat();
    private Email email = new Email();

    @Bean("notificationRestTemplate")
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder) {
        return builder.setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Getter
    @Setter
    public static class Webhook {
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Chat {
        /** Slack-compatible incoming webhook URL. */
        private String webhookUrl;

        private String username = "NodeGuardian";
        private String channel;
    }

    @Getter
    @Setter
    public static class Email {
        private boolean enabled = false;
        private String from = "nodeguardian@localhost";
        private List<String> to = new ArrayList<>();
    }
}
