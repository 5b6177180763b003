package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.AlertSeverity;
import com.nodeguardian.domain.enums.AlertType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A rendered alert, ready for any channel.
 *
 * <p>{@code templateChannels} are the channels the template itself declares; the dispatcher
 * merges them with the channels of the alert action.
 */
@Data
@Builder
public class AlertMessage {

    private String title;
    private String summary;
    private String description;
    private AlertSeverity severity;
    private String ruleName;

    @Builder.Default
    private List<String> triggeredNodes = new ArrayList<>();

    private Instant timestamp;
    private AlertType alertType;
    private String templateName;

    @Builder.Default
    private List<ChannelConfig> templateChannels = new ArrayList<>();
}
