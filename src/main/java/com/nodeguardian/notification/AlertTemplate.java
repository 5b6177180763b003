package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.AlertSeverity;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Named alert layout with {@code {{ variable }}} placeholders and its own channel list. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertTemplate {

    private String name;
    private String title;
    private String summary;
    private String description;
    private AlertSeverity severity;

    @Builder.Default
    private List<ChannelConfig> channels = new ArrayList<>();
}
