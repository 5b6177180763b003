package com.nodeguardian.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nodeguardian.domain.enums.ChannelType;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One delivery target of an alert.
 *
 * <p>In documents a channel is either a bare type name ({@code "webhook"}) or an object
 * {@code {type, enabled, url, headers, to}}. Two entries are the same channel when all their
 * fields are equal, which is how the action's and the template's lists are deduplicated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelConfig {

    private ChannelType type;
    private Boolean enabled;
    private String url;
    private Map<String, String> headers;
    private List<String> to;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ChannelConfig of(String type) {
        return ChannelConfig.builder().type(ChannelType.fromValue(type)).build();
    }

    public static ChannelConfig of(ChannelType type) {
        return ChannelConfig.builder().type(type).build();
    }

    @JsonIgnore
    public boolean isActive() {
        return enabled == null || enabled;
    }

    public String describe() {
        return url != null ? type.toValue() + "(" + url + ")" : type.toValue();
    }
}
