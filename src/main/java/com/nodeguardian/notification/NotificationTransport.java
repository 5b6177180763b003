package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;

/** Delivers a rendered alert over one kind of channel. */
public interface NotificationTransport {

    ChannelType getType();

    /**
     * @throws com.nodeguardian.exception.NotificationException when delivery fails
     */
    void send(ChannelConfig channel, AlertMessage message);
}
