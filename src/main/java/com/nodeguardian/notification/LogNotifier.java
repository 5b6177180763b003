package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes alerts to the application log at a level matching their severity. */
@Component
public class LogNotifier implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(LogNotifier.class);

    @Override
    public ChannelType getType() {
        return ChannelType.LOG;
    }

    @Override
    public void send(ChannelConfig channel, AlertMessage message) {
        String line = String.format(
                "[%s] %s | %s | nodes=%s",
                message.getSeverity(), message.getTitle(), message.getSummary(), message.getTriggeredNodes());
        switch (message.getSeverity()) {
            case CRITICAL -> log.error(line);
            case WARNING -> log.warn(line);
            case INFO -> log.info(line);
        }
    }
}
