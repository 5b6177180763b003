package com.nodeguardian.status;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/** Publishes rule status as {@link RuleStatusEvent}s; listeners consume them asynchronously. */
@Component
public class ApplicationEventStatusPublisher implements StatusPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public ApplicationEventStatusPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(RuleStatus status) {
        applicationEventPublisher.publishEvent(new RuleStatusEvent(this, status));
    }
}
