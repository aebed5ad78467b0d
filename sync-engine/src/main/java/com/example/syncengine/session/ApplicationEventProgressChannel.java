package com.example.syncengine.session;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes progress as Spring application events. Listeners run synchronously
 * on the publishing thread, so events are applied in the order they were sent.
 */
@Component
@RequiredArgsConstructor
public class ApplicationEventProgressChannel implements ProgressChannel {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(SyncProgressEvent event) {
        eventPublisher.publishEvent(event);
    }
}
