package com.example.syncengine.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionProgressListener {

    private final SyncSessionTracker sessionTracker;

    /**
     * Apply a progress event. A conflicting write (usually a cancellation) is
     * retried once against the fresh row, where the terminal guard decides.
     */
    @EventListener
    public void onProgress(SyncProgressEvent event) {
        try {
            sessionTracker.updateProgress(event.sessionId(), event.update());
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Concurrent change on sessionId={}, re-applying progress", event.sessionId());
            sessionTracker.updateProgress(event.sessionId(), event.update());
        }
    }
}
