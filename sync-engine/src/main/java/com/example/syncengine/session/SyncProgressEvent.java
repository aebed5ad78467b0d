package com.example.syncengine.session;

import java.util.UUID;

/**
 * Progress reported by a running sync, applied to its session by {@link SessionProgressListener}.
 */
public record SyncProgressEvent(UUID sessionId, SyncProgressUpdate update) {
}
