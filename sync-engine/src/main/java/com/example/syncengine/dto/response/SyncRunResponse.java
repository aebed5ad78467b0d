package com.example.syncengine.dto.response;

import com.example.syncengine.entity.SessionStatus;

import java.util.UUID;

public record SyncRunResponse(
        UUID sessionId,
        SessionStatus status,
        String message,
        Stats stats
) {

    public record Stats(int syncedItems, int processedJobs, int failedJobs, String batchId) {
    }
}
