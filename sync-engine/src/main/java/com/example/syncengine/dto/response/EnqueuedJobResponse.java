package com.example.syncengine.dto.response;

import java.util.UUID;

public record EnqueuedJobResponse(UUID jobId, String batchId) {
}
