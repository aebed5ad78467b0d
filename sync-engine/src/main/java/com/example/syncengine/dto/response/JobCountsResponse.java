package com.example.syncengine.dto.response;

import java.util.Map;

public record JobCountsResponse(
        String batchId,
        long total,
        long queued,
        long processing,
        long done,
        long error,
        Map<String, Long> byKind
) {
}
