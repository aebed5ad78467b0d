package com.example.syncengine.dto.response;

import java.time.Instant;

/**
 * @param expired   true when the stored token had expired at the time of the call
 * @param refreshed true when this call refreshed the access token
 */
public record TokenStatusResponse(
        String service,
        boolean connected,
        Instant expiresAt,
        boolean expired,
        boolean refreshed
) {
}
