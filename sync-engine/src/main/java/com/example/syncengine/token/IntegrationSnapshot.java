package com.example.syncengine.token;

import com.example.syncengine.entity.Integration;
import com.example.syncengine.entity.ServiceType;

import java.time.Instant;
import java.util.UUID;

/**
 * Token-free view of an integration, safe to cache.
 */
public record IntegrationSnapshot(
        UUID userId,
        ServiceType service,
        boolean hasRefreshToken,
        Instant expiryDate
) {

    public static IntegrationSnapshot from(Integration integration) {
        return new IntegrationSnapshot(
                integration.getUserId(),
                integration.getService(),
                integration.getRefreshToken() != null,
                integration.getExpiryDate());
    }

    public boolean expiresWithin(Instant now, long skewSeconds) {
        return expiryDate == null || !now.plusSeconds(skewSeconds).isBefore(expiryDate);
    }
}
