package com.example.syncengine.client.provider;

import com.example.syncengine.entity.ServiceType;

import java.util.Map;
import java.util.UUID;

/**
 * @param accessToken plaintext bearer token, never logged
 * @param options     provider options such as daysBack and maxResults
 */
public record ProviderSyncRequest(
        UUID userId,
        ServiceType service,
        String accessToken,
        String batchId,
        Map<String, Object> options
) {

    public ProviderSyncRequest withAccessToken(String newAccessToken) {
        return new ProviderSyncRequest(userId, service, newAccessToken, batchId, options);
    }

    @Override
    public String toString() {
        return "ProviderSyncRequest[userId=" + userId + ", service=" + service + ", batchId=" + batchId + "]";
    }
}
