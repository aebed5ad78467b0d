package com.example.syncengine.client.provider;

/**
 * Imports raw provider data (mail, calendar events, files) for one user into a batch.
 */
public interface ProviderSyncClient {

    /**
     * Never throws for provider-side failures; they are reported through
     * {@link ProviderSyncResult#error()}.
     */
    ProviderSyncResult syncProvider(ProviderSyncRequest request);
}
