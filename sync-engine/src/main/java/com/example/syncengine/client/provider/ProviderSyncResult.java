package com.example.syncengine.client.provider;

import com.example.syncengine.exception.ProviderApiException;

import java.util.List;

/**
 * @param itemIds ids of the raw items written under the batch
 * @param error   set only when {@code success} is false
 */
public record ProviderSyncResult(boolean success, int itemsSynced, List<String> itemIds, ProviderApiException error) {

    public ProviderSyncResult {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }

    public static ProviderSyncResult succeeded(int itemsSynced, List<String> itemIds) {
        return new ProviderSyncResult(true, itemsSynced, itemIds, null);
    }

    public static ProviderSyncResult failed(ProviderApiException error) {
        return new ProviderSyncResult(false, 0, List.of(), error);
    }
}
