package com.example.syncengine.client.provider;

import com.example.syncengine.entity.ServiceType;

import java.util.List;
import java.util.UUID;

/**
 * Downstream processing of imported raw items.
 */
public interface ProcessingClient {

    /**
     * Normalize raw items of a batch into domain records.
     *
     * @param itemIds items to normalize; empty means every item of the batch
     * @return number of items normalized
     */
    int normalize(UUID userId, ServiceType service, String batchId, List<String> itemIds);

    /**
     * Compute embeddings for normalized records.
     *
     * @return number of records embedded
     */
    int embed(UUID userId, List<String> recordIds);
}
