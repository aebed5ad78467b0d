package com.example.syncengine.service;

import com.example.syncengine.client.provider.ProviderSyncClient;
import com.example.syncengine.client.provider.ProviderSyncRequest;
import com.example.syncengine.client.provider.ProviderSyncResult;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.token.TokenManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Imports raw items from a provider and queues their normalization.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional (network I/O)
 * - An auth-shaped import failure triggers exactly one token refresh and one retry
 * - Token refresh failures propagate; they are already classified
 */
@Service
@Slf4j
public class ProviderImportService {

    private final TokenManager tokenManager;
    private final ProviderSyncClient providerSyncClient;
    private final ErrorClassifier errorClassifier;
    private final JobQueueService jobQueueService;
    private final int normalizeChunkSize;

    public ProviderImportService(TokenManager tokenManager,
                                 ProviderSyncClient providerSyncClient,
                                 ErrorClassifier errorClassifier,
                                 JobQueueService jobQueueService,
                                 @Value("${sync.jobs.normalize-chunk-size:25}") int normalizeChunkSize) {
        this.tokenManager = tokenManager;
        this.providerSyncClient = providerSyncClient;
        this.errorClassifier = errorClassifier;
        this.jobQueueService = jobQueueService;
        this.normalizeChunkSize = Math.max(1, normalizeChunkSize);
    }

    /**
     * Run one provider import for the batch.
     *
     * @return the import result; a failed result carries the provider error
     */
    public ProviderSyncResult importItems(UUID userId, ServiceType service, String batchId,
                                          Map<String, Object> options) {
        String accessToken = tokenManager.getValidAccessToken(userId, service);
        ProviderSyncRequest request = new ProviderSyncRequest(userId, service, accessToken, batchId, options);

        ProviderSyncResult result = providerSyncClient.syncProvider(request);
        if (result.success() || !isAuthFailure(result)) {
            return result;
        }

        log.info("Provider rejected access token for userId={}, service={}, refreshing and retrying once",
                userId, service.getPathValue());
        String refreshed = tokenManager.refreshAccessToken(userId, service);
        return providerSyncClient.syncProvider(request.withAccessToken(refreshed));
    }

    /**
     * Queue normalize jobs for imported items, {@code sync.jobs.normalize-chunk-size} items per job,
     * all under {@code batchId}.
     *
     * @return ids of the queued jobs
     */
    public List<UUID> enqueueNormalization(UUID userId, ServiceType service, String batchId,
                                           ProviderSyncResult imported) {
        if (imported.itemsSynced() <= 0 && imported.itemIds().isEmpty()) {
            return List.of();
        }

        List<Map<String, Object>> payloads = new ArrayList<>();
        List<String> itemIds = imported.itemIds();
        if (itemIds.isEmpty()) {
            // the provider did not list ids: one job normalizes the whole batch
            payloads.add(normalizePayload(service, batchId, List.of()));
        } else {
            for (int from = 0; from < itemIds.size(); from += normalizeChunkSize) {
                int to = Math.min(from + normalizeChunkSize, itemIds.size());
                payloads.add(normalizePayload(service, batchId, itemIds.subList(from, to)));
            }
        }
        return jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE, payloads, batchId);
    }

    private boolean isAuthFailure(ProviderSyncResult result) {
        return result.error() != null
                && errorClassifier.classify(result.error()).category() == ErrorCategory.AUTH;
    }

    private static Map<String, Object> normalizePayload(ServiceType service, String batchId, List<String> itemIds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", service.getPathValue());
        payload.put("batchId", batchId);
        payload.put("itemIds", new ArrayList<>(itemIds));
        return payload;
    }
}
