package com.example.syncengine.job.handler;

import com.example.syncengine.client.provider.ProviderSyncResult;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.job.JobContext;
import com.example.syncengine.job.JobHandler;
import com.example.syncengine.service.ProviderImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Background provider import. Payload: provider options such as {@code daysBack} and {@code maxResults}.
 * Imported items are queued for normalization under the job's batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderSyncJobHandler implements JobHandler {

    private final ProviderImportService providerImportService;

    @Override
    public Set<JobKind> supportedKinds() {
        return EnumSet.of(JobKind.GMAIL_SYNC, JobKind.CALENDAR_SYNC, JobKind.DRIVE_SYNC);
    }

    @Override
    public Map<String, Object> handle(JobContext context) {
        ServiceType service = serviceFor(context.kind());
        String batchId = context.batchId() != null ? context.batchId() : UUID.randomUUID().toString();

        ProviderSyncResult result = providerImportService.importItems(
                context.userId(), service, batchId, context.payload());
        if (!result.success()) {
            throw result.error();
        }

        List<UUID> normalizeJobs = providerImportService.enqueueNormalization(
                context.userId(), service, batchId, result);
        log.info("Background {} import synced {} item(s), queued {} normalize job(s), batchId={}",
                service.getPathValue(), result.itemsSynced(), normalizeJobs.size(), batchId);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("itemsSynced", result.itemsSynced());
        output.put("normalizeJobs", normalizeJobs.size());
        output.put("batchId", batchId);
        return output;
    }

    private static ServiceType serviceFor(JobKind kind) {
        return switch (kind) {
            case GMAIL_SYNC -> ServiceType.GMAIL;
            case CALENDAR_SYNC -> ServiceType.CALENDAR;
            case DRIVE_SYNC -> ServiceType.DRIVE;
            default -> throw new IllegalArgumentException("Not a provider sync kind: " + kind);
        };
    }
}
