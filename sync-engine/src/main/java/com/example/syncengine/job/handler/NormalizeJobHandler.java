package com.example.syncengine.job.handler;

import com.example.syncengine.client.provider.ProcessingClient;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.job.InvalidJobPayloadException;
import com.example.syncengine.job.JobContext;
import com.example.syncengine.job.JobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload: {@code {service, batchId, itemIds[]}}.
 */
@Component
@RequiredArgsConstructor
public class NormalizeJobHandler implements JobHandler {

    private final ProcessingClient processingClient;

    @Override
    public Set<JobKind> supportedKinds() {
        return Set.of(JobKind.NORMALIZE);
    }

    @Override
    public Map<String, Object> handle(JobContext context) {
        ServiceType service;
        try {
            service = ServiceType.fromPath(context.requireString("service"));
        } catch (IllegalArgumentException e) {
            throw new InvalidJobPayloadException(context.jobId(), e.getMessage());
        }
        String batchId = context.optionalString("batchId");
        List<String> itemIds = PayloadLists.strings(context, "itemIds");

        int normalized = processingClient.normalize(context.userId(), service,
                batchId != null ? batchId : context.batchId(), itemIds);
        return Map.of("normalized", normalized);
    }
}
