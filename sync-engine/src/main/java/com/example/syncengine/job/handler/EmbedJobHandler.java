package com.example.syncengine.job.handler;

import com.example.syncengine.client.provider.ProcessingClient;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.job.InvalidJobPayloadException;
import com.example.syncengine.job.JobContext;
import com.example.syncengine.job.JobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload: {@code {recordIds[]}}, at least one id.
 */
@Component
@RequiredArgsConstructor
public class EmbedJobHandler implements JobHandler {

    private final ProcessingClient processingClient;

    @Override
    public Set<JobKind> supportedKinds() {
        return Set.of(JobKind.EMBED);
    }

    @Override
    public Map<String, Object> handle(JobContext context) {
        List<String> recordIds = PayloadLists.strings(context, "recordIds");
        if (recordIds.isEmpty()) {
            throw new InvalidJobPayloadException(context.jobId(), "recordIds must not be empty");
        }
        int embedded = processingClient.embed(context.userId(), recordIds);
        return Map.of("embedded", embedded);
    }
}
