package com.example.syncengine.client.provider;

import com.example.syncengine.entity.ServiceType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Client for the processing endpoints of the ingestion gateway.
 * Failures are thrown; the job runner decides whether to retry.
 */
@Component
@Slf4j
public class HttpProcessingClient implements ProcessingClient {

    private final WebClient providerWebClient;

    public HttpProcessingClient(@Qualifier("providerWebClient") WebClient providerWebClient) {
        this.providerWebClient = providerWebClient;
    }

    @Override
    @CircuitBreaker(name = "processing", fallbackMethod = "normalizeFallback")
    public int normalize(UUID userId, ServiceType service, String batchId, List<String> itemIds) {
        ProcessedResponse response = post("Normalization", "/v1/{service}/normalize", service.getPathValue(),
                Map.of("userId", userId, "batchId", batchId, "itemIds", itemIds == null ? List.of() : itemIds));
        log.debug("Normalized {} item(s) of batchId={}", response.processed(), batchId);
        return response.processed();
    }

    @Override
    @CircuitBreaker(name = "processing", fallbackMethod = "embedFallback")
    public int embed(UUID userId, List<String> recordIds) {
        ProcessedResponse response = post("Embedding", "/v1/{service}/embed", "records",
                Map.of("userId", userId, "recordIds", recordIds == null ? List.of() : recordIds));
        log.debug("Embedded {} record(s) for userId={}", response.processed(), userId);
        return response.processed();
    }

    private ProcessedResponse post(String operation, String uri, String pathValue, Map<String, Object> body) {
        try {
            ProcessedResponse response = providerWebClient.post()
                    .uri(uri, pathValue)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, r -> ProviderErrors.fromResponse(operation, r))
                    .bodyToMono(ProcessedResponse.class)
                    .timeout(Duration.ofSeconds(60))
                    .block();
            return response == null ? new ProcessedResponse(0) : response;
        } catch (RuntimeException e) {
            throw ProviderErrors.fromThrowable(operation, e);
        }
    }

    private int normalizeFallback(UUID userId, ServiceType service, String batchId, List<String> itemIds,
                                  CallNotPermittedException e) {
        throw ProviderErrors.fromThrowable("Normalization", e);
    }

    private int embedFallback(UUID userId, List<String> recordIds, CallNotPermittedException e) {
        throw ProviderErrors.fromThrowable("Embedding", e);
    }

    record ProcessedResponse(int processed) {
    }
}
