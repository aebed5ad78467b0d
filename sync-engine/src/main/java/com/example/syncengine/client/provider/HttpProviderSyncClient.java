package com.example.syncengine.client.provider;

import com.example.syncengine.exception.ProviderApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the provider ingestion gateway.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional
 * - Connection failures are retried with backoff; HTTP errors are not
 * - Circuit breaker protects against a failing gateway
 * - Failures are returned as a failed result carrying a ProviderApiException,
 *   so the caller classifies them once
 */
@Component
@Slf4j
public class HttpProviderSyncClient implements ProviderSyncClient {

    private final WebClient providerWebClient;

    public HttpProviderSyncClient(@Qualifier("providerWebClient") WebClient providerWebClient) {
        this.providerWebClient = providerWebClient;
    }

    @Override
    @Retry(name = "providerSync", fallbackMethod = "syncProviderFallback")
    @CircuitBreaker(name = "providerSync")
    public ProviderSyncResult syncProvider(ProviderSyncRequest request) {
        String operation = request.service().getDisplayName() + " import";
        log.debug("Importing {} for userId={}, batchId={}",
                request.service().getPathValue(), request.userId(), request.batchId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", request.userId());
        body.put("batchId", request.batchId());
        body.put("options", request.options() == null ? Map.of() : request.options());

        ImportResponse response = providerWebClient.post()
                .uri("/v1/{service}/import", request.service().getPathValue())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + request.accessToken())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> ProviderErrors.fromResponse(operation, r))
                .bodyToMono(ImportResponse.class)
                .timeout(Duration.ofSeconds(120))
                .block();

        if (response == null) {
            throw new ProviderApiException(operation + " returned an empty response", null, null);
        }
        log.info("Imported {} item(s) from {} for userId={}",
                response.itemsSynced(), request.service().getPathValue(), request.userId());
        return ProviderSyncResult.succeeded(response.itemsSynced(), response.itemIds());
    }

    /**
     * Fallback for syncProvider: the failure becomes a failed result.
     */
    private ProviderSyncResult syncProviderFallback(ProviderSyncRequest request, Throwable throwable) {
        ProviderApiException error = ProviderErrors.fromThrowable(
                request.service().getDisplayName() + " import", throwable);
        log.warn("⚠️ Provider import failed for userId={}, service={}: {}",
                request.userId(), request.service().getPathValue(), error.getMessage());
        return ProviderSyncResult.failed(error);
    }

    record ImportResponse(int itemsSynced, List<String> itemIds) {
    }
}
