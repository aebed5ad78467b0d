package com.example.syncengine.client.oauth;

import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.exception.ProviderApiException;
import com.example.syncengine.token.RefreshedTokens;
import com.example.syncengine.token.TokenRefreshClient;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * OAuth 2.0 refresh-token grant against the Google token endpoint.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional
 * - Provider errors surface as ProviderApiException with the OAuth error code
 *   (invalid_grant, invalid_client, ...) so callers can tell revocation from outages
 * - Circuit breaker stops hammering the token endpoint during an outage
 */
@Component
@Slf4j
public class GoogleTokenRefreshClient implements TokenRefreshClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient oauthWebClient;
    private final Clock clock;
    private final String clientId;
    private final String clientSecret;
    private final String tokenUri;

    public GoogleTokenRefreshClient(@Qualifier("oauthWebClient") WebClient oauthWebClient,
                                    Clock clock,
                                    @Value("${oauth.google.client-id:}") String clientId,
                                    @Value("${oauth.google.client-secret:}") String clientSecret,
                                    @Value("${oauth.google.token-uri:https://oauth2.googleapis.com/token}") String tokenUri) {
        this.oauthWebClient = oauthWebClient;
        this.clock = clock;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUri = tokenUri;
    }

    @Override
    public boolean isConfigured() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    @Override
    @CircuitBreaker(name = "oauthTokenRefresh", fallbackMethod = "refreshFallback")
    public RefreshedTokens refresh(String refreshToken) {
        Map<String, Object> body = oauthWebClient.post()
                .uri(tokenUri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                        .with("client_id", clientId)
                        .with("client_secret", clientSecret)
                        .with("refresh_token", refreshToken))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderError)
                .bodyToMono(JSON_MAP)
                .timeout(Duration.ofSeconds(15))
                .block();

        if (body == null || body.get("access_token") == null) {
            throw new ProviderApiException("Token endpoint returned no access_token", null, null,
                    ErrorCategory.SYSTEM, null);
        }

        long expiresIn = body.get("expires_in") instanceof Number n ? n.longValue() : 3600L;
        Instant expiry = Instant.now(clock).plusSeconds(expiresIn);
        log.debug("Refreshed Google access token, expiresIn={}s", expiresIn);

        return new RefreshedTokens(
                (String) body.get("access_token"),
                (String) body.get("refresh_token"),
                expiry);
    }

    private RefreshedTokens refreshFallback(String refreshToken, CallNotPermittedException e) {
        log.warn("⚠️ Token refresh circuit breaker is OPEN: {}", e.getMessage());
        throw new ProviderApiException("Token endpoint unavailable (circuit open)", 503, "circuit_open",
                ErrorCategory.SYSTEM, e);
    }

    private Mono<? extends Throwable> toProviderError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(JSON_MAP)
                .defaultIfEmpty(Map.of())
                .onErrorReturn(Map.of())
                .map(error -> {
                    String code = error.get("error") instanceof String c ? c : null;
                    String description = error.get("error_description") instanceof String d ? d : null;
                    String message = "Token refresh rejected (" + status + ")"
                            + (code != null ? ": " + code : "")
                            + (description != null ? " - " + description : "");
                    log.warn("Google token endpoint returned status={}, error={}", status, code);
                    return new ProviderApiException(message, status, code);
                });
    }
}
