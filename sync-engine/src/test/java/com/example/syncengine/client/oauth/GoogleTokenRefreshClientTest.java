package com.example.syncengine.client.oauth;

import com.example.syncengine.exception.ProviderApiException;
import com.example.syncengine.support.MutableClock;
import com.example.syncengine.token.RefreshedTokens;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleTokenRefreshClientTest {

    private static final String TOKEN_URI = "https://oauth.test/token";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void successfulRefresh_computesExpiryFromExpiresIn() {
        GoogleTokenRefreshClient client = clientReturning(HttpStatus.OK,
                "{\"access_token\":\"ya29.new\",\"expires_in\":1800,\"token_type\":\"Bearer\"}");

        RefreshedTokens tokens = client.refresh("1//refresh");

        assertThat(tokens.accessToken()).isEqualTo("ya29.new");
        assertThat(tokens.refreshToken()).isNull();
        assertThat(tokens.expiryDate()).isEqualTo(clock.instant().plusSeconds(1800));
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().toString()).isEqualTo(TOKEN_URI);
        assertThat(tokens.toString()).doesNotContain("ya29");
    }

    @Test
    void rotatedRefreshToken_isReturned() {
        GoogleTokenRefreshClient client = clientReturning(HttpStatus.OK,
                "{\"access_token\":\"ya29.new\",\"refresh_token\":\"1//rotated\"}");

        RefreshedTokens tokens = client.refresh("1//refresh");

        assertThat(tokens.refreshToken()).isEqualTo("1//rotated");
        assertThat(tokens.expiryDate()).isEqualTo(clock.instant().plusSeconds(3600));
    }

    @Test
    void revokedGrant_surfacesOAuthErrorCode() {
        GoogleTokenRefreshClient client = clientReturning(HttpStatus.BAD_REQUEST,
                "{\"error\":\"invalid_grant\",\"error_description\":\"Token has been expired or revoked.\"}");

        assertThatThrownBy(() -> client.refresh("1//revoked"))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(400);
                    assertThat(e.getErrorCode()).isEqualTo("invalid_grant");
                    assertThat(e.isInvalidGrant()).isTrue();
                });
    }

    @Test
    void serverError_withoutJsonBody_keepsStatus() {
        GoogleTokenRefreshClient client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE, "");

        assertThatThrownBy(() -> client.refresh("1//refresh"))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(503);
                    assertThat(e.isInvalidGrant()).isFalse();
                });
    }

    @Test
    void missingClientCredentials_isNotConfigured() {
        GoogleTokenRefreshClient client = new GoogleTokenRefreshClient(WebClient.create(), clock, "", "", TOKEN_URI);

        assertThat(client.isConfigured()).isFalse();
    }

    private GoogleTokenRefreshClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new GoogleTokenRefreshClient(webClient, clock, "client-id", "client-secret", TOKEN_URI);
    }
}
