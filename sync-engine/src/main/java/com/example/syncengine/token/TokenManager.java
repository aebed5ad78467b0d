package com.example.syncengine.token;

import com.example.syncengine.cache.CacheKeys;
import com.example.syncengine.cache.QueryCache;
import com.example.syncengine.dto.response.TokenStatusResponse;
import com.example.syncengine.entity.Integration;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.error.ErrorClassification;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.error.ErrorStage;
import com.example.syncengine.error.ErrorTrackingService;
import com.example.syncengine.exception.IntegrationNotFoundException;
import com.example.syncengine.exception.OAuthConfigurationException;
import com.example.syncengine.exception.ProviderApiException;
import com.example.syncengine.exception.ReauthorizationRequiredException;
import com.example.syncengine.exception.TokenRefreshFailedException;
import com.example.syncengine.metrics.SyncMetrics;
import com.example.syncengine.repository.IntegrationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Stores, decrypts and refreshes provider OAuth credentials.
 *
 * CRITICAL DESIGN:
 * - Plaintext tokens exist only in local variables; only ciphertext is persisted
 *   and only token-free snapshots are cached
 * - The refresh call runs outside any transaction
 * - A revoked grant is terminal (re-authorization), never retried
 * - Two concurrent refreshes race on the integration version; the loser reloads
 *   and uses the winner's tokens
 */
@Service
@Slf4j
public class TokenManager {

    public static final String PROVIDER_GOOGLE = "google";

    private final IntegrationRepository integrationRepository;
    private final TokenCipher tokenCipher;
    private final TokenRefreshClient tokenRefreshClient;
    private final ErrorClassifier errorClassifier;
    private final ErrorTrackingService errorTrackingService;
    private final QueryCache queryCache;
    private final SyncMetrics syncMetrics;
    private final Clock clock;
    private final long refreshSkewSeconds;

    public TokenManager(IntegrationRepository integrationRepository,
                        TokenCipher tokenCipher,
                        TokenRefreshClient tokenRefreshClient,
                        ErrorClassifier errorClassifier,
                        ErrorTrackingService errorTrackingService,
                        QueryCache queryCache,
                        SyncMetrics syncMetrics,
                        Clock clock,
                        @Value("${sync.tokens.refresh-skew-seconds:60}") long refreshSkewSeconds) {
        this.integrationRepository = integrationRepository;
        this.tokenCipher = tokenCipher;
        this.tokenRefreshClient = tokenRefreshClient;
        this.errorClassifier = errorClassifier;
        this.errorTrackingService = errorTrackingService;
        this.queryCache = queryCache;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
        this.refreshSkewSeconds = refreshSkewSeconds;
    }

    /**
     * @throws OAuthConfigurationException when the OAuth client credentials are missing
     */
    public void requireOAuthConfigured() {
        if (!tokenRefreshClient.isConfigured()) {
            throw new OAuthConfigurationException(
                    "Google OAuth client is not configured (oauth.google.client-id / client-secret)");
        }
    }

    /**
     * @throws IntegrationNotFoundException when the user never connected the service
     */
    public IntegrationSnapshot requireIntegration(UUID userId, ServiceType service) {
        return queryCache.get(CacheKeys.integration(userId, service),
                () -> IntegrationSnapshot.from(loadIntegration(userId, service)),
                0);
    }

    /**
     * Access token usable right now. Refreshes first when the cached expiry has passed.
     */
    public String getValidAccessToken(UUID userId, ServiceType service) {
        IntegrationSnapshot snapshot = requireIntegration(userId, service);
        if (snapshot.expiresWithin(Instant.now(clock), refreshSkewSeconds)) {
            log.info("Access token expired or expiring for userId={}, service={}, refreshing",
                    userId, service.getPathValue());
            return refresh(userId, service).accessToken();
        }

        Integration integration = loadIntegration(userId, service);
        if (integration.getAccessToken() == null) {
            return refresh(userId, service).accessToken();
        }
        return tokenCipher.decrypt(integration.getAccessToken());
    }

    /**
     * Status check. Proactively refreshes when the stored token is expired.
     */
    public TokenStatusResponse getStatus(UUID userId, ServiceType service) {
        IntegrationSnapshot snapshot = requireIntegration(userId, service);
        Instant now = Instant.now(clock);
        if (!snapshot.expiresWithin(now, refreshSkewSeconds)) {
            return new TokenStatusResponse(service.getPathValue(), true, snapshot.expiryDate(), false, false);
        }

        RefreshedTokens refreshed = refresh(userId, service);
        return new TokenStatusResponse(service.getPathValue(), true, refreshed.expiryDate(), true, true);
    }

    /**
     * Explicit refresh, regardless of the current expiry.
     */
    public TokenStatusResponse forceRefresh(UUID userId, ServiceType service) {
        boolean wasExpired = requireIntegration(userId, service).expiresWithin(Instant.now(clock), 0);
        RefreshedTokens refreshed = refresh(userId, service);
        return new TokenStatusResponse(service.getPathValue(), true, refreshed.expiryDate(), wasExpired, true);
    }

    /**
     * Refresh after the provider rejected the current access token.
     *
     * @return the new plaintext access token
     */
    public String refreshAccessToken(UUID userId, ServiceType service) {
        return refresh(userId, service).accessToken();
    }

    /**
     * Create or replace the stored credentials for a service.
     */
    public IntegrationSnapshot storeTokens(UUID userId, ServiceType service,
                                           String accessToken, String refreshToken, Instant expiryDate) {
        Integration integration = integrationRepository
                .findByUserIdAndProviderAndService(userId, PROVIDER_GOOGLE, service)
                .orElseGet(() -> Integration.builder()
                        .userId(userId)
                        .provider(PROVIDER_GOOGLE)
                        .service(service)
                        .build());
        integration.rotateTokens(tokenCipher.encrypt(accessToken), tokenCipher.encrypt(refreshToken), expiryDate);
        Integration saved = integrationRepository.save(integration);

        IntegrationSnapshot snapshot = IntegrationSnapshot.from(saved);
        queryCache.set(CacheKeys.integration(userId, service), snapshot, 0);
        log.info("✅ Stored credentials for userId={}, service={}, expiresAt={}",
                userId, service.getPathValue(), expiryDate);
        return snapshot;
    }

    /**
     * Refresh the access token and persist the new encrypted triple.
     *
     * @throws ReauthorizationRequiredException when the refresh token is missing or revoked
     * @throws TokenRefreshFailedException      for network and provider outages
     */
    private RefreshedTokens refresh(UUID userId, ServiceType service) {
        requireOAuthConfigured();
        Integration integration = loadIntegration(userId, service);

        if (integration.getRefreshToken() == null) {
            throw reauthorizationRequired(userId, service, "No refresh token stored", null);
        }
        String refreshToken = tokenCipher.decrypt(integration.getRefreshToken());

        RefreshedTokens refreshed;
        try {
            refreshed = tokenRefreshClient.refresh(refreshToken);
        } catch (ProviderApiException e) {
            if (e.isInvalidGrant()) {
                throw reauthorizationRequired(userId, service, e.getMessage(), e);
            }
            throw refreshFailed(userId, service, e);
        } catch (RuntimeException e) {
            throw refreshFailed(userId, service, e);
        }

        try {
            integration.rotateTokens(
                    tokenCipher.encrypt(refreshed.accessToken()),
                    tokenCipher.encrypt(refreshed.refreshToken()),
                    refreshed.expiryDate());
            integration = integrationRepository.save(integration);
        } catch (OptimisticLockingFailureException e) {
            // another request refreshed concurrently; its tokens are just as fresh
            log.info("Concurrent token refresh detected for userId={}, service={}, using stored tokens",
                    userId, service.getPathValue());
            integration = loadIntegration(userId, service);
            refreshed = new RefreshedTokens(
                    tokenCipher.decrypt(integration.getAccessToken()), null, integration.getExpiryDate());
        }

        queryCache.set(CacheKeys.integration(userId, service), IntegrationSnapshot.from(integration), 0);
        syncMetrics.recordTokenRefresh("success");
        log.info("✅ Refreshed access token for userId={}, service={}, expiresAt={}",
                userId, service.getPathValue(), refreshed.expiryDate());
        return refreshed;
    }

    private Integration loadIntegration(UUID userId, ServiceType service) {
        return integrationRepository.findByUserIdAndProviderAndService(userId, PROVIDER_GOOGLE, service)
                .orElseThrow(() -> new IntegrationNotFoundException(userId, service));
    }

    private ReauthorizationRequiredException reauthorizationRequired(UUID userId, ServiceType service,
                                                                     String detail, Throwable cause) {
        ErrorClassification classification = errorClassifier.reauthorizationRequired(detail);
        errorTrackingService.record(userId, service, ErrorStage.TOKEN_REFRESH, classification, null, null);
        syncMetrics.recordTokenRefresh("reauthorization_required");
        log.error("❌ Refresh token rejected for userId={}, service={}: re-authorization required",
                userId, service.getPathValue());
        return new ReauthorizationRequiredException(
                service.getDisplayName() + " authorization was revoked. Please reconnect your account.",
                classification, cause);
    }

    private TokenRefreshFailedException refreshFailed(UUID userId, ServiceType service, RuntimeException e) {
        ErrorClassification classified = errorClassifier.classify(e);
        ErrorClassification classification = classified.category() == ErrorCategory.NETWORK
                ? classified
                : errorClassifier.forCategory(ErrorCategory.SYSTEM, classified.technicalMessage());
        errorTrackingService.record(userId, service, ErrorStage.TOKEN_REFRESH, classification, null, null);
        syncMetrics.recordTokenRefresh("failure");
        log.error("❌ Token refresh failed for userId={}, service={}: category={}, message={}",
                userId, service.getPathValue(), classification.category().getWireName(), e.getMessage());
        return new TokenRefreshFailedException(
                "Failed to refresh " + service.getDisplayName() + " access token", classification, e);
    }
}
