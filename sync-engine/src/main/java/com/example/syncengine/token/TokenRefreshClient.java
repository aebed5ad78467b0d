package com.example.syncengine.token;

/**
 * Exchanges a refresh token for a new access token at the provider.
 */
public interface TokenRefreshClient {

    /**
     * @return false when client credentials are missing, in which case no refresh can succeed
     */
    boolean isConfigured();

    /**
     * @throws com.example.syncengine.exception.ProviderApiException when the provider rejects the request
     */
    RefreshedTokens refresh(String refreshToken);
}
