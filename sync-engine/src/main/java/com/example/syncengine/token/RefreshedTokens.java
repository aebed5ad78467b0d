package com.example.syncengine.token;

import java.time.Instant;

/**
 * Plaintext result of a refresh call. Never persisted or logged as is.
 *
 * @param refreshToken null when the provider kept the existing refresh token
 */
public record RefreshedTokens(String accessToken, String refreshToken, Instant expiryDate) {

    @Override
    public String toString() {
        return "RefreshedTokens[expiryDate=" + expiryDate + "]";
    }
}
