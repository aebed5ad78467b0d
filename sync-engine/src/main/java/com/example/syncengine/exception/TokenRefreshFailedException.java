package com.example.syncengine.exception;

import com.example.syncengine.error.ClassifiedFailure;
import com.example.syncengine.error.ErrorClassification;
import org.springframework.http.HttpStatus;

/**
 * Token refresh failed for a reason other than a revoked grant. Usually transient.
 */
public class TokenRefreshFailedException extends SyncEngineException implements ClassifiedFailure {

    private final transient ErrorClassification classification;

    public TokenRefreshFailedException(String message, ErrorClassification classification, Throwable cause) {
        super("TOKEN_REFRESH_FAILED", message, HttpStatus.BAD_GATEWAY, cause);
        this.classification = classification;
    }

    @Override
    public ErrorClassification getClassification() {
        return classification;
    }
}
