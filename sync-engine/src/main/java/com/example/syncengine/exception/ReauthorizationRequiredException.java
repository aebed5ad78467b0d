package com.example.syncengine.exception;

import com.example.syncengine.error.ClassifiedFailure;
import com.example.syncengine.error.ErrorClassification;
import org.springframework.http.HttpStatus;

/**
 * The provider rejected the stored refresh token. The user has to connect the account again.
 */
public class ReauthorizationRequiredException extends SyncEngineException implements ClassifiedFailure {

    private final transient ErrorClassification classification;

    public ReauthorizationRequiredException(String message, ErrorClassification classification, Throwable cause) {
        super("REAUTHORIZATION_REQUIRED", message, HttpStatus.UNAUTHORIZED, cause);
        this.classification = classification;
    }

    @Override
    public ErrorClassification getClassification() {
        return classification;
    }
}
