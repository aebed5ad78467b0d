package com.example.syncengine.exception;

import com.example.syncengine.error.CategorizedFailure;
import com.example.syncengine.error.ErrorCategory;
import lombok.Getter;

/**
 * Failure reported by a provider-facing client.
 *
 * Carries the HTTP status and provider error code so the classifier can work on
 * structure instead of message text. {@code category} is set when the client
 * already knows what kind of failure it saw.
 */
@Getter
public class ProviderApiException extends RuntimeException implements CategorizedFailure {

    private final Integer status;
    private final String errorCode;
    private final ErrorCategory category;

    public ProviderApiException(String message, Integer status, String errorCode) {
        this(message, status, errorCode, null, null);
    }

    public ProviderApiException(String message, Integer status, String errorCode,
                                ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.category = category;
    }

    public boolean isInvalidGrant() {
        return "invalid_grant".equalsIgnoreCase(errorCode)
                || (getMessage() != null && getMessage().toLowerCase().contains("invalid_grant"));
    }
}
