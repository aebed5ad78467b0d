package com.example.syncengine.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map to a specific HTTP status.
 */
@Getter
public abstract class SyncEngineException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected SyncEngineException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected SyncEngineException(String code, String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
