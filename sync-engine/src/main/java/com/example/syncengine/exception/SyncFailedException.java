package com.example.syncengine.exception;

import com.example.syncengine.error.ClassifiedFailure;
import com.example.syncengine.error.ErrorClassification;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * A blocking sync ended in failure. The session has already been finalized as failed.
 */
@Getter
public class SyncFailedException extends SyncEngineException implements ClassifiedFailure {

    private final UUID sessionId;
    private final transient ErrorClassification classification;

    public SyncFailedException(UUID sessionId, String message, ErrorClassification classification, Throwable cause) {
        super("SYNC_FAILED", message, HttpStatus.BAD_GATEWAY, cause);
        this.sessionId = sessionId;
        this.classification = classification;
    }
}
