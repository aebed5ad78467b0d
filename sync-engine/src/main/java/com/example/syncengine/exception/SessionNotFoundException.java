package com.example.syncengine.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Raised for unknown sessions and for sessions owned by another user.
 * Both cases look the same to the caller.
 */
public class SessionNotFoundException extends SyncEngineException {

    public SessionNotFoundException(UUID sessionId) {
        super("SESSION_NOT_FOUND", "Sync session not found: " + sessionId, HttpStatus.NOT_FOUND);
    }
}
