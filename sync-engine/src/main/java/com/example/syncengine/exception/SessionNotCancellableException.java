package com.example.syncengine.exception;

import com.example.syncengine.entity.SessionStatus;
import org.springframework.http.HttpStatus;

import java.util.UUID;

public class SessionNotCancellableException extends SyncEngineException {

    public SessionNotCancellableException(UUID sessionId, SessionStatus status) {
        super("SESSION_NOT_CANCELLABLE",
                "Sync session " + sessionId + " cannot be cancelled in status " + status,
                HttpStatus.CONFLICT);
    }
}
