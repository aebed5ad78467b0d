package com.example.syncengine.exception;

import org.springframework.http.HttpStatus;

public class InvalidProgressUpdateException extends SyncEngineException {

    public InvalidProgressUpdateException(String message) {
        super("INVALID_PROGRESS_UPDATE", message, HttpStatus.BAD_REQUEST);
    }
}
