package com.example.syncengine.exception;

import org.springframework.http.HttpStatus;

public class EncryptionException extends SyncEngineException {

    public EncryptionException(String message, Throwable cause) {
        super("ENCRYPTION_ERROR", message, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
