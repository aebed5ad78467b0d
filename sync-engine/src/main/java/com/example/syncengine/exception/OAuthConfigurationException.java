package com.example.syncengine.exception;

import org.springframework.http.HttpStatus;

/**
 * OAuth client credentials are missing. Fatal for every sync and refresh.
 */
public class OAuthConfigurationException extends SyncEngineException {

    public OAuthConfigurationException(String message) {
        super("OAUTH_NOT_CONFIGURED", message, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
