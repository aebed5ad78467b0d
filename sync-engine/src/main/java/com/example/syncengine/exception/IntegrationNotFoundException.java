package com.example.syncengine.exception;

import com.example.syncengine.entity.ServiceType;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * No stored credentials for the requested service. Not retryable.
 */
public class IntegrationNotFoundException extends SyncEngineException {

    public IntegrationNotFoundException(UUID userId, ServiceType service) {
        super("INTEGRATION_NOT_FOUND",
                service.getDisplayName() + " access not approved for user " + userId
                        + ". Please connect the " + service.getDisplayName() + " integration first.",
                HttpStatus.BAD_REQUEST);
    }
}
