package com.example.syncengine.controller;

import com.example.syncengine.dto.response.TokenStatusResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.token.TokenManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Token status of a connected service. Token values are never returned.
 */
@RestController
@RequestMapping("/integrations")
@RequiredArgsConstructor
public class IntegrationController {

    private final TokenManager tokenManager;

    /**
     * Refreshes proactively when the stored token has expired.
     */
    @GetMapping("/{service}/status")
    public ResponseEntity<TokenStatusResponse> getStatus(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @PathVariable String service) {

        return ResponseEntity.ok(tokenManager.getStatus(userId, ServiceType.fromPath(service)));
    }

    @PostMapping("/{service}/refresh")
    public ResponseEntity<TokenStatusResponse> refresh(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @PathVariable String service) {

        return ResponseEntity.ok(tokenManager.forceRefresh(userId, ServiceType.fromPath(service)));
    }
}
