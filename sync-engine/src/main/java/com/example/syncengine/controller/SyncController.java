package com.example.syncengine.controller;

import com.example.syncengine.dto.request.SyncRunRequest;
import com.example.syncengine.dto.response.EnqueuedJobResponse;
import com.example.syncengine.dto.response.SessionProgressResponse;
import com.example.syncengine.dto.response.SyncRunResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.service.BlockingSyncService;
import com.example.syncengine.session.SyncSessionTracker;
import com.example.syncengine.token.TokenManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Blocking sync and session polling.
 *
 * The caller is identified by the X-User-Id header set by the gateway.
 * Sessions of other users answer 404.
 */
@RestController
@RequestMapping("/sync")
@RequiredArgsConstructor
public class SyncController {

    static final String USER_HEADER = "X-User-Id";

    private final BlockingSyncService blockingSyncService;
    private final SyncSessionTracker sessionTracker;
    private final JobQueueService jobQueueService;
    private final TokenManager tokenManager;

    /**
     * Import and normalize inline. Returns once the session is finished.
     */
    @PostMapping("/{service}/run")
    public ResponseEntity<SyncRunResponse> runSync(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable String service,
            @Valid @RequestBody(required = false) SyncRunRequest request) {

        return ResponseEntity.ok(blockingSyncService.runBlockingSync(userId, ServiceType.fromPath(service), request));
    }

    /**
     * Queue a background import instead of running it inline.
     */
    @PostMapping("/{service}/enqueue")
    public ResponseEntity<EnqueuedJobResponse> enqueueSync(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable String service,
            @Valid @RequestBody(required = false) SyncRunRequest request) {

        ServiceType serviceType = ServiceType.fromPath(service);
        tokenManager.requireIntegration(userId, serviceType);
        Map<String, Object> options = request == null ? Map.of() : request.toProviderOptions();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(jobQueueService.enqueueProviderSync(userId, serviceType, options));
    }

    @GetMapping("/progress/{sessionId}")
    public ResponseEntity<SessionProgressResponse> getProgress(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID sessionId) {

        return ResponseEntity.ok(sessionTracker.getProgressData(sessionId, userId));
    }

    /**
     * Cancel an active session. 409 when it already finished.
     */
    @DeleteMapping("/progress/{sessionId}")
    public ResponseEntity<SessionProgressResponse> cancelSession(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID sessionId) {

        return ResponseEntity.ok(sessionTracker.cancelSession(sessionId, userId));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionProgressResponse>> listSessions(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "20") int limit) {

        ServiceType serviceType = service == null ? null : ServiceType.fromPath(service);
        SessionStatus sessionStatus = status == null ? null : SessionStatus.valueOf(status.toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(sessionTracker.listSessions(userId, serviceType, sessionStatus, limit));
    }

    @GetMapping("/sessions/active")
    public ResponseEntity<List<SessionProgressResponse>> getActiveSessions(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(sessionTracker.getActiveSessions(userId));
    }

    /**
     * Most recent session for a service, or 204 when there is none.
     */
    @GetMapping("/{service}/latest")
    public ResponseEntity<SessionProgressResponse> getLatestSession(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable String service) {

        return sessionTracker.getLatestSession(userId, ServiceType.fromPath(service))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
