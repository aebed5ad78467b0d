package com.example.syncengine.controller;

import com.example.syncengine.dto.response.EnqueuedJobResponse;
import com.example.syncengine.dto.response.SessionProgressResponse;
import com.example.syncengine.dto.response.SyncRunResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.exception.IntegrationNotFoundException;
import com.example.syncengine.exception.SessionNotCancellableException;
import com.example.syncengine.exception.SessionNotFoundException;
import com.example.syncengine.exception.SyncFailedException;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.service.BlockingSyncService;
import com.example.syncengine.session.SyncSessionTracker;
import com.example.syncengine.token.TokenManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyncController.class)
class SyncControllerTest {

    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID SESSION_ID = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BlockingSyncService blockingSyncService;
    @MockBean
    private SyncSessionTracker sessionTracker;
    @MockBean
    private JobQueueService jobQueueService;
    @MockBean
    private TokenManager tokenManager;

    @Test
    void runSync_returnsSummary() throws Exception {
        when(blockingSyncService.runBlockingSync(eq(USER_ID), eq(ServiceType.GMAIL), any()))
                .thenReturn(new SyncRunResponse(SESSION_ID, SessionStatus.COMPLETED,
                        "Successfully synced 3 emails and processed 1 normalizations",
                        new SyncRunResponse.Stats(3, 1, 0, "batch-1")));

        mockMvc.perform(post("/sync/gmail/run")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"daysBack\":7}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-ID"))
                .andExpect(jsonPath("$.sessionId").value(SESSION_ID.toString()))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.stats.syncedItems").value(3));
    }

    @Test
    void runSync_withoutUserHeader_isBadRequest() throws Exception {
        mockMvc.perform(post("/sync/gmail/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MISSING_HEADER"));
        verify(blockingSyncService, never()).runBlockingSync(any(), any(), any());
    }

    @Test
    void runSync_unknownService_isBadRequest() throws Exception {
        mockMvc.perform(post("/sync/dropbox/run").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Unsupported service: dropbox"));
    }

    @Test
    void runSync_invalidBody_isValidationError() throws Exception {
        mockMvc.perform(post("/sync/gmail/run")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"daysBack\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.field").value("daysBack"));
    }

    @Test
    void runSync_missingIntegration_isBadRequest() throws Exception {
        when(blockingSyncService.runBlockingSync(eq(USER_ID), eq(ServiceType.DRIVE), any()))
                .thenThrow(new IntegrationNotFoundException(USER_ID, ServiceType.DRIVE));

        mockMvc.perform(post("/sync/file-store/run").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INTEGRATION_NOT_FOUND"));
    }

    @Test
    void runSync_failure_carriesClassification() throws Exception {
        when(blockingSyncService.runBlockingSync(eq(USER_ID), eq(ServiceType.GMAIL), any()))
                .thenThrow(new SyncFailedException(SESSION_ID, "Gmail sync failed: Provider API limits have been reached",
                        new ErrorClassifier().classify("rate limited", 429, null), null));

        mockMvc.perform(post("/sync/gmail/run").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value("SYNC_FAILED"))
                .andExpect(jsonPath("$.error.details.sessionId").value(SESSION_ID.toString()))
                .andExpect(jsonPath("$.error.details.category").value("rate_limit"))
                .andExpect(jsonPath("$.error.details.retryable").value(true));
    }

    @Test
    void getProgress_returnsSession() throws Exception {
        when(sessionTracker.getProgressData(SESSION_ID, USER_ID)).thenReturn(SessionProgressResponse.builder()
                .sessionId(SESSION_ID)
                .service("calendar")
                .status(SessionStatus.IMPORTING)
                .progressPercentage(25)
                .currentStep("Discovering new events...")
                .startedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .estimate(new SessionProgressResponse.TimeEstimate(30_000, 120_000, 90_000))
                .build());

        mockMvc.perform(get("/sync/progress/{id}", SESSION_ID).header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IMPORTING"))
                .andExpect(jsonPath("$.progressPercentage").value(25.0))
                .andExpect(jsonPath("$.estimate.remainingMs").value(90_000))
                .andExpect(jsonPath("$.completedAt").doesNotExist());
    }

    @Test
    void getProgress_unknownOrForeignSession_isNotFound() throws Exception {
        when(sessionTracker.getProgressData(SESSION_ID, USER_ID)).thenThrow(new SessionNotFoundException(SESSION_ID));

        mockMvc.perform(get("/sync/progress/{id}", SESSION_ID).header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void cancel_finishedSession_isConflict() throws Exception {
        when(sessionTracker.cancelSession(SESSION_ID, USER_ID))
                .thenThrow(new SessionNotCancellableException(SESSION_ID, SessionStatus.COMPLETED));

        mockMvc.perform(delete("/sync/progress/{id}", SESSION_ID).header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("SESSION_NOT_CANCELLABLE"));
    }

    @Test
    void cancel_activeSession_returnsCancelledSession() throws Exception {
        when(sessionTracker.cancelSession(SESSION_ID, USER_ID)).thenReturn(SessionProgressResponse.builder()
                .sessionId(SESSION_ID)
                .service("gmail")
                .status(SessionStatus.CANCELLED)
                .currentStep("Sync cancelled by user")
                .completedAt(Instant.parse("2026-03-01T10:01:00Z"))
                .build());

        mockMvc.perform(delete("/sync/progress/{id}", SESSION_ID).header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void malformedSessionId_isBadRequest() throws Exception {
        mockMvc.perform(get("/sync/progress/not-a-uuid").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void enqueue_isAccepted() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobQueueService.enqueueProviderSync(eq(USER_ID), eq(ServiceType.CALENDAR), any()))
                .thenReturn(new EnqueuedJobResponse(jobId, "batch-9"));

        mockMvc.perform(post("/sync/calendar/enqueue")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxResults\":50}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.batchId").value("batch-9"));
        verify(tokenManager).requireIntegration(USER_ID, ServiceType.CALENDAR);
        verify(jobQueueService).enqueueProviderSync(USER_ID, ServiceType.CALENDAR, Map.of("maxResults", 50));
    }

    @Test
    void latest_withoutSessions_isNoContent() throws Exception {
        when(sessionTracker.getLatestSession(USER_ID, ServiceType.GMAIL)).thenReturn(Optional.empty());

        mockMvc.perform(get("/sync/mail/latest").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNoContent());
    }
}
