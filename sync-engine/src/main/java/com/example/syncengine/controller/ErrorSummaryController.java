package com.example.syncengine.controller;

import com.example.syncengine.dto.response.ErrorSummaryResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.error.ErrorSeverity;
import com.example.syncengine.error.ErrorStage;
import com.example.syncengine.error.ErrorSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/errors")
@RequiredArgsConstructor
public class ErrorSummaryController {

    private final ErrorSummaryService errorSummaryService;

    /**
     * Error summary over the last {@code timeRangeHours} hours (1 to 168).
     */
    @GetMapping("/summary")
    public ResponseEntity<ErrorSummaryResponse> getSummary(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @RequestParam(defaultValue = "" + ErrorSummaryService.DEFAULT_TIME_RANGE_HOURS) int timeRangeHours,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String stage,
            @RequestParam(required = false) String severity) {

        String servicePath = service == null ? null : ServiceType.fromPath(service).getPathValue();
        ErrorStage errorStage = stage == null ? null : ErrorStage.valueOf(stage.toUpperCase(Locale.ROOT));
        ErrorSeverity errorSeverity = severity == null ? null : ErrorSeverity.valueOf(severity.toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(errorSummaryService.getErrorSummary(
                userId, timeRangeHours, servicePath, errorStage, errorSeverity));
    }
}
