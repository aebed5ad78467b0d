package com.example.syncengine.session;

import com.example.syncengine.entity.SessionStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Partial update of a sync session. Null fields are left unchanged.
 */
@Getter
@Builder
@ToString
public class SyncProgressUpdate {

    private final SessionStatus status;

    /** Clamped to [0, 100] when applied. */
    private final Double progressPercentage;

    private final String currentStep;

    private final Integer totalItems;
    private final Integer importedItems;
    private final Integer processedItems;
    private final Integer failedItems;
}
