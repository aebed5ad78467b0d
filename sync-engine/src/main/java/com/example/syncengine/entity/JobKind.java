package com.example.syncengine.entity;

/**
 * Closed set of work types a {@link Job} can carry.
 * Each kind is executed by exactly one handler.
 */
public enum JobKind {
    NORMALIZE,
    EMBED,
    GMAIL_SYNC,
    CALENDAR_SYNC,
    DRIVE_SYNC;

    public static JobKind providerSyncFor(ServiceType service) {
        return switch (service) {
            case GMAIL -> GMAIL_SYNC;
            case CALENDAR -> CALENDAR_SYNC;
            case DRIVE -> DRIVE_SYNC;
        };
    }
}
