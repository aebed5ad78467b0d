package com.example.syncengine.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecoveryAction {
    REFRESH_TOKEN,
    REAUTHENTICATE,
    EXPONENTIAL_BACKOFF,
    REDUCE_FREQUENCY,
    RETRY_NOW,
    CHECK_CONNECTIVITY,
    REVIEW_PERMISSIONS,
    REAUTHORIZE,
    CHECK_DATA_FORMAT,
    UPDATE_SETTINGS,
    RETRY_LATER,
    CONTACT_SUPPORT,
    RETRY,
    REVIEW_LOGS;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
