package com.example.syncengine.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where in the pipeline a failure happened.
 */
public enum ErrorStage {
    INGESTION,
    NORMALIZATION,
    PROCESSING,
    TOKEN_REFRESH;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
