package com.example.syncengine.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
