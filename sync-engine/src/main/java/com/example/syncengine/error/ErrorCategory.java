package com.example.syncengine.error;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCategory {
    AUTH("auth"),
    RATE_LIMIT("rate_limit"),
    NETWORK("network"),
    PERMISSION("permission"),
    VALIDATION("validation"),
    SYSTEM("system"),
    UNKNOWN("unknown");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
