package com.example.syncengine.entity;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    STARTED,
    IMPORTING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<SessionStatus> ACTIVE = EnumSet.of(STARTED, IMPORTING, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
