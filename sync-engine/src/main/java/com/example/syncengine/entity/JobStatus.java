package com.example.syncengine.entity;

/**
 * Job lifecycle.
 * QUEUED -> PROCESSING, then PROCESSING -> DONE | QUEUED (retry) | ERROR.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    DONE,
    ERROR
}
