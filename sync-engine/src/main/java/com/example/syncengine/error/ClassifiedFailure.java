package com.example.syncengine.error;

/**
 * Implemented by exceptions that were already classified where they were raised.
 */
public interface ClassifiedFailure {

    ErrorClassification getClassification();
}
