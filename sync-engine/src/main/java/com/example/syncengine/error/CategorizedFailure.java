package com.example.syncengine.error;

/**
 * Implemented by exceptions whose origin knows the failure category.
 * The classifier trusts this over status codes and message text.
 */
public interface CategorizedFailure {

    /**
     * @return the category, or null when the origin could not tell
     */
    ErrorCategory getCategory();
}
