package com.example.syncengine.cache;

/**
 * Wraps a checked failure from a {@link CacheLoader} when no fallback entry exists.
 */
public class CacheLoadException extends RuntimeException {

    public CacheLoadException(String key, Throwable cause) {
        super("Failed to load cache key " + key + ": " + cause.getMessage(), cause);
    }
}
