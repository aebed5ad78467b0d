package com.example.syncengine.cache;

import java.util.Optional;

/**
 * Read-through cache in front of repeated persistence reads.
 *
 * The local implementation is per process. A multi-instance deployment needs a
 * shared backend behind this interface.
 */
public interface QueryCache {

    /**
     * Return the live entry for {@code key}, or load, store and return a fresh value.
     * If loading fails and an expired entry is still held, the expired value is returned.
     *
     * @param ttlSeconds time to live; values below 1 use the configured default
     */
    <T> T get(String key, CacheLoader<T> loader, long ttlSeconds);

    <T> Optional<T> getIfPresent(String key);

    <T> void set(String key, T value, long ttlSeconds);

    boolean delete(String key);

    /**
     * Remove every key matching a glob pattern where {@code *} matches any run of characters.
     *
     * @return number of removed entries
     */
    int deletePattern(String pattern);

    void clear();

    CacheStats stats();
}
