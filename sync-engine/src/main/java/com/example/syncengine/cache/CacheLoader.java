package com.example.syncengine.cache;

/**
 * Produces the value for a cache miss. May perform I/O.
 */
@FunctionalInterface
public interface CacheLoader<T> {

    T load() throws Exception;
}
