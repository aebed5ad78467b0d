package com.example.syncengine.cache;

import lombok.Getter;

import java.time.Instant;

/**
 * Cached value plus its bookkeeping. Mutated only under the owning cache's lock.
 */
@Getter
public class CacheEntry<T> {

    private final String key;
    private final T data;
    private final Instant expiresAt;
    private long hitCount;
    private Instant lastAccessed;

    CacheEntry(String key, T data, Instant expiresAt, Instant createdAt) {
        this.key = key;
        this.data = data;
        this.expiresAt = expiresAt;
        this.lastAccessed = createdAt;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void recordHit(Instant now) {
        hitCount++;
        lastAccessed = now;
    }
}
