package com.example.syncengine.cache;

public record CacheStats(long hits, long misses, long evictions, long expirations, int size, int maxSize) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
