package com.example.syncengine.cache;

import com.example.syncengine.entity.ServiceType;

import java.util.UUID;

/**
 * Key layout for cached reads. Every key is prefixed by the owning user.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String integration(UUID userId, ServiceType service) {
        return "user:" + userId + ":integration:" + service.getPathValue();
    }

    public static String jobCounts(UUID userId, String batchId) {
        return "user:" + userId + ":jobs:counts:" + (batchId == null ? "all" : batchId);
    }

    public static String latestSession(UUID userId, ServiceType service) {
        return "user:" + userId + ":sync:latest:" + service.getPathValue();
    }

    public static String userPattern(UUID userId) {
        return "user:" + userId + ":*";
    }

    public static String jobsPattern(UUID userId) {
        return "user:" + userId + ":jobs:*";
    }

    public static String syncPattern(UUID userId) {
        return "user:" + userId + ":sync:*";
    }
}
