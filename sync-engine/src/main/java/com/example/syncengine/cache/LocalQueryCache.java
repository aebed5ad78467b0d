package com.example.syncengine.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Process-local TTL cache with least-recently-accessed eviction.
 *
 * Loaders run outside the lock, so two threads missing the same key may both
 * load it; the last store wins. Expired entries are kept until the sweep runs
 * so a failing loader can fall back to them.
 */
@Component
@Slf4j
public class LocalQueryCache implements QueryCache {

    private final Clock clock;
    private final int maxEntries;
    private final long defaultTtlSeconds;

    // access-ordered: iteration starts at the least recently accessed entry
    private final LinkedHashMap<String, CacheEntry<?>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public LocalQueryCache(Clock clock,
                           @Value("${sync.cache.max-entries:1000}") int maxEntries,
                           @Value("${sync.cache.default-ttl-seconds:300}") long defaultTtlSeconds) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("sync.cache.max-entries must be positive");
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.defaultTtlSeconds = defaultTtlSeconds;
        log.info("✅ Initialized local query cache - maxEntries={}, defaultTtl={}s", maxEntries, defaultTtlSeconds);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key, CacheLoader<T> loader, long ttlSeconds) {
        CacheEntry<T> stale;
        lock.lock();
        try {
            stale = (CacheEntry<T>) entries.get(key);
            Instant now = Instant.now(clock);
            if (stale != null && !stale.isExpired(now)) {
                stale.recordHit(now);
                hits.incrementAndGet();
                return stale.getData();
            }
        } finally {
            lock.unlock();
        }

        misses.incrementAndGet();
        T value;
        try {
            value = loader.load();
        } catch (Exception e) {
            if (stale != null) {
                log.warn("⚠️ Cache loader failed for key={}, serving expired entry: {}", key, e.getMessage());
                return stale.getData();
            }
            if (e instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CacheLoadException(key, e);
        }

        set(key, value, ttlSeconds);
        return value;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> getIfPresent(String key) {
        lock.lock();
        try {
            CacheEntry<T> entry = (CacheEntry<T>) entries.get(key);
            Instant now = Instant.now(clock);
            if (entry == null || entry.isExpired(now)) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            entry.recordHit(now);
            hits.incrementAndGet();
            return Optional.ofNullable(entry.getData());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> void set(String key, T value, long ttlSeconds) {
        long ttl = ttlSeconds > 0 ? ttlSeconds : defaultTtlSeconds;
        Instant now = Instant.now(clock);
        lock.lock();
        try {
            entries.remove(key);
            while (entries.size() >= maxEntries) {
                evictLeastRecentlyAccessed();
            }
            entries.put(key, new CacheEntry<>(key, value, now.plus(Duration.ofSeconds(ttl)), now));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deletePattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        int removed = 0;
        lock.lock();
        try {
            Iterator<String> keys = entries.keySet().iterator();
            while (keys.hasNext()) {
                if (regex.matcher(keys.next()).matches()) {
                    keys.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("Deleted {} cache entries matching pattern={}", removed, pattern);
        return removed;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits.get(), misses.get(), evictions.get(), expirations.get(),
                    entries.size(), maxEntries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop expired entries. Runs on every instance; no scheduler lock, the cache is local.
     *
     * @return number of removed entries
     */
    @Scheduled(fixedDelayString = "${sync.cache.sweep-interval-ms:300000}",
            initialDelayString = "${sync.cache.sweep-interval-ms:300000}")
    public int evictExpired() {
        Instant now = Instant.now(clock);
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry<?>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            expirations.addAndGet(removed);
            log.debug("Cache sweep removed {} expired entries", removed);
        }
        return removed;
    }

    private void evictLeastRecentlyAccessed() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String key = it.next();
            it.remove();
            evictions.incrementAndGet();
            log.debug("Evicted least recently accessed cache key={}", key);
        }
    }

    static Pattern globToRegex(String glob) {
        String[] parts = glob.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile(regex.toString());
    }
}
