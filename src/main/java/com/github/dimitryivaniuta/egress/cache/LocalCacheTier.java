package com.github.dimitryivaniuta.egress.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * In-process tier backed by Caffeine with a per-entry TTL.
 *
 * <p>Size is bounded by count: once {@code maxEntries} is exceeded the least recently accessed
 * 20% of entries are dropped in one pass.
 */
@Slf4j
class LocalCacheTier {

    private static final double EVICTION_FRACTION = 0.2;

    private final Cache<String, CacheEntry> cache;
    private final int maxEntries;
    private final Clock clock;

    LocalCacheTier(int maxEntries, Clock clock) {
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryTtlExpiry())
                .build();
    }

    Optional<CacheEntry> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) return Optional.empty();
        entry.touch(clock.millis());
        return Optional.of(entry);
    }

    boolean contains(String key) {
        return cache.getIfPresent(key) != null;
    }

    void put(String key, String json, long size, Duration ttl, Collection<String> tags) {
        cache.put(key, new CacheEntry(key, json, size, positiveOrNull(ttl),
                tags == null ? null : Set.copyOf(tags), clock.millis()));
        evictIfNeeded();
    }

    void setTtl(String key, Duration ttl) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) return;
        entry.setTtl(ttl);
        cache.policy().expireVariably().ifPresent(policy -> policy.setExpiresAfter(key, ttl));
    }

    void remove(String key) {
        cache.invalidate(key);
    }

    void removeAll(Collection<String> keys) {
        cache.invalidateAll(keys);
    }

    int removeTagged(String tag) {
        List<String> keys = cache.asMap().values().stream()
                .filter(entry -> entry.isTagged(tag))
                .map(CacheEntry::getKey)
                .toList();
        cache.invalidateAll(keys);
        return keys.size();
    }

    int removeByPrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
        cache.invalidateAll(keys);
        return keys.size();
    }

    void clear() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    long memoryUsage() {
        return cache.asMap().values().stream().mapToLong(CacheEntry::getSize).sum();
    }

    void evictIfNeeded() {
        long size = size();
        if (size <= maxEntries) return;

        int toRemove = (int) Math.floor(size * EVICTION_FRACTION);
        List<String> victims = cache.asMap().values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::getLastAccess))
                .limit(toRemove)
                .map(CacheEntry::getKey)
                .toList();
        cache.invalidateAll(victims);
        log.debug("Local cache evicted {} of {} entries", victims.size(), size);
    }

    private static Duration positiveOrNull(Duration ttl) {
        return ttl == null || ttl.isZero() || ttl.isNegative() ? null : ttl;
    }

    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.getTtl() == null ? Long.MAX_VALUE : entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
