package com.github.dimitryivaniuta.egress.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache: a bounded in-process tier in front of a shared {@link DistributedStore}.
 *
 * <p>Writes go through to the store; reads try the local tier first and promote store hits.
 * Store failures never reach callers: reads degrade to a miss, writes return {@code false},
 * and the local tier keeps serving.
 */
@Slf4j
public class TieredCacheManager {

    static final String TAG_PREFIX = "tag:";

    private final EgressProperties.Cache props;
    private final DistributedStore store;
    private final ObjectMapper mapper;
    private final EgressMetrics metrics;
    private final LocalCacheTier local;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();

    public TieredCacheManager(EgressProperties.Cache props,
                              DistributedStore store,
                              ObjectMapper mapper,
                              EgressMetrics metrics,
                              Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.metrics = metrics;
        this.local = new LocalCacheTier(props.getMaxLocalEntries(), clock);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, type, null);
    }

    public <T> Optional<T> get(String key, Class<T> type, String namespace) {
        String cacheKey = cacheKey(key, namespace);

        Optional<CacheEntry> cached = local.get(cacheKey);
        if (cached.isPresent()) {
            Optional<T> value = read(cacheKey, cached.get().getJson(), type);
            if (value.isPresent()) {
                hits.incrementAndGet();
                if (metrics != null) metrics.cacheHit("local");
                return value;
            }
            return miss();
        }

        Optional<String> stored;
        try {
            stored = store.get(cacheKey);
        } catch (RuntimeException ex) {
            storeError("get", cacheKey, ex);
            return miss();
        }
        if (stored.isEmpty()) return miss();

        String json = stored.get();
        Optional<T> value = read(cacheKey, json, type);
        if (value.isEmpty()) return miss();

        promote(cacheKey, json);
        hits.incrementAndGet();
        if (metrics != null) metrics.cacheHit("distributed");
        return value;
    }

    /**
     * Empty when the JSON does not bind to {@code type}; a cached JSON {@code null} is not a hit either.
     */
    private <T> Optional<T> read(String cacheKey, String json, Class<T> type) {
        try {
            return Optional.ofNullable(mapper.readValue(json, type));
        } catch (JsonProcessingException ex) {
            log.warn("Cached value for {} is not a valid {}: {}", cacheKey, type.getSimpleName(), ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> miss() {
        misses.incrementAndGet();
        if (metrics != null) metrics.cacheMiss();
        return Optional.empty();
    }

    /**
     * The local copy never outlives the store copy. A store that cannot report the TTL leaves
     * the value unpromoted.
     */
    private void promote(String cacheKey, String json) {
        long size = byteSize(json);
        if (size > props.getMaxLocalValueSize()) return;

        long remaining;
        try {
            remaining = store.ttlSeconds(cacheKey);
        } catch (RuntimeException ex) {
            storeError("ttl", cacheKey, ex);
            return;
        }
        if (remaining == -2) return;

        Duration ttl = props.getLocalTtl();
        if (remaining > 0 && Duration.ofSeconds(remaining).compareTo(ttl) < 0) {
            ttl = Duration.ofSeconds(remaining);
        }
        local.put(cacheKey, json, size, ttl, Set.of());
    }

    public boolean set(String key, Object value) {
        return set(key, value, CacheOptions.defaults(), null);
    }

    public boolean set(String key, Object value, CacheOptions options) {
        return set(key, value, options, null);
    }

    public boolean set(String key, Object value, CacheOptions options, String namespace) {
        String cacheKey = cacheKey(key, namespace);
        CacheOptions opts = options == null ? CacheOptions.defaults() : options;
        Duration ttl = opts.ttl() == null ? props.getDefaultTtl() : opts.ttl();
        boolean expiring = !ttl.isZero() && !ttl.isNegative();

        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Cannot serialize value for {}: {}", cacheKey, ex.getOriginalMessage());
            return false;
        }

        try {
            store.set(cacheKey, json, ttl);
            for (String tag : opts.tags()) {
                store.addToSet(TAG_PREFIX + tag, List.of(cacheKey));
                if (expiring) store.expire(TAG_PREFIX + tag, ttl);
            }
        } catch (RuntimeException ex) {
            storeError("set", cacheKey, ex);
            return false;
        }

        long size = byteSize(json);
        if (size <= props.getMaxLocalValueSize()) {
            local.put(cacheKey, json, size, ttl, opts.tags());
        } else {
            local.remove(cacheKey);
        }
        sets.incrementAndGet();
        return true;
    }

    public boolean delete(String key) {
        return delete(key, null);
    }

    public boolean delete(String key, String namespace) {
        String cacheKey = cacheKey(key, namespace);
        local.remove(cacheKey);
        try {
            long removed = store.delete(List.of(cacheKey));
            deletes.incrementAndGet();
            return removed > 0;
        } catch (RuntimeException ex) {
            storeError("delete", cacheKey, ex);
            return false;
        }
    }

    /**
     * Removes every key recorded under the tag, then the tag set itself. Local entries written
     * with the tag are dropped even when the store is unreachable.
     *
     * @return number of keys deleted from the store
     */
    public int invalidateByTag(String tag) {
        String tagKey = TAG_PREFIX + tag;
        local.removeTagged(tag);
        try {
            Set<String> keys = store.members(tagKey);
            if (keys.isEmpty()) return 0;

            local.removeAll(keys);
            long deleted = store.delete(keys);
            store.delete(List.of(tagKey));

            deletes.addAndGet(deleted);
            log.debug("Invalidated {} keys tagged {}", deleted, tag);
            return (int) deleted;
        } catch (RuntimeException ex) {
            storeError("invalidateByTag", tagKey, ex);
            return 0;
        }
    }

    public boolean exists(String key) {
        return exists(key, null);
    }

    public boolean exists(String key, String namespace) {
        String cacheKey = cacheKey(key, namespace);
        if (local.contains(cacheKey)) return true;
        try {
            return store.exists(cacheKey);
        } catch (RuntimeException ex) {
            storeError("exists", cacheKey, ex);
            return false;
        }
    }

    /**
     * @return seconds to live; {@code -2} missing, {@code -1} no expiry or store unavailable
     */
    public long getTTL(String key) {
        return getTTL(key, null);
    }

    public long getTTL(String key, String namespace) {
        String cacheKey = cacheKey(key, namespace);
        try {
            return store.ttlSeconds(cacheKey);
        } catch (RuntimeException ex) {
            storeError("ttl", cacheKey, ex);
            return -1;
        }
    }

    /**
     * Adds to the remaining TTL. Keys without expiry or missing keys are left alone.
     */
    public boolean extend(String key, Duration additionalTtl) {
        return extend(key, additionalTtl, null);
    }

    public boolean extend(String key, Duration additionalTtl, String namespace) {
        String cacheKey = cacheKey(key, namespace);
        try {
            long current = store.ttlSeconds(cacheKey);
            if (current <= 0) return false;

            Duration extended = Duration.ofSeconds(current).plus(additionalTtl);
            if (!store.expire(cacheKey, extended)) return false;
            local.setTtl(cacheKey, extended);
            return true;
        } catch (RuntimeException ex) {
            storeError("extend", cacheKey, ex);
            return false;
        }
    }

    /**
     * Flushes both tiers.
     *
     * @return {@code 1} on success, {@code 0} when the store could not be flushed
     */
    public long clear() {
        local.clear();
        try {
            store.flush();
            deletes.incrementAndGet();
            return 1;
        } catch (RuntimeException ex) {
            storeError("flush", "*", ex);
            return 0;
        }
    }

    /**
     * @return number of store keys deleted under {@code namespace:}
     */
    public long clear(String namespace) {
        if (namespace == null || namespace.isBlank()) return clear();

        String prefix = namespace + ":";
        local.removeByPrefix(prefix);
        try {
            Set<String> keys = store.scan(prefix + "*");
            long deleted = store.delete(keys);
            deletes.addAndGet(deleted);
            return deleted;
        } catch (RuntimeException ex) {
            storeError("clear", prefix + "*", ex);
            return 0;
        }
    }

    public CacheStats getStats() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = h + m == 0 ? 0.0 : (double) h / (h + m) * 100.0;
        return new CacheStats(h, m, sets.get(), deletes.get(), hitRate, local.memoryUsage(), local.size());
    }

    public CacheMemoryInfo getMemoryInfo() {
        CacheMemoryInfo.Local localInfo = new CacheMemoryInfo.Local(local.memoryUsage(), local.size());
        try {
            Properties info = store.memoryInfo();
            return new CacheMemoryInfo(
                    new CacheMemoryInfo.Distributed(
                            parseLong(info.getProperty("used_memory")),
                            parseLong(info.getProperty("used_memory_peak")),
                            parseDouble(info.getProperty("mem_fragmentation_ratio"))),
                    localInfo);
        } catch (RuntimeException ex) {
            storeError("memoryInfo", "INFO", ex);
            return new CacheMemoryInfo(CacheMemoryInfo.Distributed.unknown(), localInfo);
        }
    }

    public CacheHealth healthCheck() {
        CacheHealth.Local localHealth = new CacheHealth.Local(true, local.size(), local.memoryUsage());
        long start = System.nanoTime();
        try {
            store.ping();
            return new CacheHealth(
                    new CacheHealth.Distributed(true, elapsedMillis(start), null),
                    localHealth);
        } catch (RuntimeException ex) {
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return new CacheHealth(
                    new CacheHealth.Distributed(false, elapsedMillis(start), error),
                    localHealth);
        }
    }

    public void destroy() {
        local.clear();
        log.info("Tiered cache destroyed");
    }

    private void storeError(String operation, String key, RuntimeException ex) {
        if (metrics != null) metrics.cacheStoreError(operation);
        log.error("Distributed cache {} failed for {}: {}", operation, key, ex.getMessage());
    }

    private static String cacheKey(String key, String namespace) {
        return namespace == null || namespace.isBlank() ? key : namespace + ":" + key;
    }

    private static long byteSize(String json) {
        return json.getBytes(StandardCharsets.UTF_8).length;
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static long parseLong(String value) {
        if (value == null) return 0;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static double parseDouble(String value) {
        if (value == null) return 1.0;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return 1.0;
        }
    }
}
