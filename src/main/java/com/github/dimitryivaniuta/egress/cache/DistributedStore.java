package com.github.dimitryivaniuta.egress.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Shared key-value store behind the local cache tier. Values are serialized strings.
 *
 * <p>Implementations report connectivity and server errors as unchecked exceptions;
 * {@link TieredCacheManager} turns them into misses and {@code false} results.
 */
public interface DistributedStore {

    Optional<String> get(String key);

    /**
     * @param ttl {@code null}, zero or negative stores the value without expiry
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return number of keys that existed and were removed
     */
    long delete(Collection<String> keys);

    boolean exists(String key);

    /**
     * Remaining TTL in seconds: {@code -2} when the key is missing, {@code -1} when it never expires.
     */
    long ttlSeconds(String key);

    boolean expire(String key, Duration ttl);

    void addToSet(String key, Collection<String> members);

    Set<String> members(String key);

    Set<String> scan(String pattern);

    void flush();

    void ping();

    /**
     * Raw {@code INFO memory} section.
     */
    Properties memoryInfo();
}
