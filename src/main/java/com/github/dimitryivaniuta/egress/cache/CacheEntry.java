package com.github.dimitryivaniuta.egress.cache;

import lombok.Getter;

import java.time.Duration;
import java.util.Set;

/**
 * Local tier entry holding the serialized value, so every read yields a fresh instance.
 * {@code ttl == null} means the entry lives until evicted.
 */
@Getter
public class CacheEntry {

    private final String key;
    private final String json;
    private final long size;
    private final Set<String> tags;
    private final long createdAt;
    private volatile Duration ttl;
    private volatile long lastAccess;

    CacheEntry(String key, String json, long size, Duration ttl, Set<String> tags, long now) {
        this.key = key;
        this.json = json;
        this.size = size;
        this.ttl = ttl;
        this.tags = tags == null ? Set.of() : Set.copyOf(tags);
        this.createdAt = now;
        this.lastAccess = now;
    }

    boolean isTagged(String tag) {
        return tags.contains(tag);
    }

    void touch(long now) {
        lastAccess = now;
    }

    void setTtl(Duration ttl) {
        this.ttl = ttl;
    }
}
