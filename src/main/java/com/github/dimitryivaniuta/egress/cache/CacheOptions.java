package com.github.dimitryivaniuta.egress.cache;

import lombok.Builder;
import lombok.Singular;

import java.time.Duration;
import java.util.Set;

/**
 * @param ttl  {@code null} uses the configured default; zero or negative means no expiry
 * @param tags labels for {@link TieredCacheManager#invalidateByTag(String)}
 */
@Builder
public record CacheOptions(Duration ttl, @Singular Set<String> tags) {

    public CacheOptions {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }

    public static CacheOptions ttl(Duration ttl) {
        return CacheOptions.builder().ttl(ttl).build();
    }
}
