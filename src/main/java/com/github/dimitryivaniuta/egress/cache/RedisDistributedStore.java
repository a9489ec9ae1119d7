package com.github.dimitryivaniuta.egress.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

@RequiredArgsConstructor
public class RedisDistributedStore implements DistributedStore {

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            redis.opsForValue().set(key, value, ttl);
        } else {
            redis.opsForValue().set(key, value);
        }
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) return 0;
        Long deleted = redis.delete(keys);
        return deleted == null ? 0 : deleted;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public long ttlSeconds(String key) {
        Long ttl = redis.getExpire(key);
        return ttl == null ? -2 : ttl;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return Boolean.TRUE.equals(redis.expire(key, ttl));
    }

    @Override
    public void addToSet(String key, Collection<String> members) {
        if (members.isEmpty()) return;
        redis.opsForSet().add(key, members.toArray(String[]::new));
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = redis.opsForSet().members(key);
        return members == null ? Set.of() : members;
    }

    @Override
    public Set<String> scan(String pattern) {
        Set<String> keys = new LinkedHashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redis.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    public void flush() {
        redis.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
    }

    @Override
    public void ping() {
        String reply = redis.execute((RedisCallback<String>) RedisConnection::ping);
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new IllegalStateException("Unexpected PING reply: " + reply);
        }
    }

    @Override
    public Properties memoryInfo() {
        Properties info = redis.execute((RedisCallback<Properties>) c -> c.serverCommands().info("memory"));
        return info == null ? new Properties() : info;
    }
}
