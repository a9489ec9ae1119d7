package com.github.dimitryivaniuta.egress.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Redis-like store on top of a map, expiring by the given clock. Can be switched offline.
 */
class InMemoryDistributedStore implements DistributedStore {

    private final Clock clock;
    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Properties memory = new Properties();
    private volatile boolean online = true;
    private volatile boolean ttlBroken;

    InMemoryDistributedStore(Clock clock) {
        this.clock = clock;
    }

    void goOffline() {
        online = false;
    }

    void goOnline() {
        online = true;
    }

    /** TTL lookups fail while everything else keeps working. */
    void breakTtlLookups() {
        ttlBroken = true;
    }

    Properties memory() {
        return memory;
    }

    @Override
    public Optional<String> get(String key) {
        check();
        Object value = live(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        check();
        data.put(key, value);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            expiries.put(key, clock.instant().plus(ttl));
        } else {
            expiries.remove(key);
        }
    }

    @Override
    public long delete(Collection<String> keys) {
        check();
        long removed = 0;
        for (String key : keys) {
            if (live(key) != null) removed++;
            data.remove(key);
            expiries.remove(key);
        }
        return removed;
    }

    @Override
    public boolean exists(String key) {
        check();
        return live(key) != null;
    }

    @Override
    public long ttlSeconds(String key) {
        check();
        if (ttlBroken) throw new IllegalStateException("TTL lookup timed out");
        if (live(key) == null) return -2;
        Instant expiry = expiries.get(key);
        return expiry == null ? -1 : Duration.between(clock.instant(), expiry).toSeconds();
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        check();
        if (live(key) == null) return false;
        expiries.put(key, clock.instant().plus(ttl));
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void addToSet(String key, Collection<String> members) {
        check();
        Object current = live(key);
        Set<String> set = current instanceof Set<?> ? (Set<String>) current : ConcurrentHashMap.newKeySet();
        set.addAll(members);
        data.put(key, set);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Set<String> members(String key) {
        check();
        Object current = live(key);
        return current instanceof Set<?> ? Set.copyOf((Set<String>) current) : Set.of();
    }

    @Override
    public Set<String> scan(String pattern) {
        check();
        Pattern regex = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
        return data.keySet().stream()
                .filter(k -> live(k) != null)
                .filter(k -> regex.matcher(k).matches())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public void flush() {
        check();
        data.clear();
        expiries.clear();
    }

    @Override
    public void ping() {
        check();
    }

    @Override
    public Properties memoryInfo() {
        check();
        return memory;
    }

    private Object live(String key) {
        Instant expiry = expiries.get(key);
        if (expiry != null && !clock.instant().isBefore(expiry)) {
            data.remove(key);
            expiries.remove(key);
            return null;
        }
        return data.get(key);
    }

    private void check() {
        if (!online) throw new IllegalStateException("Connection refused");
    }
}
