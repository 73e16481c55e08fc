package com.primemath.backend.modules.notification.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public class CredentialCache<K, V> {

    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();

    public CredentialCache(Clock clock, Duration ttl, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.maxEntries = maxEntries;
    }

    public V getOrCompute(K key, Function<? super K, ? extends V> loader) {
        synchronized (entries) {
            Entry<V> cached = entries.get(key);
            if (cached != null) {
                if (clock.instant().isBefore(cached.expiresAt())) {
                    return cached.value();
                }
                entries.remove(key);
            }
        }

        V loaded = loader.apply(key);
        if (loaded == null) {
            return null;
        }

        synchronized (entries) {
            entries.remove(key);
            while (entries.size() >= maxEntries) {
                Iterator<Map.Entry<K, Entry<V>>> oldest = entries.entrySet().iterator();
                oldest.next();
                oldest.remove();
            }
            entries.put(key, new Entry<>(loaded, clock.instant().plus(ttl)));
        }
        return loaded;
    }

    public void invalidate(K key) {
        synchronized (entries) {
            entries.remove(key);
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private record Entry<V>(V value, Instant expiresAt) {
    }
}
