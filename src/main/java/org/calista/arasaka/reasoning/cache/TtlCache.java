package org.calista.arasaka.reasoning.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * LRU map with per-entry TTL.
 *
 * <p>Expiry is lazy: an entry older than the TTL is removed when it is looked up, never by a
 * background sweep. A max size of 0 means unbounded.</p>
 */
public final class TtlCache<K, V> implements Cache<K, V> {

    private static final Logger log = LogManager.getLogger(TtlCache.class);

    private static final class Entry<V> {
        final V value;
        final long storedAtMs;

        Entry(V value, long storedAtMs) {
            this.value = value;
            this.storedAtMs = storedAtMs;
        }
    }

    private final String name;
    private final long ttlMs;
    private final int maxSize;
    private final LongSupplier clock;
    private final Map<K, Entry<V>> map;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private TtlCache(Builder<K, V> b) {
        this.name = b.name;
        this.ttlMs = b.ttl == null ? 0L : b.ttl.toMillis();
        this.maxSize = Math.max(0, b.maxSize);
        this.clock = b.clock;
        this.map = Collections.synchronizedMap(new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, Entry<V>> eldest) {
                boolean evict = TtlCache.this.maxSize > 0 && size() > TtlCache.this.maxSize;
                if (evict) evictions.incrementAndGet();
                return evict;
            }
        });
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    @Override
    public Optional<V> get(K key) {
        if (key == null) return Optional.empty();
        synchronized (map) {
            Entry<V> e = map.get(key);
            if (e == null) {
                misses.incrementAndGet();
                log.trace("cache[{}] miss", name);
                return Optional.empty();
            }
            if (expired(e)) {
                map.remove(key);
                expirations.incrementAndGet();
                misses.incrementAndGet();
                log.trace("cache[{}] expired", name);
                return Optional.empty();
            }
            hits.incrementAndGet();
            log.trace("cache[{}] hit", name);
            return Optional.of(e.value);
        }
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        map.put(key, new Entry<>(value, clock.getAsLong()));
    }

    @Override
    public void invalidate(K key) {
        if (key != null) map.remove(key);
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), expirations.get(), evictions.get(), size());
    }

    public long ttlMillis() {
        return ttlMs;
    }

    public int maxSize() {
        return maxSize;
    }

    private boolean expired(Entry<V> e) {
        return ttlMs > 0 && clock.getAsLong() - e.storedAtMs > ttlMs;
    }

    public static final class Builder<K, V> {
        private String name = "cache";
        private Duration ttl = Duration.ofHours(1);
        private int maxSize = 0;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder<K, V> name(String v) {
            this.name = v == null || v.isBlank() ? "cache" : v;
            return this;
        }

        /** Zero or null disables expiry. */
        public Builder<K, V> ttl(Duration v) {
            this.ttl = v;
            return this;
        }

        public Builder<K, V> maxSize(int v) {
            this.maxSize = v;
            return this;
        }

        /** Millisecond clock; tests pass a controllable one. */
        public Builder<K, V> clock(LongSupplier v) {
            this.clock = Objects.requireNonNull(v, "clock");
            return this;
        }

        public TtlCache<K, V> build() {
            return new TtlCache<>(this);
        }
    }
}
