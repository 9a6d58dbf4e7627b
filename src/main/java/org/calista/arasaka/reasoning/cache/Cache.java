package org.calista.arasaka.reasoning.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Process-local key/value cache with optional TTL and size bound.
 *
 * <p>Concurrent writers on the same key: last write wins.</p>
 */
public interface Cache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    void invalidate(K key);

    void clear();

    /** Live entries, expired ones included until touched. */
    int size();

    CacheStats stats();

    /**
     * Cached value or {@code loader.apply(key)}, stored when non-null.
     * The loader may run more than once for the same key under contention.
     */
    default V getOrCompute(K key, Function<? super K, ? extends V> loader) {
        Optional<V> hit = get(key);
        if (hit.isPresent()) return hit.get();
        V v = loader.apply(key);
        if (v != null) put(key, v);
        return v;
    }
}
