package org.calista.arasaka.reasoning.cache;

/**
 * Snapshot of cache counters.
 */
public final class CacheStats {
    public final long hits;
    public final long misses;
    public final long expirations;
    public final long evictions;
    public final int size;

    public CacheStats(long hits, long misses, long expirations, long evictions, int size) {
        this.hits = hits;
        this.misses = misses;
        this.expirations = expirations;
        this.evictions = evictions;
        this.size = size;
    }

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : hits / (double) total;
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hits + ", misses=" + misses + ", expirations=" + expirations
                + ", evictions=" + evictions + ", size=" + size + '}';
    }
}
