package org.calista.arasaka.reasoning.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class TtlCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);

    private TtlCache<String, String> cache(Duration ttl, int maxSize) {
        return TtlCache.<String, String>builder()
                .name("test")
                .ttl(ttl)
                .maxSize(maxSize)
                .clock(now::get)
                .build();
    }

    @Test
    void entryExpiresAfterTtl() {
        TtlCache<String, String> c = cache(Duration.ofSeconds(10), 0);
        c.put("k", "v");

        now.addAndGet(10_000);
        assertThat(c.get("k")).contains("v");

        now.addAndGet(1);
        assertThat(c.get("k")).isEmpty();
        assertThat(c.size()).isZero();

        CacheStats s = c.stats();
        assertThat(s.hits).isEqualTo(1);
        assertThat(s.misses).isEqualTo(1);
        assertThat(s.expirations).isEqualTo(1);
    }

    @Test
    void leastRecentlyUsedIsEvicted() {
        TtlCache<String, String> c = cache(Duration.ofHours(1), 2);
        c.put("a", "1");
        c.put("b", "2");
        assertThat(c.get("a")).contains("1");   // b is now the eldest
        c.put("c", "3");

        assertThat(c.get("b")).isEmpty();
        assertThat(c.get("a")).contains("1");
        assertThat(c.get("c")).contains("3");
        assertThat(c.stats().evictions).isEqualTo(1);
    }

    @Test
    void zeroTtlNeverExpires() {
        TtlCache<String, String> c = cache(Duration.ZERO, 0);
        c.put("k", "v");
        now.addAndGet(Duration.ofDays(365).toMillis());
        assertThat(c.get("k")).contains("v");
    }

    @Test
    void getOrComputeLoadsOnce() {
        TtlCache<String, String> c = cache(Duration.ofHours(1), 0);
        AtomicInteger loads = new AtomicInteger();

        assertThat(c.getOrCompute("k", k -> k + loads.incrementAndGet())).isEqualTo("k1");
        assertThat(c.getOrCompute("k", k -> k + loads.incrementAndGet())).isEqualTo("k1");
        assertThat(loads).hasValue(1);
        assertThat(c.stats().hitRate()).isEqualTo(0.5);
    }

    @Test
    void invalidateAndClear() {
        TtlCache<String, String> c = cache(Duration.ofHours(1), 0);
        c.put("a", "1");
        c.put("b", "2");
        c.invalidate("a");
        assertThat(c.get("a")).isEmpty();
        c.clear();
        assertThat(c.size()).isZero();
        assertThat(c.get(null)).isEmpty();
    }
}
