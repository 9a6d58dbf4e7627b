package org.calista.arasaka.reasoning.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owned worker pools: daemon threads, bounded queue, caller-runs backpressure.
 */
public final class Pools {

    private static final Logger log = LogManager.getLogger(Pools.class);

    private Pools() {}

    public static ExecutorService newBoundedPool(String threadNamePrefix, int parallelism, int queueCapacity) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    public static void shutdown(ExecutorService es, long timeoutMs, String name) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        } catch (RuntimeException e) {
            log.warn("Failed to shutdown {} cleanly", name, e);
            es.shutdownNow();
        }
    }
}
