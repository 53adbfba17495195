package im.arun.legisindex.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the shared bounded thread pool used for batch parsing.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static volatile int requestedSize;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Sets the pool size used when the pool is next created. Values below 1 fall back to
     * the processor count.
     */
    public static void configure(int poolSize) {
        synchronized (LOCK) {
            requestedSize = poolSize;
        }
    }

    /**
     * Returns the shared ExecutorService. Parsing is CPU bound (DOM building and text
     * normalization), so the default size is the processor count, capped at 16.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = requestedSize > 0
                            ? requestedSize
                            : Math.min(Runtime.getRuntime().availableProcessors(), 16);
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "legisindex-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdownNow();
                instance = null;
            }
        }
    }
}
