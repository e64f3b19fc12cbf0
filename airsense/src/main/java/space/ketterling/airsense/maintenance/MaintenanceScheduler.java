package space.ketterling.airsense.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.airsense.cache.ResultCache;
import space.ketterling.airsense.ratelimit.RateLimiter;

import java.time.Duration;
import java.util.concurrent.*;
import org.slf4j.MDC;

/**
 * Runs the background sweeps that keep in-memory state bounded: cache eviction and
 * rate-limiter pruning. Correctness never depends on these running on time.
 */
public final class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    // Executors for each job type, single-threaded
    private final ScheduledExecutorService cacheExec = Executors
            .newSingleThreadScheduledExecutor(r -> daemon(r, "sweep-cache"));
    private final ScheduledExecutorService limiterExec = Executors
            .newSingleThreadScheduledExecutor(r -> daemon(r, "sweep-rate-limiter"));

    private final ResultCache<?, ?> cache;
    private final RateLimiter rateLimiter;
    private final Duration cacheSweep;
    private final Duration limiterPrune;

    private ScheduledFuture<?> cacheTask;
    private ScheduledFuture<?> limiterTask;

    public MaintenanceScheduler(ResultCache<?, ?> cache, Duration cacheSweep,
            RateLimiter rateLimiter, Duration limiterPrune) {
        this.cache = cache;
        this.cacheSweep = cacheSweep;
        this.rateLimiter = rateLimiter;
        this.limiterPrune = limiterPrune;
    }

    public synchronized void start() {
        if (cacheTask != null)
            throw new IllegalStateException("maintenance scheduler already started");

        cacheTask = cacheExec.scheduleWithFixedDelay(safe("cacheSweep", cache::evictExpired),
                cacheSweep.toMillis(), cacheSweep.toMillis(), TimeUnit.MILLISECONDS);

        limiterTask = limiterExec.scheduleWithFixedDelay(safe("rateLimitPrune", rateLimiter::prune),
                limiterPrune.toMillis(), limiterPrune.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Maintenance scheduler started (cache sweep {}, rate-limit prune {})", cacheSweep, limiterPrune);
    }

    /**
     * Cancels both sweeps and waits for any run in progress to finish.
     */
    public synchronized void stop() {
        if (cacheTask != null)
            cacheTask.cancel(false);
        if (limiterTask != null)
            limiterTask.cancel(false);

        shutdown(cacheExec, "cacheExec");
        shutdown(limiterExec, "limiterExec");
        log.info("Maintenance scheduler stopped");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdown();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
                es.shutdownNow();
            }
        } catch (InterruptedException e) {
            es.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
