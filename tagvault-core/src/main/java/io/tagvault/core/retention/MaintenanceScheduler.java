package io.tagvault.core.retention;

import io.tagvault.core.memory.MemoryStore;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic sweep of a store, optionally followed by a save. Runs on a single daemon thread; the
 * sweep itself takes the store's exclusive lock, same as an insert-triggered prune.
 */
public final class MaintenanceScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final MemoryStore store;
    private final Duration interval;
    private final boolean saveAfterSweep;
    private final ScheduledExecutorService executor;

    public MaintenanceScheduler(MemoryStore store, Duration interval, boolean saveAfterSweep) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.saveAfterSweep = saveAfterSweep;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tagvault-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::tick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Scheduled memory maintenance every {}", interval);
    }

    /**
     * One sweep (and save, if configured). The sweep also rotates a due key and re-seals
     * encrypted records. Exceptions propagate to the caller.
     */
    public PruneResult runOnce() throws Exception {
        PruneResult result = store.sweep();
        if (saveAfterSweep) {
            store.save();
        }
        return result;
    }

    /** Cancels later runs and waits for a run in progress to finish. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Memory maintenance did not finish within {}, interrupting", SHUTDOWN_TIMEOUT);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean terminated() {
        return executor.isTerminated();
    }

    private void tick() {
        try {
            runOnce();
        } catch (Exception e) {
            // a throwing task would cancel every later run
            LOG.error("Memory maintenance failed, will retry next interval", e);
        }
    }
}
