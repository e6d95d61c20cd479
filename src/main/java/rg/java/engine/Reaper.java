package rg.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.core.clock.Clock;
import rg.core.store.KeyedStateStore;
import rg.core.store.RateEntry;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep that deletes idle rate state.
 *
 * <p>A record is stale once its last activity is older than
 * {@code stalenessMultiplier} windows. Records still under an active block
 * are kept so eviction cannot lift a block early. Capacity pools are never
 * swept here.
 *
 * <p>A sweep never throws: a failure on one record is logged and the sweep
 * moves on, and a failure of the whole run is logged so the scheduled task
 * stays alive for the next run.
 */
public final class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final Clock clock;
    private final KeyedStateStore<RateEntry> store;
    private final int stalenessMultiplier;

    private ScheduledFuture<?> task;

    public Reaper(Clock clock, KeyedStateStore<RateEntry> store, int stalenessMultiplier) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (stalenessMultiplier <= 0) throw new IllegalArgumentException("stalenessMultiplier must be > 0");
        this.clock = clock;
        this.store = store;
        this.stalenessMultiplier = stalenessMultiplier;
    }

    /**
     * Schedules {@link #sweep()} every {@code intervalMillis}. The handle is
     * kept so {@link #stop()} can cancel it.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start(ScheduledExecutorService scheduler, long intervalMillis) {
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        if (task != null) {
            throw new IllegalStateException("reaper already started");
        }
        task = scheduler.scheduleWithFixedDelay(this::run, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.debug("Reaper scheduled every {} ms", intervalMillis);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.debug("Reaper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * Runs one sweep now.
     *
     * @return number of records evicted
     */
    public int sweep() {
        long now = clock.nowMillis();
        int evicted = 0;
        for (RateEntry entry : store.values()) {
            try {
                if (store.evict(entry.key(), candidate -> candidate == entry && isStale(candidate, now))) {
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.warn("Reaper failed on key {}, skipping", entry.key(), e);
            }
        }
        if (evicted > 0) {
            log.debug("Reaper evicted {} idle keys, {} remain", evicted, store.size());
        }
        return evicted;
    }

    private void run() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Reaper run failed; next run proceeds as scheduled", e);
        }
    }

    private boolean isStale(RateEntry entry, long now) {
        if (entry.violations().isBlockedAt(now)) {
            return false;
        }
        long maxIdle = stalenessMultiplier * entry.window().windowSizeMillis();
        return entry.window().lastActivityMillis() < now - maxIdle;
    }
}
