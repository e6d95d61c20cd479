package rg.core.escalation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.core.clock.Clock;
import rg.core.store.KeyedStateStore;
import rg.core.store.RateEntry;
import rg.core.store.ViolationState;

/**
 * Promotes repeated sliding-window breaches into a timed block.
 *
 * <p>The violation count is kept per key and survives window rollover. It is
 * cleared only by {@link #reset(String)} or by reaching the threshold, in
 * which case the key is blocked for {@code blockDurationMillis} and both the
 * counter and the window start over.
 */
public final class ViolationEscalator {

    private static final Logger log = LoggerFactory.getLogger(ViolationEscalator.class);

    private static final long MINUTE_MILLIS = 60_000L;

    private final Clock clock;
    private final KeyedStateStore<RateEntry> store;
    private final int threshold;
    private final long blockDurationMillis;

    public ViolationEscalator(Clock clock, KeyedStateStore<RateEntry> store, int threshold, long blockDurationMillis) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be > 0");
        if (blockDurationMillis <= 0) throw new IllegalArgumentException("blockDurationMillis must be > 0");
        this.clock = clock;
        this.store = store;
        this.threshold = threshold;
        this.blockDurationMillis = blockDurationMillis;
    }

    public Verdict recordViolation(String key) {
        if (key == null) throw new IllegalArgumentException("key cannot be null");

        RateEntry entry = store.acquire(key, RateEntry::new);
        try {
            return recordViolation(entry);
        } finally {
            entry.unlock();
        }
    }

    /**
     * Records a violation against a record the caller has already acquired.
     * The caller must hold the entry's lock; the store is not consulted again.
     */
    public Verdict recordViolation(RateEntry entry) {
        if (entry == null) throw new IllegalArgumentException("entry cannot be null");
        if (!entry.isHeldByCurrentThread()) throw new IllegalStateException("entry lock not held");

        ViolationState violations = entry.violations();
        int count = violations.increment();
        if (count < threshold) {
            log.debug("Violation {}/{} recorded for key {}", count, threshold, entry.key());
            return Verdict.WARN;
        }

        long now = clock.nowMillis();
        violations.clearCount();
        violations.blockUntil(now + blockDurationMillis);
        entry.window().clear();
        log.warn("Key {} blocked for {} ms after {} violations", entry.key(), blockDurationMillis, count);
        return Verdict.BLOCK;
    }

    public boolean isBlocked(String key) {
        RateEntry entry = store.get(key);
        if (entry == null) {
            return false;
        }
        entry.lock();
        try {
            return !entry.isRetired() && entry.violations().isBlockedAt(clock.nowMillis());
        } finally {
            entry.unlock();
        }
    }

    /**
     * Clears window, violations and block for {@code key} in one step.
     * No-op for unknown keys.
     */
    public void reset(String key) {
        if (key == null) throw new IllegalArgumentException("key cannot be null");
        if (store.evict(key, entry -> true)) {
            log.info("Rate state reset for key {}", key);
        }
    }

    /**
     * e.g. "Too many violations. Blocked for 5 minutes."
     */
    public String blockReason() {
        long minutes = (blockDurationMillis + MINUTE_MILLIS - 1) / MINUTE_MILLIS;
        return "Too many violations. Blocked for " + minutes + (minutes == 1 ? " minute." : " minutes.");
    }

    public int threshold() {
        return threshold;
    }

    public long blockDurationMillis() {
        return blockDurationMillis;
    }
}
