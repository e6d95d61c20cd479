package rg.core.algorithms.sliding_window;

import rg.core.clock.Clock;
import rg.core.escalation.Verdict;
import rg.core.escalation.ViolationEscalator;
import rg.core.model.Decision;
import rg.core.model.RateRule;
import rg.core.store.KeyedStateStore;
import rg.core.store.RateEntry;
import rg.core.store.ViolationState;
import rg.core.store.WindowState;

/**
 * Per-key window counter: at most {@code limit} actions per window, the
 * window opening at the first action after the previous one closed.
 *
 * Every call past the limit is a violation and is reported to the
 * {@link ViolationEscalator}. While a key is blocked, calls are rejected
 * without consuming quota and windows do not roll over.
 */
public final class SlidingWindowLimiter {

    public static final String TEMPORARY_BLOCK_REASON = "Rate limit exceeded. Temporary block in effect.";

    private final Clock clock;
    private final KeyedStateStore<RateEntry> store;
    private final ViolationEscalator escalator;

    public SlidingWindowLimiter(Clock clock, KeyedStateStore<RateEntry> store, ViolationEscalator escalator) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (escalator == null) throw new IllegalArgumentException("escalator cannot be null");
        this.clock = clock;
        this.store = store;
        this.escalator = escalator;
    }

    public Decision check(String key, int limit, long windowSizeMillis) {
        return check(key, RateRule.of(limit, windowSizeMillis));
    }

    public Decision check(String key, RateRule rule) {
        if (key == null) throw new IllegalArgumentException("key cannot be null");
        if (rule == null) throw new IllegalArgumentException("rule cannot be null");

        RateEntry entry = store.acquire(key, RateEntry::new);
        try {
            long now = clock.nowMillis();
            WindowState window = entry.window();
            ViolationState violations = entry.violations();
            window.touch(now);

            if (violations.isBlockedAt(now)) {
                return blocked(violations, now);
            }

            if (violations.hasBlock()) {
                // Block served: start clean.
                violations.liftBlock();
                window.restart(now, rule.windowMillis());
            } else if (window.isExpiredAt(now)) {
                window.restart(now, rule.windowMillis());
            }

            int count = window.increment();
            long resetIn = window.endMillis() - now;
            if (count <= rule.limit()) {
                return Decision.allow(rule.limit() - count, resetIn);
            }

            if (escalator.recordViolation(entry) == Verdict.BLOCK) {
                long retryAfter = violations.blockedUntilMillis() - now;
                return Decision.reject(retryAfter, retryAfter, escalator.blockReason());
            }
            return Decision.reject(resetIn, resetIn, rule.exceededReason());
        } finally {
            entry.unlock();
        }
    }

    /**
     * Same read path as {@link #check(String, RateRule)} without mutating
     * anything: no record is created and no counter or timestamp moves.
     */
    public Decision status(String key, RateRule rule) {
        if (key == null) throw new IllegalArgumentException("key cannot be null");
        if (rule == null) throw new IllegalArgumentException("rule cannot be null");

        RateEntry entry = store.get(key);
        if (entry == null) {
            return Decision.allow(rule.limit(), 0L);
        }
        entry.lock();
        try {
            if (entry.isRetired()) {
                return Decision.allow(rule.limit(), 0L);
            }
            long now = clock.nowMillis();
            WindowState window = entry.window();
            ViolationState violations = entry.violations();

            if (violations.isBlockedAt(now)) {
                return blocked(violations, now);
            }
            if (violations.hasBlock() || window.isExpiredAt(now)) {
                return Decision.allow(rule.limit(), 0L);
            }

            int remaining = Math.max(0, rule.limit() - window.count());
            long resetIn = window.endMillis() - now;
            if (remaining > 0) {
                return Decision.allow(remaining, resetIn);
            }
            return Decision.reject(resetIn, resetIn, rule.exceededReason());
        } finally {
            entry.unlock();
        }
    }

    private static Decision blocked(ViolationState violations, long now) {
        long retryAfter = violations.blockedUntilMillis() - now;
        return Decision.reject(retryAfter, retryAfter, TEMPORARY_BLOCK_REASON);
    }
}
