package rg.core.store;

/**
 * Breach history and block expiry for one key. Survives window rollover.
 * Accessed only under the owning {@link RateEntry}'s lock.
 */
public final class ViolationState {

    private static final long NO_BLOCK = Long.MIN_VALUE;

    private int count;
    private long blockedUntilMillis = NO_BLOCK;

    public int increment() {
        return ++count;
    }

    public int count() {
        return count;
    }

    public void clearCount() {
        count = 0;
    }

    public void blockUntil(long untilMillis) {
        blockedUntilMillis = untilMillis;
    }

    public boolean hasBlock() {
        return blockedUntilMillis != NO_BLOCK;
    }

    public boolean isBlockedAt(long now) {
        return hasBlock() && blockedUntilMillis > now;
    }

    public long blockedUntilMillis() {
        return blockedUntilMillis;
    }

    public void liftBlock() {
        blockedUntilMillis = NO_BLOCK;
    }
}
