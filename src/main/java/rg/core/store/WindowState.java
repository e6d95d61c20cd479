package rg.core.store;

/**
 * Counter for one window {@code [windowStart, windowStart + windowSize)}.
 * Accessed only under the owning {@link RateEntry}'s lock.
 */
public final class WindowState {

    private boolean started;
    private long windowStartMillis;
    private long windowSizeMillis;
    private int count;
    private long lastActivityMillis;

    public boolean isExpiredAt(long now) {
        return !started || now >= endMillis();
    }

    public void restart(long now, long windowSizeMillis) {
        this.started = true;
        this.windowStartMillis = now;
        this.windowSizeMillis = windowSizeMillis;
        this.count = 0;
    }

    /**
     * Forgets the current window; the next check starts a new one.
     */
    public void clear() {
        started = false;
        count = 0;
    }

    public int increment() {
        return ++count;
    }

    public void touch(long now) {
        lastActivityMillis = now;
    }

    public long endMillis() {
        return windowStartMillis + windowSizeMillis;
    }

    public long windowStartMillis() {
        return windowStartMillis;
    }

    public long windowSizeMillis() {
        return windowSizeMillis;
    }

    public int count() {
        return count;
    }

    public long lastActivityMillis() {
        return lastActivityMillis;
    }
}
