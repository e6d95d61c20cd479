package rg.core.store;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Base for every record held in a {@link KeyedStateStore}: the key plus the
 * lock that serializes all mutations for that key.
 *
 * Thread-safety:
 * - The lock must be held while reading or writing the record's state
 * - The lock is reentrant, so a component already holding it may call
 *   another component that acquires it again for the same key
 *
 * Retirement:
 * - A record is retired (under its lock) right before it is removed from
 *   the store. A thread that locked a retired record must drop it and look
 *   the key up again; see {@link KeyedStateStore#acquire}.
 */
public abstract class GuardedEntry {

    private final String key;
    private final ReentrantLock lock;
    private boolean retired;

    protected GuardedEntry(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.key = key;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    public String key() {
        return key;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * MUST be called while holding the lock.
     */
    public boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
