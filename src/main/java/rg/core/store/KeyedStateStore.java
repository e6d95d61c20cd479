package rg.core.store;

import java.util.Collection;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Key to record map owning all per-key engine state.
 *
 * <p>Implementations only need the raw map operations; locking and the
 * retire-then-remove protocol live in the default methods so every backing
 * store gets the same per-key serialization.
 *
 * @param <V> record type
 */
public interface KeyedStateStore<V extends GuardedEntry> {

    /**
     * @return the record for {@code key}, or null
     */
    V get(String key);

    /**
     * Returns the existing record or atomically installs one from {@code factory}.
     */
    V getOrCreate(String key, Function<String, ? extends V> factory);

    /**
     * Removes {@code key} only while it still maps to {@code expected}.
     */
    boolean remove(String key, V expected);

    /**
     * Weakly consistent view of the live records, safe to iterate while
     * other threads mutate the store.
     */
    Collection<V> values();

    int size();

    void clear();

    /**
     * Returns the live record for {@code key}, created if absent, with its lock held.
     * The caller must {@link GuardedEntry#unlock()} it.
     */
    default V acquire(String key, Function<String, ? extends V> factory) {
        while (true) {
            V entry = getOrCreate(key, factory);
            entry.lock();
            if (!entry.isRetired()) {
                return entry;
            }
            // Lost a race with a removal; the map no longer holds this record.
            entry.unlock();
        }
    }

    /**
     * Retires and removes the record for {@code key} if {@code condition}
     * holds for it. The condition is evaluated under the record's lock.
     *
     * @return true if a record was removed
     */
    default boolean evict(String key, Predicate<? super V> condition) {
        V entry = get(key);
        if (entry == null) {
            return false;
        }
        entry.lock();
        try {
            if (entry.isRetired() || !condition.test(entry)) {
                return false;
            }
            entry.retire();
            return remove(key, entry);
        } finally {
            entry.unlock();
        }
    }
}
