package rg.core.store;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-local store backed by a {@link ConcurrentHashMap}.
 *
 * Limits enforced through this store are per JVM: two server instances
 * each keep their own counters.
 */
public class InMemoryStateStore<V extends GuardedEntry> implements KeyedStateStore<V> {

    private final ConcurrentHashMap<String, V> records = new ConcurrentHashMap<>();

    @Override
    public V get(String key) {
        return records.get(key);
    }

    @Override
    public V getOrCreate(String key, Function<String, ? extends V> factory) {
        return records.computeIfAbsent(key, factory);
    }

    @Override
    public boolean remove(String key, V expected) {
        return records.remove(key, expected);
    }

    @Override
    public Collection<V> values() {
        return records.values();
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Drops every record without retiring it. Only used at teardown, when
     * no caller is expected to hold a record any more.
     */
    @Override
    public void clear() {
        records.clear();
    }
}
