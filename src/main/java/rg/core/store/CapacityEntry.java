package rg.core.store;

import java.util.HashSet;
import java.util.Set;

/**
 * Occupants of one capacity pool. Accessed only under the entry's lock.
 */
public final class CapacityEntry extends GuardedEntry {

    private final Set<String> occupants = new HashSet<>();

    public CapacityEntry(String key) {
        super(key);
    }

    public Set<String> occupants() {
        return occupants;
    }
}
