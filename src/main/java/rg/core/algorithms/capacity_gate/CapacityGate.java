package rg.core.algorithms.capacity_gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.core.model.Decision;
import rg.core.store.CapacityEntry;
import rg.core.store.KeyedStateStore;

import java.util.Set;

/**
 * Fixed-ceiling membership gate: at most {@code capacityLimit} distinct
 * members per pool. No time dimension and no escalation.
 */
public final class CapacityGate {

    private static final Logger log = LoggerFactory.getLogger(CapacityGate.class);

    private final KeyedStateStore<CapacityEntry> store;

    public CapacityGate(KeyedStateStore<CapacityEntry> store) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        this.store = store;
    }

    public Decision join(String poolKey, String memberId, int capacityLimit) {
        if (poolKey == null) throw new IllegalArgumentException("poolKey cannot be null");
        if (memberId == null) throw new IllegalArgumentException("memberId cannot be null");
        if (capacityLimit <= 0) throw new IllegalArgumentException("capacityLimit must be > 0");

        CapacityEntry entry = store.acquire(poolKey, CapacityEntry::new);
        try {
            Set<String> occupants = entry.occupants();
            if (occupants.contains(memberId)) {
                return Decision.allow(capacityLimit - occupants.size(), 0L);
            }
            if (occupants.size() >= capacityLimit) {
                log.debug("Pool {} full ({} members), rejecting {}", poolKey, occupants.size(), memberId);
                return Decision.reject("Session has reached maximum capacity (" + capacityLimit + " participants).");
            }
            occupants.add(memberId);
            return Decision.allow(capacityLimit - occupants.size(), 0L);
        } finally {
            entry.unlock();
        }
    }

    /**
     * Removes the member; the pool record goes away with its last member.
     */
    public void leave(String poolKey, String memberId) {
        if (poolKey == null) throw new IllegalArgumentException("poolKey cannot be null");
        if (memberId == null) throw new IllegalArgumentException("memberId cannot be null");

        store.evict(poolKey, entry -> {
            Set<String> occupants = entry.occupants();
            occupants.remove(memberId);
            return occupants.isEmpty();
        });
    }

    public void clearSession(String poolKey) {
        if (poolKey == null) throw new IllegalArgumentException("poolKey cannot be null");
        if (store.evict(poolKey, entry -> true)) {
            log.info("Pool {} cleared", poolKey);
        }
    }

    public int occupancy(String poolKey) {
        if (poolKey == null) throw new IllegalArgumentException("poolKey cannot be null");
        CapacityEntry entry = store.get(poolKey);
        if (entry == null) {
            return 0;
        }
        entry.lock();
        try {
            return entry.isRetired() ? 0 : entry.occupants().size();
        } finally {
            entry.unlock();
        }
    }
}
