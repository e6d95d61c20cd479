package rg.core.store;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    @Test
    void testAcquire_createsOnceAndHoldsLock() {
        InMemoryStateStore<RateEntry> store = new InMemoryStateStore<>();

        RateEntry first = store.acquire("k", RateEntry::new);
        first.unlock();
        RateEntry second = store.acquire("k", RateEntry::new);
        second.unlock();

        assertSame(first, second);
        assertEquals(1, store.size());
    }

    @Test
    void testEvict_retiresAndRemoves() {
        InMemoryStateStore<RateEntry> store = new InMemoryStateStore<>();
        RateEntry entry = store.acquire("k", RateEntry::new);
        entry.unlock();

        assertTrue(store.evict("k", e -> true));

        assertNull(store.get("k"));
        entry.lock();
        try {
            assertTrue(entry.isRetired());
        } finally {
            entry.unlock();
        }
    }

    @Test
    void testEvict_conditionFalseKeepsRecord() {
        InMemoryStateStore<RateEntry> store = new InMemoryStateStore<>();
        store.acquire("k", RateEntry::new).unlock();

        assertFalse(store.evict("k", e -> false));
        assertFalse(store.evict("missing", e -> true));
        assertNotNull(store.get("k"));
    }

    @Test
    void testAcquire_afterEvictGetsFreshRecord() {
        InMemoryStateStore<RateEntry> store = new InMemoryStateStore<>();
        RateEntry old = store.acquire("k", RateEntry::new);
        old.window().restart(0L, 1_000L);
        old.window().increment();
        old.unlock();

        store.evict("k", e -> true);
        RateEntry fresh = store.acquire("k", RateEntry::new);
        fresh.unlock();

        assertNotSame(old, fresh);
        assertEquals(0, fresh.window().count());
    }

    @Test
    void testConcurrent_acquireAndEvictNeverLoseUpdatesToRetiredRecords() throws InterruptedException {
        InMemoryStateStore<RateEntry> store = new InMemoryStateStore<>();
        int numThreads = 8;
        int iterations = 2_000;
        AtomicInteger retiredWrites = new AtomicInteger(0);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads + 1);
        ExecutorService executor = Executors.newFixedThreadPool(numThreads + 1);

        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < iterations; i++) {
                        RateEntry entry = store.acquire("hot", RateEntry::new);
                        try {
                            if (entry.isRetired()) {
                                retiredWrites.incrementAndGet();
                            }
                            entry.window().increment();
                        } finally {
                            entry.unlock();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                startLatch.await();
                for (int i = 0; i < iterations; i++) {
                    store.evict("hot", e -> true);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                doneLatch.countDown();
            }
        });

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(0, retiredWrites.get(), "acquire must never hand out a retired record");
    }
}
