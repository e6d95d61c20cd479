package rg.java.engine;

import org.junit.jupiter.api.Test;
import rg.core.clock.ManualClock;
import rg.core.clock.SystemClock;
import rg.core.model.Decision;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for RateGuardEngine.
 *
 * Focus:
 * - Per-key serialization of window counters
 * - Exact capacity under concurrent joins
 * - Resets and sweeps racing with checks
 */
class RateGuardEngineConcurrencyTest {

    @Test
    void testConcurrent_sameParticipantAdmitsExactlyLimit() throws InterruptedException {
        GuardPolicy policy = GuardPolicy.defaults().withIdeaLimit(100, 60_000L);
        RateGuardEngine engine = new RateGuardEngine(new ManualClock(0L), policy);

        int numThreads = 20;
        int callsPerThread = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicInteger allowCount = new AtomicInteger(0);
        AtomicInteger rejectCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await(); // Wait for signal to start
                    for (int j = 0; j < callsPerThread; j++) {
                        Decision decision = engine.checkIdeaSubmission("p1");
                        if (decision.allowed()) {
                            allowCount.incrementAndGet();
                        } else {
                            rejectCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown(); // Signal all threads to start
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        // 200 calls against a limit of 100; the 3rd rejection blocks the rest
        assertEquals(100, allowCount.get());
        assertEquals(100, rejectCount.get());
        assertTrue(engine.isBlocked("p1"));

        engine.destroy();
    }

    @Test
    void testConcurrent_joinsAdmitExactlyCapacity() throws InterruptedException {
        RateGuardEngine engine = new RateGuardEngine(SystemClock.instance(), GuardPolicy.defaults());

        int numThreads = 100;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(16);

        for (int i = 0; i < numThreads; i++) {
            String participantId = "participant-" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (engine.checkParticipantJoin("s1", participantId).allowed()) {
                        admitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(50, admitted.get());
        assertEquals(50, engine.sessionOccupancy("s1"));

        engine.destroy();
    }

    @Test
    void testConcurrent_multipleParticipantsDoNotInterfere() throws InterruptedException {
        RateGuardEngine engine = new RateGuardEngine(new ManualClock(0L), GuardPolicy.defaults());

        int numParticipants = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numParticipants);
        AtomicInteger allowCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(10);

        for (int i = 0; i < numParticipants; i++) {
            String participantId = "p" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 6; j++) {
                        if (engine.checkIdeaSubmission(participantId).allowed()) {
                            allowCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(numParticipants * 6, allowCount.get());
        assertEquals(numParticipants, engine.trackedParticipants());

        engine.destroy();
    }

    @Test
    void testConcurrent_resetAndSweepRacingWithChecks() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        RateGuardEngine engine = new RateGuardEngine(clock, GuardPolicy.defaults());

        int numThreads = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads + 1);
        AtomicInteger failures = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads + 1);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 1_000; j++) {
                        Decision decision = engine.checkIdeaSubmission("hot");
                        if (decision.remaining() > 5) {
                            failures.incrementAndGet();
                        }
                        engine.getStatus("hot");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                startLatch.await();
                for (int j = 0; j < 500; j++) {
                    engine.reset("hot");
                    clock.advanceMillis(1_000L);
                    engine.sweepNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                failures.incrementAndGet();
            } finally {
                doneLatch.countDown();
            }
        });

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(0, failures.get());
        assertTrue(engine.trackedParticipants() <= 1);

        engine.destroy();
    }
}
