package rg.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.core.algorithms.capacity_gate.CapacityGate;
import rg.core.algorithms.sliding_window.SlidingWindowLimiter;
import rg.core.clock.Clock;
import rg.core.escalation.ViolationEscalator;
import rg.core.model.Decision;
import rg.core.store.CapacityEntry;
import rg.core.store.InMemoryStateStore;
import rg.core.store.KeyedStateStore;
import rg.core.store.RateEntry;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread-safe abuse-prevention engine for collaborative sessions.
 *
 * Features:
 * - Idea submission limit per participant and window
 * - Escalation of repeated offenders into a timed block
 * - Participant capacity per session
 * - Background reaper bounding the memory held by idle participants
 * - Administrative reset, session clearing and teardown
 *
 * Architecture:
 * - Two {@link KeyedStateStore}s: rate state per participant, occupants per session
 * - {@link SlidingWindowLimiter} and {@link ViolationEscalator} share the rate store
 * - {@link CapacityGate} owns the session store
 * - {@link Reaper} runs on a scheduler and only ever deletes rate records
 * - Clock injection enables deterministic testing
 *
 * Thread-safety:
 * - Every record carries its own lock; calls for different keys never contend
 * - A {@link Decision} is valid only for the instant it was produced:
 *   callers must not assume atomicity across two engine calls
 *
 * Scope:
 * - State is process-local. Several server instances enforce limits
 *   independently; global limits need a shared {@link KeyedStateStore}.
 *
 * Usage example:
 * <pre>
 * RateGuardEngine engine = new RateGuardEngine(SystemClock.instance(), GuardPolicy.defaults());
 *
 * Decision decision = engine.checkIdeaSubmission("participant-42");
 * if (!decision.allowed()) {
 *     // Reject with decision.reason() and decision.retryAfterMillis()
 * }
 *
 * engine.destroy(); // at shutdown
 * </pre>
 */
public final class RateGuardEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateGuardEngine.class);

    private final GuardPolicy policy;
    private final KeyedStateStore<RateEntry> rateStore;
    private final KeyedStateStore<CapacityEntry> sessionStore;
    private final SlidingWindowLimiter limiter;
    private final ViolationEscalator escalator;
    private final CapacityGate gate;
    private final Reaper reaper;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private volatile boolean destroyed;

    /**
     * Creates an engine with in-memory stores and its own reaper thread.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param policy Limits, escalation and sweep settings
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateGuardEngine(Clock clock, GuardPolicy policy) {
        this(clock, policy, new InMemoryStateStore<>(), new InMemoryStateStore<>(), newReaperScheduler(), true);
    }

    /**
     * Creates an engine over caller-supplied stores and scheduler. The
     * scheduler is not shut down by {@link #destroy()}.
     *
     * @param clock Clock instance for time control
     * @param policy Limits, escalation and sweep settings
     * @param rateStore Store for per-participant rate state
     * @param sessionStore Store for per-session occupants
     * @param scheduler Scheduler running the reaper
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateGuardEngine(
        Clock clock,
        GuardPolicy policy,
        KeyedStateStore<RateEntry> rateStore,
        KeyedStateStore<CapacityEntry> sessionStore,
        ScheduledExecutorService scheduler
    ) {
        this(clock, policy, rateStore, sessionStore, scheduler, false);
    }

    private RateGuardEngine(
        Clock clock,
        GuardPolicy policy,
        KeyedStateStore<RateEntry> rateStore,
        KeyedStateStore<CapacityEntry> sessionStore,
        ScheduledExecutorService scheduler,
        boolean ownsScheduler
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (rateStore == null || sessionStore == null) {
            throw new IllegalArgumentException("stores cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }

        this.policy = policy;
        this.rateStore = rateStore;
        this.sessionStore = sessionStore;
        this.escalator = new ViolationEscalator(clock, rateStore, policy.violationThreshold(), policy.blockDurationMillis());
        this.limiter = new SlidingWindowLimiter(clock, rateStore, escalator);
        this.gate = new CapacityGate(sessionStore);
        this.reaper = new Reaper(clock, rateStore, policy.stalenessMultiplier());
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;

        reaper.start(scheduler, policy.sweepIntervalMillis());
    }

    /**
     * Checks and counts one idea submission.
     *
     * @param participantId Participant submitting the idea
     * @return Decision; a rejection carries the reason and retry hint
     * @throws IllegalArgumentException if participantId is null
     * @throws IllegalStateException if the engine was destroyed
     */
    public Decision checkIdeaSubmission(String participantId) {
        ensureActive();
        if (!policy.enforcementEnabled()) {
            return Decision.allow(policy.ideaLimit(), 0L);
        }
        return limiter.check(participantId, policy.ideaRule());
    }

    /**
     * Admits a participant to a session unless it is full. Re-joining is
     * always allowed and never counted twice.
     *
     * @param sessionId Session to join
     * @param participantId Joining participant
     * @return Decision with the seats left
     * @throws IllegalArgumentException if an id is null
     * @throws IllegalStateException if the engine was destroyed
     */
    public Decision checkParticipantJoin(String sessionId, String participantId) {
        ensureActive();
        if (!policy.enforcementEnabled()) {
            return Decision.allow(policy.sessionCapacity(), 0L);
        }
        return gate.join(sessionId, participantId, policy.sessionCapacity());
    }

    /**
     * Frees a participant's seat. No-op if the participant is not in the session.
     */
    public void leaveSession(String sessionId, String participantId) {
        ensureActive();
        gate.leave(sessionId, participantId);
    }

    /**
     * Read-only view of a participant's quota, for display.
     */
    public Decision getStatus(String participantId) {
        ensureActive();
        if (!policy.enforcementEnabled()) {
            return Decision.allow(policy.ideaLimit(), 0L);
        }
        return limiter.status(participantId, policy.ideaRule());
    }

    /**
     * Clears window, violations and block for a participant. No-op for
     * unknown participants and after {@link #destroy()}.
     */
    public void reset(String participantId) {
        if (destroyed) {
            return;
        }
        escalator.reset(participantId);
    }

    /**
     * Drops all occupants of a session. No-op for unknown sessions and
     * after {@link #destroy()}.
     */
    public void clearSession(String sessionId) {
        if (destroyed) {
            return;
        }
        gate.clearSession(sessionId);
    }

    /**
     * Runs a reaper sweep immediately.
     *
     * @return Number of participants evicted
     */
    public int sweepNow() {
        ensureActive();
        return reaper.sweep();
    }

    public boolean isBlocked(String participantId) {
        ensureActive();
        return escalator.isBlocked(participantId);
    }

    public int sessionOccupancy(String sessionId) {
        ensureActive();
        return gate.occupancy(sessionId);
    }

    /**
     * @return Number of participants with rate state
     */
    public int trackedParticipants() {
        return rateStore.size();
    }

    /**
     * @return Number of sessions with at least one occupant
     */
    public int trackedSessions() {
        return sessionStore.size();
    }

    public boolean isReaperRunning() {
        return reaper.isRunning();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public GuardPolicy getPolicy() {
        return policy;
    }

    /**
     * Stops the reaper, shuts down an engine-owned scheduler and drops all
     * state. Idempotent. Required at shutdown and in test teardown.
     */
    public void destroy() {
        synchronized (this) {
            if (destroyed) {
                return;
            }
            destroyed = true;
        }
        reaper.stop();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        rateStore.clear();
        sessionStore.clear();
        log.info("Rate guard engine destroyed");
    }

    @Override
    public void close() {
        destroy();
    }

    private void ensureActive() {
        if (destroyed) {
            throw new IllegalStateException("engine has been destroyed");
        }
    }

    private static ScheduledExecutorService newReaperScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-guard-reaper");
            thread.setDaemon(true);
            return thread;
        });
    }
}
