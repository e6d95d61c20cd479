package rg.java.engine;

import rg.core.clock.Clock;
import rg.core.clock.SystemClock;

/**
 * Construction helpers for {@link RateGuardEngine}.
 *
 * Prefer creating one engine at startup and passing it to its callers.
 * {@link #shared()} exists for call sites that cannot receive it.
 *
 * Thread-safety: This class is stateless apart from the lazily created
 * shared instance, which is initialized exactly once.
 */
public final class RateGuardFactory {

    private RateGuardFactory() {
        // Utility class, no instantiation
    }

    /**
     * @param clock Clock instance for time control
     * @param policy Engine policy
     * @return A new engine with its own reaper running
     */
    public static RateGuardEngine create(Clock clock, GuardPolicy policy) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (policy == null) throw new IllegalArgumentException("policy cannot be null");
        return new RateGuardEngine(clock, policy);
    }

    /**
     * Engine on the system clock with {@link GuardPolicy#load()} settings.
     */
    public static RateGuardEngine createDefault() {
        return create(SystemClock.instance(), GuardPolicy.load());
    }

    /**
     * Process-wide engine, created on first use and destroyed by a JVM
     * shutdown hook. Callers must not destroy it themselves.
     */
    public static RateGuardEngine shared() {
        return SharedHolder.INSTANCE;
    }

    private static final class SharedHolder {
        private static final RateGuardEngine INSTANCE = createDefault();

        static {
            destroyOnShutdown(INSTANCE);
        }
    }

    /**
     * Registers a hook that destroys {@code engine} when the JVM exits.
     *
     * @return The registered hook thread
     */
    static Thread destroyOnShutdown(RateGuardEngine engine) {
        Thread hook = new Thread(engine::destroy, "rate-guard-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
