package rg.core.clock;

/**
 * Millisecond time source. Every time read in the engine goes through this,
 * so tests can drive virtual time with {@link ManualClock}.
 */
public interface Clock {
    long nowMillis();
}
