package rg.java.engine;

import rg.core.model.RateRule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Policy constants for a {@link RateGuardEngine}.
 *
 * @param ideaLimit Maximum idea submissions per participant per window
 * @param windowMillis Window size in milliseconds
 * @param sessionCapacity Maximum concurrent participants per session
 * @param violationThreshold Violations that trigger a block
 * @param blockDurationMillis Length of a block in milliseconds
 * @param stalenessMultiplier Idle rate state older than this many windows is reaped
 * @param sweepIntervalMillis Delay between reaper runs in milliseconds
 * @param enforcementEnabled When false every check is allowed and no state is kept
 */
public record GuardPolicy(
    int ideaLimit,
    long windowMillis,
    int sessionCapacity,
    int violationThreshold,
    long blockDurationMillis,
    int stalenessMultiplier,
    long sweepIntervalMillis,
    boolean enforcementEnabled
) {
    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "rate-guard.properties";

    /** Prefix for keys in the resource and in system properties. */
    public static final String PREFIX = "rate-guard.";

    public GuardPolicy {
        if (ideaLimit <= 0) throw new IllegalArgumentException("ideaLimit must be > 0");
        if (windowMillis <= 0) throw new IllegalArgumentException("windowMillis must be > 0");
        if (sessionCapacity <= 0) throw new IllegalArgumentException("sessionCapacity must be > 0");
        if (violationThreshold <= 0) throw new IllegalArgumentException("violationThreshold must be > 0");
        if (blockDurationMillis <= 0) throw new IllegalArgumentException("blockDurationMillis must be > 0");
        if (stalenessMultiplier <= 0) throw new IllegalArgumentException("stalenessMultiplier must be > 0");
        if (sweepIntervalMillis <= 0) throw new IllegalArgumentException("sweepIntervalMillis must be > 0");
    }

    /**
     * 6 ideas per minute, 50 participants per session, 5 minute block on the
     * 3rd violation, state idle for 10 windows reaped every 5 minutes.
     */
    public static GuardPolicy defaults() {
        return new GuardPolicy(6, 60_000L, 50, 3, 5 * 60_000L, 10, 5 * 60_000L, true);
    }

    /**
     * Defaults, overridden by {@value #RESOURCE} on the classpath, overridden
     * by {@code rate-guard.*} system properties.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static GuardPolicy load() {
        Properties properties = new Properties();
        try (InputStream in = GuardPolicy.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static GuardPolicy fromProperties(Properties properties) {
        GuardPolicy d = defaults();
        return new GuardPolicy(
            intValue(properties, "idea-limit", d.ideaLimit()),
            longValue(properties, "window-millis", d.windowMillis()),
            intValue(properties, "session-capacity", d.sessionCapacity()),
            intValue(properties, "violation-threshold", d.violationThreshold()),
            longValue(properties, "block-duration-millis", d.blockDurationMillis()),
            intValue(properties, "staleness-multiplier", d.stalenessMultiplier()),
            longValue(properties, "sweep-interval-millis", d.sweepIntervalMillis()),
            booleanValue(properties, "enforcement-enabled", d.enforcementEnabled())
        );
    }

    public RateRule ideaRule() {
        return new RateRule("ideas", ideaLimit, windowMillis);
    }

    public GuardPolicy withIdeaLimit(int limit, long windowMillis) {
        return new GuardPolicy(limit, windowMillis, sessionCapacity, violationThreshold,
            blockDurationMillis, stalenessMultiplier, sweepIntervalMillis, enforcementEnabled);
    }

    public GuardPolicy withSessionCapacity(int capacity) {
        return new GuardPolicy(ideaLimit, windowMillis, capacity, violationThreshold,
            blockDurationMillis, stalenessMultiplier, sweepIntervalMillis, enforcementEnabled);
    }

    public GuardPolicy withEscalation(int threshold, long blockDurationMillis) {
        return new GuardPolicy(ideaLimit, windowMillis, sessionCapacity, threshold,
            blockDurationMillis, stalenessMultiplier, sweepIntervalMillis, enforcementEnabled);
    }

    public GuardPolicy withSweep(int stalenessMultiplier, long sweepIntervalMillis) {
        return new GuardPolicy(ideaLimit, windowMillis, sessionCapacity, violationThreshold,
            blockDurationMillis, stalenessMultiplier, sweepIntervalMillis, enforcementEnabled);
    }

    public GuardPolicy withEnforcement(boolean enabled) {
        return new GuardPolicy(ideaLimit, windowMillis, sessionCapacity, violationThreshold,
            blockDurationMillis, stalenessMultiplier, sweepIntervalMillis, enabled);
    }

    private static String raw(Properties properties, String name) {
        String value = properties.getProperty(PREFIX + name);
        return value == null ? null : value.trim();
    }

    private static int intValue(Properties properties, String name, int fallback) {
        String value = raw(properties, name);
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + name + " is not an integer: " + value, e);
        }
    }

    private static long longValue(Properties properties, String name, long fallback) {
        String value = raw(properties, name);
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + name + " is not an integer: " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String name, boolean fallback) {
        String value = raw(properties, name);
        if (value == null || value.isEmpty()) return fallback;
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException(PREFIX + name + " is not a boolean: " + value);
    }
}
