package rg.core.model;

/**
 * "N actions per window" rule evaluated by the sliding window limiter.
 *
 * @param action plural noun used in the rejection message (e.g. "ideas")
 * @param limit maximum actions per window
 * @param windowMillis window size in milliseconds
 */
public record RateRule(String action, int limit, long windowMillis) {

    private static final long SECOND = 1_000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;

    public RateRule {
        if (action == null || action.isBlank()) throw new IllegalArgumentException("action must not be blank");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (windowMillis <= 0) throw new IllegalArgumentException("windowMillis must be > 0");
    }

    public static RateRule of(int limit, long windowMillis) {
        return new RateRule("requests", limit, windowMillis);
    }

    /**
     * e.g. "Rate limit exceeded. Maximum 6 ideas per minute."
     */
    public String exceededReason() {
        return "Rate limit exceeded. Maximum " + limit + " " + action + " per " + describeWindow() + ".";
    }

    String describeWindow() {
        if (windowMillis == HOUR) return "hour";
        if (windowMillis == MINUTE) return "minute";
        if (windowMillis == SECOND) return "second";
        if (windowMillis % HOUR == 0) return (windowMillis / HOUR) + " hours";
        if (windowMillis % MINUTE == 0) return (windowMillis / MINUTE) + " minutes";
        if (windowMillis % SECOND == 0) return (windowMillis / SECOND) + " seconds";
        return windowMillis + " ms";
    }
}
