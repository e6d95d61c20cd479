package rg.core.model;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Outcome of every rate or capacity check.
 *
 * <p>{@code retryAfterMillis} and {@code reason} are only ever set on a
 * rejection; an allowed decision carries neither. Times and the remaining
 * quota are clamped to zero.
 *
 * @param allowed whether the action may proceed
 * @param remaining quota left in the current window (or seats left in a pool)
 * @param resetInMillis time until the current window or block ends
 * @param retryAfterMillis time until a retry can succeed, {@code null} when allowed
 * @param reason human-readable rejection reason, {@code null} when allowed
 */
public record Decision(
    boolean allowed,
    int remaining,
    long resetInMillis,
    Long retryAfterMillis,
    String reason
) {
    public Decision {
        if (remaining < 0) throw new IllegalArgumentException("remaining < 0");
        if (resetInMillis < 0) throw new IllegalArgumentException("resetInMillis < 0");
        if (allowed && (retryAfterMillis != null || reason != null)) {
            throw new IllegalArgumentException("allowed decision cannot carry retryAfter or reason");
        }
    }

    public static Decision allow(int remaining, long resetInMillis) {
        return new Decision(true, Math.max(0, remaining), Math.max(0L, resetInMillis), null, null);
    }

    public static Decision reject(long resetInMillis, long retryAfterMillis, String reason) {
        return new Decision(false, 0, Math.max(0L, resetInMillis), Math.max(0L, retryAfterMillis), reason);
    }

    /**
     * Rejection with no time dimension (capacity gate): nothing to wait for.
     */
    public static Decision reject(String reason) {
        return new Decision(false, 0, 0L, null, reason);
    }

    public OptionalLong retryAfter() {
        return retryAfterMillis == null ? OptionalLong.empty() : OptionalLong.of(retryAfterMillis);
    }

    public Optional<String> rejectionReason() {
        return Optional.ofNullable(reason);
    }
}
