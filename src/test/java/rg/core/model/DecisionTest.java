package rg.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    @Test
    void testAllow_carriesNoRejectionFields() {
        Decision decision = Decision.allow(3, 1_500L);

        assertTrue(decision.allowed());
        assertEquals(3, decision.remaining());
        assertEquals(1_500L, decision.resetInMillis());
        assertTrue(decision.retryAfter().isEmpty());
        assertTrue(decision.rejectionReason().isEmpty());
    }

    @Test
    void testReject_clampsNegativeTimes() {
        Decision decision = Decision.reject(-5L, -5L, "nope");

        assertFalse(decision.allowed());
        assertEquals(0, decision.remaining());
        assertEquals(0L, decision.resetInMillis());
        assertEquals(0L, decision.retryAfter().getAsLong());
    }

    @Test
    void testRejectWithoutRetry() {
        Decision decision = Decision.reject("full");

        assertFalse(decision.allowed());
        assertTrue(decision.retryAfter().isEmpty());
        assertEquals("full", decision.rejectionReason().orElseThrow());
    }

    @Test
    void testAllowedDecisionCannotCarryReason() {
        assertThrows(IllegalArgumentException.class, () -> new Decision(true, 1, 0L, null, "why"));
        assertThrows(IllegalArgumentException.class, () -> new Decision(true, 1, 0L, 10L, null));
        assertThrows(IllegalArgumentException.class, () -> new Decision(false, -1, 0L, null, null));
    }

    @Test
    void testRateRule_describesWindow() {
        assertEquals("Rate limit exceeded. Maximum 6 ideas per minute.",
            new RateRule("ideas", 6, 60_000L).exceededReason());
        assertEquals("hour", RateRule.of(1, 3_600_000L).describeWindow());
        assertEquals("2 hours", RateRule.of(1, 7_200_000L).describeWindow());
        assertEquals("10 minutes", RateRule.of(1, 600_000L).describeWindow());
        assertEquals("30 seconds", RateRule.of(1, 30_000L).describeWindow());
        assertEquals("250 ms", RateRule.of(1, 250L).describeWindow());
    }

    @Test
    void testRateRule_invalid() {
        assertThrows(IllegalArgumentException.class, () -> new RateRule(" ", 1, 1L));
        assertThrows(IllegalArgumentException.class, () -> RateRule.of(0, 1L));
        assertThrows(IllegalArgumentException.class, () -> RateRule.of(1, 0L));
    }
}
