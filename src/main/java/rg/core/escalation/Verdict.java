package rg.core.escalation;

/**
 * Outcome of recording one violation.
 */
public enum Verdict {
    /** Below the threshold: reject this call only. */
    WARN,

    /** Threshold reached: the key is now blocked. */
    BLOCK
}
