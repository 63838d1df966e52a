package org.nowstart.tidepy.data.type;

/**
 * Classification used for every diagnostic surfaced in a cycle summary.
 */
public enum ErrorCategory {
    /** Missing or invalid per-asset snapshot field; the asset is dropped for the cycle. */
    DATA_GAP,
    /** Delta rejected by the risk manager. */
    VALIDATION_REJECTED,
    /** Network or rate-limit failure; retried with backoff. */
    EXCHANGE_TRANSIENT,
    /** Rejected order or invalid instrument; never retried. */
    EXCHANGE_TERMINAL,
    /** Informational: a forced risk-reduction delta was issued. */
    RISK_FORCED_OVERRIDE,
    /** Snapshot unavailable or risk state corrupted; the whole cycle was aborted. */
    CYCLE_FATAL,
    /** Unexpected exception while processing a single asset. */
    INTERNAL
}
