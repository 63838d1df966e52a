package org.nowstart.tidepy.data.type;

public enum RejectionReason {
    CAP_EXCEEDED,
    CONFLICTING_INFLIGHT_ORDER,
    PORTFOLIO_CEILING,
    NO_EXPOSURE,
    BELOW_MIN_NOTIONAL
}
