package org.nowstart.tidepy.data.type;

public enum DeltaReason {
    NEW_SIGNAL,
    SCALE_UP,
    SCALE_DOWN,
    RISK_FORCED
}
