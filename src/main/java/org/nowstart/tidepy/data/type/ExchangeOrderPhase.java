package org.nowstart.tidepy.data.type;

public enum ExchangeOrderPhase {
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED;

    public boolean isClosed() {
        return this != OPEN && this != PARTIALLY_FILLED;
    }
}
