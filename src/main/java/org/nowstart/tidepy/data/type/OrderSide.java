package org.nowstart.tidepy.data.type;

public enum OrderSide {
    BUY,
    SELL
}
