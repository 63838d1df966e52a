package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;

public record ExchangeOrderState(
        String exchangeOrderId,
        ExchangeOrderPhase phase,
        BigDecimal filledQuantity,
        BigDecimal filledNotional,
        BigDecimal avgPrice
) {

    public boolean isClosed() {
        return phase.isClosed();
    }
}
