package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import org.nowstart.tidepy.data.type.OrderSide;

/**
 * One market order as handed to an exchange gateway.
 */
public record OrderTicket(
        String asset,
        OrderSide side,
        BigDecimal notional,
        BigDecimal quantity,
        boolean reduceOnly,
        String clientOrderId
) {
}
