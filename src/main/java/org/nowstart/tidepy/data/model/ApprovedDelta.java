package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.data.type.RejectionReason;

/**
 * A delta the risk manager accepted, holding the asset's inflight reservation under {@code orderId}.
 *
 * @param delta             the delta after clamping
 * @param requestedNotional absolute notional the order should execute
 * @param reduceQuantity    quantity to buy back for reductions, null for increases
 * @param clampReason       why the delta was shrunk, null when it passed untouched
 */
public record ApprovedDelta(
        String orderId,
        PositionDelta delta,
        BigDecimal requestedNotional,
        BigDecimal reduceQuantity,
        RejectionReason clampReason
) {

    public String asset() {
        return delta.asset();
    }

    public boolean isIncrease() {
        return delta.isIncrease();
    }

    public OrderSide side() {
        return delta.isIncrease() ? OrderSide.SELL : OrderSide.BUY;
    }
}
