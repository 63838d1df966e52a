package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;

/**
 * Read-only copy of one asset's short position.
 *
 * @param currentNotional cost basis of the open short, quantity times average entry price
 */
public record PositionState(
        String asset,
        BigDecimal currentNotional,
        BigDecimal quantity,
        BigDecimal avgEntryPrice,
        BigDecimal entryNotionalCap,
        BigDecimal maxNotionalCap,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl
) {

    public boolean isFlat() {
        return currentNotional.signum() == 0;
    }
}
