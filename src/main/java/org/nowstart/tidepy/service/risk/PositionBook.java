package org.nowstart.tidepy.service.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Getter;
import org.nowstart.tidepy.data.model.PositionState;

/**
 * Mutable short position for one asset. Only {@link RiskManager} touches it, under the asset's lock.
 */
@Getter
class PositionBook {

    private static final int SCALE = 12;

    private final String asset;
    private BigDecimal currentNotional = BigDecimal.ZERO;
    private BigDecimal quantity = BigDecimal.ZERO;
    private BigDecimal avgEntryPrice = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    PositionBook(String asset) {
        this.asset = asset;
    }

    void addShort(BigDecimal notional, BigDecimal filledQuantity) {
        currentNotional = currentNotional.add(notional);
        quantity = quantity.add(filledQuantity);
        avgEntryPrice = quantity.signum() > 0
                ? currentNotional.divide(quantity, SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
    }

    /**
     * Buys back part of the short at {@code fillPrice}; the released cost basis leaves at the average entry.
     */
    void reduceShort(BigDecimal filledQuantity, BigDecimal fillPrice) {
        if (filledQuantity.compareTo(quantity) >= 0) {
            realizedPnl = realizedPnl.add(avgEntryPrice.subtract(fillPrice).multiply(quantity));
            currentNotional = BigDecimal.ZERO;
            quantity = BigDecimal.ZERO;
            avgEntryPrice = BigDecimal.ZERO;
            return;
        }

        realizedPnl = realizedPnl.add(avgEntryPrice.subtract(fillPrice).multiply(filledQuantity));
        quantity = quantity.subtract(filledQuantity);
        currentNotional = avgEntryPrice.multiply(quantity).setScale(SCALE, RoundingMode.HALF_UP);
    }

    boolean isFlat() {
        return currentNotional.signum() == 0;
    }

    BigDecimal unrealizedPnl(BigDecimal markPrice) {
        if (markPrice == null || isFlat()) {
            return BigDecimal.ZERO;
        }
        return avgEntryPrice.subtract(markPrice).multiply(quantity).setScale(8, RoundingMode.HALF_UP);
    }

    PositionState toState(BigDecimal entryCap, BigDecimal maxCap, BigDecimal markPrice) {
        return new PositionState(
                asset,
                currentNotional,
                quantity,
                avgEntryPrice,
                entryCap,
                maxCap,
                unrealizedPnl(markPrice),
                realizedPnl
        );
    }
}
