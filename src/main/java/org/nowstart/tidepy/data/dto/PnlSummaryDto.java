package org.nowstart.tidepy.data.dto;

import java.math.BigDecimal;

public record PnlSummaryDto(
        BigDecimal equity,
        BigDecimal aggregateNotional,
        BigDecimal portfolioCeiling,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        int openPositions,
        int inflightOrders
) {
}
