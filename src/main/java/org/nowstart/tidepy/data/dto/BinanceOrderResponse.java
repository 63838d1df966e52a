package org.nowstart.tidepy.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceOrderResponse(
        Long orderId,
        String symbol,
        String clientOrderId,
        String status,
        String side,
        BigDecimal origQty,
        BigDecimal executedQty,
        BigDecimal cumQuote,
        BigDecimal avgPrice
) {
}
