package org.nowstart.tidepy.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceTickerResponse(
        String symbol,
        BigDecimal lastPrice,
        // 24h traded value in the quote asset (USDT)
        BigDecimal quoteVolume
) {
}
