package org.nowstart.tidepy.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceExchangeInfoResponse(
        List<SymbolInfo> symbols
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SymbolInfo(
            String symbol,
            String status,
            List<SymbolFilter> filters
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SymbolFilter(
            String filterType,
            BigDecimal stepSize,
            BigDecimal minQty
    ) {
    }
}
