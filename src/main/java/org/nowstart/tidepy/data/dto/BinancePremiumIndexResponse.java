package org.nowstart.tidepy.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinancePremiumIndexResponse(
        String symbol,
        BigDecimal markPrice,
        BigDecimal lastFundingRate,
        Long time
) {
}
