package org.nowstart.tidepy.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceAccountResponse(
        BigDecimal totalWalletBalance,
        BigDecimal totalMarginBalance,
        BigDecimal availableBalance
) {
}
