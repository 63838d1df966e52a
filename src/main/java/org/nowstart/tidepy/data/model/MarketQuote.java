package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One asset's view inside a snapshot. Any field may be null when the source did not provide it.
 *
 * @param priceWindow recent daily closes, oldest first
 */
public record MarketQuote(
        String symbol,
        BigDecimal price,
        BigDecimal fundingRate,
        BigDecimal volume24h,
        BigDecimal marketCap,
        List<BigDecimal> priceWindow
) {

    public MarketQuote {
        priceWindow = priceWindow == null ? List.of() : List.copyOf(priceWindow.stream()
                .filter(value -> value != null)
                .toList());
    }
}
