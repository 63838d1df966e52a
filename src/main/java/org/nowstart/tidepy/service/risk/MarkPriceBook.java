package org.nowstart.tidepy.service.risk;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.springframework.stereotype.Component;

/**
 * Latest mark price per asset, refreshed from every snapshot. Used for unrealized PnL, paper fills and
 * order quantities; it never touches committed exposure.
 */
@Component
public class MarkPriceBook {

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public void update(MarketSnapshot snapshot) {
        snapshot.quotes().values().forEach(quote -> {
            if (quote.price() != null && quote.price().signum() > 0) {
                prices.put(quote.symbol(), quote.price());
            }
        });
    }

    public void update(String asset, BigDecimal price) {
        if (asset != null && price != null && price.signum() > 0) {
            prices.put(asset, price);
        }
    }

    public Optional<BigDecimal> price(String asset) {
        return Optional.ofNullable(prices.get(asset));
    }
}
