package org.nowstart.tidepy.service.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.dto.BinancePremiumIndexResponse;
import org.nowstart.tidepy.data.dto.BinanceTickerResponse;
import org.nowstart.tidepy.data.exception.SnapshotUnavailableException;
import org.nowstart.tidepy.data.model.MarketQuote;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.nowstart.tidepy.data.property.AssetCatalogProperties;
import org.nowstart.tidepy.data.property.AssetCatalogProperties.AssetProfile;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.repository.BinanceFuturesFeignClient;
import org.springframework.stereotype.Service;

/**
 * Builds snapshots from Binance futures public data for the assets listed in the catalog. Bulk calls
 * (funding and 24h tickers) are required; a failed per-asset kline read only leaves that asset's price
 * window empty so the factor stage drops it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceMarketSnapshotProvider implements MarketSnapshotProvider {

    private static final String DAILY_INTERVAL = "1d";
    private static final int CLOSE_INDEX = 4;

    private final BinanceFuturesFeignClient binanceFuturesFeignClient;
    private final AssetCatalogProperties assetCatalogProperties;
    private final TradingProperties tradingProperties;

    @Override
    public MarketSnapshot getSnapshot(Instant timestamp) {
        Map<String, BinancePremiumIndexResponse> premiumIndexes = new HashMap<>();
        Map<String, BinanceTickerResponse> tickers = new HashMap<>();
        try {
            binanceFuturesFeignClient.getPremiumIndexes()
                    .forEach(index -> premiumIndexes.put(index.symbol(), index));
            binanceFuturesFeignClient.get24hTickers()
                    .forEach(ticker -> tickers.put(ticker.symbol(), ticker));
        } catch (RuntimeException e) {
            throw new SnapshotUnavailableException("Binance market data unavailable: " + e.getMessage(), e);
        }

        Map<String, MarketQuote> quotes = new HashMap<>();
        for (String symbol : assetCatalogProperties.symbols()) {
            BinancePremiumIndexResponse premiumIndex = premiumIndexes.get(symbol);
            BinanceTickerResponse ticker = tickers.get(symbol);

            BigDecimal price = premiumIndex != null && premiumIndex.markPrice() != null
                    ? premiumIndex.markPrice()
                    : ticker == null ? null : ticker.lastPrice();
            BigDecimal circulatingSupply = assetCatalogProperties.find(symbol)
                    .map(AssetProfile::circulatingSupply)
                    .orElse(null);
            BigDecimal marketCap = price == null || circulatingSupply == null ? null : circulatingSupply.multiply(price);

            quotes.put(symbol, new MarketQuote(
                    symbol,
                    price,
                    premiumIndex == null ? null : premiumIndex.lastFundingRate(),
                    ticker == null ? null : ticker.quoteVolume(),
                    marketCap,
                    fetchCloses(symbol, timestamp)
            ));
        }

        log.info("event=market_snapshot cycle_ts={} assets={} premium_indexes={} tickers={}",
                timestamp, quotes.size(), premiumIndexes.size(), tickers.size());
        return new MarketSnapshot(timestamp, quotes);
    }

    List<BigDecimal> fetchCloses(String symbol, Instant timestamp) {
        try {
            List<List<Object>> klines = binanceFuturesFeignClient.getKlines(
                    symbol,
                    DAILY_INTERVAL,
                    timestamp.toEpochMilli(),
                    tradingProperties.factor().priceWindowDays()
            );
            List<BigDecimal> closes = new ArrayList<>();
            if (klines == null) {
                return closes;
            }
            for (List<Object> kline : klines) {
                BigDecimal close = kline == null || kline.size() <= CLOSE_INDEX ? null : parseDecimal(kline.get(CLOSE_INDEX));
                if (close != null) {
                    closes.add(close);
                }
            }
            return closes;
        } catch (RuntimeException e) {
            log.warn("event=kline_fetch_failed asset={} error=\"{}\"", symbol, e.getMessage());
            return List.of();
        }
    }

    private static BigDecimal parseDecimal(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
