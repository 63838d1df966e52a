package org.nowstart.tidepy.service.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.model.CycleDiagnostic;
import org.nowstart.tidepy.data.model.FactorComputation;
import org.nowstart.tidepy.data.model.FactorRecord;
import org.nowstart.tidepy.data.model.MarketQuote;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.nowstart.tidepy.data.property.AssetCatalogProperties;
import org.nowstart.tidepy.data.property.AssetCatalogProperties.AssetProfile;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.TrackTag;
import org.springframework.stereotype.Service;

/**
 * Turns a market snapshot into one factor record per tradable asset. Stateless; the same snapshot always
 * yields the same computation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactorEngine {

    static final BigDecimal TIER_3_TURNOVER_RATIO = new BigDecimal("0.5");
    static final BigDecimal TIER_2_TURNOVER_RATIO = new BigDecimal("0.1");

    private final TradingProperties tradingProperties;
    private final AssetCatalogProperties assetCatalogProperties;

    public FactorComputation compute(MarketSnapshot snapshot) {
        List<FactorRecord> records = new ArrayList<>();
        List<CycleDiagnostic> dataGaps = new ArrayList<>();
        List<String> fundingGated = new ArrayList<>();

        for (MarketQuote quote : snapshot.quotes().values()) {
            String asset = quote.symbol();
            if (quote.fundingRate() == null) {
                dataGaps.add(CycleDiagnostic.dataGap(asset, "funding_rate"));
                continue;
            }
            if (quote.fundingRate().signum() < 0) {
                fundingGated.add(asset);
                log.debug("event=funding_gate asset={} funding_rate={}", asset, quote.fundingRate());
                continue;
            }

            Optional<String> missingField = findMissingField(quote);
            if (missingField.isPresent()) {
                dataGaps.add(CycleDiagnostic.dataGap(asset, missingField.get()));
                continue;
            }

            Optional<AssetProfile> profile = assetCatalogProperties.find(asset);
            BigDecimal unlockProgress = profile.map(AssetProfile::unlockProgress).orElse(null);
            if (unlockProgress == null || unlockProgress.signum() < 0 || unlockProgress.compareTo(BigDecimal.ONE) > 0) {
                dataGaps.add(CycleDiagnostic.dataGap(asset, "unlock_progress"));
                continue;
            }

            TrackTag track = profile.map(AssetProfile::track).orElse(TrackTag.OTHER);
            records.add(new FactorRecord(
                    asset,
                    snapshot.timestamp(),
                    quote.fundingRate(),
                    liquidityTier(quote.volume24h(), quote.marketCap()),
                    pumpScore(quote.priceWindow()),
                    track == null ? TrackTag.OTHER : track,
                    unlockProgress
            ));
        }

        log.info(
                "event=factor_computation cycle_ts={} assets={} records={} data_gaps={} funding_gated={}",
                snapshot.timestamp(),
                snapshot.quotes().size(),
                records.size(),
                dataGaps.size(),
                fundingGated.size()
        );
        return new FactorComputation(records, dataGaps, fundingGated);
    }

    int liquidityTier(BigDecimal volume24h, BigDecimal marketCap) {
        TradingProperties.Factor factor = tradingProperties.factor();
        if (volume24h.compareTo(factor.minTurnover()) < 0 || marketCap.compareTo(factor.minMarketCap()) < 0) {
            return 0;
        }

        BigDecimal turnoverRatio = volume24h.divide(marketCap, 12, RoundingMode.HALF_UP);
        if (turnoverRatio.compareTo(TIER_3_TURNOVER_RATIO) >= 0) {
            return 3;
        }
        if (turnoverRatio.compareTo(TIER_2_TURNOVER_RATIO) >= 0) {
            return 2;
        }
        return 1;
    }

    /**
     * Largest run-up from any earlier low to a later close, relative to the configured reference gain.
     */
    double pumpScore(List<BigDecimal> priceWindow) {
        double runningMin = Double.NaN;
        double maxGain = 0.0;
        for (BigDecimal price : priceWindow) {
            if (price.signum() <= 0) {
                continue;
            }
            double value = price.doubleValue();
            if (!Double.isNaN(runningMin)) {
                maxGain = Math.max(maxGain, value / runningMin - 1.0);
            }
            runningMin = Double.isNaN(runningMin) ? value : Math.min(runningMin, value);
        }

        double score = maxGain / tradingProperties.factor().pumpReferenceGain().doubleValue();
        return Math.max(0.0, Math.min(1.0, score));
    }

    private Optional<String> findMissingField(MarketQuote quote) {
        if (quote.price() == null || quote.price().signum() <= 0) {
            return Optional.of("price");
        }
        if (quote.volume24h() == null || quote.volume24h().signum() < 0) {
            return Optional.of("volume_24h");
        }
        if (quote.marketCap() == null || quote.marketCap().signum() <= 0) {
            return Optional.of("market_cap");
        }
        long validPoints = quote.priceWindow().stream()
                .filter(price -> price.signum() > 0)
                .count();
        if (validPoints < 2) {
            return Optional.of("price_window");
        }
        return Optional.empty();
    }
}
