package org.nowstart.tidepy.service.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tidepy.TradingPropertiesFixture;
import org.nowstart.tidepy.data.model.CycleDiagnostic;
import org.nowstart.tidepy.data.model.FactorComputation;
import org.nowstart.tidepy.data.model.FactorRecord;
import org.nowstart.tidepy.data.model.MarketQuote;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.TrackTag;

class FactorEngineTest {

    private static final Instant CYCLE = Instant.parse("2026-01-05T00:00:00Z");

    private final FactorEngine factorEngine = new FactorEngine(
            TradingPropertiesFixture.defaults(),
            TradingPropertiesFixture.catalog()
    );

    @Test
    void compute_dropsNegativeFundingAssetsBeforeSignals() {
        MarketSnapshot snapshot = snapshot(
                quote("DOGEUSDT", "-0.001", "6000000", "10000000", "1", "2"),
                quote("ARBUSDT", "0.0002", "6000000", "10000000", "1", "2")
        );

        FactorComputation computation = factorEngine.compute(snapshot);

        assertThat(computation.fundingGated()).containsExactly("DOGEUSDT");
        assertThat(computation.records()).extracting(FactorRecord::asset).containsExactly("ARBUSDT");
        assertThat(computation.dataGaps()).isEmpty();
    }

    @Test
    void compute_reportsDataGapForMissingFieldsAndKeepsOtherAssets() {
        MarketSnapshot snapshot = snapshot(
                new MarketQuote("DOGEUSDT", null, new BigDecimal("0.0001"), new BigDecimal("6000000"),
                        new BigDecimal("10000000"), List.of(BigDecimal.ONE, BigDecimal.TEN)),
                new MarketQuote("UNIUSDT", BigDecimal.ONE, null, new BigDecimal("6000000"),
                        new BigDecimal("10000000"), List.of(BigDecimal.ONE, BigDecimal.TEN)),
                quote("ARBUSDT", "0.0002", "6000000", "10000000", "1")
        );

        FactorComputation computation = factorEngine.compute(snapshot);

        assertThat(computation.records()).isEmpty();
        assertThat(computation.dataGaps())
                .extracting(CycleDiagnostic::asset, CycleDiagnostic::message)
                .containsExactly(
                        tuple("ARBUSDT", "missing or invalid price_window"),
                        tuple("DOGEUSDT", "missing or invalid price"),
                        tuple("UNIUSDT", "missing or invalid funding_rate")
                );
        assertThat(computation.dataGaps()).allMatch(gap -> gap.category() == ErrorCategory.DATA_GAP);
    }

    @Test
    void compute_requiresUnlockProgressFromCatalog() {
        MarketSnapshot snapshot = snapshot(
                quote("NOUNLOCKUSDT", "0.0001", "6000000", "10000000", "1", "2"),
                quote("UNLISTEDUSDT", "0.0001", "6000000", "10000000", "1", "2")
        );

        FactorComputation computation = factorEngine.compute(snapshot);

        assertThat(computation.records()).isEmpty();
        assertThat(computation.dataGaps())
                .extracting(CycleDiagnostic::message)
                .containsOnly("missing or invalid unlock_progress");
    }

    @Test
    void compute_buildsRecordFromCatalogAndSnapshot() {
        FactorComputation computation = factorEngine.compute(snapshot(
                quote("DOGEUSDT", "0.0003", "2000000", "10000000", "1.0", "2.0", "1.5")
        ));

        FactorRecord record = computation.records().get(0);
        assertThat(record.asset()).isEqualTo("DOGEUSDT");
        assertThat(record.cycleTimestamp()).isEqualTo(CYCLE);
        assertThat(record.fundingRate()).isEqualByComparingTo("0.0003");
        assertThat(record.liquidityTier()).isEqualTo(2);
        assertThat(record.pumpScore()).isCloseTo(1.0, within(1e-9));
        assertThat(record.trackTag()).isEqualTo(TrackTag.MEME);
        assertThat(record.unlockProgressRatio()).isEqualByComparingTo("0.5");
    }

    @Test
    void liquidityTier_followsTurnoverThresholds() {
        assertThat(factorEngine.liquidityTier(new BigDecimal("999999"), new BigDecimal("50000000"))).isZero();
        assertThat(factorEngine.liquidityTier(new BigDecimal("5000000"), new BigDecimal("9000000"))).isZero();
        assertThat(factorEngine.liquidityTier(new BigDecimal("6000000"), new BigDecimal("10000000"))).isEqualTo(3);
        assertThat(factorEngine.liquidityTier(new BigDecimal("2000000"), new BigDecimal("10000000"))).isEqualTo(2);
        assertThat(factorEngine.liquidityTier(new BigDecimal("1000000"), new BigDecimal("20000000"))).isEqualTo(1);
    }

    @Test
    void pumpScore_measuresLargestRunUpFromEarlierLow() {
        assertThat(factorEngine.pumpScore(decimals("2", "1", "1.5"))).isCloseTo(0.5, within(1e-9));
        assertThat(factorEngine.pumpScore(decimals("4", "3", "2", "1"))).isZero();
        assertThat(factorEngine.pumpScore(decimals("1", "5"))).isEqualTo(1.0);
        assertThat(factorEngine.pumpScore(decimals("1", "1.2", "0.8", "1.0"))).isCloseTo(0.25, within(1e-9));
    }

    private static MarketSnapshot snapshot(MarketQuote... quotes) {
        Map<String, MarketQuote> map = new HashMap<>();
        for (MarketQuote quote : quotes) {
            map.put(quote.symbol(), quote);
        }
        return new MarketSnapshot(CYCLE, map);
    }

    private static MarketQuote quote(String symbol, String funding, String volume, String marketCap, String... closes) {
        return new MarketQuote(
                symbol,
                new BigDecimal(closes[closes.length - 1]),
                new BigDecimal(funding),
                new BigDecimal(volume),
                new BigDecimal(marketCap),
                decimals(closes)
        );
    }

    private static List<BigDecimal> decimals(String... values) {
        return Arrays.stream(values).map(BigDecimal::new).toList();
    }
}
