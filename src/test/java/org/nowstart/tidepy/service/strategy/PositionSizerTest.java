package org.nowstart.tidepy.service.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.tidepy.TradingPropertiesFixture;
import org.nowstart.tidepy.data.model.PortfolioView;
import org.nowstart.tidepy.data.model.PositionDelta;
import org.nowstart.tidepy.data.model.PositionState;
import org.nowstart.tidepy.data.model.Signal;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.nowstart.tidepy.data.type.SignalDirection;

class PositionSizerTest {

    private static final Instant CYCLE = Instant.parse("2026-01-05T00:00:00Z");

    private final PositionSizer positionSizer = new PositionSizer(TradingPropertiesFixture.defaults());

    @Test
    void size_capsNewEntryAtEntryCapRegardlessOfStrength() {
        List<PositionDelta> deltas = positionSizer.size(
                List.of(signal("YUSDT", 1.0), signal("HALFUSDT", 0.5)),
                portfolio(Map.of())
        );

        assertThat(deltas)
                .extracting(PositionDelta::asset, PositionDelta::reason)
                .containsExactly(
                        tuple("YUSDT", DeltaReason.NEW_SIGNAL),
                        tuple("HALFUSDT", DeltaReason.NEW_SIGNAL)
                );
        assertThat(deltas.get(0).targetChangeNotional()).isEqualByComparingTo("2500");
        assertThat(deltas.get(1).targetChangeNotional()).isEqualByComparingTo("1750");
    }

    @Test
    void size_scalesUpOnlyToMaxCapHeadroom() {
        List<PositionDelta> deltas = positionSizer.size(
                List.of(signal("ZUSDT", 1.0), signal("FULLUSDT", 1.0)),
                portfolio(Map.of("ZUSDT", "4000", "FULLUSDT", "5000"))
        );

        assertThat(deltas).hasSize(1);
        assertThat(deltas.get(0).reason()).isEqualTo(DeltaReason.SCALE_UP);
        assertThat(deltas.get(0).targetChangeNotional()).isEqualByComparingTo("1000");
    }

    @Test
    void size_unwindsHeldAssetsWithoutSignalAfterSignalDeltasInSymbolOrder() {
        List<PositionDelta> deltas = positionSizer.size(
                List.of(signal("NEWUSDT", 1.0)),
                portfolio(Map.of("ZZZUSDT", "300", "AAAUSDT", "200"))
        );

        assertThat(deltas)
                .extracting(PositionDelta::asset, PositionDelta::reason)
                .containsExactly(
                        tuple("NEWUSDT", DeltaReason.NEW_SIGNAL),
                        tuple("AAAUSDT", DeltaReason.SCALE_DOWN),
                        tuple("ZZZUSDT", DeltaReason.SCALE_DOWN)
                );
        assertThat(deltas.get(1).targetChangeNotional()).isEqualByComparingTo("-200");
        assertThat(deltas.get(2).targetChangeNotional()).isEqualByComparingTo("-300");
    }

    @Test
    void size_skipsIncreasesBelowMinimumOrderNotional() {
        List<PositionDelta> deltas = positionSizer.size(
                List.of(signal("EDGEUSDT", 1.0)),
                portfolio(Map.of("EDGEUSDT", "4998"))
        );

        assertThat(deltas).isEmpty();
    }

    @Test
    void size_closesDustPositionWithoutSignal() {
        List<PositionDelta> deltas = positionSizer.size(List.of(), portfolio(Map.of("WIFUSDT", "3")));

        assertThat(deltas)
                .extracting(PositionDelta::asset, PositionDelta::reason)
                .containsExactly(tuple("WIFUSDT", DeltaReason.SCALE_DOWN));
        assertThat(deltas.get(0).targetChangeNotional()).isEqualByComparingTo("-3");
    }

    @Test
    void size_isDeterministicForSameInputs() {
        List<Signal> signals = List.of(signal("AUSDT", 0.9), signal("BUSDT", 0.4), signal("CUSDT", 0.7));
        PortfolioView portfolio = portfolio(Map.of("BUSDT", "1200", "DUSDT", "800"));

        assertThat(positionSizer.size(signals, portfolio)).isEqualTo(positionSizer.size(signals, portfolio));
    }

    private static Signal signal(String asset, double strength) {
        return new Signal(asset, SignalDirection.SHORT, strength, CYCLE);
    }

    private static PortfolioView portfolio(Map<String, String> notionals) {
        Map<String, PositionState> positions = new HashMap<>();
        BigDecimal aggregate = BigDecimal.ZERO;
        for (Map.Entry<String, String> entry : notionals.entrySet()) {
            BigDecimal notional = new BigDecimal(entry.getValue());
            aggregate = aggregate.add(notional);
            positions.put(entry.getKey(), new PositionState(
                    entry.getKey(),
                    notional,
                    notional,
                    BigDecimal.ONE,
                    new BigDecimal("2500"),
                    new BigDecimal("5000"),
                    BigDecimal.ZERO,
                    BigDecimal.ZERO
            ));
        }
        return new PortfolioView(
                new BigDecimal("100000"),
                new BigDecimal("2500"),
                new BigDecimal("5000"),
                aggregate,
                new BigDecimal("50000"),
                positions,
                Set.of()
        );
    }
}
