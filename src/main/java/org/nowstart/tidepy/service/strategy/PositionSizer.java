package org.nowstart.tidepy.service.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.model.PortfolioView;
import org.nowstart.tidepy.data.model.PositionDelta;
import org.nowstart.tidepy.data.model.PositionState;
import org.nowstart.tidepy.data.model.Signal;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.springframework.stereotype.Service;

/**
 * Proposes exposure changes from the ranked signals. Proposals are advisory; the risk manager has the
 * final say on every one of them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSizer {

    static final BigDecimal BASE_FACTOR = new BigDecimal("0.4");
    static final BigDecimal STRENGTH_FACTOR = new BigDecimal("0.6");

    private final TradingProperties tradingProperties;

    public List<PositionDelta> size(List<Signal> signals, PortfolioView portfolio) {
        BigDecimal minOrderNotional = tradingProperties.sizing().minOrderNotional();
        BigDecimal entryCap = portfolio.entryNotionalCap();
        BigDecimal maxCap = portfolio.maxNotionalCap();

        List<PositionDelta> deltas = new ArrayList<>();
        Set<String> signaled = new HashSet<>();

        for (Signal signal : signals) {
            signaled.add(signal.asset());
            BigDecimal current = portfolio.currentNotional(signal.asset());
            BigDecimal adjusted = strengthAdjusted(entryCap, signal.strengthScore());

            PositionDelta delta;
            if (current.signum() == 0) {
                delta = new PositionDelta(signal.asset(), adjusted.min(entryCap), DeltaReason.NEW_SIGNAL);
            } else if (current.compareTo(maxCap) < 0) {
                delta = new PositionDelta(signal.asset(), adjusted.min(maxCap.subtract(current)), DeltaReason.SCALE_UP);
            } else {
                continue;
            }

            if (delta.targetChangeNotional().compareTo(minOrderNotional) >= 0) {
                deltas.add(delta);
            }
        }

        for (PositionState position : new TreeMap<>(portfolio.positions()).values()) {
            if (signaled.contains(position.asset()) || position.isFlat()) {
                continue;
            }
            // full closes bypass the minimum order size so dust never gets stranded
            deltas.add(new PositionDelta(position.asset(), position.currentNotional().negate(), DeltaReason.SCALE_DOWN));
        }

        log.info("event=position_sizing signals={} deltas={} equity={}", signals.size(), deltas.size(), portfolio.equity());
        return deltas;
    }

    BigDecimal strengthAdjusted(BigDecimal entryCap, double strength) {
        BigDecimal clamped = BigDecimal.valueOf(Math.max(0.0, Math.min(1.0, strength)));
        return entryCap.multiply(BASE_FACTOR.add(STRENGTH_FACTOR.multiply(clamped)))
                .setScale(8, RoundingMode.DOWN);
    }
}
