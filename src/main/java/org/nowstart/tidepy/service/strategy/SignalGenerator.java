package org.nowstart.tidepy.service.strategy;

import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.model.FactorRecord;
import org.nowstart.tidepy.data.model.Signal;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.SignalDirection;
import org.nowstart.tidepy.data.type.TrackTag;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SignalGenerator {

    private static final Comparator<ScoredRecord> RANKING = Comparator
            .comparingDouble(ScoredRecord::strength).reversed()
            .thenComparing(scored -> scored.record().unlockProgressRatio())
            .thenComparing(scored -> scored.record().asset());

    private final TradingProperties tradingProperties;

    /**
     * Ranks every eligible record: strongest first, then lower unlock progress, then symbol.
     */
    public List<Signal> generate(List<FactorRecord> records) {
        double minStrength = tradingProperties.scoring().minStrength().doubleValue();

        List<Signal> signals = records.stream()
                .filter(this::isEligible)
                .map(record -> new ScoredRecord(record, strength(record)))
                .filter(scored -> scored.strength() >= minStrength)
                .sorted(RANKING)
                .map(scored -> new Signal(
                        scored.record().asset(),
                        SignalDirection.SHORT,
                        scored.strength(),
                        scored.record().cycleTimestamp()
                ))
                .toList();

        log.info("event=signal_generation records={} signals={}", records.size(), signals.size());
        return signals;
    }

    boolean isEligible(FactorRecord record) {
        if (record.trackTag() == TrackTag.DEFI) {
            return false;
        }
        return record.unlockProgressRatio().compareTo(tradingProperties.scoring().unlockThreshold()) <= 0;
    }

    double strength(FactorRecord record) {
        TradingProperties.Scoring scoring = tradingProperties.scoring();
        double pumpWeight = scoring.pumpScoreWeight().doubleValue();
        double liquidityWeight = scoring.liquidityWeight().doubleValue();
        double trackWeight = scoring.trackWeight().doubleValue();
        double totalWeight = pumpWeight + liquidityWeight + trackWeight;
        if (totalWeight <= 0.0) {
            return 0.0;
        }

        double weighted = pumpWeight * record.pumpScore()
                + liquidityWeight * (record.liquidityTier() / 3.0)
                + trackWeight * trackScore(record.trackTag());
        return weighted / totalWeight;
    }

    static double trackScore(TrackTag trackTag) {
        return switch (trackTag) {
            case MEME -> 1.0;
            case DEFI -> 0.0;
            case INFRA, OTHER -> 0.5;
        };
    }

    private record ScoredRecord(FactorRecord record, double strength) {
    }
}
