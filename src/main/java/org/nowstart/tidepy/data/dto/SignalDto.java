package org.nowstart.tidepy.data.dto;

import java.time.Instant;
import org.nowstart.tidepy.data.entity.SignalEntry;
import org.nowstart.tidepy.data.type.SignalDirection;

public record SignalDto(
        Instant cycleTimestamp,
        int rank,
        String asset,
        SignalDirection direction,
        double strengthScore
) {

    public static SignalDto from(SignalEntry entry) {
        return new SignalDto(
                entry.getCycleTimestamp(),
                entry.getRankPosition(),
                entry.getAsset(),
                entry.getDirection(),
                entry.getStrengthScore()
        );
    }
}
