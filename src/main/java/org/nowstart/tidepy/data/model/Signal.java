package org.nowstart.tidepy.data.model;

import java.time.Instant;
import org.nowstart.tidepy.data.type.SignalDirection;

public record Signal(
        String asset,
        SignalDirection direction,
        double strengthScore,
        Instant cycleTimestamp
) {
}
