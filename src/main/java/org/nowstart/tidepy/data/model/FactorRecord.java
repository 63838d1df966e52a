package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.tidepy.data.type.TrackTag;

public record FactorRecord(
        String asset,
        Instant cycleTimestamp,
        BigDecimal fundingRate,
        int liquidityTier,
        double pumpScore,
        TrackTag trackTag,
        BigDecimal unlockProgressRatio
) {
}
