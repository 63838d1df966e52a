package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import org.nowstart.tidepy.data.type.DeltaReason;

/**
 * Proposed exposure change. A positive target adds short exposure, a negative one reduces it.
 */
public record PositionDelta(
        String asset,
        BigDecimal targetChangeNotional,
        DeltaReason reason
) {

    public boolean isIncrease() {
        return targetChangeNotional.signum() > 0;
    }
}
