package org.nowstart.tidepy.service.market;

import java.time.Instant;
import org.nowstart.tidepy.data.model.MarketSnapshot;

public interface MarketSnapshotProvider {

    /**
     * Point-in-time view of every tradable asset.
     *
     * @throws org.nowstart.tidepy.data.exception.SnapshotUnavailableException when no usable snapshot exists
     */
    MarketSnapshot getSnapshot(Instant timestamp);
}
