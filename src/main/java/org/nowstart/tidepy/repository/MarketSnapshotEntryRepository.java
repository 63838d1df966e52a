package org.nowstart.tidepy.repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.nowstart.tidepy.data.entity.MarketSnapshotEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MarketSnapshotEntryRepository extends JpaRepository<MarketSnapshotEntry, UUID> {

    List<MarketSnapshotEntry> findByCycleTimestampOrderByAssetAsc(Instant cycleTimestamp);
}
