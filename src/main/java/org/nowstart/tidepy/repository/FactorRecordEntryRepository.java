package org.nowstart.tidepy.repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.nowstart.tidepy.data.entity.FactorRecordEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FactorRecordEntryRepository extends JpaRepository<FactorRecordEntry, UUID> {

    List<FactorRecordEntry> findByCycleTimestampOrderByAssetAsc(Instant cycleTimestamp);
}
