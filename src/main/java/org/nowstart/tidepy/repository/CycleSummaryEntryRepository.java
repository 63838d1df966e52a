package org.nowstart.tidepy.repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.nowstart.tidepy.data.entity.CycleSummaryEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CycleSummaryEntryRepository extends JpaRepository<CycleSummaryEntry, UUID> {

    Optional<CycleSummaryEntry> findFirstByCycleTimestamp(Instant cycleTimestamp);
}
