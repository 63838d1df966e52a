package org.nowstart.tidepy.repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.nowstart.tidepy.data.entity.SignalEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SignalEntryRepository extends JpaRepository<SignalEntry, UUID> {

    List<SignalEntry> findByCycleTimestampOrderByRankPositionAsc(Instant cycleTimestamp);
}
