package org.nowstart.tidepy.repository;

import java.util.List;
import org.nowstart.tidepy.data.entity.OrderEventEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrderEventEntryRepository extends JpaRepository<OrderEventEntry, String> {

    List<OrderEventEntry> findTop50ByOrderBySettledAtDesc();
}
