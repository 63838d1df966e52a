package org.nowstart.tidepy.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.tidepy.service.CycleCoordinator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CycleScheduler {

    private final CycleCoordinator cycleCoordinator;

    @Scheduled(fixedRateString = "${tidepy.trading.cycle-interval:60s}")
    public void run() {
        cycleCoordinator.runOnce();
    }
}
