package org.nowstart.tidepy.service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.model.CycleSummary;
import org.nowstart.tidepy.data.type.CycleStatus;
import org.nowstart.tidepy.service.storage.StrategyStorageService;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CycleSummaryService {

    private final StrategyStorageService strategyStorageService;
    private final AtomicReference<CycleSummary> latest = new AtomicReference<>();

    public void publish(CycleSummary summary) {
        log.info(
                "event=cycle_summary cycle_ts={} status={} factors={} funding_gated={} signals={} forced={} sized={} approved={} rejected={} settled={} filled={} failed={} pending={} diagnostics={} abort_reason=\"{}\"",
                summary.cycleTimestamp(),
                summary.status(),
                summary.factorCount(),
                summary.fundingGatedCount(),
                summary.signalCount(),
                summary.forcedDeltaCount(),
                summary.sizedDeltaCount(),
                summary.approvedCount(),
                summary.rejectedCount(),
                summary.settledOrderCount(),
                summary.filledOrderCount(),
                summary.failedOrderCount(),
                summary.pendingOrderCount(),
                summary.diagnostics().size(),
                summary.abortReason()
        );
        if (summary.status() == CycleStatus.SKIPPED) {
            return;
        }
        latest.set(summary);
        strategyStorageService.appendCycleSummary(summary);
    }

    public Optional<CycleSummary> latest() {
        return Optional.ofNullable(latest.get());
    }
}
