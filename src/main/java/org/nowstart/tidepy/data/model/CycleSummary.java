package org.nowstart.tidepy.data.model;

import java.time.Instant;
import java.util.List;
import org.nowstart.tidepy.data.type.CycleStatus;

public record CycleSummary(
        Instant cycleTimestamp,
        Instant startedAt,
        Instant finishedAt,
        CycleStatus status,
        String abortReason,
        int factorCount,
        int fundingGatedCount,
        int signalCount,
        int forcedDeltaCount,
        int sizedDeltaCount,
        int approvedCount,
        int rejectedCount,
        int settledOrderCount,
        int filledOrderCount,
        int failedOrderCount,
        int pendingOrderCount,
        List<CycleDiagnostic> diagnostics
) {

    public CycleSummary {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static CycleSummary skipped(Instant now) {
        return new CycleSummary(null, now, now, CycleStatus.SKIPPED, "previous cycle still running",
                0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of());
    }

    public static CycleSummary aborted(Instant cycleTimestamp, Instant startedAt, Instant finishedAt,
                                       String reason, List<CycleDiagnostic> diagnostics) {
        return new CycleSummary(cycleTimestamp, startedAt, finishedAt, CycleStatus.ABORTED, reason,
                0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, diagnostics);
    }
}
