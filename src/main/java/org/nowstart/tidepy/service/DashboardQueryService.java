package org.nowstart.tidepy.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.tidepy.data.dto.OrderDto;
import org.nowstart.tidepy.data.dto.PnlSummaryDto;
import org.nowstart.tidepy.data.dto.SignalDto;
import org.nowstart.tidepy.data.exception.TidepyApiException;
import org.nowstart.tidepy.data.model.CycleSummary;
import org.nowstart.tidepy.data.model.PortfolioView;
import org.nowstart.tidepy.data.model.PositionState;
import org.nowstart.tidepy.service.execution.OrderExecutionEngine;
import org.nowstart.tidepy.service.risk.RiskManager;
import org.nowstart.tidepy.service.storage.StrategyStorageService;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Read side for the dashboard. Nothing here can change engine state.
 */
@Service
@RequiredArgsConstructor
public class DashboardQueryService {

    private final RiskManager riskManager;
    private final OrderExecutionEngine orderExecutionEngine;
    private final CycleSummaryService cycleSummaryService;
    private final StrategyStorageService strategyStorageService;

    public List<PositionState> getPositions() {
        return riskManager.positions();
    }

    public CycleSummary getLatestCycle() {
        return cycleSummaryService.latest()
                .orElseThrow(() -> new TidepyApiException(HttpStatus.NOT_FOUND, "no_cycle", "No cycle has run yet"));
    }

    public CycleSummary getCycle(Instant cycleTimestamp) {
        return strategyStorageService.findCycleSummary(cycleTimestamp)
                .orElseThrow(() -> new TidepyApiException(
                        HttpStatus.NOT_FOUND,
                        "cycle_not_found",
                        "No cycle summary stored for " + cycleTimestamp
                ));
    }

    public PnlSummaryDto getPnl() {
        PortfolioView view = riskManager.snapshot();
        BigDecimal unrealized = view.positions().values().stream()
                .map(PositionState::unrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new PnlSummaryDto(
                view.equity(),
                view.aggregateNotional(),
                view.portfolioCeiling(),
                unrealized,
                riskManager.totalRealizedPnl(),
                view.positions().size(),
                view.inflightAssets().size()
        );
    }

    public List<OrderDto> getActiveOrders() {
        return orderExecutionEngine.activeOrders().stream()
                .map(OrderDto::from)
                .toList();
    }

    public List<OrderDto> getRecentOrders() {
        return strategyStorageService.findRecentOrderEvents().stream()
                .map(OrderDto::from)
                .toList();
    }

    public List<SignalDto> getSignals(Instant cycleTimestamp) {
        Instant resolved = cycleTimestamp != null
                ? cycleTimestamp
                : getLatestCycle().cycleTimestamp();
        return strategyStorageService.findSignals(resolved).stream()
                .map(SignalDto::from)
                .toList();
    }
}
