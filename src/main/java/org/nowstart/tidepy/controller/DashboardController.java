package org.nowstart.tidepy.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.List;
import org.nowstart.tidepy.data.dto.OrderDto;
import org.nowstart.tidepy.data.dto.PnlSummaryDto;
import org.nowstart.tidepy.data.dto.SignalDto;
import org.nowstart.tidepy.data.model.CycleSummary;
import org.nowstart.tidepy.data.model.PositionState;
import org.nowstart.tidepy.service.DashboardQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@Tag(name = "Dashboard", description = "Read-only view of positions, PnL, orders, signals and cycle summaries")
public class DashboardController {

    private final DashboardQueryService dashboardQueryService;

    public DashboardController(DashboardQueryService dashboardQueryService) {
        this.dashboardQueryService = dashboardQueryService;
    }

    @GetMapping("/positions")
    @Operation(summary = "Open positions", description = "Current short positions as owned by the risk manager.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public List<PositionState> getPositions() {
        return dashboardQueryService.getPositions();
    }

    @GetMapping("/pnl")
    @Operation(summary = "PnL summary", description = "Equity, aggregate exposure and realized/unrealized PnL.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public PnlSummaryDto getPnl() {
        return dashboardQueryService.getPnl();
    }

    @GetMapping("/cycles/latest")
    @Operation(summary = "Latest cycle", description = "Summary of the most recent completed or aborted cycle.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "404", description = "No cycle has run yet")
    })
    public CycleSummary getLatestCycle() {
        return dashboardQueryService.getLatestCycle();
    }

    @GetMapping("/cycles/{cycleTimestamp}")
    @Operation(summary = "Cycle by timestamp", description = "Stored summary of one cycle, looked up by its ISO-8601 timestamp.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "400", description = "Malformed timestamp"),
            @ApiResponse(responseCode = "404", description = "No summary stored for that cycle")
    })
    public CycleSummary getCycle(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant cycleTimestamp
    ) {
        return dashboardQueryService.getCycle(cycleTimestamp);
    }

    @GetMapping("/orders/active")
    @Operation(summary = "Active orders", description = "Orders that have not reached a terminal status yet.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public List<OrderDto> getActiveOrders() {
        return dashboardQueryService.getActiveOrders();
    }

    @GetMapping("/orders/recent")
    @Operation(summary = "Recent settled orders", description = "The last settled orders from storage, newest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public List<OrderDto> getRecentOrders() {
        return dashboardQueryService.getRecentOrders();
    }

    @GetMapping("/signals")
    @Operation(summary = "Ranked signals", description = "Signals of one cycle in rank order; defaults to the latest cycle.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "404", description = "No cycle has run yet")
    })
    public List<SignalDto> getSignals(
            @Parameter(description = "ISO-8601 cycle timestamp")
            @RequestParam(value = "cycle", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant cycle
    ) {
        return dashboardQueryService.getSignals(cycle);
    }
}
