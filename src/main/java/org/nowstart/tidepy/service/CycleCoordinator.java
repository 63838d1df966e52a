package org.nowstart.tidepy.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.exception.RiskStateCorruptedException;
import org.nowstart.tidepy.data.model.CycleDiagnostic;
import org.nowstart.tidepy.data.model.CycleSummary;
import org.nowstart.tidepy.data.model.FactorComputation;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.nowstart.tidepy.data.model.Order;
import org.nowstart.tidepy.data.model.PositionDelta;
import org.nowstart.tidepy.data.model.Signal;
import org.nowstart.tidepy.data.model.ValidationResult;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.CycleStatus;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.OrderStatus;
import org.nowstart.tidepy.service.execution.ExchangeGateway;
import org.nowstart.tidepy.service.execution.OrderExecutionEngine;
import org.nowstart.tidepy.service.market.MarketSnapshotProvider;
import org.nowstart.tidepy.service.risk.MarkPriceBook;
import org.nowstart.tidepy.service.risk.RiskManager;
import org.nowstart.tidepy.service.storage.StrategyStorageService;
import org.nowstart.tidepy.service.strategy.FactorEngine;
import org.nowstart.tidepy.service.strategy.PositionSizer;
import org.nowstart.tidepy.service.strategy.SignalGenerator;
import org.springframework.stereotype.Service;

/**
 * Runs one full decision pass. Only a missing snapshot or corrupted risk state aborts a cycle; every other
 * failure is recorded against its asset or order and the pass moves on. Orders still active when the
 * await deadline passes keep running and commit whenever they settle.
 */
@Slf4j
@Service
public class CycleCoordinator {

    private final MarketSnapshotProvider marketSnapshotProvider;
    private final FactorEngine factorEngine;
    private final SignalGenerator signalGenerator;
    private final PositionSizer positionSizer;
    private final RiskManager riskManager;
    private final MarkPriceBook markPriceBook;
    private final OrderExecutionEngine orderExecutionEngine;
    private final ExchangeGateway exchangeGateway;
    private final StrategyStorageService strategyStorageService;
    private final CycleSummaryService cycleSummaryService;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public CycleCoordinator(
            MarketSnapshotProvider marketSnapshotProvider,
            FactorEngine factorEngine,
            SignalGenerator signalGenerator,
            PositionSizer positionSizer,
            RiskManager riskManager,
            MarkPriceBook markPriceBook,
            OrderExecutionEngine orderExecutionEngine,
            ExchangeGateway exchangeGateway,
            StrategyStorageService strategyStorageService,
            CycleSummaryService cycleSummaryService,
            TradingProperties tradingProperties,
            Clock clock
    ) {
        this.marketSnapshotProvider = marketSnapshotProvider;
        this.factorEngine = factorEngine;
        this.signalGenerator = signalGenerator;
        this.positionSizer = positionSizer;
        this.riskManager = riskManager;
        this.markPriceBook = markPriceBook;
        this.orderExecutionEngine = orderExecutionEngine;
        this.exchangeGateway = exchangeGateway;
        this.strategyStorageService = strategyStorageService;
        this.cycleSummaryService = cycleSummaryService;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    public CycleSummary runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("event=cycle_skipped reason=previous_cycle_running");
            CycleSummary skipped = CycleSummary.skipped(clock.instant());
            cycleSummaryService.publish(skipped);
            return skipped;
        }

        try {
            CycleSummary summary = runCycle();
            cycleSummaryService.publish(summary);
            return summary;
        } finally {
            running.set(false);
        }
    }

    private CycleSummary runCycle() {
        Instant startedAt = clock.instant();
        Instant cycleTimestamp = startedAt.truncatedTo(ChronoUnit.SECONDS);
        Instant awaitDeadline = startedAt.plus(tradingProperties.effectiveAwaitTimeout());
        List<CycleDiagnostic> diagnostics = new ArrayList<>();

        MarketSnapshot snapshot;
        try {
            snapshot = marketSnapshotProvider.getSnapshot(cycleTimestamp);
        } catch (RuntimeException e) {
            log.error("event=cycle_aborted cycle_ts={} reason=snapshot_unavailable", cycleTimestamp, e);
            return abort(cycleTimestamp, startedAt, "snapshot unavailable: " + e.getMessage());
        }

        try {
            riskManager.verifyIntegrity();
        } catch (RiskStateCorruptedException e) {
            log.error("event=cycle_aborted cycle_ts={} reason=risk_state_corrupted detail=\"{}\"", cycleTimestamp, e.getMessage());
            return abort(cycleTimestamp, startedAt, "risk state corrupted: " + e.getMessage());
        }

        try {
            return decideAndExecute(snapshot, startedAt, awaitDeadline, diagnostics);
        } catch (RuntimeException e) {
            log.error("event=cycle_aborted cycle_ts={} reason=internal_error", cycleTimestamp, e);
            diagnostics.add(CycleDiagnostic.forAsset(ErrorCategory.INTERNAL, null, e.getMessage()));
            return CycleSummary.aborted(cycleTimestamp, startedAt, clock.instant(), "internal error: " + e.getMessage(), diagnostics);
        }
    }

    private CycleSummary decideAndExecute(MarketSnapshot snapshot, Instant startedAt, Instant awaitDeadline,
                                          List<CycleDiagnostic> diagnostics) {
        Instant cycleTimestamp = snapshot.timestamp();
        refreshEquity();
        markPriceBook.update(snapshot);
        strategyStorageService.appendSnapshot(snapshot);

        FactorComputation factors = factorEngine.compute(snapshot);
        diagnostics.addAll(factors.dataGaps());
        strategyStorageService.appendFactors(cycleTimestamp, factors.records());

        List<Signal> signals = signalGenerator.generate(factors.records());
        strategyStorageService.appendSignals(cycleTimestamp, signals);

        List<PositionDelta> forced = riskManager.evaluatePnl();
        forced.forEach(delta -> diagnostics.add(CycleDiagnostic.forAsset(
                ErrorCategory.RISK_FORCED_OVERRIDE,
                delta.asset(),
                "forced reduction of " + delta.targetChangeNotional().negate()
        )));
        List<PositionDelta> sized = withoutForcedAssets(positionSizer.size(signals, riskManager.snapshot()), forced, diagnostics);

        List<PositionDelta> ordered = new ArrayList<>(forced);
        ordered.addAll(sized);

        int approved = 0;
        int rejected = 0;
        List<CompletableFuture<Order>> submitted = new ArrayList<>();
        for (PositionDelta delta : ordered) {
            try {
                ValidationResult result = riskManager.validate(delta);
                if (!result.approved()) {
                    rejected++;
                    diagnostics.add(CycleDiagnostic.forAsset(
                            ErrorCategory.VALIDATION_REJECTED,
                            delta.asset(),
                            delta.reason() + " rejected: " + result.rejectionReason() + " (" + result.message() + ")"
                    ));
                    continue;
                }
                approved++;
                submitted.add(orderExecutionEngine.submit(result.approvedDelta(), awaitDeadline));
            } catch (RuntimeException e) {
                log.error("event=delta_failed cycle_ts={} asset={} reason={}", cycleTimestamp, delta.asset(), delta.reason(), e);
                diagnostics.add(CycleDiagnostic.forAsset(ErrorCategory.INTERNAL, delta.asset(), e.getMessage()));
            }
        }

        awaitOrders(submitted, awaitDeadline);

        int settled = 0;
        int filled = 0;
        int failed = 0;
        int pending = 0;
        for (CompletableFuture<Order> future : submitted) {
            Order order = future.getNow(null);
            if (order == null) {
                pending++;
                continue;
            }
            settled++;
            if (order.getStatus() == OrderStatus.FILLED) {
                filled++;
                continue;
            }
            failed++;
            diagnostics.add(orderDiagnostic(order));
        }

        return new CycleSummary(
                cycleTimestamp,
                startedAt,
                clock.instant(),
                CycleStatus.COMPLETED,
                null,
                factors.records().size(),
                factors.fundingGated().size(),
                signals.size(),
                forced.size(),
                sized.size(),
                approved,
                rejected,
                settled,
                filled,
                failed,
                pending,
                diagnostics
        );
    }

    /**
     * A forced reduction owns its asset for the whole cycle, so signal-driven deltas for that asset are
     * dropped rather than validated after the reduction may already have settled.
     */
    private List<PositionDelta> withoutForcedAssets(List<PositionDelta> sized, List<PositionDelta> forced,
                                                    List<CycleDiagnostic> diagnostics) {
        Set<String> forcedAssets = forced.stream().map(PositionDelta::asset).collect(Collectors.toSet());
        List<PositionDelta> kept = new ArrayList<>();
        for (PositionDelta delta : sized) {
            if (!forcedAssets.contains(delta.asset())) {
                kept.add(delta);
                continue;
            }
            log.info("event=sized_delta_dropped asset={} reason={} target={} cause=risk_forced",
                    delta.asset(), delta.reason(), delta.targetChangeNotional());
            diagnostics.add(CycleDiagnostic.forAsset(
                    ErrorCategory.RISK_FORCED_OVERRIDE,
                    delta.asset(),
                    delta.reason() + " dropped: asset has a forced reduction this cycle"
            ));
        }
        return kept;
    }

    private static CycleDiagnostic orderDiagnostic(Order order) {
        ErrorCategory category = order.getFailureCategory() != null
                ? order.getFailureCategory()
                : ErrorCategory.EXCHANGE_TERMINAL;
        String detail = order.getFailure() != null
                ? order.getFailure()
                : "filled " + order.getFilledNotional() + " of " + order.getRequestedNotional();
        return CycleDiagnostic.forOrder(category, order.getAsset(), order.getId(), order.getStatus() + ": " + detail);
    }

    private void refreshEquity() {
        try {
            BigDecimal equity = exchangeGateway.fetchAccountEquity();
            riskManager.refreshEquity(equity);
        } catch (RuntimeException e) {
            log.warn("event=equity_refresh_failed keep_equity={} error=\"{}\"", riskManager.getEquity(), e.getMessage());
        }
    }

    private void awaitOrders(List<CompletableFuture<Order>> submitted, Instant awaitDeadline) {
        if (submitted.isEmpty()) {
            return;
        }
        Duration remaining = Duration.between(clock.instant(), awaitDeadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        try {
            CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0]))
                    .get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("event=cycle_await_timeout inflight_orders={}", submitted.stream().filter(future -> !future.isDone()).count());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=cycle_await_interrupted");
        } catch (ExecutionException e) {
            log.error("event=cycle_await_failed", e);
        }
    }

    private CycleSummary abort(Instant cycleTimestamp, Instant startedAt, String reason) {
        List<CycleDiagnostic> diagnostics = List.of(CycleDiagnostic.forAsset(ErrorCategory.CYCLE_FATAL, null, reason));
        return CycleSummary.aborted(cycleTimestamp, startedAt, clock.instant(), reason, diagnostics);
    }
}
