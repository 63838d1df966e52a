package org.nowstart.tidepy.service.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.exception.RiskStateCorruptedException;
import org.nowstart.tidepy.data.model.ApprovedDelta;
import org.nowstart.tidepy.data.model.Order;
import org.nowstart.tidepy.data.model.PortfolioView;
import org.nowstart.tidepy.data.model.PositionDelta;
import org.nowstart.tidepy.data.model.PositionState;
import org.nowstart.tidepy.data.model.ValidationResult;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.nowstart.tidepy.data.type.RejectionReason;
import org.springframework.stereotype.Service;

/**
 * Sole owner of position state. Every write to a {@link PositionBook} happens in {@link #commit(Order)}
 * under that asset's lock; the aggregate exposure used for the portfolio ceiling is guarded by a single
 * monitor that is always taken after an asset lock, never before.
 */
@Slf4j
@Service
public class RiskManager {

    private static final int CAP_SCALE = 8;
    private static final BigDecimal CAP_TOLERANCE = new BigDecimal("0.00000001");

    private final TradingProperties tradingProperties;
    private final MarkPriceBook markPriceBook;

    private final Map<String, PositionBook> books = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> assetLocks = new ConcurrentHashMap<>();
    private final Map<String, Reservation> inflight = new ConcurrentHashMap<>();

    private final Object portfolioMonitor = new Object();
    private BigDecimal committedExposure = BigDecimal.ZERO;
    private BigDecimal reservedExposure = BigDecimal.ZERO;

    private volatile BigDecimal equity;
    private volatile String corruptionReason;

    public RiskManager(TradingProperties tradingProperties, MarkPriceBook markPriceBook) {
        this.tradingProperties = tradingProperties;
        this.markPriceBook = markPriceBook;
        this.equity = tradingProperties.initialEquity();
    }

    public ValidationResult validate(PositionDelta delta) {
        if (delta == null || delta.targetChangeNotional() == null || delta.targetChangeNotional().signum() == 0) {
            throw new IllegalArgumentException("delta with a non-zero target is required");
        }

        ReentrantLock lock = lockFor(delta.asset());
        lock.lock();
        try {
            Reservation existing = inflight.get(delta.asset());
            if (existing != null) {
                return reject(delta, RejectionReason.CONFLICTING_INFLIGHT_ORDER,
                        "order " + existing.orderId() + " is still inflight");
            }

            return delta.isIncrease() ? validateIncrease(delta) : validateReduction(delta);
        } finally {
            lock.unlock();
        }
    }

    private ValidationResult validateIncrease(PositionDelta delta) {
        BigDecimal current = currentNotional(delta.asset());
        BigDecimal entryCap = entryNotionalCap();
        BigDecimal maxCap = maxNotionalCap();
        BigDecimal change = delta.targetChangeNotional();
        RejectionReason clampReason = null;

        if (delta.reason() == DeltaReason.NEW_SIGNAL && current.signum() == 0 && change.compareTo(entryCap) > 0) {
            return reject(delta, RejectionReason.CAP_EXCEEDED,
                    "new entry " + change + " exceeds entry cap " + entryCap);
        }

        BigDecimal headroom = maxCap.subtract(current);
        if (headroom.signum() <= 0) {
            return reject(delta, RejectionReason.CAP_EXCEEDED,
                    "exposure " + current + " already at max cap " + maxCap);
        }
        if (change.compareTo(headroom) > 0) {
            change = headroom;
            clampReason = RejectionReason.CAP_EXCEEDED;
        }

        synchronized (portfolioMonitor) {
            BigDecimal remaining = portfolioCeiling().subtract(committedExposure).subtract(reservedExposure);
            if (remaining.signum() <= 0) {
                return reject(delta, RejectionReason.PORTFOLIO_CEILING,
                        "portfolio ceiling " + portfolioCeiling() + " reached");
            }
            if (change.compareTo(remaining) > 0) {
                change = remaining;
                clampReason = RejectionReason.PORTFOLIO_CEILING;
            }
            if (change.compareTo(tradingProperties.sizing().minOrderNotional()) < 0) {
                return reject(delta, RejectionReason.BELOW_MIN_NOTIONAL,
                        "clamped notional " + change + " is below the minimum order");
            }

            String orderId = UUID.randomUUID().toString();
            reservedExposure = reservedExposure.add(change);
            inflight.put(delta.asset(), new Reservation(orderId, delta.asset(), change, maxCap));

            ApprovedDelta approved = new ApprovedDelta(
                    orderId,
                    new PositionDelta(delta.asset(), change, delta.reason()),
                    change,
                    null,
                    clampReason
            );
            log.info(
                    "event=delta_approved asset={} reason={} requested={} approved={} clamp_reason={} order_id={}",
                    delta.asset(),
                    delta.reason(),
                    delta.targetChangeNotional(),
                    change,
                    clampReason,
                    orderId
            );
            return ValidationResult.approved(approved);
        }
    }

    private ValidationResult validateReduction(PositionDelta delta) {
        PositionBook book = books.get(delta.asset());
        if (book == null || book.isFlat()) {
            return reject(delta, RejectionReason.NO_EXPOSURE, "no open exposure to reduce");
        }

        BigDecimal current = book.getCurrentNotional();
        BigDecimal change = delta.targetChangeNotional().abs();
        BigDecimal quantity;
        if (change.compareTo(current) >= 0) {
            change = current;
            quantity = book.getQuantity();
        } else {
            if (change.compareTo(tradingProperties.sizing().minOrderNotional()) < 0) {
                return reject(delta, RejectionReason.BELOW_MIN_NOTIONAL,
                        "reduction " + change + " is below the minimum order");
            }
            quantity = book.getQuantity()
                    .multiply(change)
                    .divide(current, 12, RoundingMode.DOWN);
        }

        String orderId = UUID.randomUUID().toString();
        inflight.put(delta.asset(), new Reservation(orderId, delta.asset(), BigDecimal.ZERO, maxNotionalCap()));

        log.info(
                "event=delta_approved asset={} reason={} requested={} approved={} quantity={} order_id={}",
                delta.asset(),
                delta.reason(),
                delta.targetChangeNotional(),
                change.negate(),
                quantity,
                orderId
        );
        return ValidationResult.approved(new ApprovedDelta(
                orderId,
                new PositionDelta(delta.asset(), change.negate(), delta.reason()),
                change,
                quantity,
                null
        ));
    }

    /**
     * Forced reductions for the current marks: a full unwind past the stop loss, otherwise a partial
     * reduce for near-cap positions whose PnL crossed either reduce threshold.
     */
    public List<PositionDelta> evaluatePnl() {
        TradingProperties.Risk risk = tradingProperties.risk();
        BigDecimal nearCapNotional = maxNotionalCap().multiply(risk.nearCapRatio());
        List<PositionDelta> forced = new ArrayList<>();

        for (String asset : new TreeSet<>(books.keySet())) {
            ReentrantLock lock = lockFor(asset);
            lock.lock();
            try {
                PositionBook book = books.get(asset);
                if (book == null || book.isFlat() || inflight.containsKey(asset)) {
                    continue;
                }
                Optional<BigDecimal> mark = markPriceBook.price(asset);
                if (mark.isEmpty() || book.getAvgEntryPrice().signum() <= 0) {
                    continue;
                }

                BigDecimal pnlPct = book.getAvgEntryPrice()
                        .subtract(mark.get())
                        .divide(book.getAvgEntryPrice(), 12, RoundingMode.HALF_UP);
                BigDecimal current = book.getCurrentNotional();

                if (pnlPct.compareTo(risk.stopLossThreshold().negate()) <= 0) {
                    forced.add(new PositionDelta(asset, current.negate(), DeltaReason.RISK_FORCED));
                    log.warn("event=risk_forced asset={} action=unwind pnl_pct={} notional={}", asset, pnlPct, current);
                    continue;
                }

                boolean nearCap = current.compareTo(nearCapNotional) >= 0;
                boolean lossBreached = pnlPct.compareTo(risk.reduceLossThreshold().negate()) <= 0;
                boolean profitBreached = pnlPct.compareTo(risk.reduceProfitThreshold()) >= 0;
                if (nearCap && (lossBreached || profitBreached)) {
                    BigDecimal reduce = current.multiply(risk.reduceRatio()).setScale(CAP_SCALE, RoundingMode.DOWN);
                    forced.add(new PositionDelta(asset, reduce.negate(), DeltaReason.RISK_FORCED));
                    log.warn("event=risk_forced asset={} action=reduce pnl_pct={} notional={} reduce={}", asset, pnlPct, current, reduce);
                }
            } finally {
                lock.unlock();
            }
        }
        return forced;
    }

    /**
     * Applies a terminal order exactly once and releases the asset's reservation. Returns false when the
     * report was ignored as a already committed, unknown or non-terminal.
     */
    public boolean commit(Order order) {
        if (order == null || !order.isTerminal()) {
            log.warn("event=commit_ignored reason=non_terminal order_id={}", order == null ? null : order.getId());
            return false;
        }

        ReentrantLock lock = lockFor(order.getAsset());
        lock.lock();
        try {
            Reservation reservation = inflight.get(order.getAsset());
            if (reservation == null || !reservation.orderId().equals(order.getId())) {
                log.warn("event=commit_ignored reason=not_inflight asset={} order_id={}", order.getAsset(), order.getId());
                return false;
            }

            BigDecimal exposureChange = order.hasFills() ? applyFills(order, reservation) : BigDecimal.ZERO;

            inflight.remove(order.getAsset());
            synchronized (portfolioMonitor) {
                reservedExposure = reservedExposure.subtract(reservation.reservedNotional());
                committedExposure = committedExposure.add(exposureChange);
            }

            PositionBook book = books.get(order.getAsset());
            log.info(
                    "event=order_committed asset={} order_id={} status={} filled_notional={} filled_qty={} exposure_change={} current_notional={}",
                    order.getAsset(),
                    order.getId(),
                    order.getStatus(),
                    order.getFilledNotional(),
                    order.getFilledQuantity(),
                    exposureChange,
                    book == null ? BigDecimal.ZERO : book.getCurrentNotional()
            );
            return true;
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal applyFills(Order order, Reservation reservation) {
        PositionBook book = books.computeIfAbsent(order.getAsset(), PositionBook::new);
        BigDecimal before = book.getCurrentNotional();

        if (order.isIncrease()) {
            BigDecimal notional = order.getFilledNotional();
            BigDecimal quantity = order.getFilledQuantity();
            if (notional.compareTo(reservation.reservedNotional()) > 0) {
                quantity = quantity.multiply(reservation.reservedNotional())
                        .divide(notional, 12, RoundingMode.DOWN);
                notional = reservation.reservedNotional();
            }
            if (before.add(notional).compareTo(reservation.maxCapAtApproval().add(CAP_TOLERANCE)) > 0) {
                markCorrupted("fill for order " + order.getId() + " would take " + order.getAsset()
                        + " past its max cap " + reservation.maxCapAtApproval());
                return BigDecimal.ZERO;
            }
            book.addShort(notional, quantity);
        } else {
            if (order.getFilledQuantity().compareTo(book.getQuantity().add(CAP_TOLERANCE)) > 0) {
                markCorrupted("buy-back of " + order.getFilledQuantity() + " for order " + order.getId()
                        + " exceeds the held quantity " + book.getQuantity() + " of " + order.getAsset());
                return BigDecimal.ZERO;
            }
            book.reduceShort(order.getFilledQuantity(), order.getAvgFillPrice());
        }
        return book.getCurrentNotional().subtract(before);
    }

    private void markCorrupted(String reason) {
        corruptionReason = reason;
        log.error("event=risk_state_corrupted reason=\"{}\"", reason);
    }

    public void verifyIntegrity() {
        String reason = corruptionReason;
        if (reason != null) {
            throw new RiskStateCorruptedException(reason);
        }
    }

    public boolean isCorrupted() {
        return corruptionReason != null;
    }

    public void refreshEquity(BigDecimal latestEquity) {
        if (latestEquity == null || latestEquity.signum() <= 0) {
            log.warn("event=equity_refresh_ignored equity={}", latestEquity);
            return;
        }
        equity = latestEquity;
    }

    public BigDecimal getEquity() {
        return equity;
    }

    public boolean hasInflightOrder(String asset) {
        return inflight.containsKey(asset);
    }

    public PortfolioView snapshot() {
        BigDecimal entryCap = entryNotionalCap();
        BigDecimal maxCap = maxNotionalCap();
        Map<String, PositionState> positions = new LinkedHashMap<>();
        for (String asset : new TreeSet<>(books.keySet())) {
            ReentrantLock lock = lockFor(asset);
            lock.lock();
            try {
                PositionBook book = books.get(asset);
                if (book != null && !book.isFlat()) {
                    positions.put(asset, book.toState(entryCap, maxCap, markPriceBook.price(asset).orElse(null)));
                }
            } finally {
                lock.unlock();
            }
        }

        BigDecimal aggregate;
        synchronized (portfolioMonitor) {
            aggregate = committedExposure;
        }
        return new PortfolioView(
                equity,
                entryCap,
                maxCap,
                aggregate,
                portfolioCeiling(),
                positions,
                Set.copyOf(inflight.keySet())
        );
    }

    public List<PositionState> positions() {
        return List.copyOf(snapshot().positions().values());
    }

    /**
     * Realized PnL summed over every asset, including ones that are flat again.
     */
    public BigDecimal totalRealizedPnl() {
        BigDecimal total = BigDecimal.ZERO;
        for (PositionBook book : books.values()) {
            total = total.add(book.getRealizedPnl());
        }
        return total;
    }

    BigDecimal entryNotionalCap() {
        return equity.multiply(tradingProperties.sizing().entryCapPct()).setScale(CAP_SCALE, RoundingMode.DOWN);
    }

    BigDecimal maxNotionalCap() {
        return equity.multiply(tradingProperties.sizing().maxCapPct()).setScale(CAP_SCALE, RoundingMode.DOWN);
    }

    BigDecimal portfolioCeiling() {
        return equity.multiply(tradingProperties.sizing().portfolioCeilingPct()).setScale(CAP_SCALE, RoundingMode.DOWN);
    }

    private BigDecimal currentNotional(String asset) {
        PositionBook book = books.get(asset);
        return book == null ? BigDecimal.ZERO : book.getCurrentNotional();
    }

    private ReentrantLock lockFor(String asset) {
        return assetLocks.computeIfAbsent(asset, key -> new ReentrantLock());
    }

    private ValidationResult reject(PositionDelta delta, RejectionReason reason, String message) {
        log.info(
                "event=delta_rejected asset={} reason={} target={} rejection={} detail=\"{}\"",
                delta.asset(),
                delta.reason(),
                delta.targetChangeNotional(),
                reason,
                message
        );
        return ValidationResult.rejected(reason, message);
    }

    private record Reservation(
            String orderId,
            String asset,
            BigDecimal reservedNotional,
            BigDecimal maxCapAtApproval
    ) {
    }
}
