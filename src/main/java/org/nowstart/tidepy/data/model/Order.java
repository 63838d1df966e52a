package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.data.type.OrderStatus;

/**
 * Lifecycle of one approved delta on the exchange. Only the execution engine mutates it, and every
 * status change goes through {@link #transitionTo(OrderStatus, Instant)}.
 */
@Getter
public class Order {

    private final String id;
    private final String asset;
    private final OrderSide side;
    private final DeltaReason reason;
    private final BigDecimal requestedNotional;
    // buy-back quantity for reductions, null for increases
    private final BigDecimal requestedQuantity;
    private final Instant createdAt;

    private BigDecimal filledNotional = BigDecimal.ZERO;
    private BigDecimal filledQuantity = BigDecimal.ZERO;
    private BigDecimal avgFillPrice = BigDecimal.ZERO;
    private volatile OrderStatus status = OrderStatus.CREATED;
    private int attempts;
    private String exchangeOrderId;
    private ErrorCategory failureCategory;
    private String failure;
    private Instant updatedAt;

    @Builder
    private Order(String id, String asset, OrderSide side, DeltaReason reason, BigDecimal requestedNotional,
                  BigDecimal requestedQuantity, Instant createdAt) {
        this.id = id;
        this.asset = asset;
        this.side = side;
        this.reason = reason;
        this.requestedNotional = requestedNotional;
        this.requestedQuantity = requestedQuantity;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static Order from(ApprovedDelta approved, Instant now) {
        return Order.builder()
                .id(approved.orderId())
                .asset(approved.asset())
                .side(approved.side())
                .reason(approved.delta().reason())
                .requestedNotional(approved.requestedNotional())
                .requestedQuantity(approved.reduceQuantity())
                .createdAt(now)
                .build();
    }

    public synchronized void transitionTo(OrderStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("order " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        updatedAt = now;
    }

    public synchronized void recordAttempt(String exchangeOrderId) {
        attempts++;
        this.exchangeOrderId = exchangeOrderId;
    }

    public synchronized void adoptExchangeOrder(String exchangeOrderId) {
        this.exchangeOrderId = exchangeOrderId;
    }

    public synchronized void recordFailedAttempt() {
        attempts++;
    }

    /**
     * Adds the fills of one closed exchange order to the running totals.
     */
    public synchronized void recordFill(BigDecimal quantity, BigDecimal notional) {
        if (quantity == null || quantity.signum() <= 0 || notional == null || notional.signum() <= 0) {
            return;
        }
        filledQuantity = filledQuantity.add(quantity);
        filledNotional = filledNotional.add(notional);
        avgFillPrice = filledNotional.divide(filledQuantity, 12, RoundingMode.HALF_UP);
    }

    public synchronized void fail(ErrorCategory category, String message) {
        this.failureCategory = category;
        this.failure = message;
    }

    public boolean isIncrease() {
        return side == OrderSide.SELL;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized BigDecimal remainingNotional() {
        return requestedNotional.subtract(filledNotional).max(BigDecimal.ZERO);
    }

    public synchronized BigDecimal remainingQuantity() {
        if (requestedQuantity == null) {
            return null;
        }
        return requestedQuantity.subtract(filledQuantity).max(BigDecimal.ZERO);
    }

    public synchronized boolean hasFills() {
        return filledQuantity.signum() > 0;
    }
}
