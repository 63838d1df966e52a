package org.nowstart.tidepy.service.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.exception.ExchangeException;
import org.nowstart.tidepy.data.model.ApprovedDelta;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.Order;
import org.nowstart.tidepy.data.model.OrderTicket;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;
import org.nowstart.tidepy.data.type.OrderStatus;
import org.nowstart.tidepy.service.risk.MarkPriceBook;
import org.nowstart.tidepy.service.risk.RiskManager;
import org.nowstart.tidepy.service.storage.StrategyStorageService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives approved deltas to a terminal order status on the shared order pool. Each order runs on its own
 * worker until it settles, so orders outlive the cycle that created them; the terminal report to the risk
 * manager is the only way an order affects position state.
 */
@Slf4j
@Service
public class OrderExecutionEngine {

    private static final int QUANTITY_SCALE = 8;

    private final ExchangeGateway exchangeGateway;
    private final RiskManager riskManager;
    private final MarkPriceBook markPriceBook;
    private final StrategyStorageService strategyStorageService;
    private final TradingProperties tradingProperties;
    private final ExecutorService orderExecutor;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final Map<String, Order> activeOrders = new ConcurrentHashMap<>();

    public OrderExecutionEngine(
            ExchangeGateway exchangeGateway,
            RiskManager riskManager,
            MarkPriceBook markPriceBook,
            StrategyStorageService strategyStorageService,
            TradingProperties tradingProperties,
            @Qualifier("orderExecutor") ExecutorService orderExecutor,
            Clock clock
    ) {
        this.exchangeGateway = exchangeGateway;
        this.riskManager = riskManager;
        this.markPriceBook = markPriceBook;
        this.strategyStorageService = strategyStorageService;
        this.tradingProperties = tradingProperties;
        this.orderExecutor = orderExecutor;
        this.clock = clock;
        this.retryPolicy = RetryPolicy.from(tradingProperties.execution());
    }

    /**
     * Starts the order for an approved delta.
     *
     * A second order for an asset that still has an active one is refused and settled as FAILED, which
     * releases its reservation without touching the position.
     *
     * @param resubmitDeadline partial-fill remainders are only resubmitted before this instant
     */
    public CompletableFuture<Order> submit(ApprovedDelta approved, Instant resubmitDeadline) {
        Order order = Order.from(approved, clock.instant());
        Order existing = activeOrders.putIfAbsent(order.getAsset(), order);
        if (existing != null) {
            log.error("event=order_refused order_id={} asset={} active_order_id={}", order.getId(), order.getAsset(), existing.getId());
            order.fail(ErrorCategory.INTERNAL, "asset already has active order " + existing.getId());
            order.transitionTo(OrderStatus.FAILED, clock.instant());
            settle(order);
            return CompletableFuture.completedFuture(order);
        }

        log.info(
                "event=order_created order_id={} asset={} side={} reason={} requested_notional={} requested_qty={}",
                order.getId(),
                order.getAsset(),
                order.getSide(),
                order.getReason(),
                order.getRequestedNotional(),
                order.getRequestedQuantity()
        );

        try {
            return CompletableFuture.supplyAsync(() -> execute(order, resubmitDeadline), orderExecutor);
        } catch (RejectedExecutionException e) {
            log.error("event=order_pool_rejected order_id={} asset={}", order.getId(), order.getAsset(), e);
            order.fail(ErrorCategory.INTERNAL, "order pool rejected the task");
            order.transitionTo(OrderStatus.FAILED, clock.instant());
            settle(order);
            return CompletableFuture.completedFuture(order);
        }
    }

    public List<Order> activeOrders() {
        return activeOrders.values().stream()
                .sorted(Comparator.comparing(Order::getAsset))
                .toList();
    }

    Order execute(Order order, Instant resubmitDeadline) {
        try {
            runLifecycle(order, resubmitDeadline);
        } catch (RuntimeException e) {
            log.error("event=order_lifecycle_error order_id={} asset={}", order.getId(), order.getAsset(), e);
            order.fail(ErrorCategory.INTERNAL, e.getMessage());
            if (!order.isTerminal()) {
                order.transitionTo(OrderStatus.FAILED, clock.instant());
            }
        } finally {
            settle(order);
        }
        return order;
    }

    private void runLifecycle(Order order, Instant resubmitDeadline) {
        int round = 0;
        while (true) {
            round++;
            Optional<OrderTicket> ticket = buildTicket(order, round);
            if (ticket.isEmpty()) {
                order.fail(ErrorCategory.EXCHANGE_TERMINAL, "no mark price or zero quantity for " + order.getAsset());
                closeUnfilled(order, OrderStatus.REJECTED);
                return;
            }

            String exchangeOrderId = submitWithRetry(order, ticket.get());
            if (exchangeOrderId == null) {
                return;
            }

            ExchangeOrderState state = awaitResolution(order, exchangeOrderId);
            order.recordFill(state.filledQuantity(), state.filledNotional());
            if (state.avgPrice() != null) {
                markPriceBook.update(order.getAsset(), state.avgPrice());
            }

            if (state.phase() == ExchangeOrderPhase.FILLED) {
                order.transitionTo(OrderStatus.FILLED, clock.instant());
                return;
            }
            if (!order.hasFills()) {
                if (state.phase() == ExchangeOrderPhase.REJECTED) {
                    order.fail(ErrorCategory.EXCHANGE_TERMINAL, "exchange rejected order " + exchangeOrderId);
                    order.transitionTo(OrderStatus.REJECTED, clock.instant());
                } else {
                    order.fail(ErrorCategory.EXCHANGE_TERMINAL,
                            "exchange closed order " + exchangeOrderId + " as " + state.phase() + " without fills");
                    order.transitionTo(OrderStatus.CANCELED, clock.instant());
                }
                return;
            }

            boolean filledThisRound = state.filledQuantity() != null && state.filledQuantity().signum() > 0;
            order.transitionTo(OrderStatus.PARTIALLY_FILLED, clock.instant());
            if (!filledThisRound || !shouldResubmitRemainder(order, resubmitDeadline)) {
                log.info(
                        "event=order_remainder_dropped order_id={} asset={} filled_notional={} remaining_notional={}",
                        order.getId(),
                        order.getAsset(),
                        order.getFilledNotional(),
                        order.remainingNotional()
                );
                order.transitionTo(OrderStatus.CANCELED, clock.instant());
                return;
            }
            log.info("event=order_remainder_resubmit order_id={} asset={} remaining_notional={}",
                    order.getId(), order.getAsset(), order.remainingNotional());
        }
    }

    /**
     * Returns the exchange order id, or null once the order has been moved to a terminal status.
     *
     * After a transient failure the exchange may still have accepted the order, so every later decision
     * first looks the ticket's client id up and adopts an order found there instead of submitting again.
     */
    private String submitWithRetry(Order order, OrderTicket ticket) {
        int failures = 0;
        boolean outcomeUnknown = false;
        while (true) {
            if (outcomeUnknown) {
                String accepted = findAccepted(order, ticket);
                if (accepted != null) {
                    return adopt(order, ticket, accepted);
                }
            }
            try {
                String exchangeOrderId = exchangeGateway.submitOrder(ticket);
                order.recordAttempt(exchangeOrderId);
                order.transitionTo(OrderStatus.SUBMITTED, clock.instant());
                log.info(
                        "event=order_submitted order_id={} asset={} exchange_order_id={} side={} quantity={} notional={} attempts={}",
                        order.getId(),
                        order.getAsset(),
                        exchangeOrderId,
                        ticket.side(),
                        ticket.quantity(),
                        ticket.notional(),
                        order.getAttempts()
                );
                return exchangeOrderId;
            } catch (ExchangeException e) {
                failures++;
                order.recordFailedAttempt();

                if (!e.isTransient()) {
                    String accepted = outcomeUnknown ? findAccepted(order, ticket) : null;
                    if (accepted != null) {
                        return adopt(order, ticket, accepted);
                    }
                    log.warn("event=order_submit_rejected order_id={} asset={} error=\"{}\"", order.getId(), order.getAsset(), e.getMessage());
                    order.fail(ErrorCategory.EXCHANGE_TERMINAL, e.getMessage());
                    closeUnfilled(order, OrderStatus.REJECTED);
                    return null;
                }
                outcomeUnknown = true;
                if (!retryPolicy.shouldRetry(failures)) {
                    String accepted = findAccepted(order, ticket);
                    if (accepted != null) {
                        return adopt(order, ticket, accepted);
                    }
                    log.warn("event=order_retry_exhausted order_id={} asset={} failures={} error=\"{}\"",
                            order.getId(), order.getAsset(), failures, e.getMessage());
                    order.fail(ErrorCategory.EXCHANGE_TRANSIENT, "retry budget exhausted: " + e.getMessage());
                    order.transitionTo(OrderStatus.FAILED, clock.instant());
                    return null;
                }

                Duration delay = retryPolicy.delayAfter(failures);
                log.info("event=order_submit_retry order_id={} asset={} failures={} delay_ms={} error=\"{}\"",
                        order.getId(), order.getAsset(), failures, delay.toMillis(), e.getMessage());
                if (!pause(delay)) {
                    order.fail(ErrorCategory.INTERNAL, "interrupted while backing off");
                    order.transitionTo(OrderStatus.FAILED, clock.instant());
                    return null;
                }
            }
        }
    }

    private String findAccepted(Order order, OrderTicket ticket) {
        try {
            return exchangeGateway.findOrderByClientId(ticket.asset(), ticket.clientOrderId()).orElse(null);
        } catch (ExchangeException e) {
            log.warn("event=order_lookup_failed order_id={} client_order_id={} category={} error=\"{}\"",
                    order.getId(), ticket.clientOrderId(), e.getCategory(), e.getMessage());
            return null;
        }
    }

    private String adopt(Order order, OrderTicket ticket, String exchangeOrderId) {
        order.adoptExchangeOrder(exchangeOrderId);
        order.transitionTo(OrderStatus.SUBMITTED, clock.instant());
        log.warn(
                "event=order_adopted order_id={} asset={} client_order_id={} exchange_order_id={} attempts={}",
                order.getId(),
                order.getAsset(),
                ticket.clientOrderId(),
                exchangeOrderId,
                order.getAttempts()
        );
        return exchangeOrderId;
    }

    private ExchangeOrderState awaitResolution(Order order, String exchangeOrderId) {
        TradingProperties.Execution execution = tradingProperties.execution();
        Instant pollDeadline = clock.instant().plus(execution.pollTimeout());

        while (true) {
            ExchangeOrderState state = pollQuietly(order, exchangeOrderId);
            if (state != null && state.isClosed()) {
                return state;
            }
            if (!clock.instant().isBefore(pollDeadline) || !pause(execution.pollInterval())) {
                return cancelAndResolve(order, exchangeOrderId, state);
            }
        }
    }

    private ExchangeOrderState cancelAndResolve(Order order, String exchangeOrderId, ExchangeOrderState lastSeen) {
        log.warn("event=order_poll_timeout order_id={} asset={} exchange_order_id={}", order.getId(), order.getAsset(), exchangeOrderId);
        try {
            exchangeGateway.cancelOrder(order.getAsset(), exchangeOrderId);
        } catch (ExchangeException e) {
            log.warn("event=order_cancel_failed order_id={} exchange_order_id={} error=\"{}\"", order.getId(), exchangeOrderId, e.getMessage());
        }

        ExchangeOrderState finalState = pollQuietly(order, exchangeOrderId);
        ExchangeOrderState resolved = finalState != null ? finalState : lastSeen;
        if (resolved == null) {
            return new ExchangeOrderState(exchangeOrderId, ExchangeOrderPhase.CANCELED, BigDecimal.ZERO, BigDecimal.ZERO, null);
        }
        if (resolved.isClosed()) {
            return resolved;
        }
        return new ExchangeOrderState(
                exchangeOrderId,
                ExchangeOrderPhase.CANCELED,
                resolved.filledQuantity(),
                resolved.filledNotional(),
                resolved.avgPrice()
        );
    }

    private ExchangeOrderState pollQuietly(Order order, String exchangeOrderId) {
        try {
            return exchangeGateway.pollOrder(order.getAsset(), exchangeOrderId);
        } catch (ExchangeException e) {
            log.warn("event=order_poll_failed order_id={} exchange_order_id={} category={} error=\"{}\"",
                    order.getId(), exchangeOrderId, e.getCategory(), e.getMessage());
            return null;
        }
    }

    private Optional<OrderTicket> buildTicket(Order order, int round) {
        String clientOrderId = order.getId().replace("-", "") + "r" + round;
        Optional<BigDecimal> mark = markPriceBook.price(order.getAsset());

        if (order.isIncrease()) {
            if (mark.isEmpty()) {
                return Optional.empty();
            }
            BigDecimal notional = order.remainingNotional();
            BigDecimal quantity = notional.divide(mark.get(), QUANTITY_SCALE, RoundingMode.DOWN);
            if (quantity.signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(new OrderTicket(order.getAsset(), order.getSide(), notional, quantity, false, clientOrderId));
        }

        BigDecimal quantity = order.remainingQuantity();
        if (quantity == null || quantity.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal notional = mark.map(price -> price.multiply(quantity).setScale(QUANTITY_SCALE, RoundingMode.HALF_UP))
                .orElseGet(order::remainingNotional);
        return Optional.of(new OrderTicket(order.getAsset(), order.getSide(), notional, quantity, true, clientOrderId));
    }

    private boolean shouldResubmitRemainder(Order order, Instant resubmitDeadline) {
        if (!clock.instant().isBefore(resubmitDeadline)) {
            return false;
        }
        BigDecimal minOrderNotional = tradingProperties.sizing().minOrderNotional();
        if (order.isIncrease()) {
            return order.remainingNotional().compareTo(minOrderNotional) >= 0;
        }
        BigDecimal remainingQuantity = order.remainingQuantity();
        if (remainingQuantity == null || remainingQuantity.signum() <= 0) {
            return false;
        }
        BigDecimal remainingNotional = markPriceBook.price(order.getAsset())
                .map(price -> price.multiply(remainingQuantity))
                .orElseGet(order::remainingNotional);
        return remainingNotional.compareTo(minOrderNotional) >= 0;
    }

    // a terminal exchange answer after earlier partial fills still has to keep those fills
    private void closeUnfilled(Order order, OrderStatus statusWithoutFills) {
        order.transitionTo(order.hasFills() ? OrderStatus.CANCELED : statusWithoutFills, clock.instant());
    }

    private void settle(Order order) {
        activeOrders.remove(order.getAsset(), order);
        riskManager.commit(order);
        strategyStorageService.appendOrderEvent(order);
        log.info(
                "event=order_terminal order_id={} asset={} status={} filled_notional={} filled_qty={} avg_fill_price={} attempts={} failure=\"{}\"",
                order.getId(),
                order.getAsset(),
                order.getStatus(),
                order.getFilledNotional(),
                order.getFilledQuantity(),
                order.getAvgFillPrice(),
                order.getAttempts(),
                order.getFailure()
        );
    }

    private boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
