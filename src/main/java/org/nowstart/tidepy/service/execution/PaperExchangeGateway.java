package org.nowstart.tidepy.service.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.exception.ExchangeException;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.OrderTicket;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;
import org.nowstart.tidepy.service.risk.MarkPriceBook;
import org.nowstart.tidepy.service.risk.RiskManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Simulated exchange that fills every order in full at the latest mark price. An order is forgotten once it
 * has been polled, since it is already closed by then.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "tidepy.trading", name = "execution-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private final MarkPriceBook markPriceBook;
    private final RiskManager riskManager;
    private final TradingProperties tradingProperties;
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
    private final Map<String, String> exchangeIdsByClientId = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public PaperExchangeGateway(MarkPriceBook markPriceBook, RiskManager riskManager, TradingProperties tradingProperties) {
        this.markPriceBook = markPriceBook;
        this.riskManager = riskManager;
        this.tradingProperties = tradingProperties;
    }

    @Override
    public String submitOrder(OrderTicket ticket) {
        BigDecimal price = markPriceBook.price(ticket.asset())
                .orElseThrow(() -> ExchangeException.terminalFailure("no mark price for " + ticket.asset(), null));
        if (ticket.quantity() == null || ticket.quantity().signum() <= 0) {
            throw ExchangeException.terminalFailure("quantity must be positive for " + ticket.asset(), null);
        }

        String exchangeOrderId = "paper-" + sequence.incrementAndGet();
        BigDecimal notional = price.multiply(ticket.quantity()).setScale(8, RoundingMode.HALF_UP);
        orders.put(exchangeOrderId, new PaperOrder(ticket.clientOrderId(), new ExchangeOrderState(
                exchangeOrderId,
                ExchangeOrderPhase.FILLED,
                ticket.quantity(),
                notional,
                price
        )));
        exchangeIdsByClientId.put(ticket.clientOrderId(), exchangeOrderId);
        log.info(
                "event=paper_fill exchange_order_id={} asset={} side={} qty={} price={} notional={}",
                exchangeOrderId,
                ticket.asset(),
                ticket.side(),
                ticket.quantity(),
                price,
                notional
        );
        return exchangeOrderId;
    }

    @Override
    public ExchangeOrderState pollOrder(String asset, String exchangeOrderId) {
        PaperOrder order = orders.remove(exchangeOrderId);
        if (order == null) {
            throw ExchangeException.terminalFailure("unknown paper order " + exchangeOrderId, null);
        }
        exchangeIdsByClientId.remove(order.clientOrderId());
        return order.state();
    }

    @Override
    public Optional<String> findOrderByClientId(String asset, String clientOrderId) {
        return Optional.ofNullable(exchangeIdsByClientId.get(clientOrderId));
    }

    @Override
    public void cancelOrder(String asset, String exchangeOrderId) {
        // paper orders fill on submission, so there is never anything left to cancel
        if (!orders.containsKey(exchangeOrderId)) {
            throw ExchangeException.terminalFailure("unknown paper order " + exchangeOrderId, null);
        }
    }

    int openOrderCount() {
        return orders.size();
    }

    @Override
    public BigDecimal fetchAccountEquity() {
        return tradingProperties.initialEquity().add(riskManager.totalRealizedPnl());
    }

    private record PaperOrder(String clientOrderId, ExchangeOrderState state) {
    }
}
