package org.nowstart.tidepy.service.execution;

import java.math.BigDecimal;
import java.util.Optional;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.OrderTicket;

/**
 * Order-entry side of an exchange. Implementations throw
 * {@link org.nowstart.tidepy.data.exception.ExchangeException} already classified as transient or terminal.
 */
public interface ExchangeGateway {

    /**
     * @return the exchange's id for the accepted order
     */
    String submitOrder(OrderTicket ticket);

    ExchangeOrderState pollOrder(String asset, String exchangeOrderId);

    /**
     * Looks up an order by the client id it was submitted with, for submits whose outcome is unknown.
     *
     * @return the exchange's id, or empty when no order with that client id was ever accepted
     */
    Optional<String> findOrderByClientId(String asset, String clientOrderId);

    void cancelOrder(String asset, String exchangeOrderId);

    BigDecimal fetchAccountEquity();
}
