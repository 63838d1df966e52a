package org.nowstart.tidepy.service.execution;

import feign.FeignException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.dto.BinanceAccountResponse;
import org.nowstart.tidepy.data.dto.BinanceExchangeInfoResponse;
import org.nowstart.tidepy.data.dto.BinanceOrderResponse;
import org.nowstart.tidepy.data.exception.ExchangeException;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.OrderTicket;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;
import org.nowstart.tidepy.repository.BinanceFuturesFeignClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Live order entry on Binance USD-M futures. Orders are MARKET orders; quantities are rounded down to the
 * symbol's LOT_SIZE step before submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tidepy.trading", name = "execution-mode", havingValue = "LIVE")
public class BinanceExchangeGateway implements ExchangeGateway {

    static final String ORDER_DOES_NOT_EXIST = "-2013";

    private final BinanceFuturesFeignClient binanceFuturesFeignClient;
    private final Map<String, BigDecimal> stepSizes = new ConcurrentHashMap<>();

    @Override
    public String submitOrder(OrderTicket ticket) {
        BigDecimal quantity = roundToStep(ticket.asset(), ticket.quantity());
        if (quantity.signum() <= 0) {
            throw ExchangeException.terminalFailure(
                    "quantity " + ticket.quantity() + " is below the lot step of " + ticket.asset(), null);
        }

        try {
            BinanceOrderResponse response = binanceFuturesFeignClient.createOrder(
                    ticket.asset(),
                    ticket.side().name(),
                    "MARKET",
                    quantity.stripTrailingZeros().toPlainString(),
                    ticket.reduceOnly(),
                    ticket.clientOrderId(),
                    "RESULT"
            );
            if (response == null || response.orderId() == null) {
                throw ExchangeException.transientFailure("order response without orderId for " + ticket.asset(), null);
            }
            return String.valueOf(response.orderId());
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("submit order " + ticket.clientOrderId(), e);
        }
    }

    @Override
    public ExchangeOrderState pollOrder(String asset, String exchangeOrderId) {
        try {
            return toState(binanceFuturesFeignClient.getOrder(asset, Long.parseLong(exchangeOrderId)), exchangeOrderId);
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("poll order " + exchangeOrderId, e);
        }
    }

    @Override
    public Optional<String> findOrderByClientId(String asset, String clientOrderId) {
        try {
            BinanceOrderResponse response = binanceFuturesFeignClient.getOrderByClientOrderId(asset, clientOrderId);
            if (response == null || response.orderId() == null) {
                return Optional.empty();
            }
            return Optional.of(String.valueOf(response.orderId()));
        } catch (FeignException e) {
            if (e.status() == 400 && e.contentUTF8() != null && e.contentUTF8().contains(ORDER_DOES_NOT_EXIST)) {
                return Optional.empty();
            }
            throw ExchangeFailureClassifier.classify("find order " + clientOrderId, e);
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("find order " + clientOrderId, e);
        }
    }

    @Override
    public void cancelOrder(String asset, String exchangeOrderId) {
        try {
            binanceFuturesFeignClient.cancelOrder(asset, Long.parseLong(exchangeOrderId));
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("cancel order " + exchangeOrderId, e);
        }
    }

    @Override
    public BigDecimal fetchAccountEquity() {
        try {
            BinanceAccountResponse account = binanceFuturesFeignClient.getAccount();
            if (account == null) {
                throw ExchangeException.transientFailure("empty account response", null);
            }
            return account.totalMarginBalance() != null ? account.totalMarginBalance() : account.totalWalletBalance();
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("fetch account", e);
        }
    }

    BigDecimal roundToStep(String asset, BigDecimal quantity) {
        BigDecimal step = stepSize(asset).orElse(null);
        if (step == null || step.signum() <= 0) {
            return quantity;
        }
        return quantity.divide(step, 0, RoundingMode.DOWN).multiply(step);
    }

    private Optional<BigDecimal> stepSize(String asset) {
        if (stepSizes.isEmpty()) {
            loadStepSizes();
        }
        return Optional.ofNullable(stepSizes.get(asset));
    }

    private void loadStepSizes() {
        BinanceExchangeInfoResponse info;
        try {
            info = binanceFuturesFeignClient.getExchangeInfo();
        } catch (RuntimeException e) {
            throw ExchangeFailureClassifier.classify("load exchange info", e);
        }
        if (info == null || info.symbols() == null) {
            return;
        }
        for (BinanceExchangeInfoResponse.SymbolInfo symbol : info.symbols()) {
            if (symbol.filters() == null) {
                continue;
            }
            symbol.filters().stream()
                    .filter(filter -> "LOT_SIZE".equals(filter.filterType()) && filter.stepSize() != null)
                    .findFirst()
                    .ifPresent(filter -> stepSizes.put(symbol.symbol(), filter.stepSize()));
        }
        log.info("event=exchange_info_loaded symbols={}", stepSizes.size());
    }

    static ExchangeOrderState toState(BinanceOrderResponse response, String exchangeOrderId) {
        if (response == null) {
            throw ExchangeException.transientFailure("empty order response for " + exchangeOrderId, null);
        }
        BigDecimal executed = safe(response.executedQty());
        BigDecimal cumQuote = safe(response.cumQuote());
        BigDecimal avgPrice = response.avgPrice() != null && response.avgPrice().signum() > 0
                ? response.avgPrice()
                : null;
        return new ExchangeOrderState(exchangeOrderId, toPhase(response.status()), executed, cumQuote, avgPrice);
    }

    static ExchangeOrderPhase toPhase(String status) {
        if (status == null) {
            return ExchangeOrderPhase.OPEN;
        }
        return switch (status) {
            case "PARTIALLY_FILLED" -> ExchangeOrderPhase.PARTIALLY_FILLED;
            case "FILLED" -> ExchangeOrderPhase.FILLED;
            case "CANCELED" -> ExchangeOrderPhase.CANCELED;
            case "REJECTED" -> ExchangeOrderPhase.REJECTED;
            case "EXPIRED", "EXPIRED_IN_MATCH" -> ExchangeOrderPhase.EXPIRED;
            default -> ExchangeOrderPhase.OPEN;
        };
    }

    private static BigDecimal safe(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
