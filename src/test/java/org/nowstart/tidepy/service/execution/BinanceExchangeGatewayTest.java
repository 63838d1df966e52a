package org.nowstart.tidepy.service.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.tidepy.data.dto.BinanceAccountResponse;
import org.nowstart.tidepy.data.dto.BinanceExchangeInfoResponse;
import org.nowstart.tidepy.data.dto.BinanceExchangeInfoResponse.SymbolFilter;
import org.nowstart.tidepy.data.dto.BinanceExchangeInfoResponse.SymbolInfo;
import org.nowstart.tidepy.data.dto.BinanceOrderResponse;
import org.nowstart.tidepy.data.exception.ExchangeException;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.OrderTicket;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.repository.BinanceFuturesFeignClient;

@ExtendWith(MockitoExtension.class)
class BinanceExchangeGatewayTest {

    @Mock
    private BinanceFuturesFeignClient binanceFuturesFeignClient;

    private BinanceExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new BinanceExchangeGateway(binanceFuturesFeignClient);
    }

    @Test
    void submitOrder_roundsQuantityDownToLotStep() {
        when(binanceFuturesFeignClient.getExchangeInfo()).thenReturn(exchangeInfo());
        when(binanceFuturesFeignClient.createOrder("DOGEUSDT", "SELL", "MARKET", "12.3", false, "abc1r1", "RESULT"))
                .thenReturn(orderResponse(42L, "FILLED"));

        String exchangeOrderId = gateway.submitOrder(new OrderTicket(
                "DOGEUSDT", OrderSide.SELL, new BigDecimal("2.5"), new BigDecimal("12.3456"), false, "abc1r1"));

        assertThat(exchangeOrderId).isEqualTo("42");
    }

    @Test
    void submitOrder_rejectsQuantityBelowLotStep() {
        when(binanceFuturesFeignClient.getExchangeInfo()).thenReturn(exchangeInfo());

        assertThatThrownBy(() -> gateway.submitOrder(new OrderTicket(
                "DOGEUSDT", OrderSide.BUY, new BigDecimal("0.01"), new BigDecimal("0.05"), true, "abc1r1")))
                .isInstanceOfSatisfying(ExchangeException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.EXCHANGE_TERMINAL));
        verify(binanceFuturesFeignClient, never())
                .createOrder(anyString(), anyString(), anyString(), anyString(), anyBoolean(), anyString(), anyString());
    }

    @Test
    void submitOrder_classifiesServerErrorAsTransient() {
        when(binanceFuturesFeignClient.getExchangeInfo()).thenReturn(exchangeInfo());
        when(binanceFuturesFeignClient.createOrder(anyString(), anyString(), anyString(), anyString(), anyBoolean(), anyString(), anyString()))
                .thenThrow(feignFailure(503));

        assertThatThrownBy(() -> gateway.submitOrder(new OrderTicket(
                "DOGEUSDT", OrderSide.SELL, new BigDecimal("2.5"), new BigDecimal("10"), false, "abc1r1")))
                .isInstanceOfSatisfying(ExchangeException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void submitOrder_loadsExchangeInfoOnce() {
        when(binanceFuturesFeignClient.getExchangeInfo()).thenReturn(exchangeInfo());

        assertThat(gateway.roundToStep("DOGEUSDT", new BigDecimal("7.77"))).isEqualByComparingTo("7.7");
        assertThat(gateway.roundToStep("ARBUSDT", new BigDecimal("7.77"))).isEqualByComparingTo("7");
        assertThat(gateway.roundToStep("UNKNOWNUSDT", new BigDecimal("7.77"))).isEqualByComparingTo("7.77");
        verify(binanceFuturesFeignClient, times(1)).getExchangeInfo();
    }

    @Test
    void pollOrder_mapsOrderResponse() {
        when(binanceFuturesFeignClient.getOrder("DOGEUSDT", 42L)).thenReturn(new BinanceOrderResponse(
                42L,
                "DOGEUSDT",
                "abc1r1",
                "PARTIALLY_FILLED",
                "SELL",
                new BigDecimal("10"),
                new BigDecimal("4"),
                new BigDecimal("0.8"),
                new BigDecimal("0.2")
        ));

        ExchangeOrderState state = gateway.pollOrder("DOGEUSDT", "42");

        assertThat(state.phase()).isEqualTo(ExchangeOrderPhase.PARTIALLY_FILLED);
        assertThat(state.filledQuantity()).isEqualByComparingTo("4");
        assertThat(state.filledNotional()).isEqualByComparingTo("0.8");
        assertThat(state.avgPrice()).isEqualByComparingTo("0.2");
        assertThat(state.isClosed()).isFalse();
    }

    @Test
    void toState_dropsZeroAveragePrice() {
        ExchangeOrderState state = BinanceExchangeGateway.toState(orderResponse(7L, "NEW"), "7");

        assertThat(state.phase()).isEqualTo(ExchangeOrderPhase.OPEN);
        assertThat(state.avgPrice()).isNull();
        assertThat(state.filledQuantity()).isEqualByComparingTo("0");
    }

    @Test
    void toPhase_mapsBinanceStatuses() {
        assertThat(BinanceExchangeGateway.toPhase("NEW")).isEqualTo(ExchangeOrderPhase.OPEN);
        assertThat(BinanceExchangeGateway.toPhase(null)).isEqualTo(ExchangeOrderPhase.OPEN);
        assertThat(BinanceExchangeGateway.toPhase("FILLED")).isEqualTo(ExchangeOrderPhase.FILLED);
        assertThat(BinanceExchangeGateway.toPhase("CANCELED")).isEqualTo(ExchangeOrderPhase.CANCELED);
        assertThat(BinanceExchangeGateway.toPhase("REJECTED")).isEqualTo(ExchangeOrderPhase.REJECTED);
        assertThat(BinanceExchangeGateway.toPhase("EXPIRED_IN_MATCH")).isEqualTo(ExchangeOrderPhase.EXPIRED);
    }

    @Test
    void findOrderByClientId_returnsAcceptedOrderId() {
        when(binanceFuturesFeignClient.getOrderByClientOrderId("DOGEUSDT", "abc1r1")).thenReturn(orderResponse(42L, "NEW"));

        assertThat(gateway.findOrderByClientId("DOGEUSDT", "abc1r1")).contains("42");
    }

    @Test
    void findOrderByClientId_returnsEmptyWhenOrderDoesNotExist() {
        when(binanceFuturesFeignClient.getOrderByClientOrderId("DOGEUSDT", "abc1r1"))
                .thenThrow(feignFailure(400, "{\"code\":-2013,\"msg\":\"Order does not exist.\"}"));

        assertThat(gateway.findOrderByClientId("DOGEUSDT", "abc1r1")).isEmpty();
    }

    @Test
    void findOrderByClientId_classifiesOtherFailures() {
        when(binanceFuturesFeignClient.getOrderByClientOrderId("DOGEUSDT", "abc1r1")).thenThrow(feignFailure(503));

        assertThatThrownBy(() -> gateway.findOrderByClientId("DOGEUSDT", "abc1r1"))
                .isInstanceOfSatisfying(ExchangeException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void fetchAccountEquity_fallsBackToWalletBalance() {
        when(binanceFuturesFeignClient.getAccount())
                .thenReturn(new BinanceAccountResponse(new BigDecimal("1000"), new BigDecimal("1020"), new BigDecimal("900")))
                .thenReturn(new BinanceAccountResponse(new BigDecimal("1000"), null, new BigDecimal("900")));

        assertThat(gateway.fetchAccountEquity()).isEqualByComparingTo("1020");
        assertThat(gateway.fetchAccountEquity()).isEqualByComparingTo("1000");
    }

    private static BinanceExchangeInfoResponse exchangeInfo() {
        return new BinanceExchangeInfoResponse(List.of(
                new SymbolInfo("DOGEUSDT", "TRADING", List.of(
                        new SymbolFilter("PRICE_FILTER", null, null),
                        new SymbolFilter("LOT_SIZE", new BigDecimal("0.1"), new BigDecimal("0.1"))
                )),
                new SymbolInfo("ARBUSDT", "TRADING", List.of(
                        new SymbolFilter("LOT_SIZE", BigDecimal.ONE, BigDecimal.ONE)
                ))
        ));
    }

    private static BinanceOrderResponse orderResponse(Long orderId, String status) {
        return new BinanceOrderResponse(
                orderId,
                "DOGEUSDT",
                "abc1r1",
                status,
                "SELL",
                new BigDecimal("12.3"),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO
        );
    }

    private static FeignException feignFailure(int status) {
        return feignFailure(status, null);
    }

    private static FeignException feignFailure(int status, String body) {
        Request request = Request.create(
                Request.HttpMethod.POST,
                "https://fapi.binance.com/fapi/v1/order",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(status)
                .reason("status " + status)
                .request(request)
                .headers(Map.of())
                .body(body, StandardCharsets.UTF_8)
                .build();
        return FeignException.errorStatus("BinanceFuturesFeignClient#createOrder", response);
    }
}
