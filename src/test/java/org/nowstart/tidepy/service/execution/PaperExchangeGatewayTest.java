package org.nowstart.tidepy.service.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.tidepy.TradingPropertiesFixture;
import org.nowstart.tidepy.data.exception.ExchangeException;
import org.nowstart.tidepy.data.model.ExchangeOrderState;
import org.nowstart.tidepy.data.model.OrderTicket;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.ExchangeOrderPhase;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.service.risk.MarkPriceBook;
import org.nowstart.tidepy.service.risk.RiskManager;

@ExtendWith(MockitoExtension.class)
class PaperExchangeGatewayTest {

    @Mock
    private RiskManager riskManager;

    private MarkPriceBook markPriceBook;
    private PaperExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        markPriceBook = new MarkPriceBook();
        gateway = new PaperExchangeGateway(markPriceBook, riskManager, TradingPropertiesFixture.defaults());
    }

    @Test
    void submitOrder_fillsInFullAtMarkPrice() {
        markPriceBook.update("DOGEUSDT", new BigDecimal("0.25"));

        String exchangeOrderId = gateway.submitOrder(
                new OrderTicket("DOGEUSDT", OrderSide.SELL, new BigDecimal("100"), new BigDecimal("400"), false, "c1r1"));
        ExchangeOrderState state = gateway.pollOrder("DOGEUSDT", exchangeOrderId);

        assertThat(exchangeOrderId).startsWith("paper-");
        assertThat(state.phase()).isEqualTo(ExchangeOrderPhase.FILLED);
        assertThat(state.filledQuantity()).isEqualByComparingTo("400");
        assertThat(state.filledNotional()).isEqualByComparingTo("100");
        assertThat(state.avgPrice()).isEqualByComparingTo("0.25");
    }

    @Test
    void pollOrder_forgetsOrderOnceReportedClosed() {
        markPriceBook.update("DOGEUSDT", new BigDecimal("0.25"));
        String exchangeOrderId = gateway.submitOrder(
                new OrderTicket("DOGEUSDT", OrderSide.SELL, new BigDecimal("100"), new BigDecimal("400"), false, "c1r1"));

        assertThat(gateway.findOrderByClientId("DOGEUSDT", "c1r1")).contains(exchangeOrderId);
        gateway.pollOrder("DOGEUSDT", exchangeOrderId);

        assertThat(gateway.openOrderCount()).isZero();
        assertThat(gateway.findOrderByClientId("DOGEUSDT", "c1r1")).isEmpty();
        assertThatThrownBy(() -> gateway.pollOrder("DOGEUSDT", exchangeOrderId))
                .isInstanceOf(ExchangeException.class);
    }

    @Test
    void submitOrder_rejectsAssetWithoutMarkPrice() {
        assertThatThrownBy(() -> gateway.submitOrder(
                new OrderTicket("NOMARKUSDT", OrderSide.SELL, new BigDecimal("100"), BigDecimal.TEN, false, "c1r1")))
                .isInstanceOfSatisfying(ExchangeException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.EXCHANGE_TERMINAL));
    }

    @Test
    void pollOrder_rejectsUnknownOrder() {
        assertThatThrownBy(() -> gateway.pollOrder("DOGEUSDT", "paper-99"))
                .isInstanceOf(ExchangeException.class);
        assertThatThrownBy(() -> gateway.cancelOrder("DOGEUSDT", "paper-99"))
                .isInstanceOf(ExchangeException.class);
    }

    @Test
    void fetchAccountEquity_addsRealizedPnlToInitialEquity() {
        when(riskManager.totalRealizedPnl()).thenReturn(new BigDecimal("-250"));

        assertThat(gateway.fetchAccountEquity()).isEqualByComparingTo("99750");
    }
}
