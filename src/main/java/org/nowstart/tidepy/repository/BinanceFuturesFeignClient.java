package org.nowstart.tidepy.repository;

import java.util.List;
import org.nowstart.tidepy.config.ExchangeFeignConfig;
import org.nowstart.tidepy.data.dto.BinanceAccountResponse;
import org.nowstart.tidepy.data.dto.BinanceExchangeInfoResponse;
import org.nowstart.tidepy.data.dto.BinanceOrderResponse;
import org.nowstart.tidepy.data.dto.BinancePremiumIndexResponse;
import org.nowstart.tidepy.data.dto.BinanceTickerResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "binanceFuturesClient",
        url = "${tidepy.trading.base-url:https://fapi.binance.com}",
        configuration = ExchangeFeignConfig.class
)
public interface BinanceFuturesFeignClient {

    @GetMapping("/fapi/v1/premiumIndex")
    List<BinancePremiumIndexResponse> getPremiumIndexes();

    @GetMapping("/fapi/v1/ticker/24hr")
    List<BinanceTickerResponse> get24hTickers();

    /**
     * Each kline is a JSON array; index 4 holds the close price as a string.
     */
    @GetMapping("/fapi/v1/klines")
    List<List<Object>> getKlines(
            @RequestParam("symbol") String symbol,
            @RequestParam("interval") String interval,
            @RequestParam("endTime") long endTime,
            @RequestParam("limit") int limit
    );

    @GetMapping("/fapi/v1/exchangeInfo")
    BinanceExchangeInfoResponse getExchangeInfo();

    @PostMapping("/fapi/v1/order")
    BinanceOrderResponse createOrder(
            @RequestParam("symbol") String symbol,
            @RequestParam("side") String side,
            @RequestParam("type") String type,
            @RequestParam("quantity") String quantity,
            @RequestParam("reduceOnly") boolean reduceOnly,
            @RequestParam("newClientOrderId") String newClientOrderId,
            @RequestParam("newOrderRespType") String newOrderRespType
    );

    @GetMapping("/fapi/v1/order")
    BinanceOrderResponse getOrder(@RequestParam("symbol") String symbol, @RequestParam("orderId") long orderId);

    @GetMapping("/fapi/v1/order")
    BinanceOrderResponse getOrderByClientOrderId(
            @RequestParam("symbol") String symbol,
            @RequestParam("origClientOrderId") String origClientOrderId
    );

    @DeleteMapping("/fapi/v1/order")
    BinanceOrderResponse cancelOrder(@RequestParam("symbol") String symbol, @RequestParam("orderId") long orderId);

    @GetMapping("/fapi/v2/account")
    BinanceAccountResponse getAccount();
}
