package org.nowstart.tidepy.config;

import feign.RequestInterceptor;
import java.time.Clock;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.service.auth.BinanceAuthRequestInterceptor;
import org.nowstart.tidepy.service.auth.BinanceRequestSigner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExchangeFeignConfig {

    @Bean
    public BinanceRequestSigner binanceRequestSigner(TradingProperties tradingProperties) {
        return new BinanceRequestSigner(tradingProperties.apiKey(), tradingProperties.secretKey());
    }

    @Bean
    public RequestInterceptor binanceAuthRequestInterceptor(BinanceRequestSigner binanceRequestSigner, Clock clock) {
        return new BinanceAuthRequestInterceptor(binanceRequestSigner, clock);
    }
}
