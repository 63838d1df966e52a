package org.nowstart.tidepy.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestInterceptor;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import org.nowstart.tidepy.TradingPropertiesFixture;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.service.auth.BinanceAuthRequestInterceptor;
import org.nowstart.tidepy.service.auth.BinanceRequestSigner;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class ExchangeFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ExchangeFeignConfig.class, TradingPropsTestConfig.class);

    @Test
    void contextLoadsWithExchangeFeignConfig() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(BinanceRequestSigner.class);
            assertThat(context.getBean(BinanceRequestSigner.class).getApiKey()).isEqualTo("api-key");
            assertThat(context.getBean(RequestInterceptor.class)).isInstanceOf(BinanceAuthRequestInterceptor.class);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class TradingPropsTestConfig {

        @Bean
        TradingProperties tradingProperties() {
            return TradingPropertiesFixture.defaults();
        }

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }
}
