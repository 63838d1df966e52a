package org.nowstart.tidepy.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool shared by all order workers; one worker per active order.
     */
    @Bean(name = "orderExecutor", destroyMethod = "shutdown")
    public ExecutorService orderExecutor(TradingProperties tradingProperties) {
        int poolSize = tradingProperties.execution().poolSize();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "order-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        log.info("event=order_pool_started pool_size={}", poolSize);
        return Executors.newFixedThreadPool(poolSize, threadFactory);
    }
}
