package org.nowstart.tidepy.service.execution;

import java.time.Duration;
import org.nowstart.tidepy.data.property.TradingProperties;

/**
 * Bounded exponential backoff for order submission: the n-th failure waits
 * {@code min(cap, base * 2^(n-1))} and no attempt is made past the limit.
 */
public class RetryPolicy {

    private final int attemptLimit;
    private final Duration base;
    private final Duration cap;

    public RetryPolicy(int attemptLimit, Duration base, Duration cap) {
        if (attemptLimit < 1) {
            throw new IllegalArgumentException("attemptLimit must be at least 1");
        }
        this.attemptLimit = attemptLimit;
        this.base = base;
        this.cap = cap;
    }

    public static RetryPolicy from(TradingProperties.Execution execution) {
        return new RetryPolicy(execution.retryAttemptLimit(), execution.backoffBase(), execution.backoffCap());
    }

    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts < attemptLimit;
    }

    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts < 1) {
            return Duration.ZERO;
        }
        long capMillis = cap.toMillis();
        long delayMillis = base.toMillis();
        for (int i = 1; i < failedAttempts && delayMillis < capMillis; i++) {
            delayMillis *= 2;
        }
        return Duration.ofMillis(Math.min(delayMillis, capMillis));
    }

    public int getAttemptLimit() {
        return attemptLimit;
    }
}
