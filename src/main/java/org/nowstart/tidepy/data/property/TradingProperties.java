package org.nowstart.tidepy.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.nowstart.tidepy.data.type.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tidepy.trading")
public record TradingProperties(
        // order execution mode (LIVE or PAPER)
        @NotNull @DefaultValue("PAPER") ExecutionMode executionMode,
        // Binance USD-M futures REST base URL
        @NotBlank @DefaultValue("https://fapi.binance.com") String baseUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("") String secretKey,
        // scheduler period, one cycle per tick
        @NotNull @DefaultValue("60s") Duration cycleInterval,
        // how long a cycle waits for its own orders before publishing the summary
        @NotNull @DefaultValue("45s") Duration orderAwaitTimeout,
        // equity used until the first successful account read
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("100000") BigDecimal initialEquity,
        @Valid @NotNull @DefaultValue Factor factor,
        @Valid @NotNull @DefaultValue Scoring scoring,
        @Valid @NotNull @DefaultValue Sizing sizing,
        @Valid @NotNull @DefaultValue Risk risk,
        @Valid @NotNull @DefaultValue Execution execution
) {

    /**
     * Cycle await deadline, never longer than the cycle interval itself.
     */
    public Duration effectiveAwaitTimeout() {
        return orderAwaitTimeout.compareTo(cycleInterval) > 0 ? cycleInterval : orderAwaitTimeout;
    }

    public record Factor(
            // 24h quote volume below this puts the asset in liquidity tier 0
            @DecimalMin("0") @DefaultValue("1000000") BigDecimal minTurnover,
            @DecimalMin("0") @DefaultValue("10000000") BigDecimal minMarketCap,
            // run-up that maps to a pump score of 1.0
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.0") BigDecimal pumpReferenceGain,
            // daily closes fetched for the pump window
            @Min(2) @DefaultValue("30") int priceWindowDays,
            @DefaultValue("true") boolean persistFactors
    ) {
    }

    public record Scoring(
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.8") BigDecimal unlockThreshold,
            @DecimalMin("0") @DefaultValue("0.5") BigDecimal pumpScoreWeight,
            @DecimalMin("0") @DefaultValue("0.3") BigDecimal liquidityWeight,
            @DecimalMin("0") @DefaultValue("0.2") BigDecimal trackWeight,
            // signals scoring below this are dropped
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.3") BigDecimal minStrength
    ) {
    }

    public record Sizing(
            // fraction of equity for the first entry
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") @DefaultValue("0.025") BigDecimal entryCapPct,
            // fraction of equity a single asset may never exceed
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") @DefaultValue("0.05") BigDecimal maxCapPct,
            // fraction of equity the whole book may never exceed
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.5") BigDecimal portfolioCeilingPct,
            @DecimalMin("0") @DefaultValue("5") BigDecimal minOrderNotional
    ) {
    }

    public record Risk(
            @DecimalMin("0") @DefaultValue("0.2") BigDecimal reduceLossThreshold,
            @DecimalMin("0") @DefaultValue("0.2") BigDecimal reduceProfitThreshold,
            @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") @DefaultValue("0.5") BigDecimal reduceRatio,
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.9") BigDecimal nearCapRatio,
            // loss fraction that unwinds the whole position
            @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.5") BigDecimal stopLossThreshold
    ) {
    }

    public record Execution(
            @Positive @DefaultValue("3") int retryAttemptLimit,
            @NotNull @DefaultValue("500ms") Duration backoffBase,
            @NotNull @DefaultValue("10s") Duration backoffCap,
            @NotNull @DefaultValue("1s") Duration pollInterval,
            @NotNull @DefaultValue("5m") Duration pollTimeout,
            @Positive @DefaultValue("8") int poolSize
    ) {
    }
}
