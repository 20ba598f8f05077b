package in.digitflow.config;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Trade placement and safety settings.
 */
public record ExecutionConfig(
    Duration placementDelay,         // Pause between two buys of one round
    BigDecimal minStake,             // Venue floor for a stake
    BigDecimal defaultStakePercent,  // PERCENTAGE staking when the session carries none (0.02 = 2%)
    BigDecimal defaultMartingaleMultiplier,
    BigDecimal minTakeProfit,        // Admin floors when the session has none
    BigDecimal minStopLoss,
    String currency,
    int contractDuration,
    String durationUnit,             // "t" = ticks
    Duration requestTimeout,
    int maxConsecutiveLosses,        // Global pause threshold
    int apiErrorThreshold            // Global pause threshold
) {
    public static ExecutionConfig defaults() {
        return new ExecutionConfig(
            Duration.ofMillis(500),
            new BigDecimal("0.35"),
            new BigDecimal("0.02"),
            new BigDecimal("2.0"),
            new BigDecimal("5"),
            new BigDecimal("3"),
            "USD",
            1,
            "t",
            Duration.ofSeconds(15),
            5,
            5
        );
    }

    public boolean isValid() {
        return !placementDelay.isNegative()
            && minStake.signum() > 0
            && defaultStakePercent.signum() > 0 && defaultStakePercent.compareTo(BigDecimal.ONE) <= 0
            && defaultMartingaleMultiplier.compareTo(BigDecimal.ONE) >= 0
            && contractDuration > 0
            && maxConsecutiveLosses > 0 && apiErrorThreshold > 0;
    }
}
