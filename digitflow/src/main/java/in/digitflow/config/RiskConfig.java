package in.digitflow.config;

import java.time.Duration;

/**
 * Admission-control limits applied before a signal reaches execution.
 */
public record RiskConfig(
    int tradesPerMinute,
    int tradesPerHour,

    int breakerFailureThreshold,
    Duration breakerResetTimeout,

    int maxOpenPerMarket,
    int maxOpenGlobal,

    double dailyLossCap,            // Realized loss (positive number) that blocks a session; 0 = off

    boolean drawdownGuardEnabled,
    double maxDrawdownPercent       // Net session loss as % of the balance reference
) {
    public static RiskConfig defaults() {
        return new RiskConfig(
            30, 500,
            5, Duration.ofSeconds(60),
            3, 10,
            0,
            true, 15.0
        );
    }

    public boolean isValid() {
        return tradesPerMinute > 0 && tradesPerHour >= tradesPerMinute
            && breakerFailureThreshold > 0
            && !breakerResetTimeout.isNegative() && !breakerResetTimeout.isZero()
            && maxOpenPerMarket > 0 && maxOpenGlobal >= maxOpenPerMarket
            && dailyLossCap >= 0
            && maxDrawdownPercent > 0 && maxDrawdownPercent <= 100;
    }
}
