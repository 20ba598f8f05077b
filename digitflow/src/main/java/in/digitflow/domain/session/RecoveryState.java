package in.digitflow.domain.session;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Martingale bookkeeping for a recovery session.
 */
public record RecoveryState(
    String sessionId,
    BigDecimal multiplier,
    int consecutiveLosses,
    int maxConsecutiveLosses,
    BigDecimal recoveredAmount,
    BigDecimal targetAmount,
    boolean completed
) {
    public static RecoveryState start(String sessionId, BigDecimal target) {
        return new RecoveryState(sessionId, BigDecimal.ONE, 0, 0, BigDecimal.ZERO,
            target == null ? BigDecimal.ZERO : target, false);
    }

    /** Percent of the target already won back, capped at 100. */
    public BigDecimal progressPercent() {
        if (targetAmount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal pct = recoveredAmount.multiply(BigDecimal.valueOf(100))
            .divide(targetAmount, 2, RoundingMode.HALF_UP);
        return pct.min(BigDecimal.valueOf(100));
    }
}
