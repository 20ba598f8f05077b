package in.digitflow.domain.session;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Normalized session as seen by the engine, whichever schema the row came from.
 */
public record TradingSession(
    String id,
    String name,
    SessionType type,
    SessionStatus status,
    List<String> markets,
    StakingMode stakingMode,
    BigDecimal baseStake,
    BigDecimal stakePercent,           // Fraction of balance for PERCENTAGE, null = engine default
    BigDecimal martingaleMultiplier,   // null = engine default
    BigDecimal minBalance,
    BigDecimal defaultTakeProfit,
    BigDecimal defaultStopLoss,
    BigDecimal minTakeProfit,          // Floors; null = engine default
    BigDecimal minStopLoss,
    BigDecimal lossThreshold,          // Session max loss, null/0 = off
    BigDecimal recoveryTarget,         // Amount a recovery session must win back
    Instant startedAt
) {
    public TradingSession {
        markets = markets == null ? List.of() : List.copyOf(markets);
    }

    public boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    public boolean isRecovery() {
        return type == SessionType.RECOVERY;
    }

    public TradingSession withStatus(SessionStatus newStatus) {
        return new TradingSession(id, name, type, newStatus, markets, stakingMode, baseStake, stakePercent,
            martingaleMultiplier, minBalance, defaultTakeProfit, defaultStopLoss, minTakeProfit, minStopLoss,
            lossThreshold, recoveryTarget, startedAt);
    }
}
