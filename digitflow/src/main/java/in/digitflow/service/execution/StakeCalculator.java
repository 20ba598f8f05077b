package in.digitflow.service.execution;

import in.digitflow.config.ExecutionConfig;
import in.digitflow.domain.session.RecoveryState;
import in.digitflow.domain.session.StakingMode;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-account stake for one placement.
 *
 * <pre>
 *   FIXED        base stake
 *   PERCENTAGE   balance x stake percent (engine default 2 %)
 *   MARTINGALE   base stake x recovery multiplier
 *   recovery     base stake x recovery multiplier, whatever the staking mode
 * </pre>
 * Never below the venue minimum; rounded to cents.
 */
public final class StakeCalculator {

    private final ExecutionConfig config;

    public StakeCalculator(ExecutionConfig config) {
        this.config = config;
    }

    /**
     * @param recovery current martingale state, null outside recovery
     */
    public BigDecimal calculate(TradingSession session, TradingAccount account, RecoveryState recovery) {
        BigDecimal base = session.baseStake() != null && session.baseStake().signum() > 0
            ? session.baseStake()
            : config.minStake();

        BigDecimal stake;
        if (session.isRecovery() || session.stakingMode() == StakingMode.MARTINGALE) {
            BigDecimal multiplier = recovery != null && recovery.multiplier() != null
                ? recovery.multiplier()
                : BigDecimal.ONE;
            stake = base.multiply(multiplier);
        } else if (session.stakingMode() == StakingMode.PERCENTAGE) {
            BigDecimal pct = session.stakePercent() != null && session.stakePercent().signum() > 0
                ? session.stakePercent()
                : config.defaultStakePercent();
            BigDecimal balance = account.balance() == null ? BigDecimal.ZERO : account.balance();
            stake = balance.multiply(pct);
        } else {
            stake = base;
        }

        return stake.setScale(2, RoundingMode.HALF_UP).max(config.minStake().setScale(2, RoundingMode.HALF_UP));
    }
}
