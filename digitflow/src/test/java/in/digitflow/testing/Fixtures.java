package in.digitflow.testing;

import in.digitflow.domain.session.Credential;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.SessionType;
import in.digitflow.domain.session.StakingMode;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.DecisionLog;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Shared builders for sessions, participants and signals.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-04-10T08:00:00Z");

    public static TradingSession session(String id) {
        return session(id, SessionType.DAY, StakingMode.FIXED);
    }

    public static TradingSession session(String id, SessionType type, StakingMode mode) {
        return new TradingSession(id, "Morning digits", type, SessionStatus.RUNNING, List.of("R_100"), mode,
            new BigDecimal("1.00"), null, null, new BigDecimal("10"),
            new BigDecimal("10"), new BigDecimal("5"), null, null,
            null, new BigDecimal("20"), T0);
    }

    public static TradingSession withLossThreshold(TradingSession s, BigDecimal threshold) {
        return new TradingSession(s.id(), s.name(), s.type(), s.status(), s.markets(), s.stakingMode(),
            s.baseStake(), s.stakePercent(), s.martingaleMultiplier(), s.minBalance(), s.defaultTakeProfit(),
            s.defaultStopLoss(), s.minTakeProfit(), s.minStopLoss(), threshold, s.recoveryTarget(), s.startedAt());
    }

    public static TradingAccount account(String id, String token, BigDecimal balance) {
        return new TradingAccount(id, "CR" + id, token == null ? null : Credential.of(token), balance, "USD", true);
    }

    public static Participant participant(String id, String sessionId, TradingAccount account) {
        return new Participant(id, sessionId, "user-" + id, ParticipantStatus.ACTIVE,
            new BigDecimal("10"), new BigDecimal("5"), account);
    }

    public static Signal signal(String market, Side side, int digit, double confidence) {
        return signal(market, side, digit, confidence, Regime.STABLE);
    }

    public static Signal signal(String market, Side side, int digit, double confidence, Regime regime) {
        List<IndicatorVote> votes = List.of(
            new IndicatorVote(Indicator.MARKOV, side, 0.6, 0.6, "MKV"),
            new IndicatorVote(Indicator.BIAS, side.opposite(), 0.2, 0.12, "BIAS"));
        DecisionLog log = new DecisionLog(60, 2.1, regime, side == Side.OVER ? 0.6 : 0.12,
            side == Side.OVER ? 0.12 : 0.6, 0.72, confidence, side, confidence, 0.25, digit, 0.5,
            votes, true, true, "test");
        return new Signal(market, side, digit, confidence, regime, Set.of(Indicator.MARKOV, Indicator.BIAS),
            T0, "test", log);
    }

    private Fixtures() {}
}
