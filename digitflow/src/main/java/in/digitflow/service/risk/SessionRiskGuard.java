package in.digitflow.service.risk;

import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Session-level checks: status, realized loss limits and regime.
 */
public final class SessionRiskGuard {
    private static final Logger log = LoggerFactory.getLogger(SessionRiskGuard.class);

    private final SessionRepository sessions;
    private final BigDecimal dailyLossCap;
    private final Clock clock;

    public SessionRiskGuard(SessionRepository sessions, double dailyLossCap, Clock clock) {
        this.sessions = sessions;
        this.dailyLossCap = BigDecimal.valueOf(dailyLossCap);
        this.clock = clock;
    }

    public RiskDecision check(TradingSession session, Signal signal) {
        if (!session.isRunning()) {
            return RiskDecision.reject(RiskDecision.SESSION_INACTIVE, "status " + session.status().label());
        }
        if (signal.regime() == Regime.CHAOS) {
            return RiskDecision.reject(RiskDecision.REGIME_CHAOS, "market " + signal.market() + " in chaos");
        }

        try {
            BigDecimal lossThreshold = session.lossThreshold();
            if (lossThreshold != null && lossThreshold.signum() > 0) {
                Instant since = session.startedAt() != null ? session.startedAt() : Instant.EPOCH;
                BigDecimal sessionPnl = sessions.realizedProfitSince(session.id(), since);
                if (sessionPnl.compareTo(lossThreshold.negate()) <= 0) {
                    return RiskDecision.reject(RiskDecision.SESSION_MAX_LOSS,
                        "session P&L " + sessionPnl.toPlainString() + " reached -" + lossThreshold.toPlainString());
                }
            }

            if (dailyLossCap.signum() > 0) {
                Instant startOfDay = LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay().toInstant(ZoneOffset.UTC);
                BigDecimal todayPnl = sessions.realizedProfitSince(session.id(), startOfDay);
                if (todayPnl.compareTo(dailyLossCap.negate()) <= 0) {
                    return RiskDecision.reject(RiskDecision.DAILY_LOSS,
                        "today's P&L " + todayPnl.toPlainString() + " reached -" + dailyLossCap.toPlainString());
                }
            }
        } catch (RuntimeException e) {
            log.error("[SessionRiskGuard] Cannot read realized P&L for session {}: {}", session.id(), e.getMessage());
            return RiskDecision.reject(RiskDecision.RISK_DATA_UNAVAILABLE, e.getMessage());
        }

        return RiskDecision.allow();
    }
}
