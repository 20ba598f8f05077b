package in.digitflow.service.risk;

import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission control in front of execution.
 *
 * Order: session → circuit breaker → exposure → rate limit. The first rejection wins.
 * The rate limiter runs last since an allowed check consumes a slot.
 */
public final class RiskGuard {
    private static final Logger log = LoggerFactory.getLogger(RiskGuard.class);

    private final SessionRiskGuard sessionGuard;
    private final CircuitBreaker circuitBreaker;
    private final CorrelationGuard correlationGuard;
    private final RateLimiter rateLimiter;

    public RiskGuard(SessionRiskGuard sessionGuard, CircuitBreaker circuitBreaker,
                     CorrelationGuard correlationGuard, RateLimiter rateLimiter) {
        this.sessionGuard = sessionGuard;
        this.circuitBreaker = circuitBreaker;
        this.correlationGuard = correlationGuard;
        this.rateLimiter = rateLimiter;
    }

    public RiskDecision check(TradingSession session, Signal signal) {
        RiskDecision decision = sessionGuard.check(session, signal);
        if (!decision.allowed()) {
            return rejected(session, signal, decision);
        }

        decision = circuitBreaker.check();
        if (!decision.allowed()) {
            return rejected(session, signal, decision);
        }

        decision = correlationGuard.check(signal.market());
        if (!decision.allowed()) {
            circuitBreaker.releaseProbe();
            return rejected(session, signal, decision);
        }

        decision = rateLimiter.tryAcquire(session.id());
        if (!decision.allowed()) {
            circuitBreaker.releaseProbe();
            return rejected(session, signal, decision);
        }

        return RiskDecision.allow();
    }

    /**
     * Forget per-session state once the session stops.
     */
    public void releaseSession(String sessionId) {
        rateLimiter.reset(sessionId);
    }

    private RiskDecision rejected(TradingSession session, Signal signal, RiskDecision decision) {
        log.info("[RiskGuard] Blocked {} {} for session {}: {} ({})",
            signal.market(), signal.side(), session.id(), decision.reason(), decision.detail());
        return decision;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public CorrelationGuard correlationGuard() {
        return correlationGuard;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }
}
