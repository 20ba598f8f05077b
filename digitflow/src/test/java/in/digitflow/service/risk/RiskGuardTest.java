package in.digitflow.service.risk;

import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;
import in.digitflow.testing.Fixtures;
import in.digitflow.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RiskGuard.
 *
 * Tests:
 * - Session check runs first
 * - Breaker rejection does not consume a rate slot
 * - Exposure rejection hands the half-open probe back
 * - Rate limit is the last check
 * - Stopped session's rate windows are dropped
 */
class RiskGuardTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private CorrelationGuard correlation;
    private RateLimiter limiter;
    private RiskGuard guard;

    private final Signal signal = Fixtures.signal("R_100", Side.OVER, 4, 0.7);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Fixtures.T0);
        SessionRepository sessions = mock(SessionRepository.class);
        when(sessions.realizedProfitSince(anyString(), any())).thenReturn(BigDecimal.ZERO);
        breaker = new CircuitBreaker("venue", 2, Duration.ofSeconds(30), clock);
        correlation = new CorrelationGuard(1, 5);
        limiter = new RateLimiter(1, 10, clock);
        guard = new RiskGuard(new SessionRiskGuard(sessions, 0, clock), breaker, correlation, limiter);
    }

    @Test
    void testAllowedConsumesRateSlot() {
        TradingSession session = Fixtures.session("s1");

        assertTrue(guard.check(session, signal).allowed());
        RiskDecision second = guard.check(session, signal);

        assertEquals(RiskDecision.RATE_LIMIT, second.reason());
    }

    @Test
    void testSessionCheckFirst() {
        breaker.recordFailure();
        breaker.recordFailure();

        RiskDecision decision = guard.check(Fixtures.session("s1").withStatus(SessionStatus.COMPLETED), signal);

        assertEquals(RiskDecision.SESSION_INACTIVE, decision.reason());
    }

    @Test
    void testOpenBreakerKeepsRateSlot() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(RiskDecision.CIRCUIT_OPEN, guard.check(Fixtures.session("s1"), signal).reason());

        breaker.reset();
        assertTrue(guard.check(Fixtures.session("s1"), signal).allowed(), "Rejected check consumed nothing");
    }

    @Test
    void testExposureRejectionReleasesProbe() {
        correlation.register("R_100", "c-1");
        breaker.recordFailure();
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(30));

        RiskDecision decision = guard.check(Fixtures.session("s1"), signal);

        assertEquals(RiskDecision.EXPOSURE_LIMIT, decision.reason());
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        assertTrue(breaker.allowRequest(), "Probe is still available after the exposure rejection");
    }

    @Test
    void testReleaseSessionDropsRateWindows() {
        TradingSession session = Fixtures.session("s1");
        assertTrue(guard.check(session, signal).allowed());
        assertTrue(guard.check(Fixtures.session("s2"), signal).allowed());
        assertEquals(2, limiter.trackedKeys());

        guard.releaseSession("s1");

        assertEquals(1, limiter.trackedKeys(), "Only the stopped session is forgotten");
        assertTrue(guard.check(session, signal).allowed(), "Fresh window after release");
    }
}
