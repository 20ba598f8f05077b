package in.digitflow.service.risk;

import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Side;
import in.digitflow.testing.Fixtures;
import in.digitflow.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionRiskGuard.
 *
 * Tests:
 * - Non-running sessions are rejected without touching the repository
 * - Chaos regime is rejected
 * - Session loss threshold measured from session start
 * - Daily cap measured from UTC midnight
 * - Repository failure fails closed
 */
@ExtendWith(MockitoExtension.class)
class SessionRiskGuardTest {

    private static final Instant MIDNIGHT = Instant.parse("2026-04-10T00:00:00Z");

    @Mock
    private SessionRepository sessions;

    private SessionRiskGuard guard;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Fixtures.T0.plusSeconds(3600));
        guard = new SessionRiskGuard(sessions, 50.0, clock);
    }

    @Test
    void testPausedSessionRejected() {
        TradingSession paused = Fixtures.session("s1").withStatus(SessionStatus.PAUSED);

        RiskDecision decision = guard.check(paused, Fixtures.signal("R_100", Side.OVER, 4, 0.7));

        assertFalse(decision.allowed());
        assertEquals(RiskDecision.SESSION_INACTIVE, decision.reason());
        verifyNoInteractions(sessions);
    }

    @Test
    void testChaosRegimeRejected() {
        RiskDecision decision = guard.check(Fixtures.session("s1"),
            Fixtures.signal("R_100", Side.OVER, 4, 0.7, Regime.CHAOS));

        assertFalse(decision.allowed());
        assertEquals(RiskDecision.REGIME_CHAOS, decision.reason());
    }

    @Test
    void testSessionLossThresholdReached() {
        TradingSession session = Fixtures.withLossThreshold(Fixtures.session("s1"), new BigDecimal("20"));
        when(sessions.realizedProfitSince("s1", Fixtures.T0)).thenReturn(new BigDecimal("-20.00"));

        RiskDecision decision = guard.check(session, Fixtures.signal("R_100", Side.OVER, 4, 0.7));

        assertFalse(decision.allowed());
        assertEquals(RiskDecision.SESSION_MAX_LOSS, decision.reason());
    }

    @Test
    void testWithinLimitsAllowed() {
        TradingSession session = Fixtures.withLossThreshold(Fixtures.session("s1"), new BigDecimal("20"));
        when(sessions.realizedProfitSince(eq("s1"), any(Instant.class))).thenReturn(new BigDecimal("-5.00"));

        RiskDecision decision = guard.check(session, Fixtures.signal("R_100", Side.OVER, 4, 0.7));

        assertTrue(decision.allowed());
        verify(sessions).realizedProfitSince("s1", Fixtures.T0);
        verify(sessions).realizedProfitSince("s1", MIDNIGHT);
    }

    @Test
    void testDailyCapReached() {
        when(sessions.realizedProfitSince("s1", MIDNIGHT)).thenReturn(new BigDecimal("-51"));

        RiskDecision decision = guard.check(Fixtures.session("s1"), Fixtures.signal("R_100", Side.UNDER, 6, 0.7));

        assertFalse(decision.allowed());
        assertEquals(RiskDecision.DAILY_LOSS, decision.reason());
    }

    @Test
    void testRepositoryFailureFailsClosed() {
        when(sessions.realizedProfitSince(anyString(), any(Instant.class)))
            .thenThrow(new IllegalStateException("connection refused"));

        RiskDecision decision = guard.check(Fixtures.session("s1"), Fixtures.signal("R_100", Side.OVER, 4, 0.7));

        assertFalse(decision.allowed(), "Unknown P&L must not allow trading");
        assertEquals(RiskDecision.RISK_DATA_UNAVAILABLE, decision.reason());
    }
}
