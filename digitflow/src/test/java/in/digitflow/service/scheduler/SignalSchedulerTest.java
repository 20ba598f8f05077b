package in.digitflow.service.scheduler;

import in.digitflow.config.RiskConfig;
import in.digitflow.config.SchedulerConfig;
import in.digitflow.config.SignalConfig;
import in.digitflow.domain.common.EngineEvent;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.data.TickHistory;
import in.digitflow.domain.repository.ActivityLogRepository;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;
import in.digitflow.infrastructure.metrics.EngineMetrics;
import in.digitflow.infrastructure.persistence.InMemoryLearningMemoryRepository;
import in.digitflow.infrastructure.venue.TickStream;
import in.digitflow.service.core.EventService;
import in.digitflow.service.execution.ExecutionOrchestrator;
import in.digitflow.service.execution.ExecutionReport;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.risk.RiskDecision;
import in.digitflow.service.risk.RiskGuard;
import in.digitflow.service.signal.SignalEngine;
import in.digitflow.testing.Fixtures;
import in.digitflow.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SignalScheduler.
 *
 * Tests:
 * - Non-running sessions skip the cycle
 * - Warmup windows produce no candidate
 * - Candidate waits out the smart delay, one timer per session and market
 * - Revalidation veto, risk block and execution
 * - Stopped session never trades from a pending timer
 * - Drawdown guard pauses execution engine-wide
 * - Start and stop manage market subscriptions
 */
class SignalSchedulerTest {

    private SessionRepository sessions;
    private TickStream tickStream;
    private RiskGuard riskGuard;
    private ExecutionOrchestrator orchestrator;
    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    private SignalScheduler scheduler;

    private final TradingSession session = Fixtures.session("s1");

    private static TickHistory stickySeven() {
        List<Integer> digits = new ArrayList<>(List.of(0, 1, 2, 3, 4));
        digits.addAll(Collections.nCopies(20, 7));
        return TickHistory.ofDigits("R_100", digits);
    }

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Fixtures.T0);
        sessions = mock(SessionRepository.class);
        tickStream = mock(TickStream.class);
        riskGuard = mock(RiskGuard.class);
        orchestrator = mock(ExecutionOrchestrator.class);
        when(sessions.findSession("s1")).thenReturn(Optional.of(session));
        when(sessions.realizedProfitSince(anyString(), any())).thenReturn(BigDecimal.ZERO);
        when(tickStream.latestHistory("R_100")).thenReturn(stickySeven());

        EventService eventService = new EventService(events::add, mock(ActivityLogRepository.class), clock);
        SchedulerConfig config = new SchedulerConfig(Duration.ofHours(1), Duration.ofMillis(200),
            List.of("R_100"), Duration.ofSeconds(5));
        scheduler = new SignalScheduler(config, RiskConfig.defaults(), sessions, tickStream,
            new SignalEngine(SignalConfig.defaults(), clock),
            new LearningMemory(new InMemoryLearningMemoryRepository(), Duration.ofSeconds(5), clock),
            riskGuard, orchestrator, eventService, EngineMetrics.noop());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private long eventCount(EventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private static ExecutionReport executed() {
        return new ExecutionReport("s1", "R_100", Side.OVER, 7, ExecutionReport.Status.EXECUTED,
            List.of(), List.of(), List.of());
    }

    @Test
    void testSessionNotRunning() {
        when(sessions.findSession("s1")).thenReturn(Optional.of(session.withStatus(SessionStatus.PAUSED)));

        assertEquals(SignalScheduler.CycleOutcome.SESSION_NOT_RUNNING, scheduler.runCycle("s1"));
        verifyNoInteractions(tickStream);
    }

    @Test
    void testWarmupGivesNoSignal() {
        when(tickStream.latestHistory("R_100")).thenReturn(TickHistory.empty("R_100"));

        assertEquals(SignalScheduler.CycleOutcome.NO_SIGNAL, scheduler.runCycle("s1"));
        assertEquals(0, scheduler.pendingTimers());
    }

    @Test
    void testExecutionPausedSkipsCycle() {
        when(orchestrator.isPaused()).thenReturn(true);

        assertEquals(SignalScheduler.CycleOutcome.EXECUTION_PAUSED, scheduler.runCycle("s1"));
    }

    @Test
    void testSmartDelayThenExecute() throws InterruptedException {
        when(riskGuard.check(any(), any())).thenReturn(RiskDecision.allow());
        when(orchestrator.execute(any(), any())).thenReturn(executed());
        scheduler.start("s1");

        assertEquals(SignalScheduler.CycleOutcome.SCHEDULED, scheduler.runCycle("s1"));
        assertEquals(SignalScheduler.CycleOutcome.DELAY_PENDING, scheduler.runCycle("s1"),
            "One timer per session and market");

        verify(orchestrator, timeout(2000)).execute(eq(session), argThat(s -> s.side() == Side.OVER && s.digit() == 7));
        long deadline = System.currentTimeMillis() + 2000;
        while ((scheduler.pendingTimers() > 0 || eventCount(EventType.SESSION_REPORT) == 0)
            && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, scheduler.pendingTimers(), "Timer removed after it ran");
        assertEquals(1, eventCount(EventType.SIGNAL_GENERATED));
        assertEquals(1, eventCount(EventType.SESSION_REPORT));
    }

    @Test
    void testRevalidationVeto() {
        Signal candidate = Fixtures.signal("R_100", Side.OVER, 7, 0.7);
        when(tickStream.latestHistory("R_100")).thenReturn(TickHistory.empty("R_100"));
        scheduler.start("s1");

        assertEquals(SignalScheduler.RevalidationOutcome.VETOED, scheduler.revalidate("s1", candidate));

        assertEquals(1, eventCount(EventType.SIGNAL_VETOED));
        verifyNoInteractions(riskGuard);
        verify(orchestrator, never()).execute(any(), any());
    }

    @Test
    void testRevalidationRiskBlocked() {
        when(riskGuard.check(any(), any())).thenReturn(RiskDecision.reject(RiskDecision.RATE_LIMIT, "30 trades per minute"));
        scheduler.start("s1");

        SignalScheduler.RevalidationOutcome outcome =
            scheduler.revalidate("s1", Fixtures.signal("R_100", Side.OVER, 7, 0.7));

        assertEquals(SignalScheduler.RevalidationOutcome.RISK_BLOCKED, outcome);
        assertEquals(1, eventCount(EventType.RISK_BLOCKED));
        verify(orchestrator, never()).execute(any(), any());
    }

    @Test
    void testRevalidationStoppedSession() {
        scheduler.start("s1");
        when(sessions.findSession("s1")).thenReturn(Optional.empty());

        assertEquals(SignalScheduler.RevalidationOutcome.SESSION_NOT_RUNNING,
            scheduler.revalidate("s1", Fixtures.signal("R_100", Side.OVER, 7, 0.7)));
    }

    @Test
    void testRevalidationAfterStopDoesNotTrade() {
        when(riskGuard.check(any(), any())).thenReturn(RiskDecision.allow());
        scheduler.start("s1");
        scheduler.stop("s1");

        SignalScheduler.RevalidationOutcome outcome =
            scheduler.revalidate("s1", Fixtures.signal("R_100", Side.OVER, 7, 0.7));

        assertEquals(SignalScheduler.RevalidationOutcome.SESSION_NOT_RUNNING, outcome,
            "Session still reads running in storage, but its loop is gone");
        verify(riskGuard, never()).check(any(), any());
        verify(orchestrator, never()).execute(any(), any());
        assertEquals(0, eventCount(EventType.SIGNAL_GENERATED));
    }

    @Test
    void testStopDuringExecutionTearsDownAgain() {
        when(riskGuard.check(any(), any())).thenReturn(RiskDecision.allow());
        when(orchestrator.execute(any(), any())).thenAnswer(invocation -> {
            scheduler.stop("s1");
            return executed();
        });
        scheduler.start("s1");

        assertEquals(SignalScheduler.RevalidationOutcome.EXECUTED,
            scheduler.revalidate("s1", Fixtures.signal("R_100", Side.OVER, 7, 0.7)));

        verify(orchestrator, times(2)).stopSession("s1");
    }

    @Test
    void testDrawdownGuardPauses() {
        when(sessions.realizedProfitSince("s1", Fixtures.T0)).thenReturn(new BigDecimal("-1.50"));
        when(orchestrator.pause("drawdown_guard")).thenReturn(true);

        assertEquals(SignalScheduler.CycleOutcome.DRAWDOWN_PAUSED, scheduler.runCycle("s1"));

        verify(orchestrator).pause("drawdown_guard");
        assertEquals(1, eventCount(EventType.DRAWDOWN_GUARD));
        verifyNoInteractions(tickStream);
    }

    @Test
    void testDrawdownBelowLimit() {
        when(sessions.realizedProfitSince("s1", Fixtures.T0)).thenReturn(new BigDecimal("-1.40"));

        assertFalse(scheduler.drawdownBreached(session), "14% of the minimum balance is under 15%");
        verify(orchestrator, never()).pause(anyString());
    }

    @Test
    void testStartAndStop() {
        assertTrue(scheduler.start("s1"));
        assertFalse(scheduler.start("s1"), "Already scheduled");
        assertFalse(scheduler.start("missing"));

        verify(tickStream).subscribe("R_100");
        assertEquals(Set.of("s1"), scheduler.activeSessions());

        scheduler.stop("s1");

        verify(tickStream).unsubscribe("R_100");
        verify(orchestrator).stopSession("s1");
        verify(riskGuard).releaseSession("s1");
        assertTrue(scheduler.activeSessions().isEmpty());
    }
}
