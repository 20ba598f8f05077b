package in.digitflow.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.digitflow.config.ExecutionConfig;
import in.digitflow.config.VenueConfig;
import in.digitflow.domain.common.EngineEvent;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.repository.ActivityLogRepository;
import in.digitflow.domain.repository.RecoveryStateRepository;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.repository.TradeAuditRepository;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;
import in.digitflow.domain.trade.ContractStatus;
import in.digitflow.domain.trade.TradeExecution;
import in.digitflow.infrastructure.metrics.EngineMetrics;
import in.digitflow.infrastructure.persistence.InMemoryLearningMemoryRepository;
import in.digitflow.infrastructure.venue.ConnectionPool;
import in.digitflow.service.core.EventService;
import in.digitflow.service.core.NotificationSink;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.risk.CircuitBreaker;
import in.digitflow.service.risk.CorrelationGuard;
import in.digitflow.testing.FakeVenue;
import in.digitflow.testing.Fixtures;
import in.digitflow.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionOrchestrator against an in-process venue.
 *
 * Tests:
 * - Round places one contract per eligible account, counts as one position
 * - TP exit sells, settled loss does not, round books learning once
 * - Invalid and unauthorized accounts reported, never bought for
 * - Buy rejections trip the API error pause
 * - Stop session tears down monitors and connections
 * - Dropped connection: contracts re-watched on a new one, or released when that fails
 * - Half-open breaker trial handed back when nothing reached the venue
 * - Transport failures count toward the API error pause
 * - Barrier clamping
 */
class ExecutionOrchestratorTest {

    private static final ExecutionConfig CONFIG = new ExecutionConfig(
        Duration.ZERO, new BigDecimal("0.35"), new BigDecimal("0.02"), new BigDecimal("2.0"),
        new BigDecimal("5"), new BigDecimal("3"), "USD", 1, "t", Duration.ofSeconds(2), 3, 2);

    private FakeVenue venue;
    private ConnectionPool pool;
    private SessionRepository sessions;
    private TradeAuditRepository audit;
    private CircuitBreaker breaker;
    private CorrelationGuard correlation;
    private LearningMemory learning;
    private MutableClock clock;
    private EventService eventService;
    private RecoveryManager recovery;
    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    private ExecutionOrchestrator orchestrator;

    private final TradingSession session = Fixtures.session("s1");
    private final Signal signal = Fixtures.signal("R_100", Side.OVER, 4, 0.72);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Fixtures.T0);
        venue = new FakeVenue();
        sessions = mock(SessionRepository.class);
        audit = mock(TradeAuditRepository.class);
        breaker = new CircuitBreaker("venue", 5, Duration.ofSeconds(30), clock);
        correlation = new CorrelationGuard(3, 10);
        learning = new LearningMemory(new InMemoryLearningMemoryRepository(), Duration.ofMinutes(5), clock);
        NotificationSink sink = events::add;
        eventService = new EventService(sink, mock(ActivityLogRepository.class), clock);
        recovery = new RecoveryManager(mock(RecoveryStateRepository.class), sessions, eventService, CONFIG);
        build(Duration.ofSeconds(2));
    }

    private void build(Duration requestTimeout) {
        VenueConfig venueConfig = new VenueConfig("wss://venue.test/websockets/v3?app_id=1",
            Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(120),
            Duration.ofSeconds(2), Duration.ofSeconds(1), 3);
        pool = new ConnectionPool(venueConfig, venue, requestTimeout, clock);
        orchestrator = new ExecutionOrchestrator(CONFIG, sessions, audit, pool, breaker, correlation,
            learning, recovery, eventService, EngineMetrics.noop(), clock);
    }

    private void tripToHalfOpen() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(31));
        assertTrue(breaker.allowRequest(), "Trial granted, as the risk guard would");
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        pool.shutdown();
    }

    private Participant participant(String id, String token) {
        return Fixtures.participant(id, "s1", Fixtures.account("a-" + id, token, new BigDecimal("100")));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "Condition not met within 3s");
    }

    private long eventCount(EventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private void pushUpdate(FakeVenue.FakeSocket socket, String contractId, String profit, boolean sold) {
        socket.push("{\"msg_type\":\"proposal_open_contract\",\"proposal_open_contract\":{\"contract_id\":"
            + contractId + ",\"profit\":" + profit + ",\"is_sold\":" + (sold ? 1 : 0) + "}}");
    }

    @Test
    void testRoundOpensOneContractPerAccount() {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1"), participant("p2", "tok-2")));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.EXECUTED, report.status());
        assertEquals(2, report.opened().size());
        assertEquals(4, report.barrier());
        verify(audit, times(2)).recordOpened(any());
        assertEquals(1, correlation.openCount("R_100"), "A round is one position");
        assertEquals(2, orchestrator.stats().activeMonitors());
        assertEquals(2, eventCount(EventType.TRADE_OPENED));

        JsonNode buy = venue.sockets().get(0).sent("buy").get(0);
        assertEquals("DIGITOVER", buy.path("parameters").path("contract_type").asText());
        assertEquals("4", buy.path("parameters").path("barrier").asText());
        assertEquals(1, venue.sockets().get(0).sent("proposal_open_contract").size(), "Contract watched");
    }

    @Test
    void testCloseFlowBooksRoundOnce() throws InterruptedException {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1"), participant("p2", "tok-2")));
        ExecutionReport report = orchestrator.execute(session, signal);
        TradeExecution first = report.opened().get(0);
        TradeExecution second = report.opened().get(1);
        FakeVenue.FakeSocket socket1 = venue.sockets().get(0);
        FakeVenue.FakeSocket socket2 = venue.sockets().get(1);

        pushUpdate(socket1, first.contractId(), "10.25", false);
        await(() -> orchestrator.stats().tradesClosed() == 1);

        assertEquals(1, socket1.sent("sell").size(), "TP exit sells");
        verify(audit).recordClosed(argThat(t -> t.contractId().equals(first.contractId())
            && t.status() == ContractStatus.TP_HIT));
        verify(sessions).updateParticipantStatus("p1", ParticipantStatus.REMOVED_TP);
        assertEquals(1, correlation.openCount("R_100"), "Round still has an open contract");

        pushUpdate(socket2, second.contractId(), "-1", true);
        await(() -> orchestrator.stats().openRounds() == 0);

        assertTrue(socket2.sent("sell").isEmpty(), "Settled contract is not sold");
        verify(audit).markRecoveryEligible(argThat(t -> t.contractId().equals(second.contractId())));
        verify(audit, never()).markRecoveryEligible(argThat(t -> t.contractId().equals(first.contractId())));
        assertEquals(0, correlation.openCount("R_100"));
        assertEquals(1, learning.summary("R_100").totalTrades(), "Round learned once");
        assertEquals(0, orchestrator.stats().consecutiveLosses(), "Net round profit is positive");
        assertEquals(2, eventCount(EventType.TRADE_CLOSED));
        assertFalse(socket1.sent("forget").isEmpty(), "Closed contract stream forgotten");
    }

    @Test
    void testInvalidAccountsReported() {
        Participant noToken = participant("p1", null);
        Participant broke = Fixtures.participant("p2", "s1", Fixtures.account("a-p2", "tok-2", new BigDecimal("1")));
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(noToken, broke));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.NO_ELIGIBLE_ACCOUNTS, report.status());
        assertEquals(2, report.invalid().size());
        assertEquals(1, eventCount(EventType.ACCOUNT_INVALID));
        assertEquals(1, eventCount(EventType.LOW_BALANCE));
        assertEquals(0, venue.opens(), "Nothing is sent for invalid accounts");
        verifyNoInteractions(audit);
    }

    @Test
    void testUnauthorizedAccountSkipped() {
        when(sessions.findActiveParticipants("s1")).thenReturn(
            List.of(participant("p1", FakeVenue.BAD_TOKEN), participant("p2", "tok-2")));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.EXECUTED, report.status());
        assertEquals(1, report.opened().size());
        assertEquals(InvalidAccount.Reason.AUTHORIZATION_FAILED, report.invalid().get(0).reason());
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state(), "Bad token is not a venue failure");
    }

    @Test
    void testBuyRejectionsPause() {
        venue.respond("buy", req -> FakeVenue.error("buy", "ContractBuyValidationError", "Market is closed."));
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1"), participant("p2", "tok-2")));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.NOTHING_PLACED, report.status());
        assertEquals(2, report.failed().size());
        assertEquals("buy_rejected", report.failed().get(0).reason());
        assertTrue(orchestrator.isPaused(), "Two venue errors reach the threshold");
        assertEquals(1, eventCount(EventType.SAFETY_PAUSE));
        assertEquals(2, eventCount(EventType.TRADE_FAILED));
        assertEquals(2, breaker.failureCount());
        assertEquals(0, correlation.openTotal(), "Empty round holds no position");

        ExecutionReport held = orchestrator.execute(session, signal);
        assertEquals(ExecutionReport.Status.PAUSED, held.status());

        orchestrator.resume();
        assertFalse(orchestrator.isPaused());
        assertEquals(1, eventCount(EventType.SAFETY_RESUMED));
    }

    @Test
    void testStopSessionTearsDown() {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1")));
        orchestrator.execute(session, signal);
        assertEquals(1, pool.size());

        orchestrator.stopSession("s1");

        assertEquals(0, orchestrator.openContractCount());
        assertEquals(0, correlation.openTotal());
        assertEquals(1, venue.lastSocket().sent("forget").size(), "Contract stream forgotten");
        assertEquals(0, pool.size(), "Session lease released and no watches left");
    }

    @Test
    void testExternalPause() {
        assertTrue(orchestrator.pause("drawdown_guard"));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.PAUSED, report.status());
        assertEquals("drawdown_guard", orchestrator.stats().pauseReason());
        verify(sessions, never()).findActiveParticipants(eq("s1"));
    }

    @Test
    void testClampBarrier() {
        assertEquals(8, ExecutionOrchestrator.clampBarrier(Side.OVER, 9));
        assertEquals(0, ExecutionOrchestrator.clampBarrier(Side.OVER, 0));
        assertEquals(1, ExecutionOrchestrator.clampBarrier(Side.UNDER, 0));
        assertEquals(9, ExecutionOrchestrator.clampBarrier(Side.UNDER, 9));
        assertEquals(5, ExecutionOrchestrator.clampBarrier(Side.UNDER, 5));
    }

    @Test
    void testDroppedConnectionRewatchesContract() throws InterruptedException {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1")));
        TradeExecution trade = orchestrator.execute(session, signal).opened().get(0);
        FakeVenue.FakeSocket first = venue.lastSocket();

        first.drop(1006, "abnormal closure");

        await(() -> venue.opens() == 2 && !venue.lastSocket().sent("proposal_open_contract").isEmpty());
        FakeVenue.FakeSocket second = venue.lastSocket();
        assertEquals(trade.contractId(), second.sent("proposal_open_contract").get(0).path("contract_id").asText());
        assertEquals(1, orchestrator.openContractCount());
        assertTrue(pool.get(trade.credentialRef()).isWatching(trade.contractId()));

        pushUpdate(second, trade.contractId(), "10.25", false);
        await(() -> orchestrator.stats().openRounds() == 0);

        assertEquals(1, second.sent("sell").size(), "Exit control restored on the new connection");
        assertEquals(0, correlation.openCount("R_100"));
    }

    @Test
    void testDroppedConnectionReleasesContractWhenRewatchFails() throws InterruptedException {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1")));
        TradeExecution trade = orchestrator.execute(session, signal).opened().get(0);
        assertEquals(1, correlation.openCount("R_100"));

        venue.refuseConnections(true);
        venue.lastSocket().drop(1006, "abnormal closure");

        await(() -> orchestrator.openContractCount() == 0);
        await(() -> orchestrator.stats().openRounds() == 0);
        assertEquals(0, correlation.openCount("R_100"), "Market slot freed");
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.TRADE_FAILED
            && trade.contractId().equals(e.payload().path("contractId").asText())));
        assertEquals(0, learning.summary("R_100").totalTrades(), "Nothing closed, nothing learned");
        assertTrue(correlation.check("R_100").allowed());
    }

    @Test
    void testHalfOpenTrialReturnedWhenNoEligibleAccounts() {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of());
        tripToHalfOpen();

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.NO_ELIGIBLE_ACCOUNTS, report.status());
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        assertTrue(breaker.allowRequest(), "Next signal may try the venue");
    }

    @Test
    void testHalfOpenTrialReturnedWhenPaused() {
        orchestrator.pause("drawdown_guard");
        tripToHalfOpen();

        assertEquals(ExecutionReport.Status.PAUSED, orchestrator.execute(session, signal).status());

        assertTrue(breaker.allowRequest());
    }

    @Test
    void testHalfOpenTrialReturnedWhenAllAuthorizationsFail() {
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", FakeVenue.BAD_TOKEN)));
        tripToHalfOpen();

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.NOTHING_PLACED, report.status());
        assertEquals(1, report.invalid().size());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void testHalfOpenTrialReturnedWhenLocked() throws Exception {
        CountDownLatch buying = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        venue.respond("buy", req -> {
            buying.countDown();
            try {
                release.await(3, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ObjectNode r = FakeVenue.reply("buy");
            r.putObject("buy").put("contract_id", 9001).put("buy_price", 1).put("payout", 1.95);
            return r;
        });
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1")));
        ExecutorService background = Executors.newSingleThreadExecutor();
        try {
            Future<ExecutionReport> running = background.submit(() -> orchestrator.execute(session, signal));
            assertTrue(buying.await(3, TimeUnit.SECONDS));
            tripToHalfOpen();

            assertEquals(ExecutionReport.Status.LOCKED, orchestrator.execute(session, signal).status());
            assertTrue(breaker.allowRequest(), "Locked round handed its trial back");

            release.countDown();
            assertEquals(ExecutionReport.Status.EXECUTED, running.get(3, TimeUnit.SECONDS).status());
        } finally {
            release.countDown();
            background.shutdownNow();
        }
    }

    @Test
    void testBuyTimeoutsPause() {
        orchestrator.shutdown();
        pool.shutdown();
        build(Duration.ofMillis(200));
        venue.silence("buy");
        when(sessions.findActiveParticipants("s1")).thenReturn(
            List.of(participant("p1", "tok-1"), participant("p2", "tok-2"), participant("p3", "tok-3")));

        ExecutionReport report = orchestrator.execute(session, signal);

        assertEquals(ExecutionReport.Status.NOTHING_PLACED, report.status());
        assertEquals("connection", report.failed().get(0).reason());
        assertEquals("connection", report.failed().get(1).reason());
        assertEquals("paused", report.failed().get(2).reason(), "Third account held by the pause");
        assertTrue(orchestrator.isPaused());
        assertEquals(1, eventCount(EventType.SAFETY_PAUSE));
    }

    @Test
    void testConnectFailuresCountAsApiErrors() {
        venue.refuseConnections(true);
        when(sessions.findActiveParticipants("s1")).thenReturn(List.of(participant("p1", "tok-1")));

        orchestrator.execute(session, signal);

        assertEquals(1, orchestrator.stats().apiErrors());
        assertFalse(orchestrator.isPaused(), "One error is under the threshold");
        assertEquals(1, breaker.failureCount());
    }
}
