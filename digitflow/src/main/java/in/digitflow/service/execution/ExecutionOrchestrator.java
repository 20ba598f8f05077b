package in.digitflow.service.execution;

import in.digitflow.config.ExecutionConfig;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.learning.TradeOutcome;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.repository.TradeAuditRepository;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.RecoveryState;
import in.digitflow.domain.session.StakingMode;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;
import in.digitflow.domain.trade.ContractStatus;
import in.digitflow.domain.trade.TradeExecution;
import in.digitflow.infrastructure.metrics.EngineMetrics;
import in.digitflow.infrastructure.venue.BuyReceipt;
import in.digitflow.infrastructure.venue.ConnectionPool;
import in.digitflow.infrastructure.venue.MalformedFrameException;
import in.digitflow.infrastructure.venue.VenueAuthorizationException;
import in.digitflow.infrastructure.venue.VenueConnection;
import in.digitflow.infrastructure.venue.VenueConnectionException;
import in.digitflow.infrastructure.venue.VenueProtocol;
import in.digitflow.infrastructure.venue.VenueRequestException;
import in.digitflow.service.core.EventService;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.risk.CircuitBreaker;
import in.digitflow.service.risk.CorrelationGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Execution Orchestrator.
 * Turns one admitted signal into contracts: eligibility → stake → buy per account
 * (sequential, paced) → contract monitor → close handling.
 *
 * One signal execution is a round. A round counts as one open position for the
 * correlation guard, and its net result feeds recovery accounting, safety guards
 * and learning once its last contract closes.
 */
public final class ExecutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    /**
     * Engine statistics exposed on the status endpoint.
     */
    public record Stats(
        boolean paused,
        String pauseReason,
        int activeMonitors,
        int openRounds,
        int consecutiveLosses,
        int apiErrors,
        long tradesOpened,
        long tradesClosed,
        long placementsFailed,
        int poolConnections
    ) {}

    /** Contract being watched, with everything its close and a re-watch need. */
    private record OpenContract(ExecutionRound round, ContractMonitor monitor, VenueConnection connection,
                                TradingAccount account) {

        OpenContract movedTo(VenueConnection fresh) {
            return new OpenContract(round, monitor, fresh, account);
        }
    }

    private final ExecutionConfig config;
    private final SessionRepository sessions;
    private final TradeAuditRepository audit;
    private final ConnectionPool pool;
    private final CircuitBreaker circuitBreaker;
    private final CorrelationGuard correlationGuard;
    private final LearningMemory learningMemory;
    private final RecoveryManager recoveryManager;
    private final EventService eventService;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final AccountEligibilityChecker eligibility;
    private final StakeCalculator stakeCalculator;
    private final SafetyGuards safetyGuards;
    private final SignalLocks signalLocks = new SignalLocks();

    private final Map<String, OpenContract> openContracts = new ConcurrentHashMap<>();
    private final Map<String, ExecutionRound> openRounds = new ConcurrentHashMap<>();

    private final AtomicLong tradesOpened = new AtomicLong();
    private final AtomicLong tradesClosed = new AtomicLong();
    private final AtomicLong placementsFailed = new AtomicLong();

    // Closes run here, never on a connection's read loop: a sell waits for a response on that loop
    private final ExecutorService closeExecutor = Executors.newFixedThreadPool(
        Math.max(2, Runtime.getRuntime().availableProcessors()),
        r -> {
            Thread t = new Thread(r, "exec-orchestrator");
            t.setDaemon(true);
            return t;
        });

    public ExecutionOrchestrator(
            ExecutionConfig config,
            SessionRepository sessions,
            TradeAuditRepository audit,
            ConnectionPool pool,
            CircuitBreaker circuitBreaker,
            CorrelationGuard correlationGuard,
            LearningMemory learningMemory,
            RecoveryManager recoveryManager,
            EventService eventService,
            EngineMetrics metrics,
            Clock clock) {
        this.config = config;
        this.sessions = sessions;
        this.audit = audit;
        this.pool = pool;
        this.circuitBreaker = circuitBreaker;
        this.correlationGuard = correlationGuard;
        this.learningMemory = learningMemory;
        this.recoveryManager = recoveryManager;
        this.eventService = eventService;
        this.metrics = metrics;
        this.clock = clock;
        this.eligibility = new AccountEligibilityChecker(config);
        this.stakeCalculator = new StakeCalculator(config);
        this.safetyGuards = new SafetyGuards(config.maxConsecutiveLosses(), config.apiErrorThreshold());
        pool.onConnectionClosed(this::connectionLost);
    }

    // ═══════════════════════════════════════════════════════════════
    // EXECUTE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Place the signal's contract for every eligible participant of the session.
     * Blocks for the duration of the placements (buy round trips plus pacing delay).
     *
     * A circuit breaker trial granted for this call is handed back when no venue request
     * produced an outcome for it.
     */
    public ExecutionReport execute(TradingSession session, Signal signal) {
        AtomicBoolean outcomeRecorded = new AtomicBoolean();
        try {
            return executeRound(session, signal, outcomeRecorded);
        } finally {
            if (!outcomeRecorded.get()) {
                circuitBreaker.releaseProbe();
            }
        }
    }

    private ExecutionReport executeRound(TradingSession session, Signal signal, AtomicBoolean outcomeRecorded) {
        Side side = signal.side();
        int barrier = clampBarrier(side, signal.digit());

        if (safetyGuards.isPaused()) {
            log.warn("[ExecutionOrchestrator] Paused ({}), skipping {} {} for session {}",
                safetyGuards.pauseReason(), signal.market(), side, session.id());
            return ExecutionReport.skipped(session.id(), signal.market(), side, barrier, ExecutionReport.Status.PAUSED);
        }

        String lockKey = signal.lockKey(session.id());
        if (!signalLocks.tryLock(lockKey)) {
            log.info("[ExecutionOrchestrator] {} already executing, skipped", lockKey);
            return ExecutionReport.skipped(session.id(), signal.market(), side, barrier, ExecutionReport.Status.LOCKED);
        }

        try {
            List<Participant> participants = sessions.findActiveParticipants(session.id());
            AccountEligibilityChecker.Result checked = eligibility.check(session, participants);
            checked.invalid().forEach(invalid -> reportInvalid(session, invalid));

            if (checked.eligible().isEmpty()) {
                log.info("[ExecutionOrchestrator] No eligible accounts in session {} ({} invalid)",
                    session.id(), checked.invalid().size());
                return new ExecutionReport(session.id(), signal.market(), side, barrier,
                    ExecutionReport.Status.NO_ELIGIBLE_ACCOUNTS, List.of(), checked.invalid(), List.of());
            }

            RecoveryState recovery = usesMartingale(session) ? recoveryManager.current(session) : null;
            ExecutionRound round = new ExecutionRound(UUID.randomUUID().toString(), session, signal);

            List<TradeExecution> opened = new ArrayList<>();
            List<InvalidAccount> invalid = new ArrayList<>(checked.invalid());
            List<ExecutionReport.PlacementFailure> failed = new ArrayList<>();

            log.info("[ExecutionOrchestrator] Executing {} {} barrier {} for {} account(s) in session {}",
                signal.market(), side, barrier, checked.eligible().size(), session.id());

            boolean first = true;
            for (Participant participant : checked.eligible()) {
                if (safetyGuards.isPaused()) {
                    failed.add(new ExecutionReport.PlacementFailure(participant.id(), participant.userId(),
                        "paused", "execution paused by safety guards"));
                    continue;
                }
                if (!first && !pace(config.placementDelay())) {
                    break;
                }
                first = false;
                if (place(round, participant, barrier, recovery, opened, invalid, failed)) {
                    outcomeRecorded.set(true);
                }
            }

            round.sealPlacements();
            finishRoundIfDone(round);

            ExecutionReport.Status status = opened.isEmpty()
                ? ExecutionReport.Status.NOTHING_PLACED
                : ExecutionReport.Status.EXECUTED;
            log.info("[ExecutionOrchestrator] Round {} on {}: {} opened, {} invalid, {} failed",
                round.id(), signal.market(), opened.size(), invalid.size(), failed.size());
            return new ExecutionReport(session.id(), signal.market(), side, barrier, status, opened, invalid, failed);

        } finally {
            signalLocks.unlock(lockKey);
        }
    }

    /**
     * @return whether the circuit breaker was told the outcome of a venue call
     */
    private boolean place(ExecutionRound round, Participant participant, int barrier, RecoveryState recovery,
                          List<TradeExecution> opened, List<InvalidAccount> invalid,
                          List<ExecutionReport.PlacementFailure> failed) {
        TradingSession session = round.session();
        Signal signal = round.signal();
        TradingAccount account = participant.account();
        BigDecimal stake = stakeCalculator.calculate(session, account, recovery);

        // ═══════════════════════════════════════════════════════════════
        // 1. Connection
        // ═══════════════════════════════════════════════════════════════

        VenueConnection connection;
        try {
            connection = pool.acquire(account.credential(), account.venueAccountId(), session.id());
        } catch (VenueAuthorizationException e) {
            InvalidAccount rejected = new InvalidAccount(participant.id(), participant.userId(), account.id(),
                InvalidAccount.Reason.AUTHORIZATION_FAILED, "Authorization failed: " + e.getErrorCode());
            invalid.add(rejected);
            reportInvalid(session, rejected);
            metrics.recordTradeFailed(signal.market(), "authorization");
            return false;
        } catch (VenueConnectionException e) {
            circuitBreaker.recordFailure();
            apiError();
            placementFailed(round, participant, "connection", e.getMessage(), failed);
            return true;
        }

        // ═══════════════════════════════════════════════════════════════
        // 2. Buy
        // ═══════════════════════════════════════════════════════════════

        Instant started = clock.instant();
        BuyReceipt receipt;
        try {
            receipt = VenueProtocol.buyReceipt(connection.call(VenueProtocol.buy(
                signal.side().contractType(), signal.market(), barrier, stake,
                config.currency(), config.contractDuration(), config.durationUnit())));
            metrics.recordVenueRequest("buy", true, Duration.between(started, clock.instant()));
            circuitBreaker.recordSuccess();
            safetyGuards.recordApiSuccess();
        } catch (VenueRequestException | MalformedFrameException e) {
            metrics.recordVenueRequest("buy", false, Duration.between(started, clock.instant()));
            circuitBreaker.recordFailure();
            apiError();
            placementFailed(round, participant, "buy_rejected", e.getMessage(), failed);
            return true;
        } catch (VenueConnectionException e) {
            metrics.recordVenueRequest("buy", false, Duration.between(started, clock.instant()));
            circuitBreaker.recordFailure();
            apiError();
            placementFailed(round, participant, "connection", e.getMessage(), failed);
            return true;
        }

        TradeExecution trade = new TradeExecution(
            UUID.randomUUID().toString(),
            session.id(),
            participant.id(),
            participant.userId(),
            account.id(),
            connection.credentialRef(),
            signal.market(),
            receipt.contractId(),
            signal.side(),
            barrier,
            stake,
            receipt.buyPrice() != null ? receipt.buyPrice() : stake,
            receipt.payout(),
            participant.takeProfit(),
            participant.stopLoss(),
            clock.instant(),
            ContractStatus.OPEN,
            null, null, null, null
        );

        try {
            audit.recordOpened(trade);
        } catch (RuntimeException e) {
            log.error("[ExecutionOrchestrator] Audit of opened {} failed: {}", trade.contractId(), e.getMessage());
        }

        // ═══════════════════════════════════════════════════════════════
        // 3. Monitor
        // ═══════════════════════════════════════════════════════════════

        round.contractOpened();
        if (openRounds.putIfAbsent(round.id(), round) == null) {
            correlationGuard.register(signal.market(), round.id());
        }

        ContractMonitor monitor = new ContractMonitor(trade, clock,
            (closed, settled) -> scheduleClose(closed, settled));
        OpenContract open = new OpenContract(round, monitor, connection, account);
        openContracts.put(trade.contractId(), open);
        metrics.setActiveMonitors(openContracts.size());

        try {
            connection.watchContract(trade.contractId(), monitor::onUpdate);
        } catch (RuntimeException e) {
            // The contract still settles at the venue; only our exit control is lost
            log.error("[ExecutionOrchestrator] ❌ Cannot watch {}: {}", trade.contractId(), e.getMessage());
            openContracts.remove(trade.contractId());
            metrics.setActiveMonitors(openContracts.size());
            round.contractAbandoned();
            finishRoundIfDone(round);
        }

        opened.add(trade);
        tradesOpened.incrementAndGet();
        metrics.recordTradeOpened(signal.market());
        eventService.emitUser(EventType.TRADE_OPENED, session.id(), participant.userId(), EventService.payload(
            "contractId", trade.contractId(),
            "market", trade.market(),
            "side", trade.side(),
            "barrier", barrier,
            "stake", stake,
            "payout", trade.payout(),
            "confidence", signal.confidence()));
        log.info("[ExecutionOrchestrator] ✅ {} bought {} {} {} stake {} for user {}",
            trade.contractId(), trade.market(), trade.side(), barrier, stake.toPlainString(), participant.userId());
        return true;
    }

    private void placementFailed(ExecutionRound round, Participant participant, String reason, String detail,
                                 List<ExecutionReport.PlacementFailure> failed) {
        String market = round.signal().market();
        log.warn("[ExecutionOrchestrator] Placement for user {} on {} failed ({}): {}",
            participant.userId(), market, reason, detail);
        failed.add(new ExecutionReport.PlacementFailure(participant.id(), participant.userId(), reason, detail));
        placementsFailed.incrementAndGet();
        metrics.recordTradeFailed(market, reason);
        eventService.emitUser(EventType.TRADE_FAILED, round.session().id(), participant.userId(), EventService.payload(
            "market", market,
            "reason", reason,
            "message", "Trade failed: " + detail));
    }

    private void reportInvalid(TradingSession session, InvalidAccount invalid) {
        EventType type = invalid.reason() == InvalidAccount.Reason.LOW_BALANCE
            ? EventType.LOW_BALANCE
            : EventType.ACCOUNT_INVALID;
        eventService.emitUser(type, session.id(), invalid.userId(), EventService.payload(
            "participantId", invalid.participantId(),
            "accountId", invalid.accountId(),
            "reason", invalid.reason(),
            "message", invalid.detail()));
    }

    // ═══════════════════════════════════════════════════════════════
    // CLOSE
    // ═══════════════════════════════════════════════════════════════

    private void scheduleClose(TradeExecution closed, boolean settled) {
        try {
            closeExecutor.execute(() -> {
                try {
                    closeContract(closed, settled);
                } catch (Exception e) {
                    log.error("[ExecutionOrchestrator] Close of {} failed", closed.contractId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[ExecutionOrchestrator] Shutting down, close of {} not processed", closed.contractId());
        }
    }

    /**
     * Tear down and book one closed contract. Runs once per contract.
     */
    void closeContract(TradeExecution closed, boolean settled) {
        OpenContract open = openContracts.remove(closed.contractId());
        if (open == null) {
            log.debug("[ExecutionOrchestrator] {} no longer tracked", closed.contractId());
            return;
        }
        metrics.setActiveMonitors(openContracts.size());
        VenueConnection connection = open.connection();
        connection.unwatchContract(closed.contractId());

        if (!settled) {
            sell(connection, closed);
        }

        try {
            audit.recordClosed(closed);
        } catch (RuntimeException e) {
            log.error("[ExecutionOrchestrator] Audit of closed {} failed: {}", closed.contractId(), e.getMessage());
        }
        try {
            sessions.updateParticipantStatus(closed.participantId(), closed.status().participantStatus());
        } catch (RuntimeException e) {
            log.error("[ExecutionOrchestrator] Participant {} status update failed: {}", closed.participantId(), e.getMessage());
        }
        if (closed.isLoss()) {
            try {
                audit.markRecoveryEligible(closed);
            } catch (RuntimeException e) {
                log.error("[ExecutionOrchestrator] Recovery eligibility for {} failed: {}", closed.userId(), e.getMessage());
            }
        }

        tradesClosed.incrementAndGet();
        metrics.recordTradeClosed(closed.market(), closed.status().label());
        eventService.emitUser(EventType.TRADE_CLOSED, closed.sessionId(), closed.userId(), EventService.payload(
            "contractId", closed.contractId(),
            "market", closed.market(),
            "status", closed.status().label(),
            "profit", closed.profit(),
            "exitSpot", closed.exitSpot(),
            "durationMs", closed.duration() == null ? null : closed.duration().toMillis(),
            "message", closeMessage(closed)));
        log.info("[ExecutionOrchestrator] Closed {} ({}) P&L {}",
            closed.contractId(), closed.status().label(), closed.profit().toPlainString());

        ExecutionRound round = open.round();
        round.contractClosed(closed);
        finishRoundIfDone(round);
    }

    private void sell(VenueConnection connection, TradeExecution closed) {
        Instant started = clock.instant();
        try {
            connection.call(VenueProtocol.sell(closed.contractId()));
            metrics.recordVenueRequest("sell", true, Duration.between(started, clock.instant()));
        } catch (VenueRequestException e) {
            // Usually the contract expired between the update and the sell
            metrics.recordVenueRequest("sell", false, Duration.between(started, clock.instant()));
            log.warn("[ExecutionOrchestrator] Sell of {} rejected: {}", closed.contractId(), e.getMessage());
        } catch (VenueConnectionException e) {
            metrics.recordVenueRequest("sell", false, Duration.between(started, clock.instant()));
            log.error("[ExecutionOrchestrator] Sell of {} failed: {}", closed.contractId(), e.getMessage());
        }
    }

    private static String closeMessage(TradeExecution closed) {
        String pnl = "$" + closed.profit().setScale(2, RoundingMode.HALF_UP).toPlainString();
        return switch (closed.status()) {
            case TP_HIT -> "✅ Take Profit hit! Profit: " + pnl;
            case SL_HIT -> "❌ Stop Loss hit! Loss: " + pnl;
            default -> "Trade closed. P&L: " + pnl;
        };
    }

    /**
     * Book a round once placements are over and no contract of it is open.
     */
    private void finishRoundIfDone(ExecutionRound round) {
        if (!round.tryFinish()) {
            return;
        }
        if (openRounds.remove(round.id()) != null) {
            correlationGuard.deregister(round.signal().market(), round.id());
        }
        if (round.closedCount() == 0) {
            return;
        }

        TradingSession session = round.session();
        BigDecimal net = round.netProfit();
        boolean loss = net.signum() <= 0;

        if (usesMartingale(session)) {
            recoveryManager.recordOutcome(session, net);
        }
        if (safetyGuards.recordOutcome(loss)) {
            announcePause();
        }
        try {
            learningMemory.recordOutcome(round.signal().market(), outcomeOf(round, net));
        } catch (RuntimeException e) {
            log.error("[ExecutionOrchestrator] Learning update for {} failed: {}", round.signal().market(), e.getMessage());
        }
    }

    private TradeOutcome outcomeOf(ExecutionRound round, BigDecimal net) {
        Signal signal = round.signal();
        Map<Indicator, Side> votes = new EnumMap<>(Indicator.class);
        if (signal.decisionLog() != null) {
            for (IndicatorVote vote : signal.decisionLog().votes()) {
                votes.put(vote.indicator(), vote.side());
            }
        }
        return new TradeOutcome(
            round.lastContractId(),
            round.session().id(),
            signal.side(),
            signal.digit(),
            net.signum() > 0,
            net.doubleValue(),
            signal.confidence(),
            signal.regime(),
            votes,
            clock.instant()
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION LOSS
    // ═══════════════════════════════════════════════════════════════

    /**
     * A pooled connection closed: its contract streams are gone. Every contract watched on it
     * is moved to a fresh connection for the same credential.
     */
    private void connectionLost(VenueConnection lost) {
        for (Map.Entry<String, OpenContract> entry : List.copyOf(openContracts.entrySet())) {
            if (entry.getValue().connection() != lost) {
                continue;
            }
            String contractId = entry.getKey();
            OpenContract open = entry.getValue();
            try {
                closeExecutor.execute(() -> rewatch(contractId, open));
            } catch (RejectedExecutionException e) {
                log.warn("[ExecutionOrchestrator] Shutting down, {} not re-watched", contractId);
            }
        }
    }

    private void rewatch(String contractId, OpenContract open) {
        if (openContracts.get(contractId) != open) {
            return;
        }
        String sessionId = open.round().session().id();
        TradingAccount account = open.account();
        OpenContract moved = null;
        try {
            VenueConnection fresh = pool.acquire(account.credential(), account.venueAccountId(), sessionId);
            moved = open.movedTo(fresh);
            if (!openContracts.replace(contractId, open, moved)) {
                return;
            }
            fresh.watchContract(contractId, open.monitor()::onUpdate);
            log.info("[ExecutionOrchestrator] ✅ {} re-watched on a new {} connection", contractId, fresh.credentialRef());
        } catch (RuntimeException e) {
            abandon(contractId, moved != null ? moved : open, e.getMessage());
        }
    }

    /**
     * Give up exit control over a contract. It settles at the venue; its audit row stays open.
     */
    private void abandon(String contractId, OpenContract open, String why) {
        if (!openContracts.remove(contractId, open)) {
            return;
        }
        metrics.setActiveMonitors(openContracts.size());
        open.connection().unwatchContract(contractId);
        log.error("[ExecutionOrchestrator] ❌ Lost {} for user {}: {}",
            contractId, open.monitor().current().userId(), why);
        eventService.emitUser(EventType.TRADE_FAILED, open.round().session().id(), open.monitor().current().userId(),
            EventService.payload(
                "contractId", contractId,
                "market", open.round().signal().market(),
                "reason", "monitor_lost",
                "message", "Contract " + contractId + " is no longer monitored and will settle at expiry"));
        ExecutionRound round = open.round();
        round.contractAbandoned();
        finishRoundIfDone(round);
    }

    // ═══════════════════════════════════════════════════════════════
    // CONTROL
    // ═══════════════════════════════════════════════════════════════

    /**
     * Drop every monitor of the session, unsubscribe its contracts and release its connections.
     * Contracts left open at the venue settle there; their audit rows stay open.
     */
    public void stopSession(String sessionId) {
        int dropped = 0;
        for (Map.Entry<String, OpenContract> entry : List.copyOf(openContracts.entrySet())) {
            OpenContract open = entry.getValue();
            if (!open.round().session().id().equals(sessionId)) {
                continue;
            }
            if (openContracts.remove(entry.getKey(), open)) {
                open.connection().unwatchContract(entry.getKey());
                dropped++;
            }
        }
        for (ExecutionRound round : List.copyOf(openRounds.values())) {
            if (round.session().id().equals(sessionId) && openRounds.remove(round.id()) != null) {
                correlationGuard.deregister(round.signal().market(), round.id());
            }
        }
        metrics.setActiveMonitors(openContracts.size());
        pool.releaseAll(sessionId);
        recoveryManager.evict(sessionId);
        log.info("[ExecutionOrchestrator] Session {} stopped, {} monitor(s) dropped", sessionId, dropped);
    }

    /**
     * Hold all execution until {@link #resume()}.
     *
     * @return true when this call paused execution
     */
    public boolean pause(String reason) {
        boolean paused = safetyGuards.pause(reason);
        if (paused) {
            metrics.setPaused(true);
        }
        return paused;
    }

    /**
     * Lift a safety pause.
     */
    public void resume() {
        boolean wasPaused = safetyGuards.isPaused();
        safetyGuards.resume();
        metrics.setPaused(false);
        if (wasPaused) {
            eventService.emitGlobal(EventType.SAFETY_RESUMED, EventService.payload("message", "Execution resumed"));
        }
    }

    public boolean isPaused() {
        return safetyGuards.isPaused();
    }

    public Stats stats() {
        return new Stats(
            safetyGuards.isPaused(),
            safetyGuards.pauseReason(),
            openContracts.size(),
            openRounds.size(),
            safetyGuards.consecutiveLosses(),
            safetyGuards.apiErrors(),
            tradesOpened.get(),
            tradesClosed.get(),
            placementsFailed.get(),
            pool.size()
        );
    }

    public void shutdown() {
        closeExecutor.shutdown();
        try {
            if (!closeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                closeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            closeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (Map.Entry<String, OpenContract> entry : List.copyOf(openContracts.entrySet())) {
            entry.getValue().connection().unwatchContract(entry.getKey());
        }
        openContracts.clear();
        log.info("[ExecutionOrchestrator] Shut down ({} opened, {} closed)", tradesOpened.get(), tradesClosed.get());
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private void apiError() {
        if (safetyGuards.recordApiError()) {
            announcePause();
        }
    }

    private void announcePause() {
        metrics.setPaused(true);
        eventService.emitGlobal(EventType.SAFETY_PAUSE, EventService.payload(
            "reason", safetyGuards.pauseReason(),
            "message", "Bot paused: " + safetyGuards.pauseReason()));
    }

    private static boolean usesMartingale(TradingSession session) {
        return session.isRecovery() || session.stakingMode() == StakingMode.MARTINGALE;
    }

    /**
     * OVER 9 and UNDER 0 cannot win, so the venue rejects them.
     */
    static int clampBarrier(Side side, int digit) {
        return side == Side.OVER
            ? Math.max(0, Math.min(8, digit))
            : Math.max(1, Math.min(9, digit));
    }

    private static boolean pace(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    int openContractCount() {
        return openContracts.size();
    }
}
