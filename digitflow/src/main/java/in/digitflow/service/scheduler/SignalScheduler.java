package in.digitflow.service.scheduler;

import in.digitflow.config.RiskConfig;
import in.digitflow.config.SchedulerConfig;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.data.TickHistory;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Signal;
import in.digitflow.domain.signal.SignalDecision;
import in.digitflow.infrastructure.metrics.EngineMetrics;
import in.digitflow.infrastructure.venue.TickStream;
import in.digitflow.service.core.EventService;
import in.digitflow.service.execution.ExecutionOrchestrator;
import in.digitflow.service.execution.ExecutionReport;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.risk.RiskDecision;
import in.digitflow.service.risk.RiskGuard;
import in.digitflow.service.signal.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Signal Scheduler.
 * One periodic cycle per active session:
 * <pre>
 *   session running? → drawdown guard → evaluate every market → best tradeable signal
 *     → smart delay (one timer per session+market) → revalidate on the fresh window
 *     → risk guard → execution
 * </pre>
 * Failures inside a cycle are logged; they never cancel the loop or affect other sessions.
 */
public final class SignalScheduler {
    private static final Logger log = LoggerFactory.getLogger(SignalScheduler.class);

    public enum CycleOutcome {
        SESSION_NOT_RUNNING,
        DRAWDOWN_PAUSED,
        EXECUTION_PAUSED,
        NO_SIGNAL,
        DELAY_PENDING,
        SCHEDULED
    }

    public enum RevalidationOutcome {
        SESSION_NOT_RUNNING,
        VETOED,
        RISK_BLOCKED,
        EXECUTED
    }

    private final SchedulerConfig config;
    private final RiskConfig riskConfig;
    private final SessionRepository sessions;
    private final TickStream tickStream;
    private final SignalEngine signalEngine;
    private final LearningMemory learningMemory;
    private final RiskGuard riskGuard;
    private final ExecutionOrchestrator orchestrator;
    private final EventService eventService;
    private final EngineMetrics metrics;

    private final Map<String, ScheduledFuture<?>> loops = new ConcurrentHashMap<>();
    private final Map<String, List<String>> sessionMarkets = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> smartDelays = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(
        Math.max(2, Runtime.getRuntime().availableProcessors()),
        r -> {
            Thread t = new Thread(r, "signal-scheduler");
            t.setDaemon(true);
            return t;
        });

    public SignalScheduler(
            SchedulerConfig config,
            RiskConfig riskConfig,
            SessionRepository sessions,
            TickStream tickStream,
            SignalEngine signalEngine,
            LearningMemory learningMemory,
            RiskGuard riskGuard,
            ExecutionOrchestrator orchestrator,
            EventService eventService,
            EngineMetrics metrics) {
        this.config = config;
        this.riskConfig = riskConfig;
        this.sessions = sessions;
        this.tickStream = tickStream;
        this.signalEngine = signalEngine;
        this.learningMemory = learningMemory;
        this.riskGuard = riskGuard;
        this.orchestrator = orchestrator;
        this.eventService = eventService;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Subscribe the session's markets and start its cycle.
     *
     * @return false when the session is unknown or already scheduled
     */
    public synchronized boolean start(String sessionId) {
        if (loops.containsKey(sessionId)) {
            log.info("[SignalScheduler] Session {} already scheduled", sessionId);
            return false;
        }
        Optional<TradingSession> session = sessions.findSession(sessionId);
        if (session.isEmpty()) {
            log.warn("[SignalScheduler] Session {} not found", sessionId);
            return false;
        }

        List<String> markets = marketsOf(session.get());
        sessionMarkets.put(sessionId, markets);
        markets.forEach(tickStream::subscribe);

        long period = config.cycleInterval().toMillis();
        ScheduledFuture<?> loop = scheduler.scheduleAtFixedRate(() -> {
            try {
                runCycle(sessionId);
            } catch (Exception e) {
                log.error("[SignalScheduler] Cycle for session {} failed", sessionId, e);
            }
        }, period, period, TimeUnit.MILLISECONDS);
        loops.put(sessionId, loop);

        log.info("[SignalScheduler] ✅ Session {} started on {} (every {} ms)", sessionId, markets, period);
        return true;
    }

    /**
     * Cancel the session's cycle and pending smart-delay timers, then tear down its
     * contract monitors and connection leases.
     */
    public synchronized void stop(String sessionId) {
        ScheduledFuture<?> loop = loops.remove(sessionId);
        if (loop != null) {
            loop.cancel(false);
        }

        String prefix = sessionId + ":";
        int cancelled = 0;
        for (Map.Entry<String, ScheduledFuture<?>> entry : List.copyOf(smartDelays.entrySet())) {
            if (entry.getKey().startsWith(prefix) && smartDelays.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().cancel(false);
                cancelled++;
            }
        }

        List<String> markets = sessionMarkets.remove(sessionId);
        if (markets != null) {
            for (String market : markets) {
                boolean stillUsed = sessionMarkets.values().stream().anyMatch(m -> m.contains(market));
                if (!stillUsed) {
                    tickStream.unsubscribe(market);
                }
            }
        }

        orchestrator.stopSession(sessionId);
        riskGuard.releaseSession(sessionId);
        log.info("[SignalScheduler] Session {} stopped ({} pending timer(s) cancelled)", sessionId, cancelled);
    }

    public Set<String> activeSessions() {
        return Set.copyOf(loops.keySet());
    }

    public void shutdown() {
        for (String sessionId : activeSessions()) {
            stop(sessionId);
        }
        scheduler.shutdownNow();
        log.info("[SignalScheduler] Shut down");
    }

    // ═══════════════════════════════════════════════════════════════
    // CYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * One pass for the session. Public so a cycle can be triggered on demand.
     */
    public CycleOutcome runCycle(String sessionId) {
        TradingSession session = sessions.findSession(sessionId).orElse(null);
        if (session == null || !session.isRunning()) {
            log.debug("[SignalScheduler] Session {} not running, skipping", sessionId);
            return CycleOutcome.SESSION_NOT_RUNNING;
        }

        if (drawdownBreached(session)) {
            return CycleOutcome.DRAWDOWN_PAUSED;
        }
        if (orchestrator.isPaused()) {
            log.debug("[SignalScheduler] Execution paused, session {} waits", sessionId);
            return CycleOutcome.EXECUTION_PAUSED;
        }

        Signal best = null;
        for (String market : marketsOf(session)) {
            SignalDecision decision = evaluate(market);
            if (!decision.tradeable()) {
                log.debug("[SignalScheduler] {} no trade: {} ({})", market, decision.rejection(), decision.reason());
                continue;
            }
            Signal signal = decision.signal();
            if (best == null || signal.confidence() > best.confidence()) {
                best = signal;
            }
        }

        if (best == null) {
            return CycleOutcome.NO_SIGNAL;
        }

        String timerKey = sessionId + ":" + best.market();
        if (smartDelays.containsKey(timerKey)) {
            log.debug("[SignalScheduler] Smart delay active for {}, waiting", timerKey);
            return CycleOutcome.DELAY_PENDING;
        }

        Signal candidate = best;
        log.info("[SignalScheduler] Candidate {} {} digit {} ({}%) for session {}, revalidating in {} ms",
            candidate.market(), candidate.side(), candidate.digit(),
            Math.round(candidate.confidence() * 100), sessionId, config.smartDelay().toMillis());

        // Scheduled inside computeIfAbsent so the timer's own removal cannot run before the put
        boolean[] created = {false};
        smartDelays.computeIfAbsent(timerKey, key -> {
            created[0] = true;
            return scheduler.schedule(() -> {
                try {
                    revalidate(sessionId, candidate);
                } catch (Exception e) {
                    log.error("[SignalScheduler] Revalidation of {} failed", key, e);
                } finally {
                    smartDelays.remove(key);
                }
            }, config.smartDelay().toMillis(), TimeUnit.MILLISECONDS);
        });
        if (!created[0]) {
            return CycleOutcome.DELAY_PENDING;
        }
        return CycleOutcome.SCHEDULED;
    }

    /**
     * Re-evaluate the candidate's market on the current window and, if it still qualifies,
     * send the fresh signal through risk and execution.
     * A timer already running when its session stops must not trade for it.
     */
    RevalidationOutcome revalidate(String sessionId, Signal candidate) {
        if (!loops.containsKey(sessionId)) {
            log.info("[SignalScheduler] Session {} stopped, dropping candidate {}", sessionId, candidate.market());
            return RevalidationOutcome.SESSION_NOT_RUNNING;
        }
        TradingSession session = sessions.findSession(sessionId).orElse(null);
        if (session == null || !session.isRunning()) {
            return RevalidationOutcome.SESSION_NOT_RUNNING;
        }

        String market = candidate.market();
        SignalDecision fresh = evaluate(market);
        if (!fresh.tradeable()) {
            log.info("[SignalScheduler] Smart delay vetoed {} for session {}: {}", market, sessionId, fresh.reason());
            eventService.emitSession(EventType.SIGNAL_VETOED, sessionId, EventService.payload(
                "market", market,
                "candidateSide", candidate.side(),
                "candidateDigit", candidate.digit(),
                "rejection", fresh.rejection(),
                "reason", fresh.reason()));
            eventService.logActivity(sessionId, "veto",
                "Smart delay vetoed " + candidate.side() + " digit " + candidate.digit() + " on " + market,
                EventService.payload("market", market, "reason", fresh.reason()));
            return RevalidationOutcome.VETOED;
        }

        Signal signal = fresh.signal();
        eventService.logActivity(sessionId, "signal",
            String.format("Signal %s digit %d conf %.2f", signal.side(), signal.digit(), signal.confidence()),
            EventService.payload(
                "market", market,
                "regime", signal.regime(),
                "parts", signal.factorTrace()));
        eventService.emitSession(EventType.SIGNAL_GENERATED, sessionId, EventService.payload(
            "market", market,
            "side", signal.side(),
            "digit", signal.digit(),
            "confidence", signal.confidence(),
            "regime", signal.regime(),
            "factors", signal.factorTrace()));

        RiskDecision risk = riskGuard.check(session, signal);
        if (!risk.allowed()) {
            metrics.recordRiskBlock(risk.reason());
            eventService.emitSession(EventType.RISK_BLOCKED, sessionId, EventService.payload(
                "market", market,
                "reason", risk.reason(),
                "detail", risk.detail()));
            eventService.logActivity(sessionId, "risk_block",
                "Risk blocked " + signal.side() + " on " + market + ": " + risk.reason(),
                EventService.payload("reason", risk.reason(), "detail", risk.detail()));
            return RevalidationOutcome.RISK_BLOCKED;
        }

        ExecutionReport report = orchestrator.execute(session, signal);
        if (!loops.containsKey(sessionId)) {
            // Stopped while placing: tear down what this round opened
            log.warn("[SignalScheduler] Session {} stopped during execution, releasing its contracts", sessionId);
            orchestrator.stopSession(sessionId);
        }
        eventService.emitSession(EventType.SESSION_REPORT, sessionId, EventService.payload(
            "market", market,
            "status", report.status(),
            "opened", report.opened().size(),
            "invalid", report.invalid().size(),
            "failed", report.failed().size()));
        return RevalidationOutcome.EXECUTED;
    }

    private SignalDecision evaluate(String market) {
        TickHistory history = tickStream.latestHistory(market);
        SignalDecision decision = signalEngine.evaluate(history, learningMemory.weights(market));
        metrics.recordSignal(market, decision.tradeable() ? "tradeable" : decision.rejection().name().toLowerCase());
        return decision;
    }

    /**
     * Net session loss at or beyond the drawdown limit, measured against the minimum balance.
     * Breaching it pauses execution engine-wide.
     */
    boolean drawdownBreached(TradingSession session) {
        if (!riskConfig.drawdownGuardEnabled()) {
            return false;
        }
        BigDecimal netPnl;
        try {
            Instant since = session.startedAt() != null ? session.startedAt() : Instant.EPOCH;
            netPnl = sessions.realizedProfitSince(session.id(), since);
        } catch (RuntimeException e) {
            log.warn("[SignalScheduler] Drawdown check skipped for {}: {}", session.id(), e.getMessage());
            return false;
        }
        if (netPnl.signum() >= 0) {
            return false;
        }

        BigDecimal reference = session.minBalance() != null && session.minBalance().signum() > 0
            ? session.minBalance()
            : BigDecimal.ONE;
        double drawdownPct = netPnl.abs().multiply(BigDecimal.valueOf(100))
            .divide(reference, 4, RoundingMode.HALF_UP).doubleValue();
        if (drawdownPct < riskConfig.maxDrawdownPercent()) {
            return false;
        }

        if (orchestrator.pause("drawdown_guard")) {
            log.error("[SignalScheduler] ❌ Drawdown guard: session {} down {} ({}% of {})",
                session.id(), netPnl.toPlainString(), drawdownPct, reference.toPlainString());
            eventService.emitSession(EventType.DRAWDOWN_GUARD, session.id(), EventService.payload(
                "netPnl", netPnl,
                "drawdownPct", drawdownPct,
                "message", "Bot paused: drawdown guard triggered"));
        }
        return true;
    }

    private List<String> marketsOf(TradingSession session) {
        return session.markets().isEmpty() ? config.defaultMarkets() : session.markets();
    }

    int pendingTimers() {
        return smartDelays.size();
    }
}
