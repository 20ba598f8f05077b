package in.digitflow.service.execution;

import in.digitflow.config.ExecutionConfig;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.repository.RecoveryStateRepository;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.RecoveryState;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Martingale accounting for recovery sessions.
 *
 * A win resets the multiplier to 1 and adds to the recovered amount; reaching the target
 * completes the session. A loss multiplies the multiplier by the session factor.
 * Store failures are logged; the in-memory state keeps the session trading.
 */
public final class RecoveryManager {
    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private final RecoveryStateRepository repository;
    private final SessionRepository sessions;
    private final EventService eventService;
    private final ExecutionConfig config;

    private final Map<String, RecoveryState> states = new ConcurrentHashMap<>();

    public RecoveryManager(RecoveryStateRepository repository, SessionRepository sessions,
                           EventService eventService, ExecutionConfig config) {
        this.repository = repository;
        this.sessions = sessions;
        this.eventService = eventService;
        this.config = config;
    }

    /**
     * Current state of a recovery session, loaded once and then kept in memory.
     */
    public RecoveryState current(TradingSession session) {
        return states.computeIfAbsent(session.id(), id -> {
            try {
                return repository.find(id).orElseGet(() -> RecoveryState.start(id, session.recoveryTarget()));
            } catch (RuntimeException e) {
                log.warn("[RecoveryManager] Cannot load recovery state for {}: {}", id, e.getMessage());
                return RecoveryState.start(id, session.recoveryTarget());
            }
        });
    }

    /**
     * Apply the net profit of one finished trade round to the session's recovery state.
     * A completed recovery is left untouched.
     */
    public synchronized RecoveryState recordOutcome(TradingSession session, BigDecimal profit) {
        RecoveryState before = current(session);
        if (before.completed()) {
            return before;
        }
        RecoveryState updated = profit.signum() > 0
            ? applyWin(before, profit)
            : applyLoss(before, multiplierFor(session));
        states.put(session.id(), updated);

        try {
            repository.save(updated);
        } catch (RuntimeException e) {
            log.error("[RecoveryManager] Cannot save recovery state for {}: {}", session.id(), e.getMessage());
        }

        if (updated.completed()) {
            log.info("[RecoveryManager] 🏁 Recovery session {} COMPLETED, recovered {}",
                session.id(), updated.recoveredAmount().toPlainString());
            try {
                sessions.updateSessionStatus(session.id(), SessionStatus.COMPLETED);
            } catch (RuntimeException e) {
                log.error("[RecoveryManager] Cannot complete session {}: {}", session.id(), e.getMessage());
            }
            eventService.emitSession(EventType.RECOVERY_COMPLETED, session.id(), EventService.payload(
                "recovered", updated.recoveredAmount(),
                "target", updated.targetAmount(),
                "message", "Recovery session completed! Recovered: $" + updated.recoveredAmount().toPlainString()));
        } else if (profit.signum() <= 0) {
            log.info("[RecoveryManager] 📉 Recovery loss on {}, multiplier now {}x",
                session.id(), updated.multiplier().toPlainString());
        }
        return updated;
    }

    static RecoveryState applyWin(RecoveryState state, BigDecimal profit) {
        if (state.completed()) {
            return state;
        }
        BigDecimal recovered = state.recoveredAmount().add(profit);
        boolean completed = state.targetAmount().signum() > 0 && recovered.compareTo(state.targetAmount()) >= 0;
        return new RecoveryState(state.sessionId(), BigDecimal.ONE, 0, state.maxConsecutiveLosses(),
            recovered, state.targetAmount(), completed);
    }

    static RecoveryState applyLoss(RecoveryState state, BigDecimal factor) {
        if (state.completed()) {
            return state;
        }
        int losses = state.consecutiveLosses() + 1;
        return new RecoveryState(state.sessionId(), state.multiplier().multiply(factor), losses,
            Math.max(losses, state.maxConsecutiveLosses()), state.recoveredAmount(), state.targetAmount(), false);
    }

    private BigDecimal multiplierFor(TradingSession session) {
        BigDecimal m = session.martingaleMultiplier();
        return m != null && m.compareTo(BigDecimal.ONE) >= 0 ? m : config.defaultMartingaleMultiplier();
    }

    /**
     * Forget the cached state, e.g. when the session stops.
     */
    public void evict(String sessionId) {
        states.remove(sessionId);
    }
}
