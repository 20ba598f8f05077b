package in.digitflow.service.execution;

import in.digitflow.domain.trade.ContractStatus;
import in.digitflow.domain.trade.TradeExecution;
import in.digitflow.infrastructure.venue.ContractUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TP/SL state machine for one open contract.
 *
 * <pre>
 *   OPEN ──profit ≥ TP──────▶ TP_HIT
 *   OPEN ──profit ≤ -|SL|───▶ SL_HIT
 *   OPEN ──is_sold──────────▶ WIN (profit > 0) | LOSS
 * </pre>
 * Updates are applied in arrival order. TP is checked before SL within one update and the
 * first terminal transition wins the CAS, so the close handler runs exactly once.
 */
public final class ContractMonitor {
    private static final Logger log = LoggerFactory.getLogger(ContractMonitor.class);

    @FunctionalInterface
    public interface CloseHandler {
        /**
         * @param settled the venue already settled the contract, no sell is needed
         */
        void onClose(TradeExecution closed, boolean settled);
    }

    private final AtomicReference<TradeExecution> state;
    private final Clock clock;
    private final CloseHandler handler;

    public ContractMonitor(TradeExecution trade, Clock clock, CloseHandler handler) {
        if (!trade.isOpen()) {
            throw new IllegalArgumentException("contract " + trade.contractId() + " is not open");
        }
        this.state = new AtomicReference<>(trade);
        this.clock = clock;
        this.handler = handler;
    }

    public void onUpdate(ContractUpdate update) {
        TradeExecution current = state.get();
        if (!current.isOpen() || !current.contractId().equals(update.contractId())) {
            return;
        }

        ContractStatus next = evaluate(current, update);
        if (next == ContractStatus.OPEN) {
            return;
        }

        BigDecimal profit = update.profit() != null ? update.profit() : BigDecimal.ZERO;
        TradeExecution closed = current.close(next, profit, update.entrySpot(), update.exitSpot(), clock.instant());
        if (!state.compareAndSet(current, closed)) {
            log.debug("[ContractMonitor] {} already closed, ignoring {}", current.contractId(), next.label());
            return;
        }

        log.info("[ContractMonitor] {} {} at profit {}", current.contractId(), next.label(), profit.toPlainString());
        handler.onClose(closed, update.sold());
    }

    /**
     * Status an update moves the contract to; OPEN when no threshold is crossed.
     */
    static ContractStatus evaluate(TradeExecution trade, ContractUpdate update) {
        BigDecimal profit = update.profit();
        if (profit != null) {
            if (trade.takeProfit() != null && profit.compareTo(trade.takeProfit()) >= 0) {
                return ContractStatus.TP_HIT;
            }
            if (trade.stopLoss() != null && profit.compareTo(trade.stopLoss().abs().negate()) <= 0) {
                return ContractStatus.SL_HIT;
            }
        }
        if (update.sold()) {
            return profit != null && profit.signum() > 0 ? ContractStatus.WIN : ContractStatus.LOSS;
        }
        return ContractStatus.OPEN;
    }

    public TradeExecution current() {
        return state.get();
    }

    public boolean isClosed() {
        return !state.get().isOpen();
    }
}
