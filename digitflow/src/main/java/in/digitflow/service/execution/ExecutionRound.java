package in.digitflow.service.execution;

import in.digitflow.domain.session.TradingSession;
import in.digitflow.domain.signal.Signal;
import in.digitflow.domain.trade.TradeExecution;

import java.math.BigDecimal;

/**
 * Contracts opened for one signal execution.
 * The round finishes exactly once: after placements are sealed and its last open contract closed.
 */
final class ExecutionRound {

    private final String id;
    private final TradingSession session;
    private final Signal signal;

    private int open = 0;
    private int closed = 0;
    private boolean sealed = false;
    private boolean finished = false;
    private BigDecimal netProfit = BigDecimal.ZERO;
    private String lastContractId;

    ExecutionRound(String id, TradingSession session, Signal signal) {
        this.id = id;
        this.session = session;
        this.signal = signal;
    }

    synchronized void contractOpened() {
        open++;
    }

    /** A placed contract that will never be reported closed to this round. */
    synchronized void contractAbandoned() {
        open--;
    }

    synchronized void contractClosed(TradeExecution trade) {
        open--;
        closed++;
        netProfit = netProfit.add(trade.profit());
        lastContractId = trade.contractId();
    }

    synchronized void sealPlacements() {
        sealed = true;
    }

    /**
     * @return true for the single caller that finishes the round
     */
    synchronized boolean tryFinish() {
        if (finished || !sealed || open > 0) {
            return false;
        }
        finished = true;
        return true;
    }

    String id() {
        return id;
    }

    TradingSession session() {
        return session;
    }

    Signal signal() {
        return signal;
    }

    synchronized int closedCount() {
        return closed;
    }

    synchronized BigDecimal netProfit() {
        return netProfit;
    }

    synchronized String lastContractId() {
        return lastContractId;
    }
}
