package in.digitflow.domain.repository;

import in.digitflow.domain.trade.TradeExecution;

/**
 * Execution and audit rows written by the engine.
 */
public interface TradeAuditRepository {
    void recordOpened(TradeExecution trade);

    /**
     * Persist final status, profit, exit spot and duration.
     */
    void recordClosed(TradeExecution trade);

    /**
     * Mark the participant as eligible for a later recovery session after a losing exit (SL hit or settled loss).
     */
    void markRecoveryEligible(TradeExecution trade);
}
