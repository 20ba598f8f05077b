package in.digitflow.domain.trade;

import in.digitflow.domain.signal.Side;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * One placed contract for one participant. Created at buy time; only the contract monitor
 * produces the closed copy.
 */
public record TradeExecution(
    String executionId,
    String sessionId,
    String participantId,
    String userId,
    String accountId,
    String credentialRef,
    String market,
    String contractId,
    Side side,
    int barrier,
    BigDecimal stake,
    BigDecimal buyPrice,
    BigDecimal payout,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    Instant openedAt,
    ContractStatus status,
    BigDecimal profit,          // null while open
    BigDecimal entrySpot,
    BigDecimal exitSpot,
    Instant closedAt
) {
    public boolean isOpen() {
        return status == ContractStatus.OPEN;
    }

    /** Whether the contract ended with money lost. */
    public boolean isLoss() {
        return profit != null && profit.signum() <= 0;
    }

    public Duration duration() {
        return closedAt == null ? null : Duration.between(openedAt, closedAt);
    }

    public TradeExecution close(ContractStatus finalStatus, BigDecimal finalProfit,
                                BigDecimal entry, BigDecimal exit, Instant at) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + finalStatus);
        }
        if (!isOpen()) {
            throw new IllegalStateException("contract " + contractId + " already " + status.label());
        }
        return new TradeExecution(executionId, sessionId, participantId, userId, accountId, credentialRef,
            market, contractId, side, barrier, stake, buyPrice, payout, takeProfit, stopLoss, openedAt,
            finalStatus, finalProfit, entry != null ? entry : entrySpot, exit, at);
    }
}
