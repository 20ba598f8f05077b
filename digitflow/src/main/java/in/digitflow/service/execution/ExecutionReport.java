package in.digitflow.service.execution;

import in.digitflow.domain.signal.Side;
import in.digitflow.domain.trade.TradeExecution;

import java.util.List;

/**
 * What one {@code execute} call did: contracts opened, accounts skipped, placements that failed.
 */
public record ExecutionReport(
    String sessionId,
    String market,
    Side side,
    int barrier,
    Status status,
    List<TradeExecution> opened,
    List<InvalidAccount> invalid,
    List<PlacementFailure> failed
) {
    public enum Status {
        EXECUTED,           // At least one contract opened
        NOTHING_PLACED,     // Eligible accounts existed but every placement failed
        NO_ELIGIBLE_ACCOUNTS,
        PAUSED,             // Safety guards hold execution
        LOCKED              // Same candidate already executing
    }

    public record PlacementFailure(String participantId, String userId, String reason, String detail) {}

    public ExecutionReport {
        opened = List.copyOf(opened);
        invalid = List.copyOf(invalid);
        failed = List.copyOf(failed);
    }

    static ExecutionReport skipped(String sessionId, String market, Side side, int barrier, Status status) {
        return new ExecutionReport(sessionId, market, side, barrier, status, List.of(), List.of(), List.of());
    }
}
