package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Side;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one closed contract as fed back into learning.
 *
 * @param votes side each fired indicator voted for; an indicator is scored correct when its
 *              side matches the side that actually paid out
 */
public record TradeOutcome(
    String contractId,
    String sessionId,
    Side side,
    int digit,
    boolean won,
    double profit,
    double confidence,
    Regime regime,
    Map<Indicator, Side> votes,
    Instant closedAt
) {
    public TradeOutcome {
        votes = votes == null ? Map.of() : Map.copyOf(votes);
    }

    /** The side that would have won this round. */
    public Side winningSide() {
        return won ? side : side.opposite();
    }
}
