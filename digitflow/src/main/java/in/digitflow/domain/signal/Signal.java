package in.digitflow.domain.signal;

import java.time.Instant;
import java.util.Set;

/**
 * A tradeable signal produced by the engine. Immutable; revalidation produces a new instance.
 */
public record Signal(
    String market,
    Side side,
    int digit,                         // Barrier digit
    double confidence,                 // Vote ratio, [0, 1]
    Regime regime,
    Set<Indicator> indicators,         // Indicators that fired
    Instant generatedAt,
    String factorTrace,
    DecisionLog decisionLog
) {
    public Signal {
        if (digit < 0 || digit > 9) {
            throw new IllegalArgumentException("digit out of range: " + digit);
        }
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        indicators = Set.copyOf(indicators);
    }

    /**
     * Same trading decision, ignoring when it was produced.
     */
    public boolean sameDecisionAs(Signal other) {
        return other != null
            && market.equals(other.market)
            && side == other.side
            && digit == other.digit
            && Double.compare(confidence, other.confidence) == 0
            && regime == other.regime
            && indicators.equals(other.indicators);
    }

    /**
     * Lock key preventing two overlapping executions of one candidate.
     */
    public String lockKey(String sessionId) {
        return sessionId + ":" + market + ":" + digit + ":" + side;
    }
}
