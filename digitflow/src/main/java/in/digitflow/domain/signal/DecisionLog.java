package in.digitflow.domain.signal;

import java.util.List;

/**
 * Everything needed to reconstruct why an evaluation did or did not produce a trade.
 */
public record DecisionLog(
    int digitsObserved,
    double entropy,
    Regime regime,
    double overScore,
    double underScore,
    double totalScore,
    double voteRatio,
    Side finalSide,          // null when no vote was cast
    double confidence,
    double requiredConfidence,
    Integer digit,           // null when no digit was selected
    double digitScore,
    List<IndicatorVote> votes,
    boolean meetsConfidence,
    boolean meetsFactors,
    String factorTrace
) {
    public DecisionLog {
        votes = List.copyOf(votes);
    }

    public int indicatorsUsed() {
        return votes.size();
    }

    public static DecisionLog warmup(int digitsObserved) {
        return new DecisionLog(digitsObserved, 0, null, 0, 0, 0, 0, null, 0, 0,
            null, 0, List.of(), false, false, "WARMUP:" + digitsObserved);
    }
}
