package in.digitflow.service.signal;

import in.digitflow.domain.signal.Side;

/**
 * Picks the barrier digit on the winning side by blending posterior and rarity.
 */
public final class DigitSelector {

    public record Selection(int digit, double score) {}

    private final double posteriorWeight;

    public DigitSelector(double posteriorWeight) {
        this.posteriorWeight = posteriorWeight;
    }

    /**
     * Highest {@code w·posterior[d] + (1-w)·(1-freq[d])} among the side's digits; ties go to the lower digit.
     */
    public Selection select(Side side, double[] posterior, double[] frequency) {
        int from = side == Side.OVER ? 5 : 0;
        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int d = from; d < from + 5; d++) {
            double score = posteriorWeight * posterior[d] + (1.0 - posteriorWeight) * (1.0 - frequency[d]);
            if (score > bestScore) {
                best = d;
                bestScore = score;
            }
        }
        return new Selection(best, bestScore);
    }
}
