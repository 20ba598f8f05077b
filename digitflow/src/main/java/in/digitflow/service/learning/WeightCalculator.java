package in.digitflow.service.learning;

import in.digitflow.domain.learning.IndicatorStats;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorWeights;

import java.util.Map;

/**
 * Learned weight of an indicator from its track record.
 *
 * weight = 1.0 until MIN_OUTCOMES outcomes are recorded,
 * then 0.3 + accuracy × 1.7 (30% → ~0.81, 50% → 1.15, 100% → 2.0).
 */
public final class WeightCalculator {

    public static final int MIN_OUTCOMES = 20;
    private static final double BASE = 0.3;
    private static final double SLOPE = 1.7;

    public static double weight(IndicatorStats stats) {
        if (stats == null || stats.total() < MIN_OUTCOMES) {
            return 1.0;
        }
        return IndicatorWeights.clamp(BASE + stats.accuracy() * SLOPE);
    }

    /**
     * Recompute all weights. The entropy weight is not learned and is carried over.
     */
    public static IndicatorWeights weights(Map<Indicator, IndicatorStats> performance, double entropyWeight) {
        return new IndicatorWeights(
            weight(performance.get(Indicator.MARKOV)),
            weight(performance.get(Indicator.EXHAUSTION)),
            weight(performance.get(Indicator.STREAK)),
            weight(performance.get(Indicator.BIAS)),
            entropyWeight
        );
    }

    private WeightCalculator() {}
}
