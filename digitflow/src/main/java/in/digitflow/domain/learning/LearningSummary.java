package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Regime;

import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only view of a market's learning state for status endpoints.
 */
public record LearningSummary(
    String market,
    int totalTrades,
    double winRate,
    IndicatorWeights weights,
    Map<Indicator, Double> indicatorAccuracy,
    Regime currentRegime,
    int regimeTransitions
) {
    public static LearningSummary of(LearningRecord record) {
        Map<Indicator, Double> accuracy = new EnumMap<>(Indicator.class);
        record.indicatorPerformance().forEach((k, v) -> accuracy.put(k, v.accuracy()));
        return new LearningSummary(
            record.market(),
            record.performance().totalTrades(),
            record.performance().winRate(),
            record.weights(),
            Map.copyOf(accuracy),
            record.regime().current(),
            record.regime().history().size()
        );
    }
}
