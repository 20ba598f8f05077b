package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorWeights;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adaptive state for one market. Persisted as a single versioned JSON document.
 */
public record LearningRecord(
    int schemaVersion,
    String market,
    IndicatorWeights weights,
    Map<Indicator, IndicatorStats> indicatorPerformance,
    PerformanceStats performance,
    RegimeHistory regime,
    SessionStats currentSession,      // null until the first outcome
    List<TradeOutcome> lastTrades,    // Newest first
    Instant updatedAt
) {
    public static final int SCHEMA_VERSION = 3;
    public static final int MAX_TRADES = 100;

    public LearningRecord {
        EnumMap<Indicator, IndicatorStats> copy = new EnumMap<>(Indicator.class);
        for (Indicator indicator : Indicator.values()) {
            IndicatorStats stats = indicatorPerformance == null ? null : indicatorPerformance.get(indicator);
            copy.put(indicator, stats == null ? IndicatorStats.empty() : stats);
        }
        indicatorPerformance = Map.copyOf(copy);
        weights = weights == null ? IndicatorWeights.defaults() : weights;
        performance = performance == null ? PerformanceStats.empty() : performance;
        regime = regime == null ? RegimeHistory.initial() : regime;
        lastTrades = lastTrades == null ? List.of() : List.copyOf(lastTrades);
    }

    public static LearningRecord defaults(String market, Instant now) {
        return new LearningRecord(SCHEMA_VERSION, market, IndicatorWeights.defaults(), Map.of(),
            PerformanceStats.empty(), RegimeHistory.initial(), null, List.of(), now);
    }

    public IndicatorStats stats(Indicator indicator) {
        return indicatorPerformance.get(indicator);
    }
}
