package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Regime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Regime observed at each trade outcome: current value, newest-first transitions and per-regime counts.
 */
public record RegimeHistory(
    Regime current,
    List<RegimeTransition> history,
    Map<Regime, Integer> counts
) {
    public static final int MAX_HISTORY = 50;

    public RegimeHistory {
        history = List.copyOf(history);
        EnumMap<Regime, Integer> copy = new EnumMap<>(Regime.class);
        for (Regime regime : Regime.values()) {
            Integer count = counts == null ? null : counts.get(regime);
            copy.put(regime, count == null ? 0 : count);
        }
        counts = Map.copyOf(copy);
    }

    public static RegimeHistory initial() {
        return new RegimeHistory(Regime.STABLE, List.of(), Map.of());
    }

    public RegimeHistory observe(Regime regime, Instant at) {
        if (regime == null) {
            return this;
        }
        List<RegimeTransition> updated = history;
        if (regime != current) {
            List<RegimeTransition> next = new ArrayList<>(history.size() + 1);
            next.add(new RegimeTransition(current, regime, at));
            next.addAll(history);
            updated = next.size() > MAX_HISTORY ? next.subList(0, MAX_HISTORY) : next;
        }
        Map<Regime, Integer> nextCounts = new EnumMap<>(counts);
        nextCounts.merge(regime, 1, Integer::sum);
        return new RegimeHistory(regime, updated, nextCounts);
    }
}
