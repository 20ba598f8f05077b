package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Side;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate trade results for a market.
 */
public record PerformanceStats(
    Map<Side, SideStats> bySide,
    int totalTrades,
    int totalWins,
    int totalLosses,
    double winRate          // wins / trades, 0 when no trades
) {
    public PerformanceStats {
        EnumMap<Side, SideStats> copy = new EnumMap<>(Side.class);
        for (Side side : Side.values()) {
            SideStats stats = bySide == null ? null : bySide.get(side);
            copy.put(side, stats == null ? SideStats.empty() : stats);
        }
        bySide = Map.copyOf(copy);
    }

    public static PerformanceStats empty() {
        return new PerformanceStats(Map.of(), 0, 0, 0, 0.0);
    }

    public PerformanceStats record(Side side, boolean won) {
        Map<Side, SideStats> updated = new EnumMap<>(bySide);
        updated.put(side, bySide.get(side).record(won));
        int trades = totalTrades + 1;
        int wins = won ? totalWins + 1 : totalWins;
        int losses = won ? totalLosses : totalLosses + 1;
        return new PerformanceStats(updated, trades, wins, losses, (double) wins / trades);
    }
}
