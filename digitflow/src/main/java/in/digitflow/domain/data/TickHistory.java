package in.digitflow.domain.data;

import java.util.List;

/**
 * Immutable snapshot of a market's recent ticks and their digits, oldest first.
 */
public record TickHistory(
    String market,
    List<Tick> ticks,
    List<Integer> digits
) {
    public TickHistory {
        ticks = List.copyOf(ticks);
        digits = List.copyOf(digits);
    }

    public static TickHistory empty(String market) {
        return new TickHistory(market, List.of(), List.of());
    }

    /**
     * Snapshot built from bare digits. Used when replaying recorded sequences.
     */
    public static TickHistory ofDigits(String market, List<Integer> digits) {
        return new TickHistory(market, List.of(), digits);
    }

    public int size() {
        return digits.size();
    }

    public Tick latestTick() {
        return ticks.isEmpty() ? null : ticks.get(ticks.size() - 1);
    }
}
