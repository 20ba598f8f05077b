package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;

import java.util.List;
import java.util.Optional;

/**
 * Run of consecutive same-direction digit moves at the end of the window.
 * Short runs suggest continuation; long runs suggest reversion.
 */
public final class StreakDetector {

    private static final double STRENGTH_PER_STEP = 0.15;
    private static final double MAX_STRENGTH = 0.6;

    private final SignalConfig config;

    public StreakDetector(SignalConfig config) {
        this.config = config;
    }

    /**
     * Difference between two digits. Circular deltas take the short way round, so 9 -> 0 is +1.
     */
    static int delta(int from, int to, boolean circular) {
        int direct = to - from;
        if (!circular) {
            return direct;
        }
        if (direct > 5) {
            return direct - 10;
        }
        if (direct < -5) {
            return direct + 10;
        }
        return direct;
    }

    /**
     * Signed length of the trailing run: positive for rising digits, negative for falling, 0 if none.
     * A repeated digit ends the run.
     */
    static int trailingStreak(List<Integer> window, boolean circular) {
        int streak = 0;
        int direction = 0;
        for (int i = window.size() - 1; i > 0; i--) {
            int sign = Integer.signum(delta(window.get(i - 1), window.get(i), circular));
            if (sign == 0 || (direction != 0 && sign != direction)) {
                break;
            }
            direction = sign;
            streak++;
        }
        return streak * direction;
    }

    public Optional<IndicatorVote> vote(List<Integer> digits, IndicatorWeights weights) {
        List<Integer> window = DigitStatistics.tail(digits, config.streakWindow());
        int signed = trailingStreak(window, config.circularDeltas());
        int length = Math.abs(signed);
        if (length < config.streakMin()) {
            return Optional.empty();
        }

        Side trend = signed > 0 ? Side.OVER : Side.UNDER;
        boolean reverse = length >= config.streakReversal();
        Side suggested = reverse ? trend.opposite() : trend;
        double strength = Math.min(length * STRENGTH_PER_STEP, MAX_STRENGTH);
        double score = strength * weights.forIndicator(Indicator.STREAK);
        return Optional.of(new IndicatorVote(Indicator.STREAK, suggested, strength, score,
            Indicator.STREAK.code() + ":" + length + (reverse ? "→REV" : "→CONT")));
    }
}
