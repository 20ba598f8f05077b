package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;

import java.util.List;
import java.util.Optional;

/**
 * Finds the digit furthest below its uniform 10% share and bets on its side coming back.
 */
public final class ExhaustionDetector {

    static final double FACTOR = 0.8;
    private static final double EXPECTED_SHARE = 0.1;

    private final SignalConfig config;

    public ExhaustionDetector(SignalConfig config) {
        this.config = config;
    }

    public Optional<IndicatorVote> vote(List<Integer> digits, IndicatorWeights weights) {
        List<Integer> window = DigitStatistics.tail(digits, config.exhaustionWindow());
        if (window.isEmpty()) {
            return Optional.empty();
        }
        double[] freq = DigitStatistics.frequencies(window);
        int exhausted = DigitStatistics.argMin(freq);
        double strength = (EXPECTED_SHARE - freq[exhausted]) / EXPECTED_SHARE;
        if (strength <= config.exhaustionThreshold()) {
            return Optional.empty();
        }

        double score = strength * weights.forIndicator(Indicator.EXHAUSTION) * FACTOR;
        return Optional.of(new IndicatorVote(Indicator.EXHAUSTION, Side.ofDigit(exhausted), strength, score,
            Indicator.EXHAUSTION.code() + ":" + exhausted));
    }
}
