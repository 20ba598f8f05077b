package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;

import java.util.List;
import java.util.Optional;

/**
 * High (5-9) versus low (0-4) imbalance in the recent window.
 * A moderate imbalance follows the dominant side; a strong one fades it.
 */
public final class BiasDetector {

    static final double FACTOR = 0.6;

    private final SignalConfig config;

    public BiasDetector(SignalConfig config) {
        this.config = config;
    }

    public Optional<IndicatorVote> vote(List<Integer> digits, IndicatorWeights weights) {
        List<Integer> window = DigitStatistics.tail(digits, config.biasWindow());
        if (window.isEmpty()) {
            return Optional.empty();
        }
        int high = 0;
        for (int d : window) {
            if (d >= 5) {
                high++;
            }
        }
        int low = window.size() - high;
        double strength = (double) Math.abs(high - low) / window.size();
        if (strength <= config.biasThreshold()) {
            return Optional.empty();
        }

        Side dominant = high > low ? Side.OVER : Side.UNDER;
        Side suggested = strength > config.biasReversion() ? dominant.opposite() : dominant;
        double score = strength * weights.forIndicator(Indicator.BIAS) * FACTOR;
        return Optional.of(new IndicatorVote(Indicator.BIAS, suggested, strength, score,
            Indicator.BIAS.code() + ":" + suggested));
    }
}
