package in.digitflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Learned multipliers applied to indicator strengths. Each is bounded to [0.3, 2.0].
 * The Bayesian indicator shares the Markov weight since its likelihood is the Markov row.
 */
public record IndicatorWeights(
    double markov,
    double exhaustion,
    double streak,
    double bias,
    double entropy
) {
    public static final double MIN = 0.3;
    public static final double MAX = 2.0;

    public static IndicatorWeights defaults() {
        return new IndicatorWeights(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    @JsonIgnore
    public double forIndicator(Indicator indicator) {
        return switch (indicator) {
            case MARKOV, BAYESIAN -> markov;
            case EXHAUSTION -> exhaustion;
            case STREAK -> streak;
            case BIAS -> bias;
        };
    }

    public static double clamp(double weight) {
        return Math.max(MIN, Math.min(MAX, weight));
    }
}
