package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;

import java.util.List;
import java.util.Optional;

/**
 * posterior[d] ∝ prior[d] × likelihood[d], where the prior is the recent digit frequency
 * and the likelihood is the Markov row from the current digit. Zero entries are floored
 * at 0.1 so a single unseen digit cannot zero out the posterior.
 */
public final class BayesianDigitPredictor {

    static final double FACTOR = 0.5;
    private static final double FLOOR = 0.1;

    private final SignalConfig config;

    public BayesianDigitPredictor(SignalConfig config) {
        this.config = config;
    }

    public double[] posterior(List<Integer> digits) {
        double[] freq = DigitStatistics.frequencies(DigitStatistics.tail(digits, config.bayesianPriorWindow()));
        double[] row = MarkovPredictor.transitionRow(digits, config.bayesianLikelihoodDepth());
        return posterior(freq, row);
    }

    /**
     * Normalized posterior. A null likelihood row is treated as uniform.
     */
    public static double[] posterior(double[] prior, double[] likelihood) {
        double[] post = new double[DigitStatistics.DIGITS];
        double total = 0.0;
        for (int d = 0; d < post.length; d++) {
            double p = prior[d] > 0 ? prior[d] : FLOOR;
            double l = likelihood == null ? FLOOR : (likelihood[d] > 0 ? likelihood[d] : FLOOR);
            post[d] = p * l;
            total += post[d];
        }
        for (int d = 0; d < post.length; d++) {
            post[d] /= total;
        }
        return post;
    }

    public static double overProbability(double[] posterior) {
        double over = 0.0;
        for (int d = 5; d < posterior.length; d++) {
            over += posterior[d];
        }
        return over;
    }

    public Optional<IndicatorVote> vote(double[] posterior, IndicatorWeights weights) {
        double over = overProbability(posterior);
        double under = 1.0 - over;
        double confidence = Math.abs(over - under);
        if (confidence <= config.bayesianMinConfidence()) {
            return Optional.empty();
        }
        Side side = over > under ? Side.OVER : Side.UNDER;
        double score = confidence * weights.forIndicator(Indicator.BAYESIAN) * FACTOR;
        return Optional.of(new IndicatorVote(Indicator.BAYESIAN, side, confidence, score,
            Indicator.BAYESIAN.code() + ":" + side + "@" + DigitStatistics.percent(confidence)));
    }
}
