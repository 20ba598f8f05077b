package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;

import java.util.List;
import java.util.Optional;

/**
 * First-order Markov prediction of the next digit from the current one.
 */
public final class MarkovPredictor {

    private final SignalConfig config;

    public MarkovPredictor(SignalConfig config) {
        this.config = config;
    }

    /**
     * Successor counts of the latest digit within the most recent {@code depth} digits.
     */
    public static int[] successorCounts(List<Integer> digits, int depth) {
        int[] counts = new int[DigitStatistics.DIGITS];
        List<Integer> window = DigitStatistics.tail(digits, depth);
        if (window.size() < 2) {
            return counts;
        }
        int current = window.get(window.size() - 1);
        for (int i = 0; i < window.size() - 1; i++) {
            if (window.get(i) == current) {
                counts[window.get(i + 1)]++;
            }
        }
        return counts;
    }

    /**
     * Normalized transition row from the latest digit, or null when it has no recorded successor.
     */
    public static double[] transitionRow(List<Integer> digits, int depth) {
        int[] counts = successorCounts(digits, depth);
        int total = 0;
        for (int c : counts) {
            total += c;
        }
        if (total == 0) {
            return null;
        }
        double[] row = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            row[i] = (double) counts[i] / total;
        }
        return row;
    }

    public Optional<IndicatorVote> vote(List<Integer> digits, IndicatorWeights weights) {
        int[] counts = successorCounts(digits, config.markovDepth());
        int observations = 0;
        for (int c : counts) {
            observations += c;
        }
        if (observations < config.markovMinObservations()) {
            return Optional.empty();
        }

        double[] row = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            row[i] = (double) counts[i] / observations;
        }
        int predicted = DigitStatistics.argMax(row);
        double probability = row[predicted];
        if (probability <= config.markovSignificance()) {
            return Optional.empty();
        }

        double score = probability * weights.forIndicator(Indicator.MARKOV);
        return Optional.of(new IndicatorVote(Indicator.MARKOV, Side.ofDigit(predicted), probability, score,
            Indicator.MARKOV.code() + ":" + predicted + "@" + DigitStatistics.percent(probability)));
    }
}
