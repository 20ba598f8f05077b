package in.digitflow.service.signal;

import java.util.List;

/**
 * Shannon entropy of the digit distribution, in bits.
 *
 * Ten equally likely digits give log2(10) ≈ 3.3219, the upper bound.
 * A window holding a single repeated digit gives 0.
 */
public final class EntropyCalculator {

    public static final double MAX_ENTROPY = Math.log(10) / Math.log(2);

    public static double entropy(List<Integer> digits) {
        return entropy(DigitStatistics.frequencies(digits));
    }

    public static double entropy(double[] distribution) {
        double h = 0.0;
        for (double p : distribution) {
            if (p > 0) {
                h -= p * (Math.log(p) / Math.log(2));
            }
        }
        // Rounding can push a uniform window a hair past the bound
        return Math.max(0.0, Math.min(MAX_ENTROPY, h));
    }

    private EntropyCalculator() {}
}
