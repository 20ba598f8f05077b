package in.digitflow.service.signal;

import java.util.List;

/**
 * Window and frequency helpers shared by the indicators.
 */
public final class DigitStatistics {

    public static final int DIGITS = 10;

    /**
     * The most recent {@code n} digits, or all of them when fewer are available.
     */
    public static List<Integer> tail(List<Integer> digits, int n) {
        int size = digits.size();
        return size <= n ? digits : digits.subList(size - n, size);
    }

    /**
     * Relative frequency of each digit. All zeros for an empty window.
     */
    public static double[] frequencies(List<Integer> digits) {
        double[] freq = new double[DIGITS];
        if (digits.isEmpty()) {
            return freq;
        }
        for (int d : digits) {
            freq[d]++;
        }
        for (int i = 0; i < DIGITS; i++) {
            freq[i] /= digits.size();
        }
        return freq;
    }

    /**
     * Index of the largest value; ties go to the lowest index.
     */
    public static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    /**
     * Index of the smallest value; ties go to the lowest index.
     */
    public static int argMin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) {
                best = i;
            }
        }
        return best;
    }

    static String percent(double value) {
        return Math.round(value * 100) + "%";
    }

    private DigitStatistics() {}
}
