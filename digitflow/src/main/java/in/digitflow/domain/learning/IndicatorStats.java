package in.digitflow.domain.learning;

/**
 * Correct/wrong tally for one indicator.
 */
public record IndicatorStats(int correct, int wrong) {

    public static IndicatorStats empty() {
        return new IndicatorStats(0, 0);
    }

    public int total() {
        return correct + wrong;
    }

    public double accuracy() {
        int total = total();
        return total == 0 ? 0.0 : (double) correct / total;
    }

    public IndicatorStats record(boolean wasCorrect) {
        return wasCorrect
            ? new IndicatorStats(correct + 1, wrong)
            : new IndicatorStats(correct, wrong + 1);
    }
}
