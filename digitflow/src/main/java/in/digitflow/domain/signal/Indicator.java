package in.digitflow.domain.signal;

/**
 * The five predictive indicators that vote on a side.
 */
public enum Indicator {
    MARKOV("MKV"),
    EXHAUSTION("EXH"),
    STREAK("STK"),
    BIAS("BIAS"),
    BAYESIAN("BAY");

    private final String code;

    Indicator(String code) {
        this.code = code;
    }

    /** Short code used in factor traces. */
    public String code() {
        return code;
    }
}
