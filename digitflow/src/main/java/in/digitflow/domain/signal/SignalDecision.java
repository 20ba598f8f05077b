package in.digitflow.domain.signal;

/**
 * Outcome of one engine evaluation. Rejections are expected results, not errors.
 */
public record SignalDecision(
    String market,
    boolean tradeable,
    Rejection rejection,   // null when tradeable
    String reason,
    Regime regime,         // null during warmup
    Signal signal,         // present only when tradeable
    DecisionLog decisionLog
) {
    public enum Rejection {
        WARMUP,
        CHAOS,
        CONTRADICTION,
        LOW_CONFIDENCE,
        INSUFFICIENT_FACTORS
    }

    public static SignalDecision trade(Signal signal) {
        return new SignalDecision(signal.market(), true, null, "signal", signal.regime(), signal, signal.decisionLog());
    }

    public static SignalDecision reject(String market, Rejection rejection, String reason, Regime regime, DecisionLog log) {
        return new SignalDecision(market, false, rejection, reason, regime, null, log);
    }
}
