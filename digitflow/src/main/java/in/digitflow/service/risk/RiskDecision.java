package in.digitflow.service.risk;

/**
 * Structured verdict of a risk check. {@code reason} is a stable machine-readable code.
 */
public record RiskDecision(boolean allowed, String reason, String detail) {

    public static final String RATE_LIMIT = "rate_limit";
    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String EXPOSURE_LIMIT = "risk_guard_limit";
    public static final String SESSION_INACTIVE = "session_inactive";
    public static final String SESSION_MAX_LOSS = "session_max_loss";
    public static final String DAILY_LOSS = "daily_loss_cap";
    public static final String REGIME_CHAOS = "regime_chaos";
    public static final String RISK_DATA_UNAVAILABLE = "risk_data_unavailable";

    private static final RiskDecision ALLOW = new RiskDecision(true, null, null);

    public static RiskDecision allow() {
        return ALLOW;
    }

    public static RiskDecision reject(String reason, String detail) {
        return new RiskDecision(false, reason, detail);
    }
}
