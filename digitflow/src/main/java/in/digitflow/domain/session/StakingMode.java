package in.digitflow.domain.session;

/**
 * How the per-account stake is derived. Recovery sessions always apply the martingale multiplier.
 */
public enum StakingMode {
    FIXED,
    PERCENTAGE,
    MARTINGALE;

    public static StakingMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return FIXED;
        }
        return switch (label.trim().toLowerCase()) {
            case "percentage", "percent", "compounding" -> PERCENTAGE;
            case "martingale" -> MARTINGALE;
            default -> FIXED;
        };
    }
}
