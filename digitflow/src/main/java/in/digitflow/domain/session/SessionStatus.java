package in.digitflow.domain.session;

/**
 * Lifecycle of a trading session. Legacy rows use "active" for running.
 */
public enum SessionStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public String label() {
        return name().toLowerCase();
    }

    public static SessionStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return PENDING;
        }
        String normalized = label.trim().toLowerCase();
        return switch (normalized) {
            case "active", "running", "started" -> RUNNING;
            case "paused", "stopped" -> PAUSED;
            case "completed", "finished", "ended" -> COMPLETED;
            case "cancelled", "canceled" -> CANCELLED;
            default -> PENDING;
        };
    }
}
