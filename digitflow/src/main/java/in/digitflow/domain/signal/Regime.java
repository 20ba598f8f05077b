package in.digitflow.domain.signal;

/**
 * Market predictability class derived from digit entropy.
 */
public enum Regime {
    STABLE,
    TRANSITION,
    CHAOS;

    public String label() {
        return name().toLowerCase();
    }

    public static Regime fromLabel(String label) {
        if (label == null) {
            return STABLE;
        }
        return valueOf(label.trim().toUpperCase());
    }
}
