package in.digitflow.domain.session;

public enum SessionType {
    DAY,
    ONE_TIME,
    RECOVERY;

    public static SessionType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return DAY;
        }
        return switch (label.trim().toLowerCase().replace('-', '_')) {
            case "recovery" -> RECOVERY;
            case "one_time", "onetime" -> ONE_TIME;
            default -> DAY;
        };
    }
}
