package in.digitflow.domain.session;

public enum ParticipantStatus {
    ACTIVE("active"),
    REMOVED_TP("removed_tp"),
    REMOVED_SL("removed_sl"),
    REMOVED("removed");

    private final String label;

    ParticipantStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ParticipantStatus fromLabel(String label) {
        if (label == null) {
            return ACTIVE;
        }
        for (ParticipantStatus status : values()) {
            if (status.label.equalsIgnoreCase(label.trim())) {
                return status;
            }
        }
        return REMOVED;
    }
}
