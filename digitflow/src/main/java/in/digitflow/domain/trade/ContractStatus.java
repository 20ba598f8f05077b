package in.digitflow.domain.trade;

import in.digitflow.domain.session.ParticipantStatus;

/**
 * Monitor state of an open contract. Everything except OPEN is terminal.
 */
public enum ContractStatus {
    OPEN("open"),
    TP_HIT("tp_hit"),
    SL_HIT("sl_hit"),
    WIN("win"),
    LOSS("loss");

    private final String label;

    ContractStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    public ParticipantStatus participantStatus() {
        return switch (this) {
            case TP_HIT -> ParticipantStatus.REMOVED_TP;
            case SL_HIT -> ParticipantStatus.REMOVED_SL;
            case OPEN -> ParticipantStatus.ACTIVE;
            case WIN, LOSS -> ParticipantStatus.REMOVED;
        };
    }
}
