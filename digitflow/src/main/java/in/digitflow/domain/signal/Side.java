package in.digitflow.domain.signal;

/**
 * Direction of a digit contract relative to the barrier digit.
 */
public enum Side {
    OVER("DIGITOVER"),
    UNDER("DIGITUNDER");

    private final String contractType;

    Side(String contractType) {
        this.contractType = contractType;
    }

    public String contractType() {
        return contractType;
    }

    public Side opposite() {
        return this == OVER ? UNDER : OVER;
    }

    /**
     * High digits (5-9) map to OVER, low digits (0-4) to UNDER.
     */
    public static Side ofDigit(int digit) {
        return digit >= 5 ? OVER : UNDER;
    }
}
