package in.digitflow.service.execution;

/**
 * A participant skipped for one round, with the reason shown to the user.
 */
public record InvalidAccount(
    String participantId,
    String userId,
    String accountId,     // null when the user has no account
    Reason reason,
    String detail
) {
    public enum Reason {
        NO_ACCOUNT,
        NO_CREDENTIAL,
        LOW_BALANCE,
        TPSL_MISSING,
        TPSL_BELOW_MINIMUM,
        AUTHORIZATION_FAILED
    }
}
