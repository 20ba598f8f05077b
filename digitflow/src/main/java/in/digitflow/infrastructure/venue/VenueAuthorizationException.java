package in.digitflow.infrastructure.venue;

/**
 * The venue rejected a credential. Fatal for that credential; never retried automatically.
 */
public class VenueAuthorizationException extends RuntimeException {

    private final String credentialRef;
    private final String errorCode;

    public VenueAuthorizationException(String credentialRef, String errorCode, String message) {
        super(String.format("[%s] Authorization failed (%s): %s", credentialRef, errorCode, message));
        this.credentialRef = credentialRef;
        this.errorCode = errorCode;
    }

    public String getCredentialRef() {
        return credentialRef;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
