package in.digitflow.infrastructure.venue;

/**
 * Transport-level failure: socket could not open, dropped, or a request timed out.
 * Transient; callers may retry.
 */
public class VenueConnectionException extends RuntimeException {

    private final String connectionRef;

    public VenueConnectionException(String connectionRef, String message) {
        super(String.format("[%s] %s", connectionRef, message));
        this.connectionRef = connectionRef;
    }

    public VenueConnectionException(String connectionRef, String message, Throwable cause) {
        super(String.format("[%s] %s", connectionRef, message), cause);
        this.connectionRef = connectionRef;
    }

    public String getConnectionRef() {
        return connectionRef;
    }
}
