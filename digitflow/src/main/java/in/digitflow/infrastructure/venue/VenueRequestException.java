package in.digitflow.infrastructure.venue;

/**
 * The venue answered a request with an error payload (e.g. a rejected buy).
 */
public class VenueRequestException extends RuntimeException {

    private final String msgType;
    private final String errorCode;

    public VenueRequestException(String msgType, String errorCode, String message) {
        super(String.format("%s rejected (%s): %s", msgType, errorCode, message));
        this.msgType = msgType;
        this.errorCode = errorCode;
    }

    public String getMsgType() {
        return msgType;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
