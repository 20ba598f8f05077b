package in.digitflow.infrastructure.venue;

/**
 * A frame that is not a JSON object or lacks a message type. Dropped by the read loops.
 */
public class MalformedFrameException extends RuntimeException {
    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
