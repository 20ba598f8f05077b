package in.digitflow.infrastructure.venue;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A parsed inbound frame.
 *
 * @param reqId          echoed request id, null for unsolicited stream frames
 * @param subscriptionId id of the stream this frame belongs to, if any
 */
public record VenueMessage(
    String msgType,
    Integer reqId,
    String subscriptionId,
    String errorCode,
    String errorMessage,
    JsonNode body
) {
    public boolean isError() {
        return errorCode != null;
    }

    /** The payload under the message type key, e.g. {@code body.tick} for a tick. */
    public JsonNode payload() {
        return body.path(msgType);
    }
}
