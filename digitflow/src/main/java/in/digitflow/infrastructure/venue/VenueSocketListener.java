package in.digitflow.infrastructure.venue;

/**
 * Callbacks from a socket's read loop. Invoked one at a time per socket, in arrival order.
 */
public interface VenueSocketListener {

    void onMessage(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
