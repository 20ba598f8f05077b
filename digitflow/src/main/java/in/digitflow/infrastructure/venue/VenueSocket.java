package in.digitflow.infrastructure.venue;

import java.util.concurrent.CompletableFuture;

/**
 * A single open WebSocket to the venue. Sends are serialized by the implementation.
 */
public interface VenueSocket {

    CompletableFuture<Void> send(String text);

    boolean isOpen();

    void close();
}
