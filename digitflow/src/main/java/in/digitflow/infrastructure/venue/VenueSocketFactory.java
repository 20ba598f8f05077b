package in.digitflow.infrastructure.venue;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens venue sockets. The JDK implementation is used in production; tests substitute fakes.
 */
public interface VenueSocketFactory {

    CompletableFuture<VenueSocket> open(URI uri, VenueSocketListener listener);
}
