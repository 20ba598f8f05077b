package in.digitflow.infrastructure.venue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * {@link VenueSocketFactory} over {@code java.net.http.WebSocket}.
 *
 * Frames are reassembled in the listener and delivered one at a time ({@code request(1)}),
 * which gives each socket a single ordered read loop.
 */
public final class JdkVenueSocketFactory implements VenueSocketFactory {
    private static final Logger log = LoggerFactory.getLogger(JdkVenueSocketFactory.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkVenueSocketFactory(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public CompletableFuture<VenueSocket> open(URI uri, VenueSocketListener listener) {
        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        try {
                            listener.onMessage(msg);
                        } catch (RuntimeException e) {
                            log.error("[VenueSocket] Message handler failed", e);
                        }
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    listener.onClosed(statusCode, reason);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    listener.onError(error);
                }
            })
            .thenApply(JdkVenueSocket::new);
    }

    private static final class JdkVenueSocket implements VenueSocket {
        private final WebSocket webSocket;
        private CompletableFuture<Void> lastSend = CompletableFuture.completedFuture(null);

        JdkVenueSocket(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        /**
         * The JDK socket rejects a send while another is pending, so sends are chained.
         */
        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            CompletableFuture<Void> next = lastSend
                .handle((ok, err) -> null)
                .thenCompose(ignored -> webSocket.sendText(text, true))
                .thenApply(ws -> null);
            lastSend = next;
            return next;
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }

        @Override
        public void close() {
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                .orTimeout(5, TimeUnit.SECONDS)
                .whenComplete((ws, err) -> {
                    if (err != null) {
                        log.debug("[VenueSocket] Close handshake failed, aborting: {}", err.getMessage());
                        webSocket.abort();
                    }
                });
        }
    }
}
