package in.digitflow.config;

import java.time.Duration;

/**
 * Venue endpoint and connection lifecycle settings.
 */
public record VenueConfig(
    String url,                    // Full WebSocket URL including app id
    Duration pingInterval,         // Keepalive for tick stream and pooled connections
    Duration reapInterval,         // How often idle pooled connections are checked
    Duration maxIdle,              // Pooled connection unused this long is closed
    Duration authorizeTimeout,
    Duration reconnectBaseDelay,   // Tick stream waits attempt * base
    int maxReconnectAttempts
) {
    public static final String DEFAULT_APP_ID = "114042";

    public static VenueConfig defaults() {
        return forAppId(DEFAULT_APP_ID);
    }

    public static VenueConfig forAppId(String appId) {
        return new VenueConfig(
            "wss://ws.derivws.com/websockets/v3?app_id=" + appId,
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofSeconds(120),
            Duration.ofSeconds(15),
            Duration.ofSeconds(5),
            10
        );
    }
}
