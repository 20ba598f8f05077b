package in.digitflow.domain.learning;

import java.time.Instant;

/**
 * Results for the trading session currently feeding this market's record.
 */
public record SessionStats(
    String sessionId,
    Instant startedAt,
    int trades,
    int wins,
    int losses
) {
    public static SessionStats start(String sessionId, Instant at) {
        return new SessionStats(sessionId, at, 0, 0, 0);
    }

    public SessionStats record(boolean won) {
        return new SessionStats(sessionId, startedAt, trades + 1, won ? wins + 1 : wins, won ? losses : losses + 1);
    }
}
