package in.digitflow.domain.repository;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Append-only per-session activity trail (signals, vetoes, risk blocks, trades).
 */
public interface ActivityLogRepository {
    void append(String sessionId, String type, String message, JsonNode metadata);
}
