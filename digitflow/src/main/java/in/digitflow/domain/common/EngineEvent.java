package in.digitflow.domain.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * An event published to the notification sink. Payload is free-form JSON.
 */
public record EngineEvent(
    EventType type,
    String sessionId,    // null for engine-wide events
    String userId,       // null unless addressed to one user
    JsonNode payload,
    Instant at
) {}
