package in.digitflow.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.digitflow.domain.common.EngineEvent;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event Service.
 * Publishes engine events to the notification sink and appends session activity to the log.
 * Neither path may fail the caller: sink and store errors are logged and dropped.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private final NotificationSink sink;
    private final ActivityLogRepository activityLog;
    private final Clock clock;

    private final Map<EventType, AtomicLong> published = new EnumMap<>(EventType.class);
    private final AtomicLong dropped = new AtomicLong();

    public EventService(NotificationSink sink, ActivityLogRepository activityLog, Clock clock) {
        this.sink = sink;
        this.activityLog = activityLog;
        this.clock = clock;
        for (EventType type : EventType.values()) {
            published.put(type, new AtomicLong());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit an engine-wide event.
     */
    public EngineEvent emitGlobal(EventType type, Object payloadPojo) {
        return publish(new EngineEvent(type, null, null, toJson(payloadPojo), clock.instant()));
    }

    /**
     * Emit an event about a session.
     */
    public EngineEvent emitSession(EventType type, String sessionId, Object payloadPojo) {
        return publish(new EngineEvent(type, sessionId, null, toJson(payloadPojo), clock.instant()));
    }

    /**
     * Emit an event addressed to one user of a session.
     */
    public EngineEvent emitUser(EventType type, String sessionId, String userId, Object payloadPojo) {
        return publish(new EngineEvent(type, sessionId, userId, toJson(payloadPojo), clock.instant()));
    }

    private EngineEvent publish(EngineEvent event) {
        try {
            sink.publish(event);
            published.get(event.type()).incrementAndGet();
            log.debug("Event emitted: type={}, session={}, user={}", event.type(), event.sessionId(), event.userId());
        } catch (RuntimeException e) {
            dropped.incrementAndGet();
            log.warn("Event {} not delivered: {}", event.type(), e.getMessage());
        }
        return event;
    }

    // ═══════════════════════════════════════════════════════════════
    // ACTIVITY LOG
    // ═══════════════════════════════════════════════════════════════

    /**
     * Append to the session's activity trail (signal, veto, risk_block, trade ...).
     */
    public void logActivity(String sessionId, String type, String message, Object metadataPojo) {
        try {
            activityLog.append(sessionId, type, message, toJson(metadataPojo));
        } catch (RuntimeException e) {
            log.warn("Activity {} for session {} not logged: {}", type, sessionId, e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // STATS
    // ═══════════════════════════════════════════════════════════════

    public long publishedCount(EventType type) {
        return published.get(type).get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Payload map from alternating keys and values. Null values are kept, unlike {@code Map.of}.
     */
    public static Map<String, Object> payload(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("payload needs key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return map;
    }

    private static JsonNode toJson(Object payloadPojo) {
        if (payloadPojo == null) {
            return MAPPER.createObjectNode();
        }
        if (payloadPojo instanceof JsonNode) {
            return (JsonNode) payloadPojo;
        }
        return MAPPER.valueToTree(payloadPojo);
    }
}
