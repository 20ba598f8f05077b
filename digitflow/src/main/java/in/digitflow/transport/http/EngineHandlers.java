package in.digitflow.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.digitflow.domain.data.TickHistory;
import in.digitflow.domain.signal.SignalDecision;
import in.digitflow.infrastructure.venue.TickStream;
import in.digitflow.service.core.EventService;
import in.digitflow.service.execution.ExecutionOrchestrator;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.scheduler.SignalScheduler;
import in.digitflow.service.signal.SignalEngine;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for the engine control surface.
 *
 * - GET  /api/health                  - Liveness
 * - GET  /api/engine/status           - Execution, tick stream and scheduler state
 * - POST /api/engine/resume           - Clear a safety pause
 * - POST /api/sessions/{id}/start     - Schedule a session
 * - POST /api/sessions/{id}/stop      - Stop a session and tear down its monitors
 * - GET  /api/markets/{market}/signal - Evaluate a market now (no execution)
 */
public final class EngineHandlers {
    private static final Logger log = LoggerFactory.getLogger(EngineHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final SignalScheduler scheduler;
    private final ExecutionOrchestrator orchestrator;
    private final TickStream tickStream;
    private final SignalEngine signalEngine;
    private final LearningMemory learningMemory;
    private final EventService eventService;
    private final Clock clock;

    public EngineHandlers(SignalScheduler scheduler, ExecutionOrchestrator orchestrator, TickStream tickStream,
                          SignalEngine signalEngine, LearningMemory learningMemory, EventService eventService,
                          Clock clock) {
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
        this.tickStream = tickStream;
        this.signalEngine = signalEngine;
        this.learningMemory = learningMemory;
        this.eventService = eventService;
        this.clock = clock;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("venueConnected", tickStream.isConnected());
            body.put("paused", orchestrator.isPaused());
            body.put("time", clock.instant());
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to build health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to build health: " + e.getMessage());
        }
    }

    /**
     * GET /api/engine/status
     */
    public void getStatus(HttpServerExchange exchange) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("execution", orchestrator.stats());
            body.put("tickStream", tickStream.stats());
            body.put("activeSessions", scheduler.activeSessions());
            body.put("eventsDropped", eventService.droppedCount());
            body.put("time", clock.instant());
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to get engine status: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get engine status: " + e.getMessage());
        }
    }

    /**
     * POST /api/engine/resume
     */
    public void resume(HttpServerExchange exchange) {
        try {
            boolean wasPaused = orchestrator.isPaused();
            orchestrator.resume();
            sendJson(exchange, Map.of("resumed", wasPaused, "paused", orchestrator.isPaused()));
        } catch (Exception e) {
            log.error("Failed to resume execution: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to resume execution: " + e.getMessage());
        }
    }

    /**
     * POST /api/sessions/{id}/start
     */
    public void startSession(HttpServerExchange exchange) {
        String sessionId = pathParam(exchange, "id");
        if (sessionId == null) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing session id");
            return;
        }
        try {
            boolean started = scheduler.start(sessionId);
            if (!started && !scheduler.activeSessions().contains(sessionId)) {
                sendError(exchange, StatusCodes.NOT_FOUND, "Session not found: " + sessionId);
                return;
            }
            sendJson(exchange, Map.of("sessionId", sessionId, "started", started));
        } catch (Exception e) {
            log.error("Failed to start session {}: {}", sessionId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to start session: " + e.getMessage());
        }
    }

    /**
     * POST /api/sessions/{id}/stop
     */
    public void stopSession(HttpServerExchange exchange) {
        String sessionId = pathParam(exchange, "id");
        if (sessionId == null) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing session id");
            return;
        }
        try {
            scheduler.stop(sessionId);
            sendJson(exchange, Map.of("sessionId", sessionId, "stopped", true));
        } catch (Exception e) {
            log.error("Failed to stop session {}: {}", sessionId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to stop session: " + e.getMessage());
        }
    }

    /**
     * GET /api/markets/{market}/signal
     *
     * Evaluates the market's current window with its learned weights. Nothing is executed.
     */
    public void getSignal(HttpServerExchange exchange) {
        String market = pathParam(exchange, "market");
        if (market == null) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing market");
            return;
        }
        try {
            TickHistory history = tickStream.latestHistory(market);
            SignalDecision decision = signalEngine.evaluate(history, learningMemory.weights(market));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("market", market);
            body.put("ticks", history.size());
            body.put("decision", decision);
            body.put("learning", learningMemory.summary(market));
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to evaluate {}: {}", market, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to evaluate market: " + e.getMessage());
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
