package in.digitflow.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.digitflow.config.EngineConfig;
import in.digitflow.domain.common.EventType;
import in.digitflow.domain.repository.LearningMemoryRepository;
import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.infrastructure.metrics.PrometheusEngineMetrics;
import in.digitflow.infrastructure.metrics.PrometheusMetricsHandler;
import in.digitflow.infrastructure.persistence.InMemoryLearningMemoryRepository;
import in.digitflow.infrastructure.persistence.PostgresActivityLogRepository;
import in.digitflow.infrastructure.persistence.PostgresLearningMemoryRepository;
import in.digitflow.infrastructure.persistence.PostgresRecoveryStateRepository;
import in.digitflow.infrastructure.persistence.PostgresSessionRepository;
import in.digitflow.infrastructure.persistence.PostgresTradeAuditRepository;
import in.digitflow.infrastructure.venue.ConnectionPool;
import in.digitflow.infrastructure.venue.JdkVenueSocketFactory;
import in.digitflow.infrastructure.venue.TickStream;
import in.digitflow.infrastructure.venue.VenueSocketFactory;
import in.digitflow.security.TokenCipher;
import in.digitflow.service.core.EventService;
import in.digitflow.service.core.LoggingNotificationSink;
import in.digitflow.service.execution.ExecutionOrchestrator;
import in.digitflow.service.execution.RecoveryManager;
import in.digitflow.service.learning.LearningMemory;
import in.digitflow.service.risk.CircuitBreaker;
import in.digitflow.service.risk.CorrelationGuard;
import in.digitflow.service.risk.RateLimiter;
import in.digitflow.service.risk.RiskGuard;
import in.digitflow.service.risk.SessionRiskGuard;
import in.digitflow.service.scheduler.SignalScheduler;
import in.digitflow.service.signal.SignalEngine;
import in.digitflow.transport.http.EngineHandlers;
import in.digitflow.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * DigitFlow engine entry point.
 *
 * Wires:
 * - PostgreSQL repositories (sessions, trades, recovery, activity, learning memory)
 * - Shared tick stream and per-credential connection pool on the venue WebSocket API
 * - Signal engine, learning memory, risk guards
 * - Execution orchestrator and per-session signal scheduler
 * - HTTP control surface and Prometheus /metrics
 *
 * Sessions listed in DIGITFLOW_SESSIONS (comma separated) are started at boot;
 * others are started through POST /api/sessions/{id}/start.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== DigitFlow Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        EngineConfig config = EngineConfig.fromEnv();
        if (!config.signal().isValid() || !config.risk().isValid() || !config.execution().isValid()) {
            log.error("❌ STARTUP VALIDATION FAILED: invalid engine configuration {}", config);
            System.exit(1);
        }
        log.info("✓ Configuration loaded (venue {})", config.venue().url());

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repository layer
        // ═══════════════════════════════════════════════════════════════
        TokenCipher cipher = TokenCipher.fromEnv();
        SessionRepository sessionRepo = new PostgresSessionRepository(dataSource, cipher);
        PostgresTradeAuditRepository auditRepo = new PostgresTradeAuditRepository(dataSource);
        PostgresRecoveryStateRepository recoveryRepo = new PostgresRecoveryStateRepository(dataSource);
        PostgresActivityLogRepository activityRepo = new PostgresActivityLogRepository(dataSource);
        LearningMemoryRepository learningRepo = "memory".equalsIgnoreCase(Env.get("LEARNING_STORE", "postgres"))
            ? new InMemoryLearningMemoryRepository()
            : new PostgresLearningMemoryRepository(dataSource);

        EventService eventService = new EventService(new LoggingNotificationSink(), activityRepo, clock);

        // ═══════════════════════════════════════════════════════════════
        // Venue: shared tick stream + per-credential connection pool
        // ═══════════════════════════════════════════════════════════════
        VenueSocketFactory socketFactory = new JdkVenueSocketFactory(config.venue().authorizeTimeout());

        TickStream tickStream = TickStream.create(config.venue(), socketFactory, clock);
        tickStream.onUnavailable(() -> {
            metrics.setTickStreamConnected(false);
            eventService.emitGlobal(EventType.VENUE_UNAVAILABLE, EventService.payload(
                "message", "Tick stream gave up reconnecting",
                "markets", tickStream.stats().markets()));
        });
        tickStream.connect(Env.get("DERIV_FEED_TOKEN", null));
        log.info("✓ Tick stream connecting");

        ConnectionPool pool = new ConnectionPool(config.venue(), socketFactory,
            config.execution().requestTimeout(), clock);
        pool.start(config.venue().pingInterval(), config.venue().reapInterval());
        log.info("✓ Connection pool started");

        // ═══════════════════════════════════════════════════════════════
        // Signal + learning
        // ═══════════════════════════════════════════════════════════════
        SignalEngine signalEngine = new SignalEngine(config.signal(), clock);
        LearningMemory learningMemory = new LearningMemory(learningRepo, config.scheduler().learningCacheTtl(), clock);

        // ═══════════════════════════════════════════════════════════════
        // Risk
        // ═══════════════════════════════════════════════════════════════
        CircuitBreaker breaker = new CircuitBreaker("venue",
            config.risk().breakerFailureThreshold(), config.risk().breakerResetTimeout(), clock);
        CorrelationGuard correlationGuard = new CorrelationGuard(
            config.risk().maxOpenPerMarket(), config.risk().maxOpenGlobal());
        RateLimiter rateLimiter = new RateLimiter(
            config.risk().tradesPerMinute(), config.risk().tradesPerHour(), clock);
        SessionRiskGuard sessionRiskGuard = new SessionRiskGuard(sessionRepo, config.risk().dailyLossCap(), clock);
        RiskGuard riskGuard = new RiskGuard(sessionRiskGuard, breaker, correlationGuard, rateLimiter);
        log.info("✓ Risk guards ready");

        // ═══════════════════════════════════════════════════════════════
        // Execution + scheduler
        // ═══════════════════════════════════════════════════════════════
        RecoveryManager recoveryManager = new RecoveryManager(recoveryRepo, sessionRepo, eventService, config.execution());
        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator(
            config.execution(), sessionRepo, auditRepo, pool, breaker, correlationGuard,
            learningMemory, recoveryManager, eventService, metrics, clock);

        SignalScheduler scheduler = new SignalScheduler(
            config.scheduler(), config.risk(), sessionRepo, tickStream, signalEngine,
            learningMemory, riskGuard, orchestrator, eventService, metrics);
        log.info("✓ Signal scheduler ready");

        ScheduledExecutorService gauges = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-gauges");
            t.setDaemon(true);
            return t;
        });
        gauges.scheduleAtFixedRate(() -> {
            try {
                metrics.setPoolSize(pool.size());
                metrics.setTickStreamConnected(tickStream.isConnected());
            } catch (Exception e) {
                log.warn("[App] Gauge refresh failed: {}", e.getMessage());
            }
        }, 5, 5, TimeUnit.SECONDS);

        // ═══════════════════════════════════════════════════════════════
        // HTTP server
        // ═══════════════════════════════════════════════════════════════
        EngineHandlers api = new EngineHandlers(scheduler, orchestrator, tickStream, signalEngine,
            learningMemory, eventService, clock);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/engine/status", api::getStatus)
            .post("/api/engine/resume", api::resume)
            .post("/api/sessions/{id}/start", api::startSession)
            .post("/api/sessions/{id}/stop", api::stopSession)
            .get("/api/markets/{market}/signal", api::getSignal)
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "DigitFlow Engine\n\n" +
                    "API:  GET /api/health, /api/engine/status, /api/markets/{market}/signal\n" +
                    "      POST /api/engine/resume, /api/sessions/{id}/start, /api/sessions/{id}/stop\n" +
                    "Ops:  GET /metrics\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        // ═══════════════════════════════════════════════════════════════
        // Boot sessions
        // ═══════════════════════════════════════════════════════════════
        Arrays.stream(Env.get("DIGITFLOW_SESSIONS", "").split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .forEach(scheduler::start);

        eventService.emitGlobal(EventType.SESSION_REPORT, EventService.payload(
            "message", "DigitFlow engine started",
            "port", port,
            "markets", config.scheduler().defaultMarkets(),
            "sessions", scheduler.activeSessions()));

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[App] Shutting down...");
            server.stop();
            scheduler.shutdown();
            orchestrator.shutdown();
            pool.shutdown();
            tickStream.shutdown();
            gauges.shutdownNow();
            dataSource.close();
            log.info("[App] Shutdown complete");
        }, "shutdown-hook"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("DigitFlow Engine started on http://localhost:{}/", port);
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/digitflow");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("digitflow-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
