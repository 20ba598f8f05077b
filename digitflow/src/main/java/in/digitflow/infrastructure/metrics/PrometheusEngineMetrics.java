package in.digitflow.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics, scraped at /metrics.
 *
 * Key Metrics:
 * - digitflow_signals_total{market, outcome} - evaluations by result
 * - digitflow_risk_blocks_total{reason} - risk guard rejections
 * - digitflow_trades_opened_total{market} / digitflow_trades_closed_total{market, status}
 * - digitflow_trades_failed_total{market, reason}
 * - digitflow_venue_request_seconds{request, status} - request/response latency
 * - digitflow_pool_connections, digitflow_active_monitors, digitflow_engine_paused,
 *   digitflow_tick_stream_connected - current state
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    private final Counter signals;
    private final Counter riskBlocks;
    private final Counter tradesOpened;
    private final Counter tradesClosed;
    private final Counter tradesFailed;
    private final Histogram venueLatency;

    private final Gauge poolConnections;
    private final Gauge activeMonitors;
    private final Gauge paused;
    private final Gauge tickStreamConnected;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signals = Counter.build()
            .name("digitflow_signals_total")
            .help("Signal evaluations by outcome")
            .labelNames("market", "outcome")
            .register(registry);

        this.riskBlocks = Counter.build()
            .name("digitflow_risk_blocks_total")
            .help("Signals blocked by the risk guard")
            .labelNames("reason")
            .register(registry);

        this.tradesOpened = Counter.build()
            .name("digitflow_trades_opened_total")
            .help("Contracts bought")
            .labelNames("market")
            .register(registry);

        this.tradesClosed = Counter.build()
            .name("digitflow_trades_closed_total")
            .help("Contracts closed by final status")
            .labelNames("market", "status")
            .register(registry);

        this.tradesFailed = Counter.build()
            .name("digitflow_trades_failed_total")
            .help("Placements that failed")
            .labelNames("market", "reason")
            .register(registry);

        this.venueLatency = Histogram.build()
            .name("digitflow_venue_request_seconds")
            .help("Venue request latency in seconds")
            .labelNames("request", "status")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 15.0)
            .register(registry);

        this.poolConnections = Gauge.build()
            .name("digitflow_pool_connections")
            .help("Authorized venue connections in the pool")
            .register(registry);

        this.activeMonitors = Gauge.build()
            .name("digitflow_active_monitors")
            .help("Open contracts being monitored")
            .register(registry);

        this.paused = Gauge.build()
            .name("digitflow_engine_paused")
            .help("Execution paused by safety guard (1=paused, 0=running)")
            .register(registry);

        this.tickStreamConnected = Gauge.build()
            .name("digitflow_tick_stream_connected")
            .help("Tick stream connection status (1=connected, 0=disconnected)")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordSignal(String market, String outcome) {
        signals.labels(market, outcome).inc();
    }

    @Override
    public void recordRiskBlock(String reason) {
        riskBlocks.labels(reason).inc();
    }

    @Override
    public void recordTradeOpened(String market) {
        tradesOpened.labels(market).inc();
    }

    @Override
    public void recordTradeClosed(String market, String status) {
        tradesClosed.labels(market, status).inc();
    }

    @Override
    public void recordTradeFailed(String market, String reason) {
        tradesFailed.labels(market, reason).inc();
    }

    @Override
    public void recordVenueRequest(String requestType, boolean success, Duration latency) {
        venueLatency.labels(requestType, success ? "success" : "failure").observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void setPoolSize(int connections) {
        poolConnections.set(connections);
    }

    @Override
    public void setActiveMonitors(int monitors) {
        activeMonitors.set(monitors);
    }

    @Override
    public void setPaused(boolean isPaused) {
        paused.set(isPaused ? 1 : 0);
    }

    @Override
    public void setTickStreamConnected(boolean connected) {
        tickStreamConnected.set(connected ? 1 : 0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
