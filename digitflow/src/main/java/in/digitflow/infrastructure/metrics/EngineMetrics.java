package in.digitflow.infrastructure.metrics;

import java.time.Duration;

/**
 * Engine metrics for monitoring and alerting.
 *
 * Implementations must be thread-safe and cheap; callers record from scheduler and read-loop threads.
 */
public interface EngineMetrics {

    /**
     * One signal evaluation.
     *
     * @param outcome "tradeable" or the lower-case rejection (warmup, chaos, ...)
     */
    void recordSignal(String market, String outcome);

    void recordRiskBlock(String reason);

    void recordTradeOpened(String market);

    /**
     * @param status final contract status label (tp_hit, sl_hit, win, loss)
     */
    void recordTradeClosed(String market, String status);

    void recordTradeFailed(String market, String reason);

    void recordVenueRequest(String requestType, boolean success, Duration latency);

    void setPoolSize(int connections);

    void setActiveMonitors(int monitors);

    void setPaused(boolean paused);

    void setTickStreamConnected(boolean connected);

    /** Metrics sink that records nothing. */
    static EngineMetrics noop() {
        return NoopEngineMetrics.INSTANCE;
    }
}
