package in.digitflow.infrastructure.metrics;

import java.time.Duration;

final class NoopEngineMetrics implements EngineMetrics {
    static final NoopEngineMetrics INSTANCE = new NoopEngineMetrics();

    @Override public void recordSignal(String market, String outcome) {}
    @Override public void recordRiskBlock(String reason) {}
    @Override public void recordTradeOpened(String market) {}
    @Override public void recordTradeClosed(String market, String status) {}
    @Override public void recordTradeFailed(String market, String reason) {}
    @Override public void recordVenueRequest(String requestType, boolean success, Duration latency) {}
    @Override public void setPoolSize(int connections) {}
    @Override public void setActiveMonitors(int monitors) {}
    @Override public void setPaused(boolean paused) {}
    @Override public void setTickStreamConnected(boolean connected) {}

    private NoopEngineMetrics() {}
}
