package in.digitflow.config;

import in.digitflow.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Root configuration assembled once at startup and passed to every service.
 */
public record EngineConfig(
    SignalConfig signal,
    RiskConfig risk,
    ExecutionConfig execution,
    VenueConfig venue,
    SchedulerConfig scheduler
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            SignalConfig.defaults(),
            RiskConfig.defaults(),
            ExecutionConfig.defaults(),
            VenueConfig.defaults(),
            SchedulerConfig.defaults()
        );
    }

    /**
     * Defaults overridden by environment variables (or -D system properties).
     */
    public static EngineConfig fromEnv() {
        EngineConfig d = defaults();

        RiskConfig r = d.risk();
        RiskConfig risk = new RiskConfig(
            Env.getInt("RISK_TRADES_PER_MINUTE", r.tradesPerMinute()),
            Env.getInt("RISK_TRADES_PER_HOUR", r.tradesPerHour()),
            Env.getInt("RISK_BREAKER_THRESHOLD", r.breakerFailureThreshold()),
            Duration.ofSeconds(Env.getLong("RISK_BREAKER_RESET_SECONDS", r.breakerResetTimeout().getSeconds())),
            Env.getInt("RISK_MAX_OPEN_PER_MARKET", r.maxOpenPerMarket()),
            Env.getInt("RISK_MAX_OPEN_GLOBAL", r.maxOpenGlobal()),
            Env.getDouble("RISK_DAILY_LOSS_CAP", r.dailyLossCap()),
            Env.getBool("RISK_DRAWDOWN_GUARD", r.drawdownGuardEnabled()),
            Env.getDouble("RISK_MAX_DRAWDOWN_PCT", r.maxDrawdownPercent())
        );

        ExecutionConfig e = d.execution();
        ExecutionConfig execution = new ExecutionConfig(
            Duration.ofMillis(Env.getLong("EXEC_PLACEMENT_DELAY_MS", e.placementDelay().toMillis())),
            e.minStake(),
            e.defaultStakePercent(),
            e.defaultMartingaleMultiplier(),
            BigDecimal.valueOf(Env.getDouble("EXEC_MIN_TP", e.minTakeProfit().doubleValue())),
            BigDecimal.valueOf(Env.getDouble("EXEC_MIN_SL", e.minStopLoss().doubleValue())),
            Env.get("EXEC_CURRENCY", e.currency()),
            e.contractDuration(),
            e.durationUnit(),
            e.requestTimeout(),
            Env.getInt("EXEC_MAX_LOSS_STREAK", e.maxConsecutiveLosses()),
            Env.getInt("EXEC_API_ERROR_THRESHOLD", e.apiErrorThreshold())
        );

        VenueConfig venue = VenueConfig.forAppId(Env.get("DERIV_APP_ID", VenueConfig.DEFAULT_APP_ID));
        String url = Env.get("VENUE_WS_URL", null);
        if (url != null) {
            venue = new VenueConfig(url, venue.pingInterval(), venue.reapInterval(), venue.maxIdle(),
                venue.authorizeTimeout(), venue.reconnectBaseDelay(), venue.maxReconnectAttempts());
        }

        SchedulerConfig s = d.scheduler();
        List<String> markets = Arrays.stream(Env.get("DIGITFLOW_MARKETS", String.join(",", s.defaultMarkets())).split(","))
            .map(String::trim)
            .filter(m -> !m.isEmpty())
            .toList();
        SchedulerConfig scheduler = new SchedulerConfig(
            Duration.ofMillis(Env.getLong("SCHEDULER_INTERVAL_MS", s.cycleInterval().toMillis())),
            Duration.ofMillis(Env.getLong("SMART_DELAY_MS", s.smartDelay().toMillis())),
            markets,
            s.learningCacheTtl()
        );

        return new EngineConfig(d.signal(), risk, execution, venue, scheduler);
    }
}
