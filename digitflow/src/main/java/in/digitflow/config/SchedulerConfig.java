package in.digitflow.config;

import java.time.Duration;
import java.util.List;

/**
 * Signal loop cadence and defaults for sessions that omit markets.
 */
public record SchedulerConfig(
    Duration cycleInterval,
    Duration smartDelay,          // Wait before revalidating a candidate signal
    List<String> defaultMarkets,
    Duration learningCacheTtl
) {
    public SchedulerConfig {
        defaultMarkets = List.copyOf(defaultMarkets);
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
            Duration.ofSeconds(3),
            Duration.ofMillis(1500),
            List.of("R_100"),
            Duration.ofSeconds(5)
        );
    }
}
