package in.digitflow.service.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window trade limiter per key (one key per session).
 * A check that passes also consumes one slot in both windows; check and increment are atomic per key.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;

    private static final class Window {
        long minuteStart;
        int minuteCount;
        long hourStart;
        int hourCount;
    }

    private final int perMinute;
    private final int perHour;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimiter(int perMinute, int perHour, Clock clock) {
        if (perMinute <= 0 || perHour <= 0) {
            throw new IllegalArgumentException("Limits must be positive");
        }
        this.perMinute = perMinute;
        this.perHour = perHour;
        this.clock = clock;
    }

    public RiskDecision tryAcquire(String key) {
        Window window = windows.computeIfAbsent(key, k -> {
            Window w = new Window();
            long now = clock.millis();
            w.minuteStart = now;
            w.hourStart = now;
            return w;
        });

        synchronized (window) {
            long now = clock.millis();
            if (now - window.minuteStart >= MINUTE_MS) {
                window.minuteStart = now;
                window.minuteCount = 0;
            }
            if (now - window.hourStart >= HOUR_MS) {
                window.hourStart = now;
                window.hourCount = 0;
            }

            if (window.minuteCount >= perMinute) {
                log.warn("[RateLimiter] {} hit {}/min", key, perMinute);
                return RiskDecision.reject(RiskDecision.RATE_LIMIT, perMinute + " trades per minute");
            }
            if (window.hourCount >= perHour) {
                log.warn("[RateLimiter] {} hit {}/hour", key, perHour);
                return RiskDecision.reject(RiskDecision.RATE_LIMIT, perHour + " trades per hour");
            }

            window.minuteCount++;
            window.hourCount++;
            return RiskDecision.allow();
        }
    }

    public void reset(String key) {
        windows.remove(key);
    }

    int trackedKeys() {
        return windows.size();
    }
}
