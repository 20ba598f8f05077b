package in.digitflow.service.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Three-state circuit breaker.
 *
 * CLOSED: calls pass, failures are counted; reaching the threshold opens the breaker.
 * OPEN: calls fail fast until the reset timeout has elapsed.
 * HALF_OPEN: exactly one probe is let through; its success closes, its failure reopens.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failures = 0;
    private Instant openedAt;
    private boolean probeInFlight = false;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    /**
     * Whether a call may proceed now. In HALF_OPEN only the first caller gets the probe.
     */
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(openedAt, clock.instant()).compareTo(resetTimeout) >= 0) {
                    state = State.HALF_OPEN;
                    probeInFlight = true;
                    log.info("[CircuitBreaker:{}] OPEN → HALF_OPEN, probing", name);
                    return true;
                }
                return false;
            case HALF_OPEN:
            default:
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            log.info("[CircuitBreaker:{}] probe succeeded, HALF_OPEN → CLOSED", name);
        }
        state = State.CLOSED;
        failures = 0;
        probeInFlight = false;
        openedAt = null;
    }

    public synchronized void recordFailure() {
        failures++;
        if (state == State.HALF_OPEN) {
            open("probe failed");
        } else if (state == State.CLOSED && failures >= failureThreshold) {
            open(failures + " consecutive failures");
        }
    }

    /**
     * Give back a granted probe that was never used, e.g. when a later check rejected the call.
     */
    public synchronized void releaseProbe() {
        if (state == State.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    public RiskDecision check() {
        return allowRequest()
            ? RiskDecision.allow()
            : RiskDecision.reject(RiskDecision.CIRCUIT_OPEN, name + " open after " + failureThreshold + " failures");
    }

    public synchronized State state() {
        return state;
    }

    public synchronized int failureCount() {
        return failures;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    private void open(String why) {
        state = State.OPEN;
        openedAt = clock.instant();
        probeInFlight = false;
        log.warn("[CircuitBreaker:{}] → OPEN ({}), fail fast for {}s", name, why, resetTimeout.getSeconds());
    }
}
