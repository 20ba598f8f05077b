package in.digitflow.service.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global execution pause on a loss streak or repeated venue errors.
 * Once paused, only {@link #resume()} lets trading continue.
 */
public final class SafetyGuards {
    private static final Logger log = LoggerFactory.getLogger(SafetyGuards.class);

    private final int maxConsecutiveLosses;
    private final int apiErrorThreshold;

    private int consecutiveLosses = 0;
    private int apiErrors = 0;
    private String pauseReason = null;

    public SafetyGuards(int maxConsecutiveLosses, int apiErrorThreshold) {
        this.maxConsecutiveLosses = maxConsecutiveLosses;
        this.apiErrorThreshold = apiErrorThreshold;
    }

    /**
     * @return true when this outcome paused execution
     */
    public synchronized boolean recordOutcome(boolean loss) {
        if (!loss) {
            consecutiveLosses = 0;
            return false;
        }
        consecutiveLosses++;
        if (consecutiveLosses >= maxConsecutiveLosses && pauseReason == null) {
            pauseReason = "consecutive_losses";
            log.error("[SafetyGuards] ❌ Pausing execution after {} consecutive losses", consecutiveLosses);
            return true;
        }
        return false;
    }

    /**
     * @return true when this error paused execution
     */
    public synchronized boolean recordApiError() {
        apiErrors++;
        if (apiErrors >= apiErrorThreshold && pauseReason == null) {
            pauseReason = "api_errors";
            log.error("[SafetyGuards] ❌ Pausing execution after {} venue errors", apiErrors);
            return true;
        }
        return false;
    }

    /**
     * Pause for an external reason, e.g. the scheduler's drawdown guard.
     *
     * @return true when this call paused execution
     */
    public synchronized boolean pause(String reason) {
        if (pauseReason != null) {
            return false;
        }
        pauseReason = reason;
        log.error("[SafetyGuards] ❌ Pausing execution: {}", reason);
        return true;
    }

    public synchronized void recordApiSuccess() {
        apiErrors = 0;
    }

    public synchronized void resume() {
        if (pauseReason != null) {
            log.info("[SafetyGuards] ✅ Execution resumed (was paused for {})", pauseReason);
        }
        pauseReason = null;
        consecutiveLosses = 0;
        apiErrors = 0;
    }

    public synchronized boolean isPaused() {
        return pauseReason != null;
    }

    public synchronized String pauseReason() {
        return pauseReason;
    }

    public synchronized int consecutiveLosses() {
        return consecutiveLosses;
    }

    public synchronized int apiErrors() {
        return apiErrors;
    }
}
