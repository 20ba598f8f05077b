package in.digitflow.infrastructure.venue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keepalive for a venue socket.
 *
 * Sends a ping every interval and expects any pong within the timeout; a missed pong
 * reports the connection unhealthy once. Runs on a caller-supplied scheduler, so it can be
 * stopped and started again across reconnects.
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager("TickStream", scheduler, clock,
 *     Duration.ofSeconds(30), Duration.ofSeconds(60),
 *     () -> socket.send(PING),
 *     healthy -> { if (!healthy) socket.close(); });
 * heartbeat.start();
 * // when a ping response arrives:
 * heartbeat.recordPong();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> timeoutTask;
    private final AtomicLong pongs = new AtomicLong();
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String name, ScheduledExecutorService scheduler, Clock clock,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction,
                            Consumer<Boolean> healthCallback) {
        this.name = name;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
    }

    /**
     * Start sending periodic pings. The first ping goes out after one interval.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat already running", name);
            return;
        }

        log.debug("[{}] Starting heartbeat (ping every {}s, timeout {}s)",
            name, pingInterval.getSeconds(), timeout.getSeconds());

        running = true;
        healthy = true;
        lastPongTime = clock.instant();

        pingTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sendPing();
            } catch (Exception e) {
                log.error("[{}] Failed to send ping", name, e);
                markUnhealthy();
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop pinging and cancel the pending timeout check. The scheduler is left running.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }

    /**
     * Record receipt of a pong. Cancels the pending timeout check.
     */
    public synchronized void recordPong() {
        lastPongTime = clock.instant();
        pongs.incrementAndGet();

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        if (!healthy) {
            log.info("[{}] Heartbeat recovered", name);
            healthy = true;
            notifyHealth(true);
        }
    }

    public boolean isHealthy() {
        return healthy && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    private synchronized void sendPing() {
        if (!running) {
            return;
        }
        log.trace("[{}] ping", name);
        pingFunction.run();
        scheduleTimeoutCheck();
    }

    private void scheduleTimeoutCheck() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        // Any pong after this ping answers it
        long pongsAtPing = pongs.get();
        timeoutTask = scheduler.schedule(() -> {
            if (pongs.get() != pongsAtPing) {
                return;
            }
            log.warn("[{}] Heartbeat timeout: no pong for {}s", name, timeout.getSeconds());
            markUnhealthy();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return false;
        }
        return Duration.between(lastPong, clock.instant()).compareTo(timeout.plus(pingInterval)) < 0;
    }

    private synchronized void markUnhealthy() {
        if (!healthy || !running) {
            return;
        }
        healthy = false;
        notifyHealth(false);
    }

    private void notifyHealth(boolean isHealthy) {
        if (healthCallback == null) {
            return;
        }
        try {
            healthCallback.accept(isHealthy);
        } catch (Exception e) {
            log.error("[{}] Health callback threw exception", name, e);
        }
    }
}
