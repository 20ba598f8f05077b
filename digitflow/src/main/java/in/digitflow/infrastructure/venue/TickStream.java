package in.digitflow.infrastructure.venue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.digitflow.config.VenueConfig;
import in.digitflow.domain.data.Tick;
import in.digitflow.domain.data.TickHistory;
import in.digitflow.domain.data.TickWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Public tick feed: one socket, many market subscriptions, a bounded window per market.
 *
 * On open the stream authorizes (when a token was given), re-subscribes every wanted market
 * and starts the keepalive. On close it reconnects after attempt × base delay; once the
 * policy is exhausted the unavailable listeners fire and the stream stops retrying.
 * Malformed frames are counted, logged and dropped.
 */
public final class TickStream {
    private static final Logger log = LoggerFactory.getLogger(TickStream.class);

    public record Stats(
        boolean connected,
        boolean unavailable,
        Set<String> markets,
        long ticksReceived,
        long malformedFrames,
        int reconnectAttempts
    ) {}

    private final URI uri;
    private final VenueSocketFactory socketFactory;
    private final ReconnectionPolicy policy;
    private final Duration pingInterval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Set<String> wantedMarkets = ConcurrentHashMap.newKeySet();
    private final Map<String, TickWindow> windows = new ConcurrentHashMap<>();
    private final Map<String, String> subscriptionIds = new ConcurrentHashMap<>();
    private final List<Runnable> unavailableListeners = new CopyOnWriteArrayList<>();

    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicLong ticksReceived = new AtomicLong();
    private final AtomicLong malformedFrames = new AtomicLong();

    private volatile VenueSocket socket;
    private volatile HeartbeatManager heartbeat;
    private volatile String token;
    private volatile boolean connected = false;
    private volatile boolean closing = false;
    private volatile boolean unavailable = false;

    public TickStream(String url, VenueSocketFactory socketFactory, ReconnectionPolicy policy, Duration pingInterval,
                      Clock clock) {
        this.uri = URI.create(url);
        this.clock = clock;
        this.socketFactory = socketFactory;
        this.policy = policy;
        this.pingInterval = pingInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tick-stream");
            t.setDaemon(true);
            return t;
        });
    }

    public static TickStream create(VenueConfig config, VenueSocketFactory socketFactory, Clock clock) {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .baseDelay(config.reconnectBaseDelay())
            .maxDelay(config.reconnectBaseDelay().multipliedBy(config.maxReconnectAttempts()))
            .maxAttempts(config.maxReconnectAttempts())
            .build();
        return new TickStream(config.url(), socketFactory, policy, config.pingInterval(), clock);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public void connect() {
        connect(null);
    }

    /**
     * Open the feed. Returns immediately; failures go through the reconnect policy.
     *
     * @param token optional API token to authorize the feed with
     */
    public void connect(String token) {
        this.token = token;
        this.closing = false;
        this.unavailable = false;
        policy.reset();
        open();
    }

    public void disconnect() {
        closing = true;
        connected = false;
        generation.incrementAndGet();
        stopHeartbeat();
        VenueSocket s = socket;
        socket = null;
        if (s != null) {
            s.close();
        }
        subscriptionIds.clear();
        log.info("[TickStream] Disconnected");
    }

    /**
     * Disconnect and release the stream's scheduler. The stream cannot be reconnected afterwards.
     */
    public void shutdown() {
        disconnect();
        scheduler.shutdownNow();
    }

    public boolean isConnected() {
        return connected;
    }

    public void onUnavailable(Runnable listener) {
        unavailableListeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ═══════════════════════════════════════════════════════════════

    public void subscribe(String market) {
        windows.computeIfAbsent(market, TickWindow::new);
        if (wantedMarkets.add(market)) {
            log.info("[TickStream] Subscribing {}", market);
            if (connected) {
                send(VenueProtocol.ticks(market));
            }
        }
    }

    /**
     * Stop the market's stream with a targeted forget of its subscription id.
     */
    public void unsubscribe(String market) {
        if (!wantedMarkets.remove(market)) {
            return;
        }
        String subscriptionId = subscriptionIds.remove(market);
        if (subscriptionId != null && connected) {
            send(VenueProtocol.forget(subscriptionId));
        }
        TickWindow window = windows.remove(market);
        if (window != null) {
            window.clear();
        }
        log.info("[TickStream] Unsubscribed {} (subscription {})", market, subscriptionId);
    }

    public TickHistory latestHistory(String market) {
        TickWindow window = windows.get(market);
        return window == null ? TickHistory.empty(market) : window.snapshot();
    }

    public String subscriptionId(String market) {
        return subscriptionIds.get(market);
    }

    public Stats stats() {
        return new Stats(connected, unavailable, Set.copyOf(wantedMarkets), ticksReceived.get(),
            malformedFrames.get(), policy.getAttemptCount());
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION HANDLING
    // ═══════════════════════════════════════════════════════════════

    private void open() {
        int gen = generation.incrementAndGet();
        log.info("[TickStream] Connecting to {} (attempt {})", uri.getHost(), policy.getAttemptCount() + 1);
        try {
            socketFactory.open(uri, new Listener(gen)).whenComplete((s, err) -> {
                if (err != null) {
                    log.warn("[TickStream] Connect failed: {}", err.getMessage());
                    handleDisconnect(gen, "connect failed");
                    return;
                }
                onOpen(gen, s);
            });
        } catch (RuntimeException e) {
            log.warn("[TickStream] Connect failed: {}", e.getMessage());
            handleDisconnect(gen, "connect failed");
        }
    }

    private void onOpen(int gen, VenueSocket s) {
        if (gen != generation.get() || closing) {
            s.close();
            return;
        }
        socket = s;
        connected = true;
        policy.recordSuccess();
        log.info("[TickStream] ✅ Connected, {} market(s) to subscribe", wantedMarkets.size());

        if (token != null) {
            send(VenueProtocol.authorize(token));
        }
        for (String market : wantedMarkets) {
            send(VenueProtocol.ticks(market));
        }

        HeartbeatManager hb = new HeartbeatManager("TickStream", scheduler, clock, pingInterval,
            pingInterval.multipliedBy(2), () -> send(VenueProtocol.ping()), healthy -> {
                if (!healthy) {
                    log.warn("[TickStream] Keepalive lost, recycling socket");
                    VenueSocket current = socket;
                    if (current != null) {
                        current.close();
                    }
                    handleDisconnect(gen, "keepalive timeout");
                }
            });
        heartbeat = hb;
        hb.start();
    }

    private void handleDisconnect(int gen, String reason) {
        if (gen != generation.get()) {
            return;
        }
        connected = false;
        socket = null;
        subscriptionIds.clear();
        stopHeartbeat();
        if (closing) {
            return;
        }
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason) {
        if (!policy.shouldRetry()) {
            unavailable = true;
            log.error("[TickStream] ❌ Giving up after {} reconnect attempts ({})", policy.getAttemptCount(), reason);
            for (Runnable listener : unavailableListeners) {
                try {
                    listener.run();
                } catch (Exception e) {
                    log.error("[TickStream] Unavailable listener failed", e);
                }
            }
            return;
        }
        policy.recordFailure();
        Duration delay = policy.getNextDelay();
        log.warn("[TickStream] {}; reconnect attempt {}/{} in {}ms",
            reason, policy.getAttemptCount(), policy.getMaxAttempts(), delay.toMillis());
        // Bump the generation so a late callback from the dead socket cannot schedule a second retry
        generation.incrementAndGet();
        try {
            scheduler.schedule(this::open, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("[TickStream] Reconnect not scheduled: {}", e.getMessage());
        }
    }

    private void stopHeartbeat() {
        HeartbeatManager hb = heartbeat;
        heartbeat = null;
        if (hb != null) {
            hb.stop();
        }
    }

    private void send(ObjectNode frame) {
        VenueSocket s = socket;
        if (s == null) {
            return;
        }
        s.send(VenueProtocol.encode(frame)).whenComplete((ok, err) -> {
            if (err != null) {
                log.warn("[TickStream] Send failed: {}", err.getMessage());
            }
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // READ LOOP
    // ═══════════════════════════════════════════════════════════════

    void handleFrame(String raw) {
        VenueMessage message;
        try {
            message = VenueProtocol.parse(raw);
        } catch (MalformedFrameException e) {
            malformedFrames.incrementAndGet();
            log.warn("[TickStream] Dropped frame: {}", e.getMessage());
            return;
        }

        if (message.isError()) {
            String market = message.body().path("echo_req").path("ticks").asText(null);
            if (market != null) {
                log.warn("[TickStream] Subscription to {} rejected: {} {}", market, message.errorCode(), message.errorMessage());
            } else {
                log.warn("[TickStream] Venue error on {}: {} {}", message.msgType(), message.errorCode(), message.errorMessage());
            }
            return;
        }

        switch (message.msgType()) {
            case "tick" -> onTick(message);
            case "ping" -> {
                HeartbeatManager hb = heartbeat;
                if (hb != null) {
                    hb.recordPong();
                }
            }
            case "authorize" -> log.info("[TickStream] Feed authorized as {}",
                message.payload().path("loginid").asText("?"));
            case "forget" -> log.debug("[TickStream] Forget acknowledged: {}", message.payload().asText());
            default -> log.debug("[TickStream] Ignoring {}", message.msgType());
        }
    }

    private void onTick(VenueMessage message) {
        Tick tick;
        try {
            tick = VenueProtocol.tick(message);
        } catch (MalformedFrameException e) {
            malformedFrames.incrementAndGet();
            log.warn("[TickStream] Dropped tick: {}", e.getMessage());
            return;
        }
        if (!wantedMarkets.contains(tick.market())) {
            return;
        }
        if (message.subscriptionId() != null && subscriptionIds.putIfAbsent(tick.market(), message.subscriptionId()) == null) {
            log.info("[TickStream] {} subscribed (id {})", tick.market(), message.subscriptionId());
        }
        TickWindow window = windows.get(tick.market());
        if (window != null) {
            window.add(tick);
            ticksReceived.incrementAndGet();
        }
    }

    private final class Listener implements VenueSocketListener {
        private final int gen;

        Listener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onMessage(String text) {
            if (gen == generation.get()) {
                handleFrame(text);
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            log.warn("[TickStream] Socket closed: {} {}", statusCode, reason);
            handleDisconnect(gen, "closed " + statusCode);
        }

        @Override
        public void onError(Throwable error) {
            log.warn("[TickStream] Socket error: {}", error.getMessage());
            handleDisconnect(gen, "error");
        }
    }
}
