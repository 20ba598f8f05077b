package in.digitflow.infrastructure.venue;

import in.digitflow.config.VenueConfig;
import in.digitflow.domain.session.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Authorized venue connections, one per credential.
 *
 * Handles are opened lazily by {@link #acquire}, kept alive by a periodic ping and closed when
 * idle past the limit with no open contract watches, when their last lease is released, on
 * failure, or at shutdown. Nothing else closes a handle.
 *
 * A handle can also die under its holders (socket dropped, keepalive failed). Contract streams
 * do not survive that; holders learn about it through {@link #onConnectionClosed}.
 */
public final class ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final URI uri;
    private final VenueSocketFactory socketFactory;
    private final Duration authorizeTimeout;
    private final Duration requestTimeout;
    private final Duration maxIdle;
    private final Clock clock;

    private final Map<String, VenueConnection> handles = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> creationLocks = new ConcurrentHashMap<>();
    private final List<Consumer<VenueConnection>> closeListeners = new CopyOnWriteArrayList<>();

    private volatile ScheduledExecutorService scheduler;
    private volatile boolean shutdown = false;

    public ConnectionPool(VenueConfig config, VenueSocketFactory socketFactory, Duration requestTimeout, Clock clock) {
        this.uri = URI.create(config.url());
        this.socketFactory = socketFactory;
        this.authorizeTimeout = config.authorizeTimeout();
        this.requestTimeout = requestTimeout;
        this.maxIdle = config.maxIdle();
        this.clock = clock;
    }

    /**
     * Start keepalive pings and idle reaping.
     */
    public synchronized void start(Duration pingInterval, Duration reapInterval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "venue-pool");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                keepalive();
            } catch (Exception e) {
                log.error("[ConnectionPool] Keepalive failed", e);
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(() -> {
            try {
                reapIdle();
            } catch (Exception e) {
                log.error("[ConnectionPool] Idle reaping failed", e);
            }
        }, reapInterval.toMillis(), reapInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[ConnectionPool] Started (ping {}s, reap {}s, max idle {}s)",
            pingInterval.toSeconds(), reapInterval.toSeconds(), maxIdle.toSeconds());
    }

    /**
     * Notify the listener whenever an authorized handle closes, for any reason.
     * Called on the thread that observed the close; listeners must not block.
     */
    public void onConnectionClosed(Consumer<VenueConnection> listener) {
        closeListeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // ACQUIRE / RELEASE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Get the authorized connection for a credential, opening it if needed.
     * Blocks until the venue answers {@code authorize} or the authorize timeout elapses.
     *
     * @param accountId  venue account the caller trades on
     * @param leaseOwner who holds the connection (a session id)
     * @throws VenueAuthorizationException the venue rejected the token
     * @throws VenueConnectionException    the socket could not be opened or authorize timed out
     */
    public VenueConnection acquire(Credential credential, String accountId, String leaseOwner) {
        if (shutdown) {
            throw new VenueConnectionException(credential.ref(), "pool is shut down");
        }
        String ref = credential.ref();

        VenueConnection existing = handles.get(ref);
        if (existing != null && existing.isAlive()) {
            return lease(existing, accountId, leaseOwner);
        }

        ReentrantLock lock = creationLocks.computeIfAbsent(ref, k -> new ReentrantLock());
        lock.lock();
        try {
            existing = handles.get(ref);
            if (existing != null) {
                if (existing.isAlive()) {
                    return lease(existing, accountId, leaseOwner);
                }
                handles.remove(ref, existing);
                existing.close();
            }
            VenueConnection conn = open(credential);
            handles.put(ref, conn);
            log.info("[ConnectionPool] ✅ {} authorized as {} ({} handle(s))", ref, conn.loginId(), handles.size());
            return lease(conn, accountId, leaseOwner);
        } finally {
            lock.unlock();
        }
    }

    private VenueConnection lease(VenueConnection conn, String accountId, String leaseOwner) {
        conn.authorized(conn.loginId(), accountId);
        if (leaseOwner != null) {
            conn.addLease(leaseOwner);
        }
        return conn;
    }

    private VenueConnection open(Credential credential) {
        String ref = credential.ref();
        VenueConnection conn = new VenueConnection(ref, requestTimeout, clock);

        VenueSocket socket;
        try {
            socket = socketFactory.open(uri, conn.listener()).get(authorizeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueConnectionException(ref, "interrupted while connecting", e);
        } catch (ExecutionException e) {
            throw new VenueConnectionException(ref, "connect failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new VenueConnectionException(ref, "connect timed out after " + authorizeTimeout.toSeconds() + "s");
        }
        conn.attach(socket);

        VenueMessage response;
        try {
            response = conn.request(VenueProtocol.authorize(credential.token()))
                .get(authorizeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            conn.close();
            throw new VenueConnectionException(ref, "interrupted while authorizing", e);
        } catch (ExecutionException e) {
            conn.close();
            Throwable cause = e.getCause();
            if (cause instanceof VenueRequestException) {
                VenueRequestException rejected = (VenueRequestException) cause;
                log.error("[ConnectionPool] ❌ {} rejected: {}", ref, rejected.getErrorCode());
                throw new VenueAuthorizationException(ref, rejected.getErrorCode(), rejected.getMessage());
            }
            if (cause instanceof TimeoutException) {
                throw new VenueConnectionException(ref, "authorize timed out after " + authorizeTimeout.toSeconds() + "s");
            }
            throw new VenueConnectionException(ref, "authorize failed", cause);
        } catch (TimeoutException e) {
            conn.close();
            throw new VenueConnectionException(ref, "authorize timed out after " + authorizeTimeout.toSeconds() + "s");
        }

        conn.authorized(response.payload().path("loginid").asText(null), null);
        conn.onClose(closed -> {
            if (handles.remove(closed.credentialRef(), closed)) {
                log.info("[ConnectionPool] {} removed ({} handle(s) left)", closed.credentialRef(), handles.size());
            }
            for (Consumer<VenueConnection> listener : closeListeners) {
                listener.accept(closed);
            }
        });
        return conn;
    }

    /**
     * Drop one lease. The handle is closed when no leases and no contract watches remain.
     */
    public void release(String credentialRef, String leaseOwner) {
        VenueConnection conn = handles.get(credentialRef);
        if (conn == null) {
            return;
        }
        conn.removeLease(leaseOwner);
        closeIfUnused(conn, "last lease released");
    }

    /**
     * Drop every lease held by the owner, e.g. when its session stops.
     */
    public void releaseAll(String leaseOwner) {
        for (VenueConnection conn : List.copyOf(handles.values())) {
            if (conn.removeLease(leaseOwner)) {
                closeIfUnused(conn, "last lease released");
            }
        }
    }

    private void closeIfUnused(VenueConnection conn, String reason) {
        if (conn.leases().isEmpty() && conn.watchedContracts() == 0) {
            log.info("[ConnectionPool] Closing {}: {}", conn.credentialRef(), reason);
            evict(conn);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // MAINTENANCE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Ping every handle. A handle whose ping fails at the transport level is closed.
     */
    public void keepalive() {
        for (VenueConnection conn : List.copyOf(handles.values())) {
            if (!conn.isAlive()) {
                evict(conn);
                continue;
            }
            conn.ping().whenComplete((pong, err) -> {
                if (err != null && !(err instanceof VenueRequestException)) {
                    log.warn("[ConnectionPool] {} keepalive failed: {}", conn.credentialRef(), err.getMessage());
                    evict(conn);
                }
            });
        }
    }

    /**
     * Close handles unused for longer than the idle limit that are not watching any contract.
     *
     * @return number of handles closed
     */
    public int reapIdle() {
        Instant now = clock.instant();
        List<VenueConnection> reaped = new ArrayList<>();
        for (VenueConnection conn : List.copyOf(handles.values())) {
            if (!conn.isAlive()) {
                reaped.add(conn);
                continue;
            }
            Duration idle = Duration.between(conn.lastUsedAt(), now);
            if (idle.compareTo(maxIdle) > 0 && conn.watchedContracts() == 0) {
                log.info("[ConnectionPool] Reaping {} (idle {}s)", conn.credentialRef(), idle.toSeconds());
                reaped.add(conn);
            }
        }
        reaped.forEach(this::evict);
        return reaped.size();
    }

    private void evict(VenueConnection conn) {
        handles.remove(conn.credentialRef(), conn);
        conn.close();
    }

    public void shutdown() {
        shutdown = true;
        ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdownNow();
        }
        for (VenueConnection conn : List.copyOf(handles.values())) {
            evict(conn);
        }
        log.info("[ConnectionPool] Shut down");
    }

    // ═══════════════════════════════════════════════════════════════
    // STATE
    // ═══════════════════════════════════════════════════════════════

    public int size() {
        return handles.size();
    }

    public VenueConnection get(String credentialRef) {
        return handles.get(credentialRef);
    }
}
