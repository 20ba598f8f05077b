package in.digitflow.infrastructure.venue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * A pooled, authorized connection for one credential.
 *
 * Every inbound frame passes through {@link #dispatch(String)}: responses go to the request
 * correlator by {@code req_id}, contract updates go to the handler registered for their
 * contract id, anything else is ignored. Only {@link ConnectionPool} opens or closes it.
 */
public final class VenueConnection {
    private static final Logger log = LoggerFactory.getLogger(VenueConnection.class);

    private final String credentialRef;
    private final Duration requestTimeout;
    private final Clock clock;

    private final RequestCorrelator correlator = new RequestCorrelator();
    private final Set<String> authorizedAccounts = ConcurrentHashMap.newKeySet();
    private final Set<String> leases = ConcurrentHashMap.newKeySet();
    private final Map<String, Consumer<ContractUpdate>> contractHandlers = new ConcurrentHashMap<>();
    private final Map<String, String> contractSubscriptions = new ConcurrentHashMap<>();
    private final List<Consumer<VenueConnection>> closeListeners = new CopyOnWriteArrayList<>();

    private volatile VenueSocket socket;
    private volatile Instant lastUsedAt;
    private volatile boolean closed = false;
    private volatile String loginId;

    VenueConnection(String credentialRef, Duration requestTimeout, Clock clock) {
        this.credentialRef = credentialRef;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.lastUsedAt = clock.instant();
    }

    // ═══════════════════════════════════════════════════════════════
    // REQUESTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Send a request and complete with its response. Venue errors complete exceptionally
     * with {@link VenueRequestException}; transport problems with {@link VenueConnectionException}.
     */
    public CompletableFuture<VenueMessage> request(ObjectNode frame) {
        touch();
        return send(frame);
    }

    /**
     * Blocking form of {@link #request}, bounded by the request timeout.
     */
    public VenueMessage call(ObjectNode frame) {
        try {
            return request(frame).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueConnectionException(credentialRef, "interrupted waiting for " + firstField(frame), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VenueRequestException) {
                throw (VenueRequestException) cause;
            }
            if (cause instanceof VenueConnectionException) {
                throw (VenueConnectionException) cause;
            }
            if (cause instanceof TimeoutException) {
                throw new VenueConnectionException(credentialRef, firstField(frame) + " timed out after " + requestTimeout.toSeconds() + "s");
            }
            throw new VenueConnectionException(credentialRef, firstField(frame) + " failed", cause);
        }
    }

    /**
     * Keepalive ping. Does not count as use for idle eviction.
     */
    CompletableFuture<VenueMessage> ping() {
        return send(VenueProtocol.ping());
    }

    private CompletableFuture<VenueMessage> send(ObjectNode frame) {
        VenueSocket s = socket;
        if (closed || s == null) {
            return CompletableFuture.failedFuture(new VenueConnectionException(credentialRef, "connection closed"));
        }
        int reqId = correlator.nextId();
        frame.put("req_id", reqId);
        CompletableFuture<VenueMessage> response = correlator.register(reqId, requestTimeout);
        s.send(VenueProtocol.encode(frame)).whenComplete((ok, err) -> {
            if (err != null) {
                response.completeExceptionally(new VenueConnectionException(credentialRef, "send failed", err));
            }
        });
        return response;
    }

    // ═══════════════════════════════════════════════════════════════
    // CONTRACT STREAMS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Subscribe to a contract's updates. The handler is registered before the request goes out,
     * so the first update cannot be missed; it also receives the initial snapshot.
     *
     * @return the initial response
     */
    public VenueMessage watchContract(String contractId, Consumer<ContractUpdate> handler) {
        contractHandlers.put(contractId, handler);
        try {
            VenueMessage first = call(VenueProtocol.watchContract(contractId));
            if (first.subscriptionId() != null) {
                contractSubscriptions.put(contractId, first.subscriptionId());
            }
            return first;
        } catch (RuntimeException e) {
            contractHandlers.remove(contractId);
            throw e;
        }
    }

    /**
     * Stop a contract's stream with a targeted forget. Other contracts on this connection are unaffected.
     */
    public void unwatchContract(String contractId) {
        contractHandlers.remove(contractId);
        String subscriptionId = contractSubscriptions.remove(contractId);
        if (subscriptionId == null || closed) {
            return;
        }
        request(VenueProtocol.forget(subscriptionId)).whenComplete((r, err) -> {
            if (err != null) {
                log.debug("[VenueConnection:{}] forget {} failed: {}", credentialRef, subscriptionId, err.getMessage());
            }
        });
    }

    public boolean isWatching(String contractId) {
        return contractHandlers.containsKey(contractId);
    }

    public int watchedContracts() {
        return contractHandlers.size();
    }

    public String subscriptionFor(String contractId) {
        return contractSubscriptions.get(contractId);
    }

    // ═══════════════════════════════════════════════════════════════
    // READ LOOP
    // ═══════════════════════════════════════════════════════════════

    void dispatch(String raw) {
        VenueMessage message;
        try {
            message = VenueProtocol.parse(raw);
        } catch (MalformedFrameException e) {
            log.warn("[VenueConnection:{}] Dropped frame: {}", credentialRef, e.getMessage());
            return;
        }

        boolean answered = correlator.complete(message);
        if ("ping".equals(message.msgType())) {
            return;
        }
        touch();

        if ("proposal_open_contract".equals(message.msgType()) && !message.isError()) {
            ContractUpdate update = VenueProtocol.contractUpdate(message);
            if (update == null) {
                return;
            }
            Consumer<ContractUpdate> handler = contractHandlers.get(update.contractId());
            if (handler == null) {
                log.debug("[VenueConnection:{}] Update for unwatched contract {}", credentialRef, update.contractId());
                return;
            }
            if (message.subscriptionId() != null) {
                contractSubscriptions.putIfAbsent(update.contractId(), message.subscriptionId());
            }
            try {
                handler.accept(update);
            } catch (RuntimeException e) {
                log.error("[VenueConnection:{}] Contract handler for {} failed", credentialRef, update.contractId(), e);
            }
            return;
        }

        if (!answered) {
            log.debug("[VenueConnection:{}] Ignoring unmatched {} (req_id {})", credentialRef, message.msgType(), message.reqId());
        }
    }

    VenueSocketListener listener() {
        return new VenueSocketListener() {
            @Override
            public void onMessage(String text) {
                dispatch(text);
            }

            @Override
            public void onClosed(int statusCode, String reason) {
                markClosed("closed " + statusCode + " " + reason);
            }

            @Override
            public void onError(Throwable error) {
                markClosed("error " + error.getMessage());
            }
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE (pool only)
    // ═══════════════════════════════════════════════════════════════

    void attach(VenueSocket socket) {
        this.socket = socket;
    }

    void authorized(String loginId, String accountId) {
        this.loginId = loginId;
        if (accountId != null) {
            authorizedAccounts.add(accountId);
        }
    }

    void addLease(String owner) {
        leases.add(owner);
    }

    boolean removeLease(String owner) {
        return leases.remove(owner);
    }

    void onClose(Consumer<VenueConnection> listener) {
        closeListeners.add(listener);
    }

    void close() {
        VenueSocket s = socket;
        markClosed("closed by pool");
        if (s != null) {
            s.close();
        }
    }

    private void markClosed(String reason) {
        if (closed) {
            return;
        }
        closed = true;
        log.info("[VenueConnection:{}] Closed: {}", credentialRef, reason);
        correlator.failAll(new VenueConnectionException(credentialRef, "connection " + reason));
        for (Consumer<VenueConnection> listener : closeListeners) {
            try {
                listener.accept(this);
            } catch (Exception e) {
                log.error("[VenueConnection:{}] Close listener failed", credentialRef, e);
            }
        }
    }

    private void touch() {
        lastUsedAt = clock.instant();
    }

    private static String firstField(ObjectNode frame) {
        return frame.fieldNames().hasNext() ? frame.fieldNames().next() : "request";
    }

    // ═══════════════════════════════════════════════════════════════
    // STATE
    // ═══════════════════════════════════════════════════════════════

    public String credentialRef() {
        return credentialRef;
    }

    public boolean isAlive() {
        VenueSocket s = socket;
        return !closed && s != null && s.isOpen();
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    public String loginId() {
        return loginId;
    }

    public Set<String> authorizedAccounts() {
        return Set.copyOf(authorizedAccounts);
    }

    public Set<String> leases() {
        return Set.copyOf(leases);
    }

    int pendingRequests() {
        return correlator.pendingCount();
    }
}
