package in.digitflow.infrastructure.venue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Matches responses to outstanding requests by {@code req_id}.
 * A response for an unknown or already answered id is reported as unmatched and ignored.
 */
final class RequestCorrelator {

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<VenueMessage>> pending = new ConcurrentHashMap<>();

    int nextId() {
        return nextId.getAndIncrement();
    }

    CompletableFuture<VenueMessage> register(int reqId, Duration timeout) {
        CompletableFuture<VenueMessage> future = new CompletableFuture<>();
        pending.put(reqId, future);
        future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((r, e) -> pending.remove(reqId));
        return future;
    }

    /**
     * @return true if the message answered a pending request
     */
    boolean complete(VenueMessage message) {
        if (message.reqId() == null) {
            return false;
        }
        CompletableFuture<VenueMessage> future = pending.remove(message.reqId());
        if (future == null) {
            return false;
        }
        if (message.isError()) {
            future.completeExceptionally(new VenueRequestException(message.msgType(), message.errorCode(), message.errorMessage()));
        } else {
            future.complete(message);
        }
        return true;
    }

    void failAll(Throwable cause) {
        List<CompletableFuture<VenueMessage>> outstanding = new ArrayList<>(pending.values());
        pending.clear();
        outstanding.forEach(f -> f.completeExceptionally(cause));
    }

    int pendingCount() {
        return pending.size();
    }
}
