package com.ryuqq.pubsub.adapter.inmemory.transport;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.spi.RequestKind;
import com.ryuqq.pubsub.core.spi.Transport;
import com.ryuqq.pubsub.core.spi.TransportRequest;
import com.ryuqq.pubsub.core.spi.TransportResponse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory implementation of {@link Transport} SPI for testing and reference purposes.
 *
 * <p>Responses are scripted per {@link RequestKind}. A request either consumes the
 * oldest scripted outcome of its kind or stays pending, like a long-poll waiting for
 * data, until {@link #respond} or {@link #fail} completes it.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Scripted outcomes:</strong> EnumMap&lt;RequestKind, Deque&lt;Outcome&gt;&gt; - answers for future requests</li>
 *   <li><strong>Pending calls:</strong> EnumMap&lt;RequestKind, Deque&lt;PendingCall&gt;&gt; - requests waiting for an answer</li>
 *   <li><strong>Cancellation counters:</strong> EnumMap&lt;RequestKind, Integer&gt; - a cancelled call leaves the pending
 *       queue immediately and is only counted</li>
 *   <li><strong>Request log:</strong> every request in arrival order, for assertions</li>
 * </ul>
 *
 * <p><strong>Defaults:</strong></p>
 * <ul>
 *   <li>Unscripted {@link RequestKind#LEAVE} requests complete with 200 immediately</li>
 *   <li>Every other unscripted request stays pending</li>
 *   <li>Cancelled pending calls are never completed</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTransport transport = new InMemoryTransport();
 *
 * // answer the next handshake immediately
 * transport.respond(RequestKind.HANDSHAKE, TransportResponse.ok(new Cursor("15000000000000000", 4)));
 *
 * // later: complete the pending receive long-poll
 * transport.respond(RequestKind.RECEIVE, TransportResponse.ok(next, messages));
 * </pre>
 *
 * <p>All methods are thread-safe. Futures are completed outside the internal lock.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public class InMemoryTransport implements Transport {

    private final Map<RequestKind, Deque<Outcome>> scripted = new EnumMap<>(RequestKind.class);
    private final Map<RequestKind, Deque<PendingCall>> pending = new EnumMap<>(RequestKind.class);
    private final Map<RequestKind, Integer> cancelled = new EnumMap<>(RequestKind.class);
    private final List<TransportRequest> requests = new ArrayList<>();

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Records the request before answering</li>
     *   <li>Returns an already completed future when an outcome is scripted</li>
     * </ul>
     */
    @Override
    public CompletableFuture<TransportResponse> execute(TransportRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Outcome outcome;
        CompletableFuture<TransportResponse> future = new CompletableFuture<>();
        synchronized (this) {
            requests.add(request);
            outcome = queue(scripted, request.kind()).poll();
            if (outcome == null && request.kind() == RequestKind.LEAVE) {
                outcome = new Outcome(TransportResponse.ok(), null);
            }
            if (outcome == null) {
                PendingCall call = new PendingCall(request, future);
                queue(pending, request.kind()).add(call);
                future.whenComplete((response, error) -> {
                    if (future.isCancelled()) {
                        onCancelled(call);
                    }
                });
                return future;
            }
        }
        outcome.complete(future);
        return future;
    }

    /**
     * Answers the oldest pending request of the kind, or scripts the answer for the next one.
     *
     * @param kind request kind
     * @param response response to deliver
     * @throws IllegalArgumentException if kind or response is null
     */
    public void respond(RequestKind kind, TransportResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        settle(kind, new Outcome(response, null));
    }

    /**
     * Fails the oldest pending request of the kind, or scripts the failure for the next one.
     *
     * @param kind request kind
     * @param error failure to deliver
     * @throws IllegalArgumentException if kind or error is null
     */
    public void fail(RequestKind kind, PubSubException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        settle(kind, new Outcome(null, error));
    }

    /**
     * Returns all requests received so far in arrival order.
     *
     * @return snapshot of the request log
     */
    public synchronized List<TransportRequest> requests() {
        return List.copyOf(requests);
    }

    /**
     * Returns the requests of one kind in arrival order.
     *
     * @param kind request kind
     * @return snapshot of matching requests
     */
    public synchronized List<TransportRequest> requests(RequestKind kind) {
        List<TransportRequest> matching = new ArrayList<>();
        for (TransportRequest request : requests) {
            if (request.kind() == kind) {
                matching.add(request);
            }
        }
        return matching;
    }

    /**
     * Counts pending requests of the kind that are still waiting (not cancelled, not completed).
     *
     * @param kind request kind
     * @return number of waiting requests
     */
    public synchronized int pendingCount(RequestKind kind) {
        int count = 0;
        for (PendingCall call : queue(pending, kind)) {
            if (!call.future().isDone()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts requests of the kind that the caller cancelled while pending, since the last {@link #reset()}.
     *
     * @param kind request kind
     * @return number of cancelled requests
     */
    public synchronized int cancelledCount(RequestKind kind) {
        return cancelled.getOrDefault(kind, 0);
    }

    /**
     * Clears scripted outcomes, pending calls, cancellation counters and the request log.
     *
     * <p>Pending futures are left incomplete.</p>
     */
    public synchronized void reset() {
        scripted.clear();
        pending.clear();
        cancelled.clear();
        requests.clear();
    }

    private void settle(RequestKind kind, Outcome outcome) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        PendingCall target = null;
        synchronized (this) {
            for (PendingCall call : queue(pending, kind)) {
                if (!call.future().isDone()) {
                    target = call;
                    break;
                }
            }
            if (target == null) {
                queue(scripted, kind).add(outcome);
                return;
            }
            queue(pending, kind).remove(target);
        }
        outcome.complete(target.future());
    }

    private synchronized void onCancelled(PendingCall call) {
        if (queue(pending, call.request().kind()).remove(call)) {
            cancelled.merge(call.request().kind(), 1, Integer::sum);
        }
    }

    private static <T> Deque<T> queue(Map<RequestKind, Deque<T>> byKind, RequestKind kind) {
        return byKind.computeIfAbsent(kind, k -> new ArrayDeque<>());
    }

    /**
     * Scripted answer: exactly one of response or error is set.
     */
    private record Outcome(TransportResponse response, PubSubException error) {

        void complete(CompletableFuture<TransportResponse> future) {
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(response);
            }
        }
    }

    private record PendingCall(TransportRequest request, CompletableFuture<TransportResponse> future) {
    }
}
