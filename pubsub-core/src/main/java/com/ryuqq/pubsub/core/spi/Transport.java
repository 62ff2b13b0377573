package com.ryuqq.pubsub.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Transport SPI used by the real-time engines.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Non-blocking: {@code execute} returns immediately with a pending future</li>
 *   <li>Server answers (any status code) complete the future normally with a {@link TransportResponse}</li>
 *   <li>Network failures and timeouts complete the future exceptionally with
 *       {@link com.ryuqq.pubsub.core.exception.TransportException}</li>
 *   <li>Cancelling the future ({@code cancel(true)}) should abort the in-flight call;
 *       a call that keeps running has its result discarded by the caller</li>
 *   <li>Thread-safe: several requests may be in flight at the same time</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CompletableFuture&lt;TransportResponse&gt; call = transport.execute(
 *     TransportRequest.handshake(channels, groups, null, "user-1"));
 *
 * call.whenComplete((response, error) -&gt; { ... });
 *
 * // abort when the effect is cancelled
 * call.cancel(true);
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Sends a request.
     *
     * @param request request descriptor
     * @return future completed with the server response, or exceptionally on network failure
     * @throws IllegalArgumentException if request is null
     */
    CompletableFuture<TransportResponse> execute(TransportRequest request);
}
