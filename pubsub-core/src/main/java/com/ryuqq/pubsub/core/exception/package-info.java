/**
 * Failure taxonomy of the real-time engines.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.core.exception.TransportException} - network errors and timeouts, retried per policy</li>
 *   <li>{@link com.ryuqq.pubsub.core.exception.ServerException} - non-2xx responses, retried for 429 and 5xx only</li>
 *   <li>{@link com.ryuqq.pubsub.core.exception.ConfigurationException} - rejected caller input, never reaches an engine</li>
 * </ul>
 *
 * <p>Cancelled effects surface as {@link java.util.concurrent.CancellationException} inside
 * effect handlers and are dropped there; they are never turned into failure events.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.exception;
