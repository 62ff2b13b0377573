/**
 * Retry policies for failed subscribe and presence requests.
 *
 * <p>A policy is a pure function from (attempt, endpoint) to a
 * {@link com.ryuqq.pubsub.core.retry.RetryDecision}. Attempt counters live in engine contexts and
 * are scoped to a single failure streak.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RetryPolicy policy = RetryPolicy.exponential(2000, 150000, 6, Endpoint.PRESENCE);
 * RetryDecision decision = policy.shouldRetry(1, Endpoint.SUBSCRIBE);
 * if (decision.retry()) {
 *     schedule(decision.delayMs());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.retry;
