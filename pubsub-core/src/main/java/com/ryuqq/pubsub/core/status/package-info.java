/**
 * Status notifications surfaced to callers.
 *
 * <p>Statuses are produced by {@code EmitStatus} effects; transient failures show up as
 * {@link com.ryuqq.pubsub.core.status.StatusCategory#RECONNECTING}, exhausted retries as one of the
 * error categories.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.status;
