/**
 * Public contract of the real-time client.
 *
 * <p>{@link com.ryuqq.pubsub.application.client.RealtimeClient} translates caller intent into
 * subscription and presence engine events; {@link com.ryuqq.pubsub.application.client.RealtimeListener}
 * receives statuses and deduplicated messages.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.application.client;
