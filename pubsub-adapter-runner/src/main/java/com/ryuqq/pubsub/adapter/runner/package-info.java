/**
 * Runtime wiring of the real-time client.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.adapter.runner.DefaultRealtimeClient} - owns both engines and their lanes</li>
 *   <li>{@link com.ryuqq.pubsub.adapter.runner.SubscribeEffectHandler} - handshake, receive, retry timer, message delivery</li>
 *   <li>{@link com.ryuqq.pubsub.adapter.runner.PresenceEffectHandler} - heartbeat, leave, cooldown timer</li>
 *   <li>{@link com.ryuqq.pubsub.adapter.runner.RealtimeConfig} - immutable client configuration</li>
 *   <li>{@link com.ryuqq.pubsub.adapter.runner.ListenerRegistry} - listener fan-out</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <pre>
 * caller thread     ─send──→ engine lane (single thread) ─dispatch──→ transport / timer
 * transport / timer ─deliver→ engine lane
 * listeners are called on the engine lane
 * </pre>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.adapter.runner;
