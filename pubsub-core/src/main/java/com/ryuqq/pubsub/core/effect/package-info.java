/**
 * Effect model and the dispatch/cancellation protocol.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.core.effect.Effect} - sealed description of an asynchronous action</li>
 *   <li>{@link com.ryuqq.pubsub.core.effect.EffectChannel} - mutual-exclusion tag of an effect</li>
 *   <li>{@link com.ryuqq.pubsub.core.effect.EffectDispatcher} - one active handle per channel</li>
 *   <li>{@link com.ryuqq.pubsub.core.effect.EffectHandler} - executes effects against the transport and timers</li>
 *   <li>{@link com.ryuqq.pubsub.core.effect.EventSink} - receives result events, drops those of cancelled handles</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.effect;
