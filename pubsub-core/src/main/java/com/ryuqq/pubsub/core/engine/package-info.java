/**
 * Generic event-engine runtime shared by the subscription and presence engines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.core.engine.EventEngine} - sequential event processing on a serial lane</li>
 *   <li>{@link com.ryuqq.pubsub.core.engine.TransitionTable} - explicit (state, event type) → handler map</li>
 *   <li>{@link com.ryuqq.pubsub.core.engine.Transition} - next state, new context, emitted effects</li>
 *   <li>{@link com.ryuqq.pubsub.core.engine.Snapshot} - immutable view of the current state</li>
 * </ul>
 *
 * <h2>Processing Rules</h2>
 * <pre>
 * (state, event) not in table  → no-op, state and context unchanged
 * (state, event) in table      → replace snapshot, cancel exit channels, dispatch effects in order
 * result of a cancelled effect → dropped when dequeued
 * </pre>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.engine;
