/**
 * Subscription Event Engine.
 *
 * <p>Drives the handshake and long-poll receive loop for a channel/group set.</p>
 *
 * <h2>Effects</h2>
 * <ul>
 *   <li>{@code Handshake} / {@code HandshakeReconnect} - HANDSHAKE channel</li>
 *   <li>{@code ReceiveMessages} / {@code ReceiveReconnect} - RECEIVE channel</li>
 *   <li>{@code Wait} - retry timer on the channel of the failed request</li>
 *   <li>{@code EmitStatus} / {@code EmitMessages} - listener notifications</li>
 * </ul>
 *
 * <p>Retry attempts are counted per failure streak starting at 1 and are reset by
 * every successful handshake or receive.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.application.subscribe;
