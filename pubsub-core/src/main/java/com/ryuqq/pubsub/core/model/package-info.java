/**
 * Value types shared by the subscription and presence engines.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.core.model.Cursor} - resume position (timetoken + region)</li>
 *   <li>{@link com.ryuqq.pubsub.core.model.ChannelSet} / {@link com.ryuqq.pubsub.core.model.GroupSet} - ordered, duplicate-free name sets</li>
 *   <li>{@link com.ryuqq.pubsub.core.model.Message} - decrypted real-time message</li>
 *   <li>{@link com.ryuqq.pubsub.core.model.MessageIdentity} - dedup key of a message</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every type is immutable; set algebra returns new instances</li>
 *   <li><strong>Validation:</strong> invalid input raises {@link com.ryuqq.pubsub.core.exception.ConfigurationException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.model;
