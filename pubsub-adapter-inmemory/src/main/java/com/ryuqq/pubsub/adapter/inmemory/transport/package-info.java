/**
 * In-memory implementation of the Transport SPI.
 *
 * <p>Used as the reference transport and by the client integration tests.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.adapter.inmemory.transport;
