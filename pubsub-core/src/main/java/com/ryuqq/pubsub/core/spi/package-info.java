/**
 * Service Provider Interfaces for the collaborators of the real-time core.
 *
 * <p>The engines only talk to the outside world through these narrow contracts:</p>
 * <ul>
 *   <li>{@link com.ryuqq.pubsub.core.spi.Transport} - request execution, cancellable through its future</li>
 *   <li>{@link com.ryuqq.pubsub.core.spi.CryptoModule} - payload decryption of received messages</li>
 * </ul>
 *
 * <p>Request encoding, HTTP clients, proxies and token handling belong to the
 * implementations of these interfaces.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.spi;
