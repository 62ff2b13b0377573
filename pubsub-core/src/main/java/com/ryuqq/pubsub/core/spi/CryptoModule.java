package com.ryuqq.pubsub.core.spi;

/**
 * Payload decryption SPI.
 *
 * <p>Applied to every received message before it reaches the dedup cache and listeners.
 * Implementations throw {@link IllegalStateException} when a payload cannot be decrypted;
 * the caller then delivers the original payload.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CryptoModule {

    /** Identity module: payloads are delivered as received. */
    CryptoModule NONE = payload -> payload;

    String decrypt(String payload);
}
