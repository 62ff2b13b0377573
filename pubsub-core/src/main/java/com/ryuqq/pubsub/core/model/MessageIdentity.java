package com.ryuqq.pubsub.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of a delivered message used by the dedup cache.
 *
 * <p>Two deliveries are the same message when channel, publish timetoken and discriminator
 * match. The discriminator is the publish sequence when the server supplies one, otherwise a
 * SHA-256 digest of the payload.</p>
 *
 * @param channel channel the message was published to
 * @param timetoken publish timetoken
 * @param discriminator {@code seq:<n>} or {@code sha256:<hex>}
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record MessageIdentity(String channel, String timetoken, String discriminator) {

    public MessageIdentity {
        if (channel == null || timetoken == null || discriminator == null) {
            throw new IllegalArgumentException("MessageIdentity components cannot be null");
        }
    }

    /**
     * Derives the identity of a message.
     *
     * @param message the message
     * @return its identity
     */
    public static MessageIdentity of(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        String discriminator = message.sequence() != null
            ? "seq:" + message.sequence()
            : "sha256:" + digest(message.payload());
        return new MessageIdentity(message.channel(), message.timetoken(), discriminator);
    }

    private static String digest(String payload) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
