package com.ryuqq.pubsub.core.spi;

import com.ryuqq.pubsub.core.retry.Endpoint;

/**
 * Kind of real-time request issued by the engines.
 *
 * <p>Each kind maps to the {@link Endpoint} group used by the retry policy.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum RequestKind {

    /** Opens a subscribe loop and obtains the initial cursor. */
    HANDSHAKE(Endpoint.SUBSCRIBE),

    /** Long-poll for messages after a cursor. */
    RECEIVE(Endpoint.SUBSCRIBE),

    /** Presence announcement. */
    HEARTBEAT(Endpoint.PRESENCE),

    /** Presence leave notification. */
    LEAVE(Endpoint.PRESENCE);

    private final Endpoint endpoint;

    RequestKind(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    public Endpoint endpoint() {
        return endpoint;
    }
}
