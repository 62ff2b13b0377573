package com.ryuqq.pubsub.core.status;

/**
 * Operation that produced a {@link Status}.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum Operation {
    SUBSCRIBE,
    HEARTBEAT
}
