package com.ryuqq.pubsub.application.subscribe;

/**
 * How a subscription change is applied while the engine is already receiving.
 *
 * <p>Only the cursor handling differs; in every policy the channel/group set of the
 * context is replaced by the new one and an empty set always unsubscribes.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum ChannelMergePolicy {

    /**
     * Re-handshake with the merged set and keep the known timetoken, so newly added
     * channels also deliver everything published after it.
     */
    RESUME_FROM_CURSOR,

    /**
     * Stay in receiving and restart the long-poll with the merged set and the same cursor.
     * Outside of receiving this behaves like {@link #RESUME_FROM_CURSOR}.
     */
    CONTINUE_RECEIVING,

    /**
     * Re-handshake with the merged set and drop the cursor; every channel starts from "now".
     */
    START_FROM_NOW
}
