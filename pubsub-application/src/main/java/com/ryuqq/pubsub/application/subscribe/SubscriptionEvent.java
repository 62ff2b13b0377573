package com.ryuqq.pubsub.application.subscribe;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;
import com.ryuqq.pubsub.core.model.Message;

import java.util.List;

/**
 * Events accepted by the Subscription Event Engine.
 *
 * <p>User-facing events ({@link SubscriptionChange}, {@link Restore}, {@link Disconnect},
 * {@link Reconnect}) are sent by the client; the others are results of effects.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public sealed interface SubscriptionEvent {

    /**
     * The complete channel/group set the client wants to be subscribed to.
     */
    record SubscriptionChange(ChannelSet channels, GroupSet groups) implements SubscriptionEvent {
        public SubscriptionChange {
            channels = channels == null ? ChannelSet.empty() : channels;
            groups = groups == null ? GroupSet.empty() : groups;
        }

        public boolean isEmpty() {
            return channels.isEmpty() && groups.isEmpty();
        }
    }

    /**
     * Subscription change that resumes from a caller supplied cursor.
     */
    record Restore(ChannelSet channels, GroupSet groups, Cursor cursor) implements SubscriptionEvent {
        public Restore {
            if (cursor == null) {
                throw new IllegalArgumentException("cursor cannot be null");
            }
            channels = channels == null ? ChannelSet.empty() : channels;
            groups = groups == null ? GroupSet.empty() : groups;
        }

        public boolean isEmpty() {
            return channels.isEmpty() && groups.isEmpty();
        }
    }

    record HandshakeSuccess(Cursor cursor) implements SubscriptionEvent {
        public HandshakeSuccess {
            if (cursor == null) {
                throw new IllegalArgumentException("cursor cannot be null");
            }
        }
    }

    record HandshakeFailure(PubSubException reason) implements SubscriptionEvent {
        public HandshakeFailure {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }
    }

    record ReceiveSuccess(Cursor cursor, List<Message> messages) implements SubscriptionEvent {
        public ReceiveSuccess {
            if (cursor == null) {
                throw new IllegalArgumentException("cursor cannot be null");
            }
            messages = messages == null ? List.of() : List.copyOf(messages);
        }
    }

    record ReceiveFailure(PubSubException reason) implements SubscriptionEvent {
        public ReceiveFailure {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }
    }

    record Disconnect() implements SubscriptionEvent {
    }

    /**
     * Resume after a stop or an exhausted retry streak.
     *
     * @param cursor optional cursor overriding the last known one (nullable)
     */
    record Reconnect(Cursor cursor) implements SubscriptionEvent {
    }

    /**
     * Fired by the retry timer of the current failure streak.
     */
    record Retry() implements SubscriptionEvent {
    }
}
