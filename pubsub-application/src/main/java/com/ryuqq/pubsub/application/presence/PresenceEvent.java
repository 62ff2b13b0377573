package com.ryuqq.pubsub.application.presence;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.GroupSet;

/**
 * Events accepted by the Presence Event Engine.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public sealed interface PresenceEvent {

    /**
     * Members to add to the presence set.
     */
    record Joined(ChannelSet channels, GroupSet groups) implements PresenceEvent {
        public Joined {
            channels = channels == null ? ChannelSet.empty() : channels;
            groups = groups == null ? GroupSet.empty() : groups;
        }
    }

    /**
     * Members to remove from the presence set.
     */
    record Left(ChannelSet channels, GroupSet groups) implements PresenceEvent {
        public Left {
            channels = channels == null ? ChannelSet.empty() : channels;
            groups = groups == null ? GroupSet.empty() : groups;
        }
    }

    /**
     * Leave every member.
     *
     * @param offline the client is known to be offline, no leave request is sent
     */
    record LeftAll(boolean offline) implements PresenceEvent {
    }

    /**
     * Stop heartbeating but remember the members.
     *
     * @param offline the client is known to be offline, no leave request is sent
     */
    record Disconnect(boolean offline) implements PresenceEvent {
    }

    record Reconnect() implements PresenceEvent {
    }

    record HeartbeatSuccess() implements PresenceEvent {
    }

    record HeartbeatFailure(PubSubException reason) implements PresenceEvent {
        public HeartbeatFailure {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }
    }

    /**
     * Fired when the cooldown or retry timer elapses.
     */
    record TimesUp() implements PresenceEvent {
    }
}
