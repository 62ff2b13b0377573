package com.ryuqq.pubsub.application.presence;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.GroupSet;

/**
 * Presence Event Engine context.
 *
 * @param channels channels this client is present on
 * @param groups channel groups this client is present on
 * @param attempts consecutive heartbeat failures (0 after a success)
 * @param reason last heartbeat failure (nullable)
 * @author PubSub Team
 * @since 1.0.0
 */
public record PresenceContext(ChannelSet channels, GroupSet groups, int attempts, PubSubException reason) {

    private static final PresenceContext EMPTY = new PresenceContext(null, null, 0, null);

    public PresenceContext {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        channels = channels == null ? ChannelSet.empty() : channels;
        groups = groups == null ? GroupSet.empty() : groups;
    }

    public static PresenceContext empty() {
        return EMPTY;
    }

    public static PresenceContext of(ChannelSet channels, GroupSet groups) {
        return new PresenceContext(channels, groups, 0, null);
    }

    public PresenceContext withFailure(int attempts, PubSubException reason) {
        return new PresenceContext(channels, groups, attempts, reason);
    }

    public PresenceContext withoutFailure() {
        return new PresenceContext(channels, groups, 0, null);
    }

    public boolean isEmpty() {
        return channels.isEmpty() && groups.isEmpty();
    }
}
