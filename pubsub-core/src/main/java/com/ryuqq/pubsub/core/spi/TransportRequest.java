package com.ryuqq.pubsub.core.spi;

import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request descriptor handed to a {@link Transport}.
 *
 * <p>Encoding into a concrete wire format (URL, query parameters, headers) is the
 * transport's responsibility.</p>
 *
 * @param kind request kind
 * @param channels channels of the request (may be empty)
 * @param groups channel groups of the request (may be empty)
 * @param cursor resume cursor, only for {@link RequestKind#RECEIVE} and restoring handshakes (nullable)
 * @param presenceTimeoutSeconds presence timeout announced to the server, 0 when not applicable
 * @param filterExpression server-side message filter (nullable)
 * @param userId identity of this client
 * @param presenceState per-channel presence state sent with {@link RequestKind#HEARTBEAT} (never null, may be empty)
 * @author PubSub Team
 * @since 1.0.0
 */
public record TransportRequest(
    RequestKind kind,
    ChannelSet channels,
    GroupSet groups,
    Cursor cursor,
    int presenceTimeoutSeconds,
    String filterExpression,
    String userId,
    Map<String, String> presenceState
) {

    public TransportRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (presenceTimeoutSeconds < 0) {
            throw new IllegalArgumentException(
                "presenceTimeoutSeconds must be non-negative (current: " + presenceTimeoutSeconds + ")"
            );
        }
        channels = channels == null ? ChannelSet.empty() : channels;
        groups = groups == null ? GroupSet.empty() : groups;
        presenceState = presenceState == null || presenceState.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(presenceState));
    }

    public static TransportRequest handshake(ChannelSet channels, GroupSet groups, String filterExpression, String userId) {
        return new TransportRequest(RequestKind.HANDSHAKE, channels, groups, null, 0, filterExpression, userId, Map.of());
    }

    public static TransportRequest receive(ChannelSet channels, GroupSet groups, Cursor cursor,
                                           String filterExpression, String userId) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
        return new TransportRequest(RequestKind.RECEIVE, channels, groups, cursor, 0, filterExpression, userId, Map.of());
    }

    public static TransportRequest heartbeat(ChannelSet channels, GroupSet groups, int presenceTimeoutSeconds, String userId) {
        return heartbeat(channels, groups, presenceTimeoutSeconds, Map.of(), userId);
    }

    /**
     * Heartbeat carrying the caller's presence state.
     *
     * @param presenceState channel name to serialized state, only channels of this heartbeat
     */
    public static TransportRequest heartbeat(ChannelSet channels, GroupSet groups, int presenceTimeoutSeconds,
                                             Map<String, String> presenceState, String userId) {
        return new TransportRequest(RequestKind.HEARTBEAT, channels, groups, null, presenceTimeoutSeconds, null,
            userId, presenceState);
    }

    public static TransportRequest leave(ChannelSet channels, GroupSet groups, String userId) {
        return new TransportRequest(RequestKind.LEAVE, channels, groups, null, 0, null, userId, Map.of());
    }
}
