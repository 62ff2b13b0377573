package com.ryuqq.pubsub.core.status;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;

/**
 * 연결 상태 변화 알림.
 *
 * @param category 상태 종류
 * @param operation 상태를 만든 작업
 * @param channels 영향받은 채널
 * @param groups 영향받은 그룹
 * @param cursor 알림 시점의 Cursor (없으면 null)
 * @param error 실패 원인 (실패 계열이 아니면 null)
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record Status(
    StatusCategory category,
    Operation operation,
    ChannelSet channels,
    GroupSet groups,
    Cursor cursor,
    PubSubException error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public Status {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        channels = channels == null ? ChannelSet.empty() : channels;
        groups = groups == null ? GroupSet.empty() : groups;
    }

    public static Status subscribe(StatusCategory category, ChannelSet channels, GroupSet groups, Cursor cursor) {
        return new Status(category, Operation.SUBSCRIBE, channels, groups, cursor, null);
    }

    public static Status subscribeError(StatusCategory category, ChannelSet channels, GroupSet groups,
                                        Cursor cursor, PubSubException error) {
        return new Status(category, Operation.SUBSCRIBE, channels, groups, cursor, error);
    }

    public static Status heartbeat(StatusCategory category, ChannelSet channels, GroupSet groups, PubSubException error) {
        return new Status(category, Operation.HEARTBEAT, channels, groups, null, error);
    }

    public boolean isError() {
        return category.isError();
    }
}
