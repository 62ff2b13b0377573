package com.ryuqq.pubsub.application.subscribe;

import com.ryuqq.pubsub.core.exception.PubSubException;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;

/**
 * Subscription Event Engine 컨텍스트 (불변 record).
 *
 * <p>전이마다 새 인스턴스로 교체되며 이전 인스턴스는 수정되지 않습니다.</p>
 *
 * @param channels 구독 채널
 * @param groups 구독 채널 그룹
 * @param cursor 마지막으로 알려진 커서 (없으면 null)
 * @param attempts 현재 실패 연속 횟수 (성공 시 0)
 * @param reason 마지막 실패 원인 (없으면 null)
 * @param reconnecting 호출자 reconnect로 수신을 재개했고 아직 수신에 성공하지 못한 경우 true
 * @author PubSub Team
 * @since 1.0.0
 */
public record SubscriptionContext(
    ChannelSet channels,
    GroupSet groups,
    Cursor cursor,
    int attempts,
    PubSubException reason,
    boolean reconnecting
) {

    private static final SubscriptionContext EMPTY = new SubscriptionContext(null, null, null, 0, null, false);

    public SubscriptionContext {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        channels = channels == null ? ChannelSet.empty() : channels;
        groups = groups == null ? GroupSet.empty() : groups;
    }

    public static SubscriptionContext empty() {
        return EMPTY;
    }

    public static SubscriptionContext of(ChannelSet channels, GroupSet groups, Cursor cursor) {
        return new SubscriptionContext(channels, groups, cursor, 0, null, false);
    }

    /**
     * 새 커서로 교체 (실패 기록과 재연결 표시 초기화).
     */
    public SubscriptionContext withCursor(Cursor cursor) {
        return new SubscriptionContext(channels, groups, cursor, 0, null, false);
    }

    public SubscriptionContext withFailure(int attempts, PubSubException reason) {
        return new SubscriptionContext(channels, groups, cursor, attempts, reason, reconnecting);
    }

    public SubscriptionContext withoutFailure() {
        return new SubscriptionContext(channels, groups, cursor, 0, null, reconnecting);
    }

    /**
     * 재연결 표시. 다음 수신 성공 시 RECONNECTED가 알려집니다.
     */
    public SubscriptionContext asReconnecting() {
        return new SubscriptionContext(channels, groups, cursor, attempts, reason, true);
    }

    public boolean isEmpty() {
        return channels.isEmpty() && groups.isEmpty();
    }
}
