package com.ryuqq.pubsub.application.client;

import com.ryuqq.pubsub.application.presence.PresenceContext;
import com.ryuqq.pubsub.application.presence.PresenceState;
import com.ryuqq.pubsub.application.subscribe.SubscriptionContext;
import com.ryuqq.pubsub.application.subscribe.SubscriptionState;
import com.ryuqq.pubsub.core.engine.Snapshot;
import com.ryuqq.pubsub.core.model.ChannelSet;
import com.ryuqq.pubsub.core.model.Cursor;
import com.ryuqq.pubsub.core.model.GroupSet;

/**
 * 실시간 구독/프레즌스 클라이언트.
 *
 * <p>호출은 즉시 반환되며 실제 처리는 각 엔진의 처리 레인에서 비동기로 진행됩니다.
 * 결과는 {@link RealtimeListener}로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * client.addListener(new RealtimeListener() {
 *     public void onMessage(Message message) { ... }
 * });
 * client.subscribe(ChannelSet.of("room1"), GroupSet.empty());
 * ...
 * client.unsubscribeAll();
 * client.shutdown();
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public interface RealtimeClient {

    /**
     * 채널/그룹 구독 추가.
     *
     * <p>현재 구독 집합에 합쳐지며, 이미 구독 중인 이름은 무시됩니다.</p>
     *
     * @param channels 추가할 채널
     * @param groups 추가할 채널 그룹
     * @throws IllegalStateException 클라이언트가 종료된 경우
     */
    void subscribe(ChannelSet channels, GroupSet groups);

    /**
     * 지정한 커서부터 구독 재개.
     */
    void subscribe(ChannelSet channels, GroupSet groups, Cursor cursor);

    void unsubscribe(ChannelSet channels, GroupSet groups);

    void unsubscribeAll();

    /**
     * 중지 또는 실패 상태에서 구독 재개.
     */
    void reconnect();

    /**
     * 지정한 커서로 구독 재개.
     */
    void reconnect(Cursor cursor);

    /**
     * 구독과 하트비트 중지 (leave 요청 전송).
     */
    void disconnect();

    /**
     * 구독과 하트비트 중지.
     *
     * @param offline true면 네트워크가 끊긴 것으로 보고 leave 요청을 보내지 않음
     */
    void disconnect(boolean offline);

    void join(ChannelSet channels, GroupSet groups);

    void leave(ChannelSet channels, GroupSet groups);

    void leaveAll();

    void leaveAll(boolean offline);

    /**
     * 채널별 프레즌스 상태 설정.
     *
     * <p>maintainPresenceState가 켜져 있으면 다음 heartbeat부터 해당 채널의 상태가 함께 전송됩니다.
     * 채널을 떠나면 상태도 지워집니다.</p>
     *
     * @param channels 대상 채널
     * @param state 직렬화된 상태 (보통 JSON 객체, null이면 제거)
     */
    void setPresenceState(ChannelSet channels, String state);

    void addListener(RealtimeListener listener);

    void removeListener(RealtimeListener listener);

    Snapshot<SubscriptionState, SubscriptionContext> subscriptionState();

    /**
     * 프레즌스 엔진 상태.
     *
     * @return 스냅샷 (프레즌스가 비활성화된 경우 HEARTBEAT_INACTIVE)
     */
    Snapshot<PresenceState, PresenceContext> presenceState();

    /**
     * 모든 진행 중인 요청과 타이머를 취소하고 레인을 종료.
     */
    void shutdown();
}
