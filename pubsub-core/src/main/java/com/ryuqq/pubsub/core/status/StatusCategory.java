package com.ryuqq.pubsub.core.status;

/**
 * 호출자에게 전달되는 상태 알림 종류.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum StatusCategory {

    /** handshake 성공, 수신 루프 시작. */
    CONNECTED,

    /** 재시도 후 수신 루프 복구. */
    RECONNECTED,

    /** 일시적 실패, 재시도 예약됨. */
    RECONNECTING,

    /** 호출자 요청으로 연결 중단. */
    DISCONNECTED,

    /** 수신 중 재시도 소진으로 연결 끊김. */
    DISCONNECTED_UNEXPECTEDLY,

    /** handshake 재시도 소진. */
    CONNECTION_ERROR,

    /** 수신 중 채널/그룹 집합 변경. */
    SUBSCRIPTION_CHANGED,

    /** 한 번의 수신 응답에 담긴 메시지 수가 requestMessageCountThreshold 이상. */
    REQUEST_MESSAGE_COUNT_EXCEEDED,

    /** heartbeat 성공 (announceSuccessfulHeartbeats=true일 때만). */
    HEARTBEAT_SUCCEEDED,

    /** heartbeat 재시도 소진 (announceFailedHeartbeats=true일 때만). */
    HEARTBEAT_FAILED;

    /**
     * 오류를 동반하는 상태인지 확인.
     *
     * @return 실패 계열이면 true
     */
    public boolean isError() {
        return this == DISCONNECTED_UNEXPECTEDLY || this == CONNECTION_ERROR || this == HEARTBEAT_FAILED;
    }
}
