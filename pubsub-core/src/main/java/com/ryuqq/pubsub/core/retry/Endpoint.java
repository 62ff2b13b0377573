package com.ryuqq.pubsub.core.retry;

/**
 * 재시도 정책에서 제외 대상으로 지정할 수 있는 엔드포인트 그룹.
 *
 * <p>실시간 엔진은 {@link #SUBSCRIBE}(handshake, receive)와 {@link #PRESENCE}(heartbeat, leave)만
 * 사용합니다. 나머지는 같은 정책을 공유하는 REST 호출을 위해 정의되어 있습니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum Endpoint {

    /** 메시지 게시 / 시그널. */
    MESSAGE_SEND,

    /** handshake 및 long-poll 수신. */
    SUBSCRIBE,

    /** heartbeat, leave, presence 조회. */
    PRESENCE,

    /** 파일 업로드 / 다운로드. */
    FILES,

    /** 메시지 히스토리. */
    MESSAGE_STORAGE,

    /** channel group 관리. */
    CHANNEL_GROUPS,

    /** 모바일 푸시 등록. */
    PUSH_NOTIFICATIONS,

    /** 사용자 / 채널 메타데이터. */
    APP_CONTEXT,

    /** 메시지 액션 (리액션). */
    MESSAGE_REACTIONS
}
