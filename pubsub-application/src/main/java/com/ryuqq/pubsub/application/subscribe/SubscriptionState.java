package com.ryuqq.pubsub.application.subscribe;

/**
 * Subscription Event Engine 상태.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * UNSUBSCRIBED ─change─→ HANDSHAKING ─success─→ RECEIVING ─┐
 *                           │   ↑                  │  ↑     │ success (loop)
 *                  failure  │   │ reconnect        │  └─────┘
 *                           ↓   │          failure │
 *                     HANDSHAKE_FAILED             ↓
 *                                            RECEIVE_FAILED
 *
 * HANDSHAKING ─disconnect─→ HANDSHAKE_STOPPED
 * RECEIVING   ─disconnect─→ RECEIVE_STOPPED
 * (any) ─change to empty set─→ UNSUBSCRIBED
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum SubscriptionState {

    /** 초기 상태. 실시간 업데이트를 처리하지 않음. */
    UNSUBSCRIBED,

    /** 구독 루프를 열고 초기 커서를 요청 중. */
    HANDSHAKING,

    /** 핸드셰이크 재시도 소진. reconnect 또는 구독 변경으로만 재개. */
    HANDSHAKE_FAILED,

    /** 핸드셰이크 도중 사용자가 연결을 끊음. */
    HANDSHAKE_STOPPED,

    /** 커서 기반 long-poll 수신 중. */
    RECEIVING,

    /** 수신 재시도 소진. */
    RECEIVE_FAILED,

    /** 수신 도중 사용자가 연결을 끊음. */
    RECEIVE_STOPPED;

    /**
     * 서버와의 연결이 활성 상태인지 확인 (요청 진행 중 또는 재시도 대기 중).
     *
     * @return HANDSHAKING 또는 RECEIVING이면 true
     */
    public boolean isActive() {
        return this == HANDSHAKING || this == RECEIVING;
    }
}
