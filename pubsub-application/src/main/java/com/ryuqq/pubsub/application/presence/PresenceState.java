package com.ryuqq.pubsub.application.presence;

/**
 * Presence Event Engine 상태.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * HEARTBEAT_INACTIVE ─joined─→ HEARTBEATING ─success─→ HEARTBEAT_COOLDOWN
 *                                 ↑    │                     │
 *                                 │    │ failure (소진)       │ timesUp / joined / left
 *                                 │    ↓                     │
 *                                 │  HEARTBEAT_FAILED        │
 *                                 └──────────────────────────┘
 *
 * HEARTBEATING / HEARTBEAT_COOLDOWN / HEARTBEAT_FAILED ─disconnect─→ HEARTBEAT_STOPPED
 * (any) ─leftAll─→ HEARTBEAT_INACTIVE
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum PresenceState {

    /** 초기 상태. 하트비트를 보내지 않음. */
    HEARTBEAT_INACTIVE,

    /** 하트비트 요청 진행 중 (재시도 대기 포함). */
    HEARTBEATING,

    /** 다음 하트비트까지 대기 중. */
    HEARTBEAT_COOLDOWN,

    /** 하트비트 재시도 소진. */
    HEARTBEAT_FAILED,

    /** 사용자가 연결을 끊음. 멤버 목록만 유지. */
    HEARTBEAT_STOPPED
}
