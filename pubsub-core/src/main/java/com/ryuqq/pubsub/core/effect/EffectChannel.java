package com.ryuqq.pubsub.core.effect;

/**
 * 이펙트 채널 태그.
 *
 * <p>같은 채널의 이펙트는 상호 배타적입니다. 새 이펙트를 시작하면
 * 같은 채널에서 진행 중인 이전 이펙트가 먼저 취소됩니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public enum EffectChannel {

    /** handshake 요청과 handshake 재시도 타이머. */
    HANDSHAKE,

    /** long-poll 수신 요청과 수신 재시도 타이머. */
    RECEIVE,

    /** heartbeat 요청, cooldown 타이머, heartbeat 재시도 타이머. */
    HEARTBEAT,

    /** 취소 대상이 아닌 이펙트 (leave, 상태/메시지 알림). */
    NONE
}
