package com.ryuqq.pubsub.core.effect;

/**
 * 이펙트 결과 이벤트를 받는 쪽 (엔진).
 *
 * @param <E> 이벤트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public interface EventSink<E> {

    /**
     * 이펙트 결과 이벤트 전달.
     *
     * <p>구현체는 이벤트를 처리 레인에서 꺼낼 때 {@code origin}이 취소되었는지 확인하고,
     * 취소되었으면 버려야 합니다.</p>
     *
     * @param event 결과 이벤트
     * @param origin 결과를 만든 이펙트의 핸들
     */
    void deliver(E event, EffectHandle origin);
}
