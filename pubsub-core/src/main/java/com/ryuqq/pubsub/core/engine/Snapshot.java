package com.ryuqq.pubsub.core.engine;

/**
 * 엔진의 현재 상태와 컨텍스트의 불변 스냅샷.
 *
 * @param state 상태 태그
 * @param context 상태 컨텍스트 (불변 값)
 * @param <S> 상태 enum 타입
 * @param <C> 컨텍스트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record Snapshot<S extends Enum<S>, C>(S state, C context) {

    public Snapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
    }
}
