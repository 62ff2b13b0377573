package com.ryuqq.pubsub.core.engine;

import com.ryuqq.pubsub.core.effect.Effect;

import java.util.ArrayList;
import java.util.List;

/**
 * 전이 결과: 다음 상태, 새 컨텍스트, 방출할 이펙트 목록.
 *
 * @param state 다음 상태
 * @param context 다음 컨텍스트 (이전 컨텍스트를 수정하지 않은 새 값)
 * @param effects 방출 순서대로의 이펙트
 * @param <S> 상태 enum 타입
 * @param <C> 컨텍스트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record Transition<S extends Enum<S>, C>(S state, C context, List<Effect> effects) {

    public Transition {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    /**
     * 전이 생성.
     *
     * @param state 다음 상태
     * @param context 다음 컨텍스트
     * @param effects 방출할 이펙트 (null 항목은 건너뜀)
     * @return Transition
     */
    public static <S extends Enum<S>, C> Transition<S, C> to(S state, C context, Effect... effects) {
        List<Effect> list = new ArrayList<>(effects.length);
        for (Effect effect : effects) {
            if (effect != null) {
                list.add(effect);
            }
        }
        return new Transition<>(state, context, list);
    }

    public static <S extends Enum<S>, C> Transition<S, C> to(S state, C context, List<Effect> effects) {
        return new Transition<>(state, context, effects);
    }
}
