package com.ryuqq.pubsub.core.engine;

import com.ryuqq.pubsub.core.effect.EffectChannel;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * (상태, 이벤트 타입) → 전이 핸들러의 명시적 전이 표.
 *
 * <p>표에 없는 조합은 no-op입니다. 모든 상태가 모든 이벤트를 처리할 필요는 없습니다.</p>
 *
 * <p>이벤트 태그는 sealed 이벤트 계층의 구체 record 클래스이며,
 * 조회는 {@code event.getClass()}와 정확히 일치하는 항목만 찾습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionTable&lt;State, Event, Context&gt; table = TransitionTable.builder(State.class)
 *     .on(State.IDLE, Event.Start.class, (ctx, e) -&gt; Transition.to(State.RUNNING, ctx))
 *     .onExit(State.RUNNING, EffectChannel.RECEIVE)
 *     .build();
 * </pre>
 *
 * @param <S> 상태 enum 타입
 * @param <E> 이벤트 기반 타입
 * @param <C> 컨텍스트 타입
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class TransitionTable<S extends Enum<S>, E, C> {

    private final Map<S, Map<Class<?>, TransitionHandler<S, C, E>>> handlers;
    private final Map<S, List<EffectChannel>> exitChannels;

    private TransitionTable(Builder<S, E, C> builder) {
        this.handlers = new EnumMap<>(builder.handlers);
        this.exitChannels = new EnumMap<>(builder.exitChannels);
    }

    public static <S extends Enum<S>, E, C> Builder<S, E, C> builder(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    /**
     * 이벤트에 대한 전이 계산.
     *
     * @param state 현재 상태
     * @param context 현재 컨텍스트
     * @param event 이벤트
     * @return 정의된 전이, 없으면 empty
     */
    public Optional<Transition<S, C>> apply(S state, C context, E event) {
        Map<Class<?>, TransitionHandler<S, C, E>> byEvent = handlers.get(state);
        if (byEvent == null) {
            return Optional.empty();
        }
        TransitionHandler<S, C, E> handler = byEvent.get(event.getClass());
        if (handler == null) {
            return Optional.empty();
        }
        return Optional.of(handler.apply(context, event));
    }

    /**
     * 상태에 해당 이벤트 전이가 정의되어 있는지 확인.
     */
    public boolean handles(S state, Class<? extends E> eventType) {
        Map<Class<?>, TransitionHandler<S, C, E>> byEvent = handlers.get(state);
        return byEvent != null && byEvent.containsKey(eventType);
    }

    /**
     * 상태를 떠날 때 취소할 채널.
     *
     * @param state 떠나는 상태
     * @return 채널 목록 (없으면 빈 목록)
     */
    public List<EffectChannel> exitChannels(S state) {
        return exitChannels.getOrDefault(state, List.of());
    }

    /**
     * Builder for {@link TransitionTable}.
     */
    public static final class Builder<S extends Enum<S>, E, C> {

        private final Map<S, Map<Class<?>, TransitionHandler<S, C, E>>> handlers;
        private final Map<S, List<EffectChannel>> exitChannels;

        private Builder(Class<S> stateType) {
            Objects.requireNonNull(stateType, "stateType");
            this.handlers = new EnumMap<>(stateType);
            this.exitChannels = new EnumMap<>(stateType);
        }

        /**
         * 전이 등록. 같은 (상태, 이벤트) 조합을 두 번 등록하면 예외가 발생합니다.
         */
        public <T extends E> Builder<S, E, C> on(S state, Class<T> eventType, TransitionHandler<S, C, ? super T> handler) {
            if (state == null || eventType == null || handler == null) {
                throw new IllegalArgumentException("state, eventType and handler cannot be null");
            }
            Map<Class<?>, TransitionHandler<S, C, E>> byEvent = handlers.computeIfAbsent(state, s -> new HashMap<>());
            TransitionHandler<S, C, E> typed = (ctx, event) -> handler.apply(ctx, eventType.cast(event));
            if (byEvent.putIfAbsent(eventType, typed) != null) {
                throw new IllegalStateException(
                    String.format("Duplicate transition: %s + %s", state, eventType.getSimpleName())
                );
            }
            return this;
        }

        /**
         * 여러 상태에 같은 전이 등록.
         */
        public <T extends E> Builder<S, E, C> on(Collection<S> states, Class<T> eventType, TransitionHandler<S, C, ? super T> handler) {
            for (S state : states) {
                on(state, eventType, handler);
            }
            return this;
        }

        /**
         * 상태를 다른 상태로 떠날 때 취소할 채널 등록.
         */
        public Builder<S, E, C> onExit(S state, EffectChannel... channels) {
            exitChannels.put(state, List.of(channels));
            return this;
        }

        public TransitionTable<S, E, C> build() {
            return new TransitionTable<>(this);
        }
    }
}
