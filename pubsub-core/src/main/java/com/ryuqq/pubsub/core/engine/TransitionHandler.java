package com.ryuqq.pubsub.core.engine;

/**
 * Computes the transition for one (state, event type) pair.
 *
 * <p>Must be free of side effects apart from reading configuration: everything observable goes
 * into the returned {@link Transition}'s effects.</p>
 *
 * @param <S> state enum type
 * @param <C> context type
 * @param <T> concrete event type
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionHandler<S extends Enum<S>, C, T> {

    Transition<S, C> apply(C context, T event);
}
