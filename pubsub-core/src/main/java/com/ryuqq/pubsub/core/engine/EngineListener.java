package com.ryuqq.pubsub.core.engine;

/**
 * Observer of applied transitions.
 *
 * <p>Called on the engine lane after the new snapshot is visible and before the effects are
 * dispatched. Exceptions are logged and ignored.</p>
 *
 * @param <S> state enum type
 * @param <C> context type
 * @param <E> event type
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EngineListener<S extends Enum<S>, C, E> {

    void onTransition(Snapshot<S, C> from, E event, Snapshot<S, C> to);
}
