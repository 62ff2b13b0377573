package com.ryuqq.pubsub.core.effect;

import java.util.function.Consumer;

/**
 * Executes effects for one kind of engine.
 *
 * <p>Implementations start the asynchronous work and report its result as an engine event
 * through {@code completion}. They must not block: network calls and timers run elsewhere and
 * call back later. Effects without a result (status and message emission, leave) simply never
 * call {@code completion}.</p>
 *
 * <p>A {@link java.util.concurrent.CancellationException} raised by aborted work must be
 * swallowed by the handler; cancelled effects are dropped, never reported as failures.</p>
 *
 * @param <E> event type of the owning engine
 *
 * @author PubSub Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EffectHandler<E> {

    /** Abort hook for effects that finish synchronously. */
    Runnable NO_ABORT = () -> { };

    /**
     * Starts an effect.
     *
     * @param effect the effect to run (never {@link Effect.CancelPrevious})
     * @param completion receives the result event, at most once
     * @return hook that aborts the in-flight work; {@link #NO_ABORT} when there is nothing to abort
     */
    Runnable handle(Effect effect, Consumer<E> completion);
}
