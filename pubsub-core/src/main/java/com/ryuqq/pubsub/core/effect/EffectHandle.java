package com.ryuqq.pubsub.core.effect;

/**
 * Cancellation handle of a dispatched effect.
 *
 * <p>Once {@link #cancel()} returns, no completion event of the effect is processed by the engine,
 * even if the underlying transport call keeps running to completion.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public interface EffectHandle {

    /**
     * Cancels the effect. Idempotent.
     */
    void cancel();

    /**
     * @return true once {@link #cancel()} has been called
     */
    boolean isCancelled();
}
