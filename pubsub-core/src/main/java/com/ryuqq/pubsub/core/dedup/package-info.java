/**
 * Bounded, insertion-ordered cache of delivered message identities.
 *
 * <p>{@link com.ryuqq.pubsub.core.dedup.DedupCache} is owned by one subscription engine and is only
 * touched from that engine's processing lane, so it carries no locking.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.core.dedup;
